package io.evmtrace.utils;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;

@JsonSerialize(using = FixedSizeByteArray.Serializer.class)
@JsonDeserialize(using = Address.Deserializer.class)
public class Address extends FixedSizeByteArray {
    public static final int LENGTH = 20;

    /**
     * Zero address: 0x0000000000000000000000000000000000000000
     */
    public static final Address ZERO = new Address(new byte[LENGTH]);

    public Address(byte[] bytes) {
        super(LENGTH, bytes);
    }

    public Address(String hex) {
        super(LENGTH, hex);
    }

    public static class Deserializer extends JsonDeserializer<Address> {
        @Override
        public Address deserialize(JsonParser jsonParser, DeserializationContext deserializationContext)
            throws IOException {
            var text = jsonParser.getValueAsString();
            if (text == null) {
                return (Address) deserializationContext.handleUnexpectedToken(Address.class, jsonParser);
            }
            try {
                return new Address(text);
            } catch (IllegalArgumentException e) {
                throw InvalidFormatException.from(
                    jsonParser, "invalid address: " + e.getMessage(), text, Address.class);
            }
        }
    }

    public static class KeyDeserializer extends com.fasterxml.jackson.databind.KeyDeserializer {
        @Override
        public Object deserializeKey(String key, DeserializationContext ctxt) throws IOException {
            try {
                return new Address(key);
            } catch (IllegalArgumentException e) {
                return ctxt.handleWeirdKey(Address.class, key, "invalid address: %s", e.getMessage());
            }
        }
    }
}
