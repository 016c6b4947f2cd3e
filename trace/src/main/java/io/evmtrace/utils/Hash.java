package io.evmtrace.utils;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;

/**
 * 32-byte value: transaction hashes as well as storage slot keys and values.
 */
@JsonSerialize(using = FixedSizeByteArray.Serializer.class)
@JsonDeserialize(using = Hash.Deserializer.class)
public class Hash extends FixedSizeByteArray {
    public static final int LENGTH = 32;

    /**
     * Zero hash: 0x0000000000000000000000000000000000000000000000000000000000000000
     */
    public static final Hash ZERO = new Hash(new byte[LENGTH]);

    public Hash(byte[] bytes) {
        super(LENGTH, bytes);
    }

    public Hash(String hex) {
        super(LENGTH, hex);
    }

    public static Hash fromBytes(byte[] bytes) {
        if (bytes == null) {
            return null;
        }
        return new Hash(bytes);
    }

    public static class Deserializer extends JsonDeserializer<Hash> {
        @Override
        public Hash deserialize(JsonParser jsonParser, DeserializationContext deserializationContext)
            throws IOException {
            var text = jsonParser.getValueAsString();
            if (text == null) {
                return (Hash) deserializationContext.handleUnexpectedToken(Hash.class, jsonParser);
            }
            try {
                return new Hash(text);
            } catch (IllegalArgumentException e) {
                throw InvalidFormatException.from(jsonParser, "invalid hash: " + e.getMessage(), text, Hash.class);
            }
        }
    }

    public static class KeyDeserializer extends com.fasterxml.jackson.databind.KeyDeserializer {
        @Override
        public Object deserializeKey(String key, DeserializationContext ctxt) throws IOException {
            try {
                return new Hash(key);
            } catch (IllegalArgumentException e) {
                return ctxt.handleWeirdKey(Hash.class, key, "invalid hash: %s", e.getMessage());
            }
        }
    }
}
