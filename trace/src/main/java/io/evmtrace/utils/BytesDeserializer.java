package io.evmtrace.utils;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;

public class BytesDeserializer extends JsonDeserializer<byte[]> {
    @Override
    public byte[] deserialize(JsonParser jsonParser, DeserializationContext ctx) throws IOException {
        if (jsonParser.currentToken() != JsonToken.VALUE_STRING) {
            return (byte[]) ctx.handleUnexpectedToken(byte[].class, jsonParser);
        }
        var text = jsonParser.getText();
        try {
            return Converter.fromPrefixedHexString(text);
        } catch (IllegalArgumentException e) {
            throw InvalidFormatException.from(jsonParser, "invalid byte string: " + e.getMessage(), text, byte[].class);
        }
    }
}
