package io.evmtrace.utils;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Reads a 256-bit unsigned integer given as a 0x-prefixed big-endian hex quantity.
 */
public class BigIntegerDeserializer extends JsonDeserializer<BigInteger> {
    public static final int MAX_BITS = 256;

    @Override
    public BigInteger deserialize(JsonParser jsonParser, DeserializationContext ctx) throws IOException {
        if (jsonParser.currentToken() != JsonToken.VALUE_STRING) {
            return (BigInteger) ctx.handleUnexpectedToken(BigInteger.class, jsonParser);
        }
        var text = jsonParser.getText();
        if (!text.startsWith(Converter.HEX_PREFIX)) {
            throw InvalidFormatException.from(jsonParser, "quantity must start with 0x", text, BigInteger.class);
        }
        var digits = text.substring(2);
        if (Converter.hasSign(digits)) {
            throw InvalidFormatException.from(jsonParser, "quantity must not carry a sign", text, BigInteger.class);
        }
        BigInteger value;
        try {
            value = new BigInteger(digits, 16);
        } catch (NumberFormatException e) {
            throw InvalidFormatException.from(jsonParser, "invalid hex quantity", text, BigInteger.class);
        }
        if (value.signum() < 0 || value.bitLength() > MAX_BITS) {
            throw InvalidFormatException.from(
                jsonParser, "quantity out of range for a 256-bit unsigned integer", text, BigInteger.class);
        }
        return value;
    }
}
