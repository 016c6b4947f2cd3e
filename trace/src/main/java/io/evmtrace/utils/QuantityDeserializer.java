package io.evmtrace.utils;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import com.fasterxml.jackson.databind.util.AccessPattern;

import java.io.IOException;
import java.math.BigInteger;

/**
 * Reads non-negative machine words given either as JSON numbers, 0x-prefixed hex strings or decimal strings.
 * Quantities are never nullable.
 */
public abstract class QuantityDeserializer<T extends Number> extends JsonDeserializer<T> {
    private final Class<T> type;
    private final BigInteger max;

    protected QuantityDeserializer(Class<T> type, BigInteger max) {
        this.type = type;
        this.max = max;
    }

    protected abstract T convert(BigInteger value);

    @Override
    public T deserialize(JsonParser jsonParser, DeserializationContext ctx) throws IOException {
        BigInteger value;
        switch (jsonParser.currentToken()) {
            case VALUE_NUMBER_INT:
                value = jsonParser.getBigIntegerValue();
                break;
            case VALUE_STRING:
                value = parse(jsonParser, jsonParser.getText());
                break;
            default:
                return type.cast(ctx.handleUnexpectedToken(type, jsonParser));
        }
        if (value.signum() < 0 || value.compareTo(max) > 0) {
            throw InvalidFormatException.from(jsonParser, "quantity out of range", value, type);
        }
        return convert(value);
    }

    private BigInteger parse(JsonParser jsonParser, String text) throws IOException {
        var hex = text.startsWith(Converter.HEX_PREFIX);
        var digits = hex ? text.substring(2) : text;
        if (Converter.hasSign(digits)) {
            throw InvalidFormatException.from(jsonParser, "quantity must not carry a sign", text, type);
        }
        try {
            return new BigInteger(digits, hex ? 16 : 10);
        } catch (NumberFormatException e) {
            throw InvalidFormatException.from(jsonParser, "invalid quantity", text, type);
        }
    }

    @Override
    public T getNullValue(DeserializationContext ctx) throws JsonMappingException {
        return ctx.reportInputMismatch(this, "quantity must not be null");
    }

    @Override
    public AccessPattern getNullAccessPattern() {
        return AccessPattern.DYNAMIC;
    }

    @Override
    public Class<?> handledType() {
        return type;
    }

    /**
     * Unsigned 64-bit values, stored in the bits of a signed long.
     */
    public static class Unsigned64 extends QuantityDeserializer<Long> {
        private static final BigInteger MAX = BigInteger.ONE.shiftLeft(64).subtract(BigInteger.ONE);

        public Unsigned64() {
            super(Long.class, MAX);
        }

        @Override
        protected Long convert(BigInteger value) {
            return value.longValue();
        }
    }

    /**
     * Non-negative int words: program counters, offsets and trace addresses.
     */
    public static class Word extends QuantityDeserializer<Integer> {
        public Word() {
            super(Integer.class, BigInteger.valueOf(Integer.MAX_VALUE));
        }

        @Override
        protected Integer convert(BigInteger value) {
            return value.intValue();
        }
    }
}
