package io.evmtrace.utils;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;

/**
 * Writes int and long machine words. Longs are treated as unsigned 64-bit values.
 */
public class QuantitySerializer extends JsonSerializer<Number> {
    private final QuantityFormat format;

    public QuantitySerializer(QuantityFormat format) {
        this.format = format;
    }

    @Override
    public void serialize(Number value, JsonGenerator jsonGenerator, SerializerProvider serializerProvider)
        throws IOException {
        if (value instanceof Long) {
            var number = value.longValue();
            if (format == QuantityFormat.HEX) {
                jsonGenerator.writeString(Converter.HEX_PREFIX + Long.toHexString(number));
            } else {
                jsonGenerator.writeNumber(Long.toUnsignedString(number));
            }
        } else {
            var number = value.intValue();
            if (format == QuantityFormat.HEX) {
                jsonGenerator.writeString(Converter.HEX_PREFIX + Integer.toHexString(number));
            } else {
                jsonGenerator.writeNumber(number);
            }
        }
    }
}
