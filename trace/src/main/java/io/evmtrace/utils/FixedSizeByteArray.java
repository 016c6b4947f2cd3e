package io.evmtrace.utils;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.Arrays;

/**
 * Immutable byte array of a fixed length, encoded as 0x-prefixed lowercase hex. Instances are ordered by their
 * unsigned big-endian byte value, which is also the order of their hex representation.
 */
public class FixedSizeByteArray implements Comparable<FixedSizeByteArray> {
    private static final String PREFIX = Converter.HEX_PREFIX;
    private final int length;
    private final byte[] bytes;

    protected FixedSizeByteArray(int length, byte[] bytes) {
        if (bytes.length != length) {
            throw new IllegalArgumentException(
                String.format("invalid length: want %d bytes got %d", length, bytes.length));
        }
        this.length = length;
        // create a copy to make sure there is no outside reference to these bytes
        this.bytes = Arrays.copyOf(bytes, length);
    }

    protected FixedSizeByteArray(int length, String hex) {
        if (!hex.startsWith(PREFIX)) {
            throw new IllegalArgumentException("hex string must be prefixed with " + PREFIX);
        }
        if (hex.length() != length * 2 + PREFIX.length()) {
            throw new IllegalArgumentException(
                String.format(
                    "invalid length: want %d hex characters got %d", length * 2 + PREFIX.length(), hex.length()));
        }
        this.length = length;
        this.bytes = Converter.fromHexString(hex.substring(2));
    }

    @Override
    public String toString() {
        return PREFIX + Converter.toHexString(bytes);
    }

    public String toStringNoPrefix() {
        return Converter.toHexString(bytes);
    }

    public byte[] toBytes() {
        return Arrays.copyOf(bytes, length);
    }

    @Override
    public int compareTo(FixedSizeByteArray other) {
        return Arrays.compareUnsigned(bytes, other.bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == null) return false;
        if (!(obj instanceof FixedSizeByteArray)) return false;
        if (obj == this) return true;
        var other = (FixedSizeByteArray) obj;
        return Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    public static class Serializer extends JsonSerializer<FixedSizeByteArray> {
        @Override
        public void serialize(
            FixedSizeByteArray value, JsonGenerator jsonGenerator, SerializerProvider serializerProvider
        ) throws IOException {
            jsonGenerator.writeString(value.toString());
        }
    }

    public static class KeySerializer extends JsonSerializer<FixedSizeByteArray> {
        @Override
        public void serialize(
            FixedSizeByteArray value, JsonGenerator jsonGenerator, SerializerProvider serializerProvider
        ) throws IOException {
            jsonGenerator.writeFieldName(value.toString());
        }
    }
}
