package io.evmtrace.vmtrace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.evmtrace.utils.Converter;

import java.util.Arrays;
import java.util.Objects;

/**
 * Chunk of memory written by an instruction.
 */
@JsonPropertyOrder({"data", "off"})
public class MemoryDiff {
    /**
     * Offset into memory the change begins.
     */
    public final int off;
    /**
     * The bytes written starting at {@link #off}.
     */
    private final byte[] data;

    @JsonCreator
    public MemoryDiff(
        @JsonProperty(value = "off", required = true) int off,
        @JsonProperty(value = "data", required = true) byte[] data
    ) {
        if (off < 0) {
            throw new IllegalArgumentException("memory offset must be non-negative: " + off);
        }
        this.off = off;
        this.data = Objects.requireNonNull(data, "data").clone();
    }

    public byte[] getData() {
        return data.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MemoryDiff that = (MemoryDiff) o;
        return off == that.off && Arrays.equals(data, that.data);
    }

    @Override
    public int hashCode() {
        return 31 * off + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return String.format("MemoryDiff{off=%d, data=%s}", off, Converter.toPrefixedHexString(data));
    }
}
