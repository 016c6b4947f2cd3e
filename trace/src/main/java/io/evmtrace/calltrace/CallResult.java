package io.evmtrace.calltrace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.evmtrace.utils.Converter;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

@JsonPropertyOrder({"gasUsed", "output"})
public class CallResult extends TraceResult {
    public final BigInteger gasUsed;
    private final byte[] output;

    @JsonCreator
    public CallResult(
        @JsonProperty(value = "gasUsed", required = true) BigInteger gasUsed,
        @JsonProperty(value = "output", required = true) byte[] output
    ) {
        this.gasUsed = Objects.requireNonNull(gasUsed, "gasUsed");
        this.output = Objects.requireNonNull(output, "output").clone();
    }

    public byte[] getOutput() {
        return output.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CallResult that = (CallResult) o;
        return gasUsed.equals(that.gasUsed) && Arrays.equals(output, that.output);
    }

    @Override
    public int hashCode() {
        return 31 * gasUsed.hashCode() + Arrays.hashCode(output);
    }

    @Override
    public String toString() {
        return String.format("CallResult{gasUsed=%s, output=%s}", gasUsed, Converter.toPrefixedHexString(output));
    }
}
