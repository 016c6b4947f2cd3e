package io.evmtrace.calltrace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.evmtrace.utils.Address;
import io.evmtrace.utils.Converter;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

@JsonPropertyOrder({"address", "code", "gasUsed"})
public class CreateResult extends TraceResult {
    public final BigInteger gasUsed;
    private final byte[] code;
    public final Address address;

    @JsonCreator
    public CreateResult(
        @JsonProperty(value = "gasUsed", required = true) BigInteger gasUsed,
        @JsonProperty(value = "code", required = true) byte[] code,
        @JsonProperty(value = "address", required = true) Address address
    ) {
        this.gasUsed = Objects.requireNonNull(gasUsed, "gasUsed");
        this.code = Objects.requireNonNull(code, "code").clone();
        this.address = Objects.requireNonNull(address, "address");
    }

    public byte[] getCode() {
        return code.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CreateResult that = (CreateResult) o;
        return gasUsed.equals(that.gasUsed) && Arrays.equals(code, that.code) && address.equals(that.address);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(gasUsed, address) + Arrays.hashCode(code);
    }

    @Override
    public String toString() {
        return String.format(
            "CreateResult{address=%s, gasUsed=%s, code=%s}", address, gasUsed, Converter.toPrefixedHexString(code));
    }
}
