package io.evmtrace.calltrace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.evmtrace.utils.Address;
import io.evmtrace.utils.Converter;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

@JsonPropertyOrder({"callType", "from", "gas", "input", "to", "value"})
public class CallAction extends Action {
    public final Address from;
    public final Address to;
    public final BigInteger value;
    public final BigInteger gas;
    private final byte[] input;
    public final CallType callType;

    @JsonCreator
    public CallAction(
        @JsonProperty(value = "from", required = true) Address from,
        @JsonProperty(value = "to", required = true) Address to,
        @JsonProperty(value = "value", required = true) BigInteger value,
        @JsonProperty(value = "gas", required = true) BigInteger gas,
        @JsonProperty(value = "input", required = true) byte[] input,
        @JsonProperty(value = "callType", required = true) CallType callType
    ) {
        this.from = Objects.requireNonNull(from, "from");
        this.to = Objects.requireNonNull(to, "to");
        this.value = Objects.requireNonNull(value, "value");
        this.gas = Objects.requireNonNull(gas, "gas");
        this.input = Objects.requireNonNull(input, "input").clone();
        this.callType = Objects.requireNonNull(callType, "callType");
    }

    @Override
    public ActionType getType() {
        return ActionType.CALL;
    }

    public byte[] getInput() {
        return input.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CallAction that = (CallAction) o;
        return from.equals(that.from) &&
            to.equals(that.to) &&
            value.equals(that.value) &&
            gas.equals(that.gas) &&
            Arrays.equals(input, that.input) &&
            callType == that.callType;
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(from, to, value, gas, callType);
        result = 31 * result + Arrays.hashCode(input);
        return result;
    }

    @Override
    public String toString() {
        return String.format(
            "CallAction{callType=%s, from=%s, to=%s, value=%s, gas=%s, input=%s}",
            callType.getTag(), from, to, value, gas, Converter.toPrefixedHexString(input));
    }
}
