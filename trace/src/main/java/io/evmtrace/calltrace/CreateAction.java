package io.evmtrace.calltrace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.evmtrace.utils.Address;
import io.evmtrace.utils.Converter;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Objects;

@JsonPropertyOrder({"from", "gas", "init", "value"})
public class CreateAction extends Action {
    public final Address from;
    public final BigInteger value;
    public final BigInteger gas;
    private final byte[] init;

    @JsonCreator
    public CreateAction(
        @JsonProperty(value = "from", required = true) Address from,
        @JsonProperty(value = "value", required = true) BigInteger value,
        @JsonProperty(value = "gas", required = true) BigInteger gas,
        @JsonProperty(value = "init", required = true) byte[] init
    ) {
        this.from = Objects.requireNonNull(from, "from");
        this.value = Objects.requireNonNull(value, "value");
        this.gas = Objects.requireNonNull(gas, "gas");
        this.init = Objects.requireNonNull(init, "init").clone();
    }

    @Override
    public ActionType getType() {
        return ActionType.CREATE;
    }

    public byte[] getInit() {
        return init.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CreateAction that = (CreateAction) o;
        return from.equals(that.from) && value.equals(that.value) && gas.equals(that.gas) &&
            Arrays.equals(init, that.init);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(from, value, gas) + Arrays.hashCode(init);
    }

    @Override
    public String toString() {
        return String.format(
            "CreateAction{from=%s, value=%s, gas=%s, init=%s}", from, value, gas, Converter.toPrefixedHexString(init));
    }
}
