package io.evmtrace.calltrace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.evmtrace.utils.Address;

import java.math.BigInteger;
import java.util.Objects;

/**
 * SELFDESTRUCT of {@code address}, sending its remaining {@code balance} to {@code refundAddress}.
 */
@JsonPropertyOrder({"address", "balance", "refundAddress"})
public class SuicideAction extends Action {
    public final Address address;
    public final Address refundAddress;
    public final BigInteger balance;

    @JsonCreator
    public SuicideAction(
        @JsonProperty(value = "address", required = true) Address address,
        @JsonProperty(value = "refundAddress", required = true) Address refundAddress,
        @JsonProperty(value = "balance", required = true) BigInteger balance
    ) {
        this.address = Objects.requireNonNull(address, "address");
        this.refundAddress = Objects.requireNonNull(refundAddress, "refundAddress");
        this.balance = Objects.requireNonNull(balance, "balance");
    }

    @Override
    public ActionType getType() {
        return ActionType.SUICIDE;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SuicideAction that = (SuicideAction) o;
        return address.equals(that.address) && refundAddress.equals(that.refundAddress) &&
            balance.equals(that.balance);
    }

    @Override
    public int hashCode() {
        return Objects.hash(address, refundAddress, balance);
    }

    @Override
    public String toString() {
        return String.format(
            "SuicideAction{address=%s, refundAddress=%s, balance=%s}", address, refundAddress, balance);
    }
}
