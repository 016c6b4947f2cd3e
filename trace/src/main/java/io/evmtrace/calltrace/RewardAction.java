package io.evmtrace.calltrace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import io.evmtrace.utils.Address;

import java.math.BigInteger;
import java.util.Objects;

@JsonPropertyOrder({"author", "rewardType", "value"})
public class RewardAction extends Action {
    public final Address author;
    public final BigInteger value;
    public final RewardType rewardType;

    @JsonCreator
    public RewardAction(
        @JsonProperty(value = "author", required = true) Address author,
        @JsonProperty(value = "value", required = true) BigInteger value,
        @JsonProperty(value = "rewardType", required = true) RewardType rewardType
    ) {
        this.author = Objects.requireNonNull(author, "author");
        this.value = Objects.requireNonNull(value, "value");
        this.rewardType = Objects.requireNonNull(rewardType, "rewardType");
    }

    @Override
    public ActionType getType() {
        return ActionType.REWARD;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        RewardAction that = (RewardAction) o;
        return author.equals(that.author) && value.equals(that.value) && rewardType == that.rewardType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(author, value, rewardType);
    }

    @Override
    public String toString() {
        return String.format("RewardAction{author=%s, value=%s, rewardType=%s}", author, value, rewardType.getTag());
    }
}
