package io.evmtrace.vmtrace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Storage slot written by an SSTORE.
 */
@JsonPropertyOrder({"key", "val"})
public class StorageDiff {
    public final BigInteger key;
    public final BigInteger val;

    @JsonCreator
    public StorageDiff(
        @JsonProperty(value = "key", required = true) BigInteger key,
        @JsonProperty(value = "val", required = true) BigInteger val
    ) {
        this.key = Objects.requireNonNull(key, "key");
        this.val = Objects.requireNonNull(val, "val");
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StorageDiff that = (StorageDiff) o;
        return key.equals(that.key) && val.equals(that.val);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, val);
    }

    @Override
    public String toString() {
        return String.format("StorageDiff{key=%s, val=%s}", key, val);
    }
}
