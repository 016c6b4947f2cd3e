package io.evmtrace.statediff;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.evmtrace.utils.Hash;

import java.io.IOException;
import java.math.BigInteger;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Changes to a single account: balance, nonce, code and every touched storage slot. Storage slots are kept in
 * ascending key order.
 */
@JsonPropertyOrder({"balance", "code", "nonce", "storage"})
public class AccountDiff {
    public final Diff<BigInteger> balance;
    public final Diff<BigInteger> nonce;
    public final Diff<byte[]> code;
    public final SortedMap<Hash, Diff<Hash>> storage;

    @JsonCreator
    public AccountDiff(
        @JsonProperty(value = "balance", required = true) Diff<BigInteger> balance,
        @JsonProperty(value = "nonce", required = true) Diff<BigInteger> nonce,
        @JsonProperty(value = "code", required = true) Diff<byte[]> code,
        @JsonProperty(value = "storage", required = true)
        @JsonDeserialize(using = StorageDeserializer.class) Map<Hash, Diff<Hash>> storage
    ) {
        this.balance = Objects.requireNonNull(balance, "balance");
        this.nonce = Objects.requireNonNull(nonce, "nonce");
        this.code = Objects.requireNonNull(code, "code");
        Objects.requireNonNull(storage, "storage");
        this.storage = Collections.unmodifiableSortedMap(new TreeMap<>(storage));
    }

    /**
     * Account diff without any storage changes.
     */
    public AccountDiff(Diff<BigInteger> balance, Diff<BigInteger> nonce, Diff<byte[]> code) {
        this(balance, nonce, code, Collections.emptyMap());
    }

    /**
     * @return true if the balance, nonce, code or any storage slot changed
     */
    public boolean hasChanges() {
        return balance.getKind() != Diff.Kind.SAME ||
            nonce.getKind() != Diff.Kind.SAME ||
            code.getKind() != Diff.Kind.SAME ||
            storage.values().stream().anyMatch(diff -> diff.getKind() != Diff.Kind.SAME);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AccountDiff that = (AccountDiff) o;
        return balance.equals(that.balance) &&
            nonce.equals(that.nonce) &&
            code.equals(that.code) &&
            storage.equals(that.storage);
    }

    @Override
    public int hashCode() {
        return Objects.hash(balance, nonce, code, storage);
    }

    @Override
    public String toString() {
        return String.format(
            "AccountDiff{balance=%s, nonce=%s, code=%s, storage=%s}", balance, nonce, code, storage);
    }

    /**
     * Storage slots whose keys differ only in hex case are rejected instead of overwriting each other.
     */
    public static class StorageDeserializer extends JsonDeserializer<Map<Hash, Diff<Hash>>> {
        @Override
        public Map<Hash, Diff<Hash>> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            var typeFactory = ctxt.getTypeFactory();
            return UniqueKeyMaps.read(p, ctxt, typeFactory.constructType(Hash.class),
                typeFactory.constructParametricType(Diff.class, Hash.class));
        }
    }
}
