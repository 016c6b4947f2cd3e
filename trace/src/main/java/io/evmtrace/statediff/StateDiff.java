package io.evmtrace.statediff;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.evmtrace.utils.Address;

import java.io.IOException;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * State changes of a transaction, keyed by account address in ascending order. Two instances built from the same
 * entries compare equal and encode identically, whatever order the entries were added in.
 */
@JsonDeserialize(using = StateDiff.Deserializer.class)
public class StateDiff {
    private final SortedMap<Address, AccountDiff> accounts;

    public StateDiff(Map<Address, AccountDiff> accounts) {
        Objects.requireNonNull(accounts, "accounts");
        var sorted = new TreeMap<Address, AccountDiff>();
        accounts.forEach((address, diff) -> sorted.put(
            Objects.requireNonNull(address, "address"),
            Objects.requireNonNull(diff, () -> "account diff of " + address)
        ));
        this.accounts = Collections.unmodifiableSortedMap(sorted);
    }

    public static StateDiff empty() {
        return new StateDiff(Collections.emptyMap());
    }

    @JsonValue
    public SortedMap<Address, AccountDiff> getAccounts() {
        return accounts;
    }

    public AccountDiff get(Address address) {
        return accounts.get(address);
    }

    public boolean contains(Address address) {
        return accounts.containsKey(address);
    }

    public int size() {
        return accounts.size();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return accounts.equals(((StateDiff) o).accounts);
    }

    @Override
    public int hashCode() {
        return accounts.hashCode();
    }

    @Override
    public String toString() {
        return String.format("StateDiff%s", accounts);
    }

    public static class Deserializer extends JsonDeserializer<StateDiff> {
        @Override
        public StateDiff deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
            Map<Address, AccountDiff> accounts = UniqueKeyMaps.read(
                p, ctxt, ctxt.constructType(Address.class), ctxt.constructType(AccountDiff.class));
            return new StateDiff(accounts);
        }

        @Override
        public Class<?> handledType() {
            return StateDiff.class;
        }
    }
}
