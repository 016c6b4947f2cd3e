package io.evmtrace.statediff;

import io.evmtrace.SchemaViolationException;
import io.evmtrace.TraceCodec;
import io.evmtrace.TraceTestBase;
import io.evmtrace.utils.Address;
import io.evmtrace.utils.Hash;
import org.junit.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class StateDiffTest extends TraceTestBase {
    private final TraceCodec codec = new TraceCodec();

    private static AccountDiff balanceChange(long from, long to) {
        return new AccountDiff(
            Diff.changed(BigInteger.valueOf(from), BigInteger.valueOf(to)), Diff.same(), Diff.same());
    }

    @Test
    public void encodingIgnoresInsertionOrder() {
        var first = new LinkedHashMap<Address, AccountDiff>();
        first.put(address("cc"), balanceChange(1, 2));
        first.put(address("aa"), balanceChange(3, 4));
        first.put(address("bb"), balanceChange(5, 6));
        var second = new LinkedHashMap<Address, AccountDiff>();
        second.put(address("bb"), balanceChange(5, 6));
        second.put(address("cc"), balanceChange(1, 2));
        second.put(address("aa"), balanceChange(3, 4));

        var a = new StateDiff(first);
        var b = new StateDiff(second);
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());

        var json = codec.encode(a);
        assertEquals("encoding must be byte-identical", json, codec.encode(b));
        assertTrue("accounts should be written in ascending address order",
            json.indexOf(address("aa").toString()) < json.indexOf(address("bb").toString()) &&
                json.indexOf(address("bb").toString()) < json.indexOf(address("cc").toString()));
    }

    @Test
    public void storageIsSorted() {
        var storage = new LinkedHashMap<Hash, Diff<Hash>>();
        storage.put(hash("ff"), Diff.born(hash("01")));
        storage.put(hash("10"), Diff.died(hash("02")));
        storage.put(hash("80"), Diff.same());
        var account = new AccountDiff(Diff.same(), Diff.same(), Diff.same(), storage);

        List<Hash> keys = new ArrayList<>(account.storage.keySet());
        assertEquals(List.of(hash("10"), hash("80"), hash("ff")), keys);
        assertThrows("storage must not be modifiable", UnsupportedOperationException.class,
            () -> account.storage.put(hash("01"), Diff.same()));
    }

    @Test
    public void hasChanges() {
        var untouched = new AccountDiff(Diff.same(), Diff.same(), Diff.same(), Map.of(hash("01"), Diff.same()));
        assertFalse(untouched.hasChanges());
        assertTrue(balanceChange(1, 2).hasChanges());
        var slotOnly = new AccountDiff(
            Diff.same(), Diff.same(), Diff.same(), Map.of(hash("01"), Diff.born(hash("02"))));
        assertTrue("a storage change is a change", slotOnly.hasChanges());
    }

    @Test
    public void decodeAccounts() {
        var json = "{\"" + address("aa") + "\":{" +
            "\"balance\":{\"-\":\"0x64\"}," +
            "\"code\":{\"-\":\"0x6080\"}," +
            "\"nonce\":{\"*\":{\"from\":\"0x1\",\"to\":\"0x0\"}}," +
            "\"storage\":{\"" + hash("01") + "\":{\"*\":{\"from\":\"" + hash("02") + "\",\"to\":\"" + Hash.ZERO + "\"}}}" +
            "}}";
        var diff = codec.decodeStateDiff(json);
        assertEquals(1, diff.size());
        assertTrue(diff.contains(address("aa")));
        var account = diff.get(address("aa"));
        assertEquals(Diff.died(BigInteger.valueOf(100)), account.balance);
        assertEquals(Diff.died(bytes("6080")), account.code);
        assertEquals(Diff.changed(BigInteger.ONE, BigInteger.ZERO), account.nonce);
        assertEquals(Diff.changed(hash("02"), Hash.ZERO), account.storage.get(hash("01")));
        assertSameJson("should re-encode to the same document", json, codec.encode(diff));
    }

    @Test
    public void emptyStateDiff() {
        assertEquals("{}", codec.encode(StateDiff.empty()));
        assertEquals(StateDiff.empty(), codec.decodeStateDiff("{}"));
    }

    @Test
    public void rejectMalformed() {
        var account = "{\"balance\":\"=\",\"code\":\"=\",\"nonce\":\"=\",\"storage\":{}}";
        assertThrows("short address key", SchemaViolationException.class,
            () -> codec.decodeStateDiff("{\"0xaa\":" + account + "}"));
        assertThrows("short storage key", SchemaViolationException.class,
            () -> codec.decodeStateDiff("{\"" + address("aa") +
                "\":{\"balance\":\"=\",\"code\":\"=\",\"nonce\":\"=\",\"storage\":{\"0x01\":\"=\"}}}"));
        assertThrows("null account", SchemaViolationException.class,
            () -> codec.decodeStateDiff("{\"" + address("aa") + "\":null}"));
        assertThrows("duplicate account", SchemaViolationException.class,
            () -> codec.decodeStateDiff("{\"" + address("aa") + "\":" + account + ",\"" + address("aa") + "\":" + account + "}"));

        var e = assertThrows("missing nonce", SchemaViolationException.class,
            () -> codec.decodeStateDiff("{\"" + address("aa") + "\":{\"balance\":\"=\",\"code\":\"=\",\"storage\":{}}}"));
        assertTrue("path should name the account: " + e.getPath(), e.getPath().startsWith("$[\"" + address("aa") + "\"]"));

        e = assertThrows("bad balance tag", SchemaViolationException.class,
            () -> codec.decodeStateDiff("{\"" + address("aa") +
                "\":{\"balance\":\"+\",\"code\":\"=\",\"nonce\":\"=\",\"storage\":{}}}"));
        assertEquals("$[\"" + address("aa") + "\"].balance", e.getPath());
    }

    @Test
    public void keysDifferingOnlyInCaseAreDuplicates() {
        var lower = address("aa").toString();
        var upper = "0x" + lower.substring(2).toUpperCase();
        var account = "{\"balance\":\"=\",\"code\":\"=\",\"nonce\":\"=\",\"storage\":{}}";
        var e = assertThrows("duplicate account", SchemaViolationException.class,
            () -> codec.decodeStateDiff("{\"" + lower + "\":" + account + ",\"" + upper + "\":" + account + "}"));
        assertEquals("$[\"" + upper + "\"]", e.getPath());

        var slot = hash("aa").toString();
        var upperSlot = "0x" + slot.substring(2).toUpperCase();
        var storage = "{\"" + slot + "\":{\"+\":\"" + hash("01") + "\"},\"" + upperSlot + "\":\"=\"}";
        e = assertThrows("duplicate slot", SchemaViolationException.class,
            () -> codec.decodeStateDiff("{\"" + lower +
                "\":{\"balance\":\"=\",\"code\":\"=\",\"nonce\":\"=\",\"storage\":" + storage + "}}"));
        assertEquals("$[\"" + lower + "\"].storage[\"" + upperSlot + "\"]", e.getPath());

        var distinct = codec.decodeStateDiff("{\"" + upper + "\":" + account + ",\"" + address("bb") + "\":" + account + "}");
        assertEquals("keys of different accounts are kept", 2, distinct.getAccounts().size());
    }

    @Test
    public void nullAccountRejected() {
        var e = assertThrows(SchemaViolationException.class,
            () -> codec.decodeStateDiff("{\"" + address("aa") + "\":null}"));
        assertEquals("$[\"" + address("aa") + "\"]", e.getPath());
    }
}
