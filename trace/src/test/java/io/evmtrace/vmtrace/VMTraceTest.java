package io.evmtrace.vmtrace;

import io.evmtrace.DepthExceededException;
import io.evmtrace.SchemaViolationException;
import io.evmtrace.TraceCodec;
import io.evmtrace.TraceCodecSettings;
import io.evmtrace.TraceTestBase;
import io.evmtrace.utils.QuantityFormat;
import org.junit.Test;

import java.math.BigInteger;
import java.util.List;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class VMTraceTest extends TraceTestBase {
    private final TraceCodec codec = new TraceCodec();

    /**
     * VM trace with the given number of nested frames, each frame calling the next from its first instruction.
     */
    private static String nested(int levels) {
        var json = new StringBuilder();
        for (int i = 1; i < levels; i++) {
            json.append("{\"code\":\"0x\",\"ops\":[{\"cost\":1,\"pc\":0,\"sub\":");
        }
        json.append("{\"code\":\"0x\",\"ops\":[]}");
        for (int i = 1; i < levels; i++) {
            json.append("}]}");
        }
        return json.toString();
    }

    private static String subPath(int hops) {
        return "$" + ".ops[0].sub".repeat(hops);
    }

    @Test
    public void decodeNested() {
        var json = "{\"code\":\"0x6080\",\"ops\":[" +
            "{\"cost\":3,\"ex\":{\"mem\":null,\"push\":[\"0x80\"],\"store\":null,\"used\":997},\"pc\":0,\"sub\":null}," +
            "{\"cost\":700,\"ex\":{\"mem\":{\"data\":\"0xff\",\"off\":32},\"push\":[],\"store\":{\"key\":\"0x0\",\"val\":\"0x1\"},\"used\":297}," +
            "\"pc\":2,\"sub\":{\"code\":\"0x00\",\"ops\":[{\"cost\":0,\"ex\":null,\"pc\":0}]}}" +
            "]}";
        var trace = codec.decodeVmTrace(json);
        assertArrayEquals(bytes("6080"), trace.getCode());
        assertEquals(2, trace.ops.size());
        assertEquals(2, trace.depth());

        var first = trace.ops.get(0);
        assertEquals(0, first.pc);
        assertEquals(3, first.cost);
        assertEquals(List.of(BigInteger.valueOf(0x80)), first.ex.push);
        assertNull(first.ex.mem);
        assertNull(first.sub);

        var second = trace.ops.get(1);
        assertEquals(new MemoryDiff(32, bytes("ff")), second.ex.mem);
        assertEquals(new StorageDiff(BigInteger.ZERO, BigInteger.ONE), second.ex.store);
        assertFalse("instruction without effects was not executed", second.sub.ops.get(0).wasExecuted());
        assertTrue(second.wasExecuted());
    }

    @Test
    public void depthLimit() {
        var limited = new TraceCodec(TraceCodecSettings.defaults().withMaxVmTraceDepth(4));
        assertEquals("nesting equal to the limit is accepted", 4, limited.decodeVmTrace(nested(4)).depth());

        var e = assertThrows(DepthExceededException.class, () -> limited.decodeVmTrace(nested(5)));
        assertEquals(4, e.getMaxDepth());
        assertEquals("should point at the frame beyond the limit", subPath(4), e.getPath());

        var block = "{\"output\":\"0x\",\"vmTrace\":" + nested(6) + "}";
        e = assertThrows(DepthExceededException.class, () -> limited.decodeBlockTrace(block));
        assertEquals("$.vmTrace" + subPath(4).substring(1), e.getPath());
    }

    @Test
    public void defaultDepthLimit() {
        assertEquals(VMTrace.DEFAULT_MAX_DEPTH, codec.getSettings().getMaxVmTraceDepth());
        assertEquals(64, codec.decodeVmTrace(nested(64)).depth());
        assertThrows(DepthExceededException.class, () -> codec.decodeVmTrace(nested(65)));
    }

    @Test
    public void deepestSupportedLimit() {
        var deep = new TraceCodec(TraceCodecSettings.defaults().withMaxVmTraceDepth(VMTrace.MAX_SUPPORTED_DEPTH));
        assertEquals(VMTrace.MAX_SUPPORTED_DEPTH, deep.decodeVmTrace(nested(VMTrace.MAX_SUPPORTED_DEPTH)).depth());
        var e = assertThrows(DepthExceededException.class,
            () -> deep.decodeVmTrace(nested(VMTrace.MAX_SUPPORTED_DEPTH + 1)));
        assertEquals(VMTrace.MAX_SUPPORTED_DEPTH, e.getMaxDepth());
    }

    @Test
    public void constructedNestingIsBounded() {
        var trace = new VMTrace(new byte[0], List.of());
        for (int i = 1; i < VMTrace.MAX_SUPPORTED_DEPTH; i++) {
            trace = new VMTrace(new byte[0], List.of(new VMOperation(0, 0, null, trace)));
        }
        assertEquals(VMTrace.MAX_SUPPORTED_DEPTH, trace.depth());
        var deepest = trace;
        assertThrows(IllegalArgumentException.class,
            () -> new VMTrace(new byte[0], List.of(new VMOperation(0, 0, null, deepest))));
    }

    @Test
    public void codeIsCopied() {
        var code = bytes("6080");
        var trace = new VMTrace(code, List.of());
        code[0] = 0;
        assertArrayEquals("changing the input must not change the trace", bytes("6080"), trace.getCode());
        trace.getCode()[0] = 0;
        assertArrayEquals("changing the output must not change the trace", bytes("6080"), trace.getCode());
        assertEquals(new VMTrace(bytes("6080"), List.of()), trace);
        assertEquals("{\"code\":\"0x6080\",\"ops\":[]}", codec.encode(trace));

        var data = bytes("ff");
        var mem = new MemoryDiff(0, data);
        data[0] = 0;
        assertArrayEquals(bytes("ff"), mem.getData());
    }

    @Test
    public void permissiveDefaults() {
        var trace = codec.decodeVmTrace("{\"ops\":[{\"ex\":{}}]}");
        assertArrayEquals("missing code decodes to empty", new byte[0], trace.getCode());
        var op = trace.ops.get(0);
        assertEquals(0, op.pc);
        assertEquals(0, op.cost);
        assertEquals(0, op.ex.used);
        assertTrue(op.ex.push.isEmpty());
        assertTrue(codec.decodeVmTrace("{}").ops.isEmpty());
    }

    @Test
    public void strictFields() {
        var strict = new TraceCodec(TraceCodecSettings.defaults().withVmTraceDefaults(false));
        var e = assertThrows(SchemaViolationException.class, () -> strict.decodeVmTrace("{\"ops\":[]}"));
        assertEquals("$.code", e.getPath());
        e = assertThrows(SchemaViolationException.class,
            () -> strict.decodeVmTrace("{\"code\":\"0x\",\"ops\":[{\"pc\":1}]}"));
        assertEquals("$.ops[0].cost", e.getPath());
        e = assertThrows(SchemaViolationException.class,
            () -> strict.decodeVmTrace("{\"code\":\"0x\",\"ops\":[{\"cost\":1,\"ex\":{\"push\":[]},\"pc\":1}]}"));
        assertEquals("$.ops[0].ex.used", e.getPath());
    }

    @Test
    public void explicitNullsRejected() {
        var e = assertThrows(SchemaViolationException.class, () -> codec.decodeVmTrace("{\"code\":null,\"ops\":[]}"));
        assertEquals("$.code", e.getPath());
        e = assertThrows(SchemaViolationException.class, () -> codec.decodeVmTrace("{\"code\":\"0x\",\"ops\":null}"));
        assertEquals("$.ops", e.getPath());
        assertThrows("null pc", SchemaViolationException.class,
            () -> codec.decodeVmTrace("{\"code\":\"0x\",\"ops\":[{\"cost\":1,\"pc\":null}]}"));
        assertThrows("null operation", SchemaViolationException.class,
            () -> codec.decodeVmTrace("{\"code\":\"0x\",\"ops\":[null]}"));
        assertThrows("null stack item", SchemaViolationException.class,
            () -> codec.decodeVmTrace("{\"code\":\"0x\",\"ops\":[{\"cost\":1,\"ex\":{\"push\":[null],\"used\":1},\"pc\":0}]}"));
    }

    @Test
    public void incompleteEffectsRejected() {
        assertThrows("memory without data", SchemaViolationException.class,
            () -> codec.decodeVmTrace("{\"code\":\"0x\",\"ops\":[{\"cost\":1,\"ex\":{\"mem\":{\"off\":0},\"push\":[],\"used\":1},\"pc\":0}]}"));
        assertThrows("negative offset", SchemaViolationException.class,
            () -> codec.decodeVmTrace("{\"code\":\"0x\",\"ops\":[{\"cost\":1,\"ex\":{\"mem\":{\"data\":\"0x\",\"off\":-1},\"push\":[],\"used\":1},\"pc\":0}]}"));
        assertThrows("storage without value", SchemaViolationException.class,
            () -> codec.decodeVmTrace("{\"code\":\"0x\",\"ops\":[{\"cost\":1,\"ex\":{\"push\":[],\"store\":{\"key\":\"0x1\"},\"used\":1},\"pc\":0}]}"));
    }

    @Test
    public void unknownFieldsIgnored() {
        var trace = codec.decodeVmTrace("{\"code\":\"0x\",\"ops\":[{\"cost\":1,\"pc\":0,\"op\":\"STOP\",\"idx\":[0]}],\"extra\":{}}");
        assertEquals(new VMTrace(new byte[0], List.of(new VMOperation(0, 1, null, null))), trace);
    }

    @Test
    public void encodeQuantities() {
        var trace = new VMTrace(bytes("00"), List.of(
            new VMOperation(2, -1L, new VMExecutedOperation(32000, List.of(BigInteger.TEN), null, null), null)));
        var json = codec.encode(trace);
        assertSameJson("gas is written as an unsigned decimal",
            "{\"code\":\"0x00\",\"ops\":[{\"cost\":18446744073709551615,\"ex\":{\"push\":[\"0xa\"],\"used\":32000},\"pc\":2}]}",
            json);
        assertEquals(trace, codec.decodeVmTrace(json));

        var hex = new TraceCodec(TraceCodecSettings.defaults().withQuantityFormat(QuantityFormat.HEX));
        var hexJson = hex.encode(trace);
        assertTrue(hexJson, hexJson.contains("\"pc\":\"0x2\""));
        assertTrue(hexJson, hexJson.contains("\"cost\":\"0xffffffffffffffff\""));
        assertEquals("hex output decodes with any settings", trace, codec.decodeVmTrace(hexJson));
    }

    @Test
    public void depthOfWideTrace() {
        var leaf = new VMTrace(new byte[0], List.of());
        var twoLevels = new VMTrace(new byte[0], List.of(new VMOperation(0, 0, null, leaf)));
        var wide = new VMTrace(new byte[0], List.of(
            new VMOperation(0, 0, null, leaf),
            new VMOperation(1, 0, null, twoLevels),
            new VMOperation(2, 0, null, null)));
        assertEquals(1, leaf.depth());
        assertEquals("depth follows the deepest branch", 3, wide.depth());
    }
}
