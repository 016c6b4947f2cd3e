package io.evmtrace;

import io.evmtrace.statediff.StateDiff;
import org.junit.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class TraceCodecTest extends TraceTestBase {
    private final TraceCodec codec = new TraceCodec();

    @Test
    public void traceTypes() {
        var types = codec.decodeTraceTypes("[\"trace\",\"vmTrace\",\"stateDiff\"]");
        assertEquals(List.of(TraceType.TRACE, TraceType.VM_TRACE, TraceType.STATE_DIFF), types);
        assertEquals("[\"trace\",\"vmTrace\",\"stateDiff\"]", codec.encode(types));
        assertEquals(TraceType.VM_TRACE, TraceType.fromTag("vmTrace"));

        var e = assertThrows(SchemaViolationException.class, () -> codec.decodeTraceTypes("[\"trace\",\"vmtrace\"]"));
        assertEquals("$[1]", e.getPath());
    }

    @Test
    public void malformedJson() {
        var e = assertThrows(SchemaViolationException.class, () -> codec.decodeBlockTrace("]"));
        assertEquals("$", e.getPath());
        assertThrows("truncated", SchemaViolationException.class, () -> codec.decodeBlockTrace("{\"output\":"));
        assertThrows("not json", SchemaViolationException.class, () -> codec.decodeStateDiff("state"));
        assertThrows("trailing tokens", SchemaViolationException.class,
            () -> codec.decodeBlockTrace("{\"output\":\"0x\"} {}"));
        assertThrows("duplicate keys", SchemaViolationException.class,
            () -> codec.decodeBlockTrace("{\"output\":\"0x\",\"output\":\"0x01\"}"));
    }

    @Test
    public void nullPayloads() {
        var e = assertThrows(SchemaViolationException.class, () -> codec.decodeBlockTrace("null"));
        assertEquals("$", e.getPath());
        e = assertThrows(SchemaViolationException.class, () -> codec.decodeBlockTraces("[{\"output\":\"0x\"},null]"));
        assertEquals("$[1]", e.getPath());
        assertThrows(NullPointerException.class, () -> codec.decodeBlockTrace((String) null));
    }

    @Test
    public void unknownFieldsIgnored() {
        var replay = codec.decodeBlockTrace("{\"output\":\"0x\",\"destination\":\"0x1\",\"stateDiff\":{}}");
        assertEquals(StateDiff.empty(), replay.stateDiff);
    }

    @Test
    public void decodeFailureLeavesCodecUsable() {
        assertThrows(SchemaViolationException.class, () -> codec.decodeBlockTrace("{\"output\":\"zz\"}"));
        assertEquals(1, codec.decodeBlockTraces("[{\"output\":\"0x\"}]").size());
    }

    @Test
    public void encodingIsDeterministic() {
        var replay = codec.decodeBlockTrace(resource("traces/replay-transaction.json"));
        assertEquals(codec.encode(replay), codec.encode(replay));
        assertEquals(codec.encode(replay), new TraceCodec().encode(codec.decodeBlockTrace(codec.encode(replay))));
    }

    @Test
    public void errorsCarryPaths() {
        var e = assertThrows(SchemaViolationException.class,
            () -> codec.decodeBlockTrace("{\"output\":\"0x\",\"vmTrace\":{\"code\":\"0x\",\"ops\":[{\"pc\":\"x\"}]}}"));
        assertEquals("$.vmTrace.ops[0].pc", e.getPath());
        assertTrue(e.getMessage(), e.getMessage().endsWith("at $.vmTrace.ops[0].pc"));
        assertTrue("cause should be kept", e.getCause() != null);
    }

    @Test
    public void mapperCopy() {
        assertNotSame(codec.getMapper(), codec.getMapper());
        assertEquals(codec.getSettings().getMaxVmTraceDepth(), TraceCodecSettings.defaults().getMaxVmTraceDepth());
    }

    @Test
    public void undecodableBytes() {
        // detected as UTF-32, 0x7fffffff is not a code point
        var payload = new byte[] {0, 0, 0, '[', 0x7f, (byte) 0xff, (byte) 0xff, (byte) 0xff, 0, 0, 0, ']'};
        var e = assertThrows(SchemaViolationException.class, () -> codec.decodeBlockTraces(payload));
        assertEquals("$", e.getPath());
        assertEquals(1, codec.decodeBlockTraces("[{\"output\":\"0x\"}]".getBytes(StandardCharsets.UTF_8)).size());
    }
}
