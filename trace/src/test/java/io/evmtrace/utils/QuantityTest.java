package io.evmtrace.utils;

import io.evmtrace.SchemaViolationException;
import io.evmtrace.TraceCodec;
import io.evmtrace.TraceCodecSettings;
import io.evmtrace.TraceTestBase;
import org.junit.Test;

import java.math.BigInteger;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

public class QuantityTest extends TraceTestBase {
    private final TraceCodec codec = new TraceCodec();
    private final TraceCodec hexCodec = new TraceCodec(TraceCodecSettings.defaults().withQuantityFormat(QuantityFormat.HEX));

    @Test
    public void wordsAcceptAllFormats() {
        assertEquals("json number", Integer.valueOf(42), codec.decode("42", Integer.class));
        assertEquals("hex string", Integer.valueOf(42), codec.decode("\"0x2a\"", Integer.class));
        assertEquals("decimal string", Integer.valueOf(42), codec.decode("\"42\"", Integer.class));
        assertEquals("hex string", Long.valueOf(42), hexCodec.decode("\"0x2a\"", Long.class));
    }

    @Test
    public void wordsRejectInvalidValues() {
        assertThrows("negative", SchemaViolationException.class, () -> codec.decode("-1", Integer.class));
        assertThrows("above int range", SchemaViolationException.class,
            () -> codec.decode("2147483648", Integer.class));
        assertThrows("above 64 bits", SchemaViolationException.class,
            () -> codec.decode("18446744073709551616", Long.class));
        assertThrows("not a number", SchemaViolationException.class, () -> codec.decode("\"0xzz\"", Long.class));
        assertThrows("fraction", SchemaViolationException.class, () -> codec.decode("1.5", Long.class));
        assertThrows("boolean", SchemaViolationException.class, () -> codec.decode("true", Integer.class));
    }

    @Test
    public void unsigned64() {
        assertEquals("max value should be stored as -1", Long.valueOf(-1L),
            codec.decode("18446744073709551615", Long.class));
        assertEquals("should print the unsigned value", "18446744073709551615", codec.encode(-1L));
        assertEquals("\"0xffffffffffffffff\"", hexCodec.encode(-1L));
    }

    @Test
    public void encodeFollowsFormat() {
        assertEquals("255", codec.encode(255));
        assertEquals("\"0xff\"", hexCodec.encode(255));
        assertEquals("\"0x0\"", hexCodec.encode(0L));
    }

    @Test
    public void bigIntegers() {
        assertEquals("\"0x0\"", codec.encode(BigInteger.ZERO));
        assertEquals("\"0xde0b6b3a7640000\"", codec.encode(new BigInteger("1000000000000000000")));
        assertEquals(BigInteger.valueOf(255), codec.decode("\"0xFF\"", BigInteger.class));

        var max = BigInteger.ONE.shiftLeft(256).subtract(BigInteger.ONE);
        assertEquals("256-bit max should decode", max, codec.decode("\"0x" + max.toString(16) + "\"", BigInteger.class));
        assertThrows("257 bits", SchemaViolationException.class,
            () -> codec.decode("\"0x1" + "0".repeat(64) + "\"", BigInteger.class));
        assertThrows("missing prefix", SchemaViolationException.class, () -> codec.decode("\"ff\"", BigInteger.class));
        assertThrows("empty digits", SchemaViolationException.class, () -> codec.decode("\"0x\"", BigInteger.class));
        assertThrows("json number", SchemaViolationException.class, () -> codec.decode("255", BigInteger.class));
    }

    @Test
    public void byteStrings() {
        assertArrayEquals("0x is the empty byte string", new byte[0], codec.decode("\"0x\"", byte[].class));
        assertArrayEquals(bytes("a9059cbb"), codec.decode("\"0xA9059CBB\"", byte[].class));
        assertEquals("\"0xa9059cbb\"", codec.encode(bytes("a9059cbb")));
        assertThrows("odd length", SchemaViolationException.class, () -> codec.decode("\"0xabc\"", byte[].class));
        assertThrows("missing prefix", SchemaViolationException.class, () -> codec.decode("\"ab\"", byte[].class));
    }

    @Test
    public void signsRejected() {
        assertThrows("plus in hex word", SchemaViolationException.class, () -> codec.decode("\"0x+5\"", Long.class));
        assertThrows("plus in decimal word", SchemaViolationException.class, () -> codec.decode("\"+7\"", Integer.class));
        assertThrows("minus in hex word", SchemaViolationException.class, () -> codec.decode("\"0x-5\"", Integer.class));
        assertThrows("plus in u256", SchemaViolationException.class,
            () -> codec.decode("\"0x+5\"", BigInteger.class));
        assertThrows("minus in u256", SchemaViolationException.class,
            () -> codec.decode("\"0x-5\"", BigInteger.class));
        assertEquals(Long.valueOf(5), codec.decode("\"0x5\"", Long.class));
    }
}
