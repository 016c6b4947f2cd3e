package io.evmtrace.utils;

/**
 * Output convention for machine words and 64-bit gas values. Both conventions are accepted when decoding.
 */
public enum QuantityFormat {
    /**
     * Plain JSON numbers, e.g. {@code 21000}.
     */
    DECIMAL,
    /**
     * 0x-prefixed hex strings, e.g. {@code "0x5208"}.
     */
    HEX
}
