package io.evmtrace.utils;

import com.google.common.io.BaseEncoding;

public final class Converter {
    public static final String HEX_PREFIX = "0x";

    private Converter() {}

    // Get byte array from hex string
    public static byte[] fromHexString(String hex) {
        return BaseEncoding.base16().lowerCase().decode(hex.toLowerCase());
    }

    // Get hex string representation of byte array
    public static String toHexString(byte[] bytes) {
        return BaseEncoding.base16().lowerCase().encode(bytes);
    }

    /**
     * Decode a 0x-prefixed hex string of any even length, "0x" being the empty byte string.
     *
     * @throws IllegalArgumentException if the prefix is missing or the digits are not valid hex
     */
    public static byte[] fromPrefixedHexString(String hex) {
        if (hex == null || !hex.startsWith(HEX_PREFIX)) {
            throw new IllegalArgumentException("hex string must be prefixed with " + HEX_PREFIX);
        }
        return fromHexString(hex.substring(HEX_PREFIX.length()));
    }

    public static String toPrefixedHexString(byte[] bytes) {
        return HEX_PREFIX + toHexString(bytes);
    }

    // BigInteger parsing accepts a leading sign, quantities on the wire never have one
    static boolean hasSign(String digits) {
        return !digits.isEmpty() && (digits.charAt(0) == '+' || digits.charAt(0) == '-');
    }
}
