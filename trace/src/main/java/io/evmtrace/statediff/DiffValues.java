package io.evmtrace.statediff;

import io.evmtrace.utils.Converter;

import java.util.Arrays;
import java.util.Objects;

// byte[] payloads need content equality
final class DiffValues {
    private DiffValues() {}

    static boolean equal(Object a, Object b) {
        if (a instanceof byte[] && b instanceof byte[]) {
            return Arrays.equals((byte[]) a, (byte[]) b);
        }
        return Objects.equals(a, b);
    }

    static int hash(Object value) {
        if (value instanceof byte[]) {
            return Arrays.hashCode((byte[]) value);
        }
        return Objects.hashCode(value);
    }

    static String toString(Object value) {
        if (value instanceof byte[]) {
            return Converter.toPrefixedHexString((byte[]) value);
        }
        return String.valueOf(value);
    }
}
