package io.evmtrace;

/**
 * How absent optional fields are written when encoding. Decoding treats a missing field and an explicit null alike.
 */
public enum NullFieldPolicy {
    OMIT,
    EXPLICIT
}
