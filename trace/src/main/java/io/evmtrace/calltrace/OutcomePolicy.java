package io.evmtrace.calltrace;

/**
 * How to decode a trace that carries both a result and an error.
 */
public enum OutcomePolicy {
    /**
     * Reject the payload.
     */
    STRICT,
    /**
     * Keep the error and drop the result.
     */
    LENIENT
}
