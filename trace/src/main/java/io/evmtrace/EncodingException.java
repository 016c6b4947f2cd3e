package io.evmtrace;

/**
 * An in-memory value violates an invariant of the wire format and cannot be encoded.
 */
public class EncodingException extends TraceException {
    public EncodingException(String message, String path, Throwable cause) {
        super(message, path, cause);
    }
}
