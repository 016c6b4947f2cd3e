package io.evmtrace;

/**
 * The payload does not have the shape required by the type it is decoded into: malformed JSON, an unknown tag,
 * invalid hex, a missing required field or a forbidden combination of fields.
 */
public class SchemaViolationException extends TraceException {
    public SchemaViolationException(String message, String path, Throwable cause) {
        super(message, path, cause);
    }
}
