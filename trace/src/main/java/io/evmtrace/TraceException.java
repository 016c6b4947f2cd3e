package io.evmtrace;

/**
 * Failure to decode or encode a trace. The path points at the offending field, e.g. {@code $.vmTrace.ops[3].sub}.
 */
public class TraceException extends RuntimeException {
    private final String path;

    public TraceException(String message, String path, Throwable cause) {
        super(String.format("%s at %s", message, path), cause);
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
