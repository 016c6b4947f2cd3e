package io.evmtrace;

public class DepthExceededException extends TraceException {
    private final int maxDepth;

    public DepthExceededException(int maxDepth, String path, Throwable cause) {
        super(String.format("VM trace nesting exceeds the maximum depth of %d", maxDepth), path, cause);
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
