package io.evmtrace.vmtrace;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.JsonMappingException;

/**
 * Raised while decoding when VM traces are nested deeper than allowed.
 */
public class VMTraceDepthException extends JsonMappingException {
    private final int maxDepth;

    public VMTraceDepthException(JsonParser p, int maxDepth) {
        super(p, String.format("VM trace nesting exceeds the maximum depth of %d", maxDepth));
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
