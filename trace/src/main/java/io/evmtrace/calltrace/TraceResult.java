package io.evmtrace.calltrace;

/**
 * Successful outcome of a call tree node. Only calls and creates produce one.
 */
public abstract class TraceResult {
    TraceResult() {}

    static Class<? extends TraceResult> classOf(ActionType type) {
        switch (type) {
            case CALL:
                return CallResult.class;
            case CREATE:
                return CreateResult.class;
            default:
                return null;
        }
    }
}
