package io.evmtrace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Trace views a caller can request from the ad-hoc tracing API.
 */
public enum TraceType {
    /**
     * Call tree trace, see {@link io.evmtrace.calltrace.TransactionTrace}.
     */
    TRACE("trace"),
    /**
     * Instruction level trace, see {@link io.evmtrace.vmtrace.VMTrace}.
     */
    VM_TRACE("vmTrace"),
    /**
     * State difference, see {@link io.evmtrace.statediff.StateDiff}.
     */
    STATE_DIFF("stateDiff");

    private final String tag;

    TraceType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static TraceType fromTag(String tag) {
        for (var type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException(String.format("unknown trace type \"%s\"", tag));
    }
}
