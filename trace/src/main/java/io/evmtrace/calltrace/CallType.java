package io.evmtrace.calltrace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Opcode that started a call frame.
 */
public enum CallType {
    NONE("none"),
    CALL("call"),
    CALL_CODE("callcode"),
    DELEGATE_CALL("delegatecall"),
    STATIC_CALL("staticcall");

    private final String tag;

    CallType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static CallType fromTag(String tag) {
        for (var type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException(String.format("unknown call type \"%s\"", tag));
    }
}
