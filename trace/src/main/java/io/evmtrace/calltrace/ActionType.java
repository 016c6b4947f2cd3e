package io.evmtrace.calltrace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ActionType {
    CALL("call"),
    CREATE("create"),
    SUICIDE("suicide"),
    REWARD("reward");

    private final String tag;

    ActionType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static ActionType fromTag(String tag) {
        for (var type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException(String.format("unknown action type \"%s\"", tag));
    }
}
