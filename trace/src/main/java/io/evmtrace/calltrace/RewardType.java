package io.evmtrace.calltrace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum RewardType {
    BLOCK("block"),
    UNCLE("uncle"),
    EMPTY_STEP("emptyStep"),
    EXTERNAL("external");

    private final String tag;

    RewardType(String tag) {
        this.tag = tag;
    }

    @JsonValue
    public String getTag() {
        return tag;
    }

    @JsonCreator
    public static RewardType fromTag(String tag) {
        for (var type : values()) {
            if (type.tag.equals(tag)) {
                return type;
            }
        }
        throw new IllegalArgumentException(String.format("unknown reward type \"%s\"", tag));
    }
}
