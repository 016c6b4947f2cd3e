package io.evmtrace.calltrace;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Parameters of a single call tree node. The concrete class is selected by the {@code type} field of the
 * enclosing {@link TransactionTrace}, never by the shape of the payload.
 */
public abstract class Action {
    Action() {}

    @JsonIgnore
    public abstract ActionType getType();

    static Class<? extends Action> classOf(ActionType type) {
        switch (type) {
            case CALL:
                return CallAction.class;
            case CREATE:
                return CreateAction.class;
            case SUICIDE:
                return SuicideAction.class;
            default:
                return RewardAction.class;
        }
    }
}
