package io.hermes.spec;

import org.jspecify.annotations.Nullable;

/**
 * A lifecycle transition is not allowed from the entity's current state.
 */
public class InvalidStateError extends A2AError {

    public InvalidStateError() {
        this("Invalid state transition");
    }

    public InvalidStateError(String message) {
        this(message, null);
    }

    public InvalidStateError(String message, @Nullable Object data) {
        super(A2AErrorCodes.INVALID_STATE_ERROR_CODE, message, data);
    }
}
