package io.hermes.spec;

import org.jspecify.annotations.Nullable;

/**
 * A deadline was exceeded before the operation reached a terminal state.
 */
public class TimeoutError extends A2AError {

    public TimeoutError() {
        this("Operation timed out");
    }

    public TimeoutError(String message) {
        this(message, null);
    }

    public TimeoutError(String message, @Nullable Object data) {
        super(A2AErrorCodes.TIMEOUT_ERROR_CODE, message, data);
    }
}
