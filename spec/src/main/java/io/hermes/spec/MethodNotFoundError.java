package io.hermes.spec;

import org.jspecify.annotations.Nullable;

/**
 * No handler is registered for the requested method.
 */
public class MethodNotFoundError extends A2AError {

    public MethodNotFoundError() {
        this("Method not found");
    }

    public MethodNotFoundError(String message) {
        this(message, null);
    }

    public MethodNotFoundError(String message, @Nullable Object data) {
        super(A2AErrorCodes.METHOD_NOT_FOUND_ERROR_CODE, message, data);
    }
}
