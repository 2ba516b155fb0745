package io.hermes.spec;

import org.jspecify.annotations.Nullable;

/**
 * The authenticated caller is not allowed to perform the operation.
 */
public class PermissionDeniedError extends A2AError {

    public PermissionDeniedError() {
        this("Permission denied");
    }

    public PermissionDeniedError(String message) {
        this(message, null);
    }

    public PermissionDeniedError(String message, @Nullable Object data) {
        super(A2AErrorCodes.PERMISSION_DENIED_ERROR_CODE, message, data);
    }
}
