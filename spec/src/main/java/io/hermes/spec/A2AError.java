package io.hermes.spec;

import org.jspecify.annotations.Nullable;

/**
 * Root of the A2A error taxonomy.
 * <p>
 * Every error carries a JSON-RPC error code and optional structured data. Errors raised by
 * validation or authorization are surfaced to the RPC caller unchanged; the dispatcher maps
 * any other exception to {@link InternalError}.
 *
 * @see A2AErrorCodes
 */
public class A2AError extends RuntimeException {

    private final int code;
    private final @Nullable Object data;

    public A2AError(int code, String message, @Nullable Object data) {
        super(message);
        this.code = code;
        this.data = data;
    }

    public A2AError(int code, String message, @Nullable Object data, @Nullable Throwable cause) {
        super(message, cause);
        this.code = code;
        this.data = data;
    }

    public int getCode() {
        return code;
    }

    public @Nullable Object getData() {
        return data;
    }

    /**
     * Converts this error into the payload of a JSON-RPC error response.
     *
     * @return the wire representation of this error
     */
    public JSONRPCError toJSONRPCError() {
        return new JSONRPCError(code, getMessage() == null ? getClass().getSimpleName() : getMessage(), data);
    }
}
