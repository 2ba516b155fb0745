package io.hermes.spec;

import java.util.Map;

import io.hermes.util.Assert;
import io.hermes.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * A JSON-RPC 2.0 request.
 * <p>
 * Params are kept as a generic named parameter bag; each handler validates the members it reads.
 * A request without an {@code id} member is a notification and produces no response.
 *
 * @param jsonrpc the protocol version, always {@value #JSONRPC_VERSION}
 * @param method the method name
 * @param params named parameters
 * @param id the request id (string or number), {@code null} for notifications
 * @param notification whether the {@code id} member was absent
 */
public record JSONRPCRequest(String jsonrpc, String method, Map<String, Object> params, @Nullable Object id,
                             boolean notification) {

    public static final String JSONRPC_VERSION = "2.0";

    public JSONRPCRequest {
        Assert.checkNotNullParam("jsonrpc", jsonrpc);
        Assert.checkNotNullParam("method", method);
        params = Utils.copyOf(params);
    }

    public JSONRPCRequest(String method, Map<String, Object> params, Object id) {
        this(JSONRPC_VERSION, method, params, id, false);
    }

    public static JSONRPCRequest notification(String method, Map<String, Object> params) {
        return new JSONRPCRequest(JSONRPC_VERSION, method, params, null, true);
    }
}
