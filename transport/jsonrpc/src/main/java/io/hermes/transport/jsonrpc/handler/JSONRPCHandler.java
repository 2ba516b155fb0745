package io.hermes.transport.jsonrpc.handler;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.hermes.server.A2AService;
import io.hermes.server.dispatch.MethodDispatcher;
import io.hermes.spec.A2AError;
import io.hermes.spec.InternalError;
import io.hermes.spec.InvalidParamsError;
import io.hermes.spec.InvalidRequestError;
import io.hermes.spec.JSONParseError;
import io.hermes.spec.JSONRPCRequest;
import io.hermes.spec.JSONRPCResponse;
import io.hermes.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JSON-RPC 2.0 handler that turns a raw request body into a response body.
 * <p>
 * This handler sits between the HTTP or WebSocket server and the {@link MethodDispatcher}. It
 * parses the body, builds {@link JSONRPCRequest}s, dispatches them and serialises the
 * {@link JSONRPCResponse}s back to JSON.
 *
 * <h2>Request shapes</h2>
 * <ul>
 *   <li><b>Single request:</b> a JSON object; answered with a single response object</li>
 *   <li><b>Batch:</b> a non-empty JSON array of requests; answered with an array holding one
 *       response per non-notification entry, in request order</li>
 *   <li><b>Notification:</b> a request without an {@code id} member; dispatched, never answered</li>
 * </ul>
 *
 * <h2>Error Handling</h2>
 * A body that is not JSON is answered with a {@link JSONParseError} with a {@code null} id. An
 * entry that is not a request object, or that carries an invalid id, is answered with an
 * {@link InvalidRequestError}. Errors raised by methods are produced by the dispatcher.
 *
 * @see MethodDispatcher
 */
@ApplicationScoped
public class JSONRPCHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(JSONRPCHandler.class);

    private static final TypeReference<Map<String, Object>> PARAMS_TYPE = new TypeReference<>() {
    };

    private final MethodDispatcher dispatcher;

    @Inject
    public JSONRPCHandler(A2AService service) {
        this(service.getDispatcher());
    }

    public JSONRPCHandler(MethodDispatcher dispatcher) {
        this.dispatcher = dispatcher;
    }

    /**
     * Handles a request body.
     *
     * @param body the raw JSON body
     * @param headers transport headers, passed to the security interceptor
     * @return the response body, or {@code null} when nothing must be sent back (notifications only)
     */
    public CompletableFuture<@Nullable String> handle(String body, Map<String, String> headers) {
        JsonNode root;
        try {
            root = Utils.OBJECT_MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            LOGGER.debug("Rejected unparseable JSON-RPC body: {}", e.getOriginalMessage());
            return CompletableFuture.completedFuture(write(JSONRPCResponse.failure(null, new JSONParseError())));
        }
        if (root == null || root.isMissingNode()) {
            return CompletableFuture.completedFuture(write(JSONRPCResponse.failure(null, new JSONParseError())));
        }
        if (root.isArray()) {
            return handleBatch(root, headers);
        }
        return handleSingle(root, headers).thenApply(response -> response == null ? null : write(response));
    }

    private CompletableFuture<@Nullable String> handleBatch(JsonNode batch, Map<String, String> headers) {
        if (batch.isEmpty()) {
            return CompletableFuture.completedFuture(
                    write(JSONRPCResponse.failure(null, new InvalidRequestError("Empty batch"))));
        }
        List<CompletableFuture<@Nullable JSONRPCResponse>> pending = new ArrayList<>(batch.size());
        for (JsonNode entry : batch) {
            pending.add(handleSingle(entry, headers));
        }
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<JSONRPCResponse> responses = pending.stream()
                            .map(CompletableFuture::join)
                            .filter(Objects::nonNull)
                            .toList();
                    return responses.isEmpty() ? null : write(responses);
                });
    }

    private CompletableFuture<@Nullable JSONRPCResponse> handleSingle(JsonNode node, Map<String, String> headers) {
        JSONRPCRequest request;
        try {
            request = parseRequest(node);
        } catch (A2AError e) {
            return CompletableFuture.completedFuture(JSONRPCResponse.failure(idOf(node), e));
        }
        CompletableFuture<JSONRPCResponse> response = dispatcher.dispatch(request, headers);
        if (request.notification()) {
            return response.thenApply(r -> {
                if (r.isError()) {
                    LOGGER.debug("Notification {} failed: {}", request.method(), r.error());
                }
                return null;
            });
        }
        return response.thenApply(r -> r);
    }

    static JSONRPCRequest parseRequest(JsonNode node) {
        if (!node.isObject()) {
            throw new InvalidRequestError("Request must be a JSON object");
        }
        JsonNode method = node.get("method");
        if (method == null || !method.isTextual()) {
            throw new InvalidRequestError("Missing method");
        }
        JsonNode version = node.get("jsonrpc");
        String jsonrpc = version != null && version.isTextual() ? version.textValue() : "";

        Map<String, Object> params;
        JsonNode paramsNode = node.get("params");
        if (paramsNode == null || paramsNode.isNull()) {
            params = Map.of();
        } else if (paramsNode.isObject()) {
            params = Utils.OBJECT_MAPPER.convertValue(paramsNode, PARAMS_TYPE);
        } else {
            throw new InvalidParamsError("Params must be a JSON object");
        }

        if (!node.has("id")) {
            return new JSONRPCRequest(jsonrpc, method.textValue(), params, null, true);
        }
        JsonNode id = node.get("id");
        if (!id.isNull() && !id.isTextual() && !id.isNumber()) {
            throw new InvalidRequestError("Request id must be a string, a number or null");
        }
        return new JSONRPCRequest(jsonrpc, method.textValue(), params, idOf(node), false);
    }

    private static @Nullable Object idOf(JsonNode node) {
        JsonNode id = node.isObject() ? node.get("id") : null;
        if (id == null || id.isNull()) {
            return null;
        }
        if (id.isTextual()) {
            return id.textValue();
        }
        return id.isNumber() ? id.numberValue() : null;
    }

    private static String write(Object value) {
        try {
            return Utils.toJson(value);
        } catch (JsonProcessingException e) {
            LOGGER.error("Failed to serialise JSON-RPC response", e);
            try {
                return Utils.toJson(JSONRPCResponse.failure(null,
                        new InternalError("Failed to serialise response: " + e.getOriginalMessage())));
            } catch (JsonProcessingException unexpected) {
                throw new IllegalStateException(unexpected);
            }
        }
    }
}
