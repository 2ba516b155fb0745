package io.hermes.server.dispatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import io.hermes.spec.A2AError;
import io.hermes.spec.InternalError;
import io.hermes.spec.InvalidParamsError;
import io.hermes.spec.InvalidRequestError;
import io.hermes.spec.JSONRPCRequest;
import io.hermes.spec.JSONRPCResponse;
import io.hermes.spec.MethodNotFoundError;
import io.hermes.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes named RPC calls to registered handlers.
 * <p>
 * A dispatch runs, in order: envelope validation, handler lookup, the interceptor chain fixed at
 * build time, and the handler itself, all on the dispatcher's executor. Failures are mapped onto
 * the error member of the response:
 * <ul>
 *   <li>{@link A2AError}: returned as is</li>
 *   <li>{@link IllegalArgumentException}: {@link InvalidParamsError}</li>
 *   <li>anything else: {@link InternalError}, logged</li>
 * </ul>
 * Handlers run concurrently without any implicit serialisation.
 */
public class MethodDispatcher {

    private static final Logger LOGGER = LoggerFactory.getLogger(MethodDispatcher.class);

    private final ConcurrentMap<String, MethodHandler> handlers = new ConcurrentHashMap<>();
    private final List<MethodInterceptor> interceptors;
    private final Executor executor;

    private MethodDispatcher(List<MethodInterceptor> interceptors, Executor executor) {
        this.interceptors = List.copyOf(interceptors);
        this.executor = executor;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Registers a handler.
     *
     * @throws IllegalArgumentException if a handler is already registered under {@code name}
     */
    public void registerMethod(String name, MethodHandler handler) {
        Assert.checkNotBlankParam("name", name);
        Assert.checkNotNullParam("handler", handler);
        if (handlers.putIfAbsent(name, handler) != null) {
            throw new IllegalArgumentException("Method already registered: " + name);
        }
        LOGGER.debug("Registered method {}", name);
    }

    public boolean hasMethod(String name) {
        return handlers.containsKey(name);
    }

    public Set<String> getMethods() {
        return new TreeSet<>(handlers.keySet());
    }

    /**
     * Dispatches a request asynchronously.
     *
     * @param request the request
     * @param headers transport headers, e.g. {@code Authorization}; looked up case insensitively
     * @return a future that always completes normally with a response carrying the request id
     */
    public CompletableFuture<JSONRPCResponse> dispatch(JSONRPCRequest request, Map<String, String> headers) {
        try {
            return CompletableFuture.supplyAsync(() -> invoke(request, headers), executor);
        } catch (RejectedExecutionException e) {
            LOGGER.warn("Dispatcher executor rejected {}", request.method());
            return CompletableFuture.completedFuture(
                    JSONRPCResponse.failure(request.id(), new InternalError("Server is shutting down")));
        }
    }

    JSONRPCResponse invoke(JSONRPCRequest request, Map<String, String> headers) {
        try {
            validate(request);
            MethodHandler handler = handlers.get(request.method());
            if (handler == null) {
                throw new MethodNotFoundError("Method not found: " + request.method());
            }
            RequestContext context = new RequestContext(request.method(), request.params(), headers);
            for (MethodInterceptor interceptor : interceptors) {
                interceptor.beforeInvoke(context);
            }
            Object result = handler.handle(new MethodParams(context.getParams()), context.getSecurityContext());
            return JSONRPCResponse.success(request.id(), result);
        } catch (A2AError e) {
            LOGGER.debug("Method {} failed with {}: {}", request.method(), e.getCode(), e.getMessage());
            return JSONRPCResponse.failure(request.id(), e);
        } catch (IllegalArgumentException e) {
            LOGGER.debug("Method {} rejected parameters: {}", request.method(), e.getMessage());
            return JSONRPCResponse.failure(request.id(), new InvalidParamsError(String.valueOf(e.getMessage())));
        } catch (Exception e) {
            LOGGER.error("Unexpected failure in method {}", request.method(), e);
            return JSONRPCResponse.failure(request.id(), new InternalError("Internal error: " + e.getMessage()));
        }
    }

    private static void validate(JSONRPCRequest request) {
        if (!JSONRPCRequest.JSONRPC_VERSION.equals(request.jsonrpc())) {
            throw new InvalidRequestError("Unsupported jsonrpc version: " + request.jsonrpc());
        }
        if (request.method().isBlank()) {
            throw new InvalidRequestError("Missing method");
        }
        Object id = request.id();
        if (id != null && !(id instanceof String) && !(id instanceof Number)) {
            throw new InvalidRequestError("Request id must be a string, a number or null");
        }
    }

    /**
     * Builds a dispatcher with a fixed interceptor chain.
     */
    public static class Builder {
        private final List<MethodInterceptor> interceptors = new ArrayList<>();
        private Executor executor = Runnable::run;

        private Builder() {
        }

        /**
         * Appends an interceptor; interceptors run in the order they were added.
         */
        public Builder interceptor(MethodInterceptor interceptor) {
            interceptors.add(Assert.checkNotNullParam("interceptor", interceptor));
            return this;
        }

        /**
         * Sets the executor handlers run on. Defaults to the calling thread.
         */
        public Builder executor(Executor executor) {
            this.executor = Assert.checkNotNullParam("executor", executor);
            return this;
        }

        public MethodDispatcher build() {
            return new MethodDispatcher(interceptors, executor);
        }
    }
}
