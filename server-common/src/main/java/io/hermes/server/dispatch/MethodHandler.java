package io.hermes.server.dispatch;

import io.hermes.server.security.SecurityContext;
import org.jspecify.annotations.Nullable;

/**
 * Handles one RPC method.
 * <p>
 * Handlers validate their own parameters through the typed accessors of {@link MethodParams} and
 * report failures by throwing an {@link io.hermes.spec.A2AError}.
 */
@FunctionalInterface
public interface MethodHandler {

    /**
     * Invokes the method.
     *
     * @param params the named parameters of the request
     * @param context the caller's identity, {@code null} for exempt methods called without a token
     *                or when security is disabled
     * @return the result, serialised as the {@code result} member of the response
     */
    @Nullable Object handle(MethodParams params, @Nullable SecurityContext context);
}
