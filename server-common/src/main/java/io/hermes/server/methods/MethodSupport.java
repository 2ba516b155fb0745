package io.hermes.server.methods;

import java.util.LinkedHashMap;
import java.util.Map;

import io.hermes.server.dispatch.MethodParams;
import io.hermes.server.security.AccessControl;
import io.hermes.server.security.SecurityContext;
import io.hermes.spec.InvalidParamsError;
import io.hermes.spec.InvalidRequestError;
import io.hermes.spec.PermissionDeniedError;
import io.hermes.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Helpers shared by the method handlers.
 */
final class MethodSupport {

    private MethodSupport() {
    }

    /**
     * Reads an agent id parameter, falling back to the authenticated caller.
     * <p>
     * An authenticated caller may only name itself, unless it holds the {@code admin} role.
     *
     * @throws PermissionDeniedError if the parameter names another agent than the caller
     */
    static String agentIdOrCaller(MethodParams params, String name, @Nullable SecurityContext context) {
        String value = params.optionalString(name);
        if (value != null && !value.isBlank()) {
            return checkActingAs(value, context);
        }
        if (context != null) {
            return context.agentId();
        }
        throw new InvalidParamsError("Missing required parameter: " + name);
    }

    /**
     * Returns {@code agentId} if the caller may act as that agent.
     *
     * @throws PermissionDeniedError if an authenticated caller without the {@code admin} role names
     *         another agent
     */
    static String checkActingAs(String agentId, @Nullable SecurityContext context) {
        if (context != null && !agentId.equals(context.agentId()) && !context.hasRole(AccessControl.ROLE_ADMIN)) {
            throw new PermissionDeniedError("Agent " + context.agentId() + " cannot act as " + agentId);
        }
        return agentId;
    }

    /**
     * Reads an optional agent id parameter under the same rule as
     * {@link #agentIdOrCaller(MethodParams, String, SecurityContext)}, without the fallback.
     */
    static @Nullable String optionalAgentId(MethodParams params, String name, @Nullable SecurityContext context) {
        String value = params.optionalString(name);
        return value == null || value.isBlank() ? null : checkActingAs(value, context);
    }

    /**
     * Builds a result object from alternating keys and values. Values may be {@code null}.
     */
    static Map<String, Object> result(@Nullable Object... keysAndValues) {
        Assert.isTrue(keysAndValues.length % 2 == 0, "keys and values must come in pairs");
        Map<String, Object> result = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            result.put((String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return result;
    }

    static <T> T found(@Nullable T value, String kind, String id) {
        if (value == null) {
            throw new InvalidRequestError(kind + " not found: " + id);
        }
        return value;
    }
}
