package io.hermes.server.methods;

import static io.hermes.server.methods.MethodSupport.result;

import java.util.List;

import io.hermes.server.dispatch.A2AMethods;
import io.hermes.server.dispatch.MethodDispatcher;
import io.hermes.server.dispatch.MethodParams;
import io.hermes.server.registry.AgentRegistry;
import io.hermes.server.security.AccessControl;
import io.hermes.server.security.SecurityContext;
import io.hermes.server.security.TokenManager;
import io.hermes.spec.AuthError;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code auth.*} methods: token issue and refresh.
 */
public class AuthMethods {

    private static final Logger LOGGER = LoggerFactory.getLogger(AuthMethods.class);

    private final TokenManager tokenManager;
    private final AgentRegistry registry;

    public AuthMethods(TokenManager tokenManager, AgentRegistry registry) {
        this.tokenManager = tokenManager;
        this.registry = registry;
    }

    public void registerWith(MethodDispatcher dispatcher) {
        dispatcher.registerMethod(A2AMethods.AUTH_LOGIN, this::login);
        dispatcher.registerMethod(A2AMethods.AUTH_REFRESH, this::refresh);
    }

    /**
     * Issues a token with the {@code agent} role to a registered agent.
     */
    Object login(MethodParams params, @Nullable SecurityContext context) {
        String agentId = params.requireString("agent_id");
        if (!registry.contains(agentId)) {
            LOGGER.warn("Login refused for unregistered agent {}", agentId);
            throw new AuthError(AuthError.Reason.INVALID, "Agent " + agentId + " is not registered");
        }
        return toResult(tokenManager.issue(agentId, List.of(AccessControl.ROLE_AGENT)));
    }

    Object refresh(MethodParams params, @Nullable SecurityContext context) {
        return toResult(tokenManager.refresh(params.requireString("token")));
    }

    private static Object toResult(SecurityContext issued) {
        return result(
                "token", issued.token(),
                "agent_id", issued.agentId(),
                "roles", issued.roles(),
                "expires_at", issued.expiresAt().toString());
    }
}
