package io.hermes.server.security;

import java.util.Set;

import io.hermes.server.dispatch.MethodInterceptor;
import io.hermes.server.dispatch.RequestContext;
import io.hermes.spec.AuthError;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Authenticates and authorizes every request whose method is not exempt.
 * <p>
 * The bearer token is read from the {@code Authorization: Bearer <token>} header, or from the
 * reserved {@value #TOKEN_PARAM} parameter for frames without headers. The reserved parameter is
 * always removed before the handler sees the parameters.
 * <p>
 * For an exempt method a supplied valid token still attaches a context; an invalid one is ignored.
 */
public class SecurityInterceptor implements MethodInterceptor {

    private static final Logger LOGGER = LoggerFactory.getLogger(SecurityInterceptor.class);

    public static final String TOKEN_PARAM = "_auth_token";
    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenManager tokenManager;
    private final AccessControl accessControl;
    private final Set<String> exemptMethods;

    public SecurityInterceptor(TokenManager tokenManager, AccessControl accessControl, Set<String> exemptMethods) {
        this.tokenManager = tokenManager;
        this.accessControl = accessControl;
        this.exemptMethods = Set.copyOf(exemptMethods);
    }

    @Override
    public void beforeInvoke(RequestContext context) {
        String token = extractToken(context);
        if (exemptMethods.contains(context.getMethod())) {
            if (token != null) {
                try {
                    context.setSecurityContext(tokenManager.validate(token));
                } catch (AuthError e) {
                    LOGGER.debug("Ignoring {} token on exempt method {}", e.getReason().value(), context.getMethod());
                }
            }
            return;
        }
        if (token == null) {
            LOGGER.warn("Rejected {}: no token", context.getMethod());
            throw new AuthError(AuthError.Reason.MISSING);
        }
        SecurityContext securityContext;
        try {
            securityContext = tokenManager.validate(token);
        } catch (AuthError e) {
            LOGGER.warn("Rejected {}: {} token", context.getMethod(), e.getReason().value());
            throw e;
        }
        accessControl.check(context.getMethod(), securityContext);
        context.setSecurityContext(securityContext);
    }

    public boolean isExempt(String method) {
        return exemptMethods.contains(method);
    }

    private static @Nullable String extractToken(RequestContext context) {
        Object param = context.getParams().remove(TOKEN_PARAM);
        String header = context.getHeader("Authorization");
        if (header != null && header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            String token = header.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        if (param instanceof String token && !token.isBlank()) {
            return token;
        }
        return null;
    }
}
