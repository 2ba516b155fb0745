package io.hermes.server.security;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.hermes.server.config.A2AConfig;
import io.hermes.spec.PermissionDeniedError;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Role based method authorization with default deny.
 * <p>
 * Each role maps to a list of method patterns: {@code *} permits every method, {@code ns.*}
 * permits every method of namespace {@code ns}, anything else must equal the method name.
 */
@ApplicationScoped
public class AccessControl {

    private static final Logger LOGGER = LoggerFactory.getLogger(AccessControl.class);

    public static final String ROLE_ADMIN = "admin";
    public static final String ROLE_AGENT = "agent";
    public static final String ROLE_OBSERVER = "observer";

    private final Map<String, List<String>> rolePermissions;

    @Inject
    public AccessControl(A2AConfig config) {
        this(config.rolePermissions());
    }

    public AccessControl(Map<String, List<String>> rolePermissions) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        rolePermissions.forEach((role, patterns) -> copy.put(role, List.copyOf(patterns)));
        this.rolePermissions = Map.copyOf(copy);
    }

    /**
     * Checks that one of the context's roles permits {@code method}.
     *
     * @throws PermissionDeniedError if no role permits the method
     */
    public void check(String method, SecurityContext context) {
        if (!isPermitted(method, context.roles())) {
            LOGGER.warn("Agent {} with roles {} denied {}", context.agentId(), context.roles(), method);
            throw new PermissionDeniedError("Agent " + context.agentId() + " may not call " + method);
        }
    }

    public boolean isPermitted(String method, Collection<String> roles) {
        for (String role : roles) {
            for (String pattern : rolePermissions.getOrDefault(role, List.of())) {
                if (matches(pattern, method)) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * Returns the union of method patterns granted by the given roles.
     */
    public Set<String> permissionsFor(Collection<String> roles) {
        Set<String> permissions = new LinkedHashSet<>();
        for (String role : roles) {
            permissions.addAll(rolePermissions.getOrDefault(role, List.of()));
        }
        return permissions;
    }

    public Set<String> roles() {
        return rolePermissions.keySet();
    }

    static boolean matches(String pattern, String method) {
        if ("*".equals(pattern)) {
            return true;
        }
        if (pattern.endsWith(".*")) {
            String namespace = pattern.substring(0, pattern.length() - 1);
            return method.startsWith(namespace) && method.length() > namespace.length();
        }
        return pattern.equals(method);
    }
}
