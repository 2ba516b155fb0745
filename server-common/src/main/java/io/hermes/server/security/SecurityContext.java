package io.hermes.server.security;

import java.time.Instant;
import java.util.Set;

import io.hermes.util.Assert;

/**
 * The authenticated identity attached to a single request. Never persisted.
 *
 * @param agentId the authenticated agent
 * @param roles the roles granted by the token
 * @param permissions the method patterns the roles permit
 * @param token the bearer token the context was validated from
 * @param expiresAt when the token expires
 */
public record SecurityContext(String agentId, Set<String> roles, Set<String> permissions, String token,
                              Instant expiresAt) {

    public SecurityContext {
        Assert.checkNotNullParam("agentId", agentId);
        roles = Set.copyOf(roles);
        permissions = Set.copyOf(permissions);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }
}
