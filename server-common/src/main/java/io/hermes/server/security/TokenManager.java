package io.hermes.server.security;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.hermes.server.config.A2AConfig;
import io.hermes.spec.AuthError;
import io.hermes.util.Assert;
import io.hermes.util.Utils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues and validates bearer tokens.
 * <p>
 * A token is {@code base64url(claims) + "." + base64url(HMAC-SHA256(claims))}, where the claims are
 * a small JSON object naming the agent, its roles, a unique token id and the issue and expiry
 * times. Tokens are opaque to clients. Revocation is tracked in memory by token id until the
 * token would have expired anyway.
 */
@ApplicationScoped
public class TokenManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(TokenManager.class);

    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();
    private static final Base64.Decoder DECODER = Base64.getUrlDecoder();

    private final HmacSha256 hmac;
    private final AccessControl accessControl;
    private final Duration ttl;
    private final Clock clock;
    private final ConcurrentMap<String, Instant> revoked = new ConcurrentHashMap<>();

    @Inject
    public TokenManager(A2AConfig config, AccessControl accessControl) {
        this(config.secret(), config.tokenTtl(), accessControl, Clock.systemUTC());
    }

    public TokenManager(String secret, Duration ttl, AccessControl accessControl, Clock clock) {
        Assert.isTrue(!ttl.isNegative() && !ttl.isZero(), "Token TTL must be positive");
        this.hmac = HmacSha256.fromSecret(secret);
        this.ttl = ttl;
        this.accessControl = accessControl;
        this.clock = clock;
    }

    /**
     * Issues a token for an agent.
     *
     * @param agentId the agent the token identifies
     * @param roles the roles to grant
     * @return the security context of the new token, including the token itself
     */
    public SecurityContext issue(String agentId, Collection<String> roles) {
        Assert.checkNotBlankParam("agentId", agentId);
        Instant issuedAt = clock.instant();
        Claims claims = new Claims(agentId, List.copyOf(new LinkedHashSet<>(roles)), UUID.randomUUID().toString(),
                issuedAt.getEpochSecond(), issuedAt.plus(ttl).getEpochSecond());
        byte[] encodedClaims;
        try {
            encodedClaims = ENCODER.encode(Utils.OBJECT_MAPPER.writeValueAsBytes(claims));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to encode token claims", e);
        }
        String token = new String(encodedClaims, StandardCharsets.US_ASCII) + "." + hmac.sign(encodedClaims);
        LOGGER.debug("Issued token {} for agent {} with roles {}", claims.jti(), agentId, claims.roles());
        return toContext(claims, token);
    }

    /**
     * Validates a token.
     *
     * @param token the bearer token
     * @return the security context the token carries
     * @throws AuthError with reason {@code invalid} for malformed, forged or revoked tokens and
     *                   reason {@code expired} for expired ones
     */
    public SecurityContext validate(String token) {
        Claims claims = verifiedClaims(token);
        if (revoked.containsKey(claims.jti())) {
            throw new AuthError(AuthError.Reason.INVALID, "Token has been revoked");
        }
        if (clock.instant().getEpochSecond() >= claims.exp()) {
            throw new AuthError(AuthError.Reason.EXPIRED);
        }
        return toContext(claims, token);
    }

    /**
     * Validates a token and replaces it with a fresh one carrying the same identity and roles.
     * The old token is revoked.
     */
    public SecurityContext refresh(String token) {
        SecurityContext current = validate(token);
        revoke(token);
        return issue(current.agentId(), current.roles());
    }

    /**
     * Revokes a token. Revoking an invalid token is a no-op.
     *
     * @return whether the token was valid and is now revoked
     */
    public boolean revoke(String token) {
        Claims claims;
        try {
            claims = verifiedClaims(token);
        } catch (AuthError e) {
            LOGGER.debug("Ignoring revocation of invalid token: {}", e.getMessage());
            return false;
        }
        Instant now = clock.instant();
        revoked.values().removeIf(expiry -> !expiry.isAfter(now));
        return revoked.put(claims.jti(), Instant.ofEpochSecond(claims.exp())) == null;
    }

    private Claims verifiedClaims(String token) {
        if (token == null || token.isBlank()) {
            throw new AuthError(AuthError.Reason.MISSING);
        }
        int dot = token.indexOf('.');
        if (dot <= 0 || dot != token.lastIndexOf('.')) {
            throw new AuthError(AuthError.Reason.INVALID);
        }
        byte[] encodedClaims = token.substring(0, dot).getBytes(StandardCharsets.US_ASCII);
        if (!hmac.verify(encodedClaims, token.substring(dot + 1))) {
            throw new AuthError(AuthError.Reason.INVALID);
        }
        try {
            return Utils.OBJECT_MAPPER.readValue(DECODER.decode(encodedClaims), Claims.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new AuthError(AuthError.Reason.INVALID);
        }
    }

    private SecurityContext toContext(Claims claims, String token) {
        Set<String> roles = new LinkedHashSet<>(claims.roles());
        return new SecurityContext(claims.sub(), roles, accessControl.permissionsFor(roles), token,
                Instant.ofEpochSecond(claims.exp()));
    }

    /**
     * The signed token payload.
     */
    public record Claims(String sub, List<String> roles, String jti, long iat, long exp) {
    }
}
