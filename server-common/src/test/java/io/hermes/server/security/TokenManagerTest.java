package io.hermes.server.security;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.hermes.server.MutableClock;
import io.hermes.spec.AuthError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class TokenManagerTest {

    private MutableClock clock;
    private TokenManager tokenManager;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock();
        AccessControl accessControl = new AccessControl(Map.of(
                AccessControl.ROLE_AGENT, List.of("task.*", "agent.get")));
        tokenManager = new TokenManager("test-secret", Duration.ofMinutes(10), accessControl, clock);
    }

    @Test
    public void testIssuedTokenValidates() {
        SecurityContext issued = tokenManager.issue("agent-1", List.of(AccessControl.ROLE_AGENT));

        SecurityContext validated = tokenManager.validate(issued.token());

        assertEquals("agent-1", validated.agentId());
        assertEquals(Set.of(AccessControl.ROLE_AGENT), validated.roles());
        assertEquals(Set.of("task.*", "agent.get"), validated.permissions());
        assertEquals(clock.instant().plus(Duration.ofMinutes(10)), validated.expiresAt());
    }

    @Test
    public void testExpiredTokenIsRejectedWithExpiredReason() {
        String token = tokenManager.issue("agent-1", List.of(AccessControl.ROLE_AGENT)).token();

        clock.advance(Duration.ofMinutes(10));

        AuthError error = assertThrows(AuthError.class, () -> tokenManager.validate(token));
        assertEquals(AuthError.Reason.EXPIRED, error.getReason());
    }

    @Test
    public void testTamperedTokenIsRejectedAsInvalid() {
        String token = tokenManager.issue("agent-1", List.of(AccessControl.ROLE_AGENT)).token();
        String tampered = token.substring(0, token.length() - 2) + (token.endsWith("A") ? "BB" : "AA");

        AuthError error = assertThrows(AuthError.class, () -> tokenManager.validate(tampered));
        assertEquals(AuthError.Reason.INVALID, error.getReason());
    }

    @Test
    public void testTokenOfAnotherSecretIsRejected() {
        TokenManager other = new TokenManager("other-secret", Duration.ofMinutes(10),
                new AccessControl(Map.of()), clock);
        String foreign = other.issue("agent-1", List.of(AccessControl.ROLE_ADMIN)).token();

        AuthError error = assertThrows(AuthError.class, () -> tokenManager.validate(foreign));
        assertEquals(AuthError.Reason.INVALID, error.getReason());
    }

    @Test
    public void testMalformedAndMissingTokens() {
        assertEquals(AuthError.Reason.INVALID,
                assertThrows(AuthError.class, () -> tokenManager.validate("not-a-token")).getReason());
        assertEquals(AuthError.Reason.INVALID,
                assertThrows(AuthError.class, () -> tokenManager.validate("a.b.c")).getReason());
        assertEquals(AuthError.Reason.MISSING,
                assertThrows(AuthError.class, () -> tokenManager.validate("")).getReason());
    }

    @Test
    public void testRefreshRevokesTheOldToken() {
        String token = tokenManager.issue("agent-1", List.of(AccessControl.ROLE_AGENT)).token();
        clock.advance(Duration.ofMinutes(5));

        SecurityContext refreshed = tokenManager.refresh(token);

        assertNotEquals(token, refreshed.token());
        assertEquals("agent-1", tokenManager.validate(refreshed.token()).agentId());
        assertEquals(clock.instant().plus(Duration.ofMinutes(10)), refreshed.expiresAt());
        assertThrows(AuthError.class, () -> tokenManager.validate(token));
    }

    @Test
    public void testRevokeInvalidTokenIsNoOp() {
        assertFalse(tokenManager.revoke("garbage"));

        String token = tokenManager.issue("agent-1", List.of()).token();
        assertTrue(tokenManager.revoke(token));
        assertFalse(tokenManager.revoke(token));
    }

    @Test
    public void testTtlMustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> new TokenManager("s", Duration.ZERO, new AccessControl(Map.of()), clock));
    }
}
