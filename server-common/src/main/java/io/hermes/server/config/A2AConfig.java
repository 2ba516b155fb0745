package io.hermes.server.config;

import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.hermes.util.Assert;

/**
 * Typed view over the {@code hermes.a2a.*} configuration keys.
 */
@ApplicationScoped
public class A2AConfig {

    public static final String SECURITY_ENABLED = "hermes.a2a.security.enabled";
    public static final String SECURITY_EXEMPT_METHODS = "hermes.a2a.security.exempt-methods";
    public static final String SECURITY_TOKEN_TTL_SECONDS = "hermes.a2a.security.token-ttl-seconds";
    public static final String SECURITY_SECRET = "hermes.a2a.security.secret";
    public static final String SECURITY_SIGNING_ENABLED = "hermes.a2a.security.signing.enabled";
    public static final String SECURITY_ROLES_PREFIX = "hermes.a2a.security.roles.";
    public static final String SECURITY_ROLES = "hermes.a2a.security.roles";
    public static final String LIVENESS_DEGRADED_AFTER_SECONDS = "hermes.a2a.liveness.degraded-after-seconds";
    public static final String LIVENESS_OFFLINE_AFTER_SECONDS = "hermes.a2a.liveness.offline-after-seconds";
    public static final String LIVENESS_SWEEP_INTERVAL_SECONDS = "hermes.a2a.liveness.sweep-interval-seconds";
    public static final String WORKFLOW_MAX_ATTEMPTS = "hermes.a2a.workflow.max-attempts";
    public static final String CHANNELS_MULTI_SEGMENT_WILDCARDS = "hermes.a2a.channels.multi-segment-wildcards";
    public static final String STREAMING_BUFFER_SIZE = "hermes.a2a.streaming.buffer-size";
    public static final String SOURCE = "hermes.a2a.source";

    private final A2AConfigProvider provider;

    @Inject
    public A2AConfig(A2AConfigProvider provider) {
        this.provider = provider;
    }

    public boolean securityEnabled() {
        return Boolean.parseBoolean(provider.getValue(SECURITY_ENABLED));
    }

    public Set<String> exemptMethods() {
        return Set.copyOf(list(provider.getValue(SECURITY_EXEMPT_METHODS)));
    }

    public Duration tokenTtl() {
        return Duration.ofSeconds(positiveLong(SECURITY_TOKEN_TTL_SECONDS));
    }

    /**
     * Returns the configured token secret; blank means a random per-process secret is used.
     */
    public String secret() {
        return provider.getOptionalValue(SECURITY_SECRET).orElse("");
    }

    public boolean signingEnabled() {
        return Boolean.parseBoolean(provider.getValue(SECURITY_SIGNING_ENABLED));
    }

    /**
     * Returns role name to permitted method patterns, for the roles listed under {@value #SECURITY_ROLES}.
     */
    public Map<String, List<String>> rolePermissions() {
        Map<String, List<String>> roles = new LinkedHashMap<>();
        for (String role : list(provider.getValue(SECURITY_ROLES))) {
            roles.put(role, list(provider.getOptionalValue(SECURITY_ROLES_PREFIX + role).orElse("")));
        }
        return roles;
    }

    public Duration degradedAfter() {
        return Duration.ofSeconds(positiveLong(LIVENESS_DEGRADED_AFTER_SECONDS));
    }

    public Duration offlineAfter() {
        Duration offline = Duration.ofSeconds(positiveLong(LIVENESS_OFFLINE_AFTER_SECONDS));
        Assert.isTrue(offline.compareTo(degradedAfter()) > 0,
                LIVENESS_OFFLINE_AFTER_SECONDS + " must be greater than " + LIVENESS_DEGRADED_AFTER_SECONDS);
        return offline;
    }

    /**
     * Returns the liveness sweep period; zero disables the built-in sweeper.
     */
    public Duration sweepInterval() {
        return Duration.ofSeconds(Long.parseLong(provider.getValue(LIVENESS_SWEEP_INTERVAL_SECONDS).trim()));
    }

    public int workflowMaxAttempts() {
        return (int) positiveLong(WORKFLOW_MAX_ATTEMPTS);
    }

    public boolean multiSegmentWildcards() {
        return Boolean.parseBoolean(provider.getValue(CHANNELS_MULTI_SEGMENT_WILDCARDS));
    }

    public int streamingBufferSize() {
        return (int) positiveLong(STREAMING_BUFFER_SIZE);
    }

    public String source() {
        return provider.getValue(SOURCE);
    }

    private long positiveLong(String key) {
        long value = Long.parseLong(provider.getValue(key).trim());
        Assert.isTrue(value > 0, key + " must be positive");
        return value;
    }

    private static List<String> list(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
