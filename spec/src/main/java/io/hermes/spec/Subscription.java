package io.hermes.spec;

import java.time.Instant;

/**
 * A pattern subscription held by an agent.
 *
 * @param id the subscription id
 * @param agentId the subscribing agent
 * @param channelPattern an exact channel name or a wildcard pattern
 * @param createdAt when the subscription was created
 */
public record Subscription(String id, String agentId, String channelPattern, Instant createdAt) {
}
