package io.hermes.server.registry;

import java.time.Instant;

import io.hermes.spec.AgentCard;
import io.hermes.spec.AgentStatus;
import io.hermes.spec.EventType;
import org.jspecify.annotations.Nullable;

/**
 * A change in the agent registry.
 *
 * @param type one of the agent event types
 * @param card the card after the change, or the removed card for deregistrations
 * @param previousStatus the status before a status change
 * @param timestamp when the change happened
 */
public record AgentRegistryEvent(EventType type, AgentCard card, @Nullable AgentStatus previousStatus,
                                 Instant timestamp) {
}
