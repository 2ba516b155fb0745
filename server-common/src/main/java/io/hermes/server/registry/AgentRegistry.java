package io.hermes.server.registry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.hermes.server.config.A2AConfig;
import io.hermes.spec.AgentCard;
import io.hermes.spec.AgentStatus;
import io.hermes.spec.EventType;
import io.hermes.spec.InvalidRequestError;
import io.hermes.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stores agent capability cards and tracks their liveness.
 * <p>
 * Every mutation of a single agent runs inside {@link ConcurrentMap#compute} on the agent id, so
 * concurrent operations on the same agent are serialised while different agents never contend.
 * Listeners are notified after the mutation, outside of the map's bin lock.
 *
 * <h2>Liveness</h2>
 * An agent that has not sent a heartbeat for {@code degradedAfter} is marked
 * {@link AgentStatus#DEGRADED}, after {@code offlineAfter} it is marked {@link AgentStatus#OFFLINE}.
 * A heartbeat always restores {@link AgentStatus#ONLINE}. Sweeps are triggered externally through
 * {@link #sweep(Instant)}, or periodically by the {@link LivenessMonitor}.
 */
@ApplicationScoped
public class AgentRegistry {

    private static final Logger LOGGER = LoggerFactory.getLogger(AgentRegistry.class);

    private final ConcurrentMap<String, AgentCard> agents = new ConcurrentHashMap<>();
    private final List<AgentRegistryListener> listeners = new CopyOnWriteArrayList<>();
    private final Clock clock;
    private final Duration degradedAfter;
    private final Duration offlineAfter;

    @Inject
    public AgentRegistry(A2AConfig config) {
        this(Clock.systemUTC(), config.degradedAfter(), config.offlineAfter());
    }

    public AgentRegistry(Clock clock, Duration degradedAfter, Duration offlineAfter) {
        Assert.isTrue(offlineAfter.compareTo(degradedAfter) > 0, "offlineAfter must be greater than degradedAfter");
        this.clock = clock;
        this.degradedAfter = degradedAfter;
        this.offlineAfter = offlineAfter;
    }

    public void addListener(AgentRegistryListener listener) {
        listeners.add(Assert.checkNotNullParam("listener", listener));
    }

    public void removeListener(AgentRegistryListener listener) {
        listeners.remove(listener);
    }

    /**
     * Stores a card, replacing any card registered under the same id.
     * <p>
     * The stored card is online with a fresh heartbeat, whatever the supplied card says.
     *
     * @param card the card to register
     * @return the previously registered card, or {@code null}
     */
    public @Nullable AgentCard register(AgentCard card) {
        Assert.checkNotNullParam("card", card);
        Instant now = clock.instant();
        AgentCard stored = card.withHeartbeat(now);
        AgentCard[] previous = new AgentCard[1];
        agents.compute(card.id(), (id, existing) -> {
            previous[0] = existing;
            return stored;
        });
        LOGGER.info("Registered agent {} ({})", stored.id(), previous[0] == null ? "new" : "update");
        notifyListeners(new AgentRegistryEvent(EventType.AGENT_REGISTERED, stored,
                previous[0] == null ? null : previous[0].status(), now));
        return previous[0];
    }

    /**
     * Removes an agent.
     *
     * @param agentId the agent id
     * @return the removed card, or {@code null} if the agent was not registered
     */
    public @Nullable AgentCard unregister(String agentId) {
        AgentCard removed = agents.remove(agentId);
        if (removed != null) {
            LOGGER.info("Unregistered agent {}", agentId);
            notifyListeners(new AgentRegistryEvent(EventType.AGENT_DEREGISTERED, removed, removed.status(),
                    clock.instant()));
        }
        return removed;
    }

    /**
     * Records a heartbeat, restoring the agent to {@link AgentStatus#ONLINE}.
     *
     * @param agentId the agent id
     * @return the updated card
     * @throws InvalidRequestError if the agent is not registered
     */
    public AgentCard updateHeartbeat(String agentId) {
        Instant now = clock.instant();
        AgentStatus[] previousStatus = new AgentStatus[1];
        AgentCard updated = agents.computeIfPresent(agentId, (id, existing) -> {
            previousStatus[0] = existing.status();
            return existing.withHeartbeat(now);
        });
        if (updated == null) {
            throw new InvalidRequestError("Agent not found: " + agentId);
        }
        if (previousStatus[0] != AgentStatus.ONLINE) {
            LOGGER.info("Agent {} back online (was {})", agentId, previousStatus[0].value());
            notifyListeners(new AgentRegistryEvent(EventType.AGENT_STATUS_CHANGED, updated, previousStatus[0], now));
        }
        return updated;
    }

    /**
     * Overrides the status of an agent.
     *
     * @param agentId the agent id
     * @param status the new status
     * @return the updated card
     * @throws InvalidRequestError if the agent is not registered
     */
    public AgentCard updateStatus(String agentId, AgentStatus status) {
        Assert.checkNotNullParam("status", status);
        AgentStatus[] previousStatus = new AgentStatus[1];
        AgentCard updated = agents.computeIfPresent(agentId, (id, existing) -> {
            previousStatus[0] = existing.status();
            return existing.withStatus(status);
        });
        if (updated == null) {
            throw new InvalidRequestError("Agent not found: " + agentId);
        }
        if (previousStatus[0] != status) {
            notifyListeners(new AgentRegistryEvent(EventType.AGENT_STATUS_CHANGED, updated, previousStatus[0],
                    clock.instant()));
        }
        return updated;
    }

    /**
     * Applies the liveness policy at the registry clock's current time.
     *
     * @return the number of agents whose status changed
     */
    public int sweep() {
        return sweep(clock.instant());
    }

    /**
     * Applies the liveness policy as of {@code now}. Sweeps only ever downgrade an agent.
     *
     * @param now the reference time
     * @return the number of agents whose status changed
     */
    public int sweep(Instant now) {
        List<AgentRegistryEvent> changes = new ArrayList<>();
        for (String agentId : agents.keySet()) {
            agents.computeIfPresent(agentId, (id, existing) -> {
                AgentStatus target = statusAt(existing, now);
                if (target.ordinal() <= existing.status().ordinal()) {
                    return existing;
                }
                AgentCard updated = existing.withStatus(target);
                changes.add(new AgentRegistryEvent(EventType.AGENT_STATUS_CHANGED, updated, existing.status(), now));
                return updated;
            });
        }
        for (AgentRegistryEvent change : changes) {
            LOGGER.info("Agent {} is now {}", change.card().id(), change.card().status().value());
            notifyListeners(change);
        }
        return changes.size();
    }

    private AgentStatus statusAt(AgentCard card, Instant now) {
        Duration silence = Duration.between(card.lastHeartbeat(), now);
        if (silence.compareTo(offlineAfter) >= 0) {
            return AgentStatus.OFFLINE;
        }
        if (silence.compareTo(degradedAfter) >= 0) {
            return AgentStatus.DEGRADED;
        }
        return AgentStatus.ONLINE;
    }

    public @Nullable AgentCard get(String agentId) {
        return agents.get(agentId);
    }

    public boolean contains(String agentId) {
        return agents.containsKey(agentId);
    }

    /**
     * Lists registered agents ordered by id.
     *
     * @param status only agents with this status, or all agents when {@code null}
     * @return the matching cards
     */
    public List<AgentCard> list(@Nullable AgentStatus status) {
        return agents.values().stream()
                .filter(card -> status == null || card.status() == status)
                .sorted(Comparator.comparing(AgentCard::id))
                .toList();
    }

    public Clock clock() {
        return clock;
    }

    private void notifyListeners(AgentRegistryEvent event) {
        for (AgentRegistryListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                LOGGER.error("Agent registry listener failed for {} on {}", event.type().value(), event.card().id(), e);
            }
        }
    }
}
