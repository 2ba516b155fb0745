package io.hermes.server.events;

import java.time.Clock;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.hermes.server.config.A2AConfig;
import io.hermes.server.security.MessageSigner;
import io.hermes.spec.Event;
import io.hermes.spec.EventType;
import io.hermes.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Fans canonical {@link Event}s out to open stream connections and channel subscribers.
 * <p>
 * Every connection is offered the event without blocking. A connection that refuses it or throws
 * is closed and removed; the others are unaffected. The event is then published on its channel
 * through the {@link ChannelBridge}: the event type, or {@code agent.<id>.<suffix>} for agent
 * events.
 */
@ApplicationScoped
public class EventStreamer {

    private static final Logger LOGGER = LoggerFactory.getLogger(EventStreamer.class);

    private final ChannelBridge bridge;
    private final @Nullable MessageSigner signer;
    private final boolean signEvents;
    private final String source;
    private final Clock clock;
    private final ConcurrentMap<String, StreamConnection> connections = new ConcurrentHashMap<>();

    @Inject
    public EventStreamer(ChannelBridge bridge, MessageSigner signer, A2AConfig config) {
        this(bridge, signer, config.signingEnabled(), config.source(), Clock.systemUTC());
    }

    /**
     * @param signer verifies events for connections that ask for it, and signs outgoing events
     *               when {@code signEvents} is set
     */
    public EventStreamer(ChannelBridge bridge, @Nullable MessageSigner signer, boolean signEvents, String source,
                         Clock clock) {
        this.bridge = bridge;
        this.signer = signer;
        this.signEvents = signEvents && signer != null;
        this.source = source;
        this.clock = clock;
    }

    public String source() {
        return source;
    }

    public void addConnection(StreamConnection connection) {
        connections.put(connection.id(), connection);
        LOGGER.debug("Opened stream connection {}", connection.id());
    }

    public boolean removeConnection(String connectionId) {
        return connections.remove(connectionId) != null;
    }

    public int connectionCount() {
        return connections.size();
    }

    public Collection<StreamConnection> connections() {
        return List.copyOf(connections.values());
    }

    /**
     * Creates an event from this streamer's source and broadcasts it.
     */
    public Event emit(String type, Map<String, Object> payload) {
        Event event = Event.of(type, source, payload, clock.instant());
        return broadcast(event);
    }

    /**
     * Broadcasts an event to every matching connection and to the subscribers of its channel.
     *
     * @return the event as sent, signed when signing is enabled
     */
    public Event broadcast(Event event) {
        Event outgoing = signEvents && event.signature() == null ? signer.sign(event) : event;
        for (StreamConnection connection : connections.values()) {
            if (!connection.filter().matches(outgoing)) {
                continue;
            }
            if (connection.verifiesSignatures() && (signer == null || !signer.verify(outgoing))) {
                LOGGER.warn("Dropped event {} for connection {}: signature verification failed", outgoing.id(),
                        connection.id());
                continue;
            }
            offer(connection, outgoing);
        }
        route(outgoing);
        return outgoing;
    }

    private void offer(StreamConnection connection, Event event) {
        boolean accepted;
        try {
            accepted = connection.offer(event);
        } catch (RuntimeException e) {
            LOGGER.warn("Stream connection {} failed on event {}, closing it", connection.id(), event.id(), e);
            accepted = false;
        }
        if (!accepted) {
            if (connections.remove(connection.id(), connection)) {
                LOGGER.warn("Closed stream connection {} that could not take event {}", connection.id(), event.id());
            }
            try {
                connection.close();
            } catch (RuntimeException e) {
                LOGGER.debug("Error closing stream connection {}", connection.id(), e);
            }
        }
    }

    private void route(Event event) {
        String channel = channelOf(event);
        try {
            bridge.publishWithMetadata(channel, event.source(), Utils.toMap(event),
                    Map.of("event_id", event.id(), "event_type", event.type()));
        } catch (RuntimeException e) {
            LOGGER.error("Routing event {} to channel {} failed", event.id(), channel, e);
        }
    }

    /**
     * The channel an event is published on.
     */
    public static String channelOf(Event event) {
        EventType type = null;
        for (EventType candidate : EventType.values()) {
            if (candidate.value().equals(event.type())) {
                type = candidate;
                break;
            }
        }
        if (type == null) {
            return event.type();
        }
        String agentId = event.payloadString("agent_id");
        if (type.isAgentEvent() && agentId != null) {
            return type.channelFor(agentId);
        }
        return type.value();
    }
}
