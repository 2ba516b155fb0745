package io.hermes.transport.jsonrpc.handler;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.hermes.server.A2AService;
import io.hermes.server.events.EventStreamer;
import io.hermes.server.events.StreamFilter;
import io.hermes.server.events.SubscriptionManager;
import io.hermes.server.security.SecurityContext;
import io.hermes.server.security.TokenManager;
import io.hermes.spec.AuthError;
import io.hermes.spec.ChannelMessage;
import io.hermes.transport.jsonrpc.streaming.SseStreamConnection;
import io.hermes.transport.jsonrpc.streaming.WebSocketSession;
import io.hermes.transport.jsonrpc.streaming.WebSocketStreamConnection;
import io.hermes.util.Assert;
import io.hermes.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens and closes the streaming connections of the HTTP server.
 * <p>
 * An SSE stream is a {@link SseStreamConnection} registered with the {@link EventStreamer}; the
 * server subscribes to {@link SseStreamConnection#frames()} and writes each frame to the response.
 * <p>
 * A WebSocket session carries both directions: domain events and channel messages go out as
 * JSON text frames, and inbound text frames are JSON-RPC requests whose responses are written
 * back on the same session. When the handshake carries a valid bearer token the session also
 * becomes the delivery endpoint of the token's agent, so channel messages for that agent arrive
 * as {@code {"type": "channel_message", "message": ...}} frames.
 */
@ApplicationScoped
public class StreamingHandler {

    private static final Logger LOGGER = LoggerFactory.getLogger(StreamingHandler.class);

    public static final String CHANNEL_MESSAGE_FRAME_TYPE = "channel_message";

    private final JSONRPCHandler rpcHandler;
    private final EventStreamer streamer;
    private final SubscriptionManager subscriptions;
    private final @Nullable TokenManager tokenManager;
    private final int bufferSize;
    private final ConcurrentMap<String, WebSocketBinding> webSockets = new ConcurrentHashMap<>();

    @Inject
    public StreamingHandler(JSONRPCHandler rpcHandler, A2AService service) {
        this(rpcHandler, service.getEventStreamer(), service.getSubscriptionManager(), service.getTokenManager(),
                service.getConfig().streamingBufferSize());
    }

    public StreamingHandler(JSONRPCHandler rpcHandler, EventStreamer streamer, SubscriptionManager subscriptions,
                            @Nullable TokenManager tokenManager, int bufferSize) {
        this.rpcHandler = rpcHandler;
        this.streamer = streamer;
        this.subscriptions = subscriptions;
        this.tokenManager = tokenManager;
        this.bufferSize = bufferSize;
    }

    /**
     * Builds a filter from query parameters {@code task_id}, {@code agent_id} and
     * {@code event_types} (comma separated).
     */
    public static StreamFilter filterOf(Map<String, String> query) {
        String types = query.get("event_types");
        Set<String> eventTypes = types == null ? Set.of() : Arrays.stream(types.split(","))
                .map(String::trim)
                .filter(type -> !type.isEmpty())
                .collect(Collectors.toSet());
        return new StreamFilter(blankToNull(query.get("task_id")), blankToNull(query.get("agent_id")), eventTypes);
    }

    public SseStreamConnection openSse(StreamFilter filter, boolean verifySignatures) {
        SseStreamConnection connection = new SseStreamConnection(filter, verifySignatures, bufferSize);
        streamer.addConnection(connection);
        LOGGER.debug("Opened SSE connection {}", connection.id());
        return connection;
    }

    public void closeSse(SseStreamConnection connection) {
        streamer.removeConnection(connection.id());
        connection.close();
    }

    /**
     * Registers a new WebSocket session.
     *
     * @return the agent the session is bound to, or {@code null} for an anonymous session
     */
    public @Nullable String onOpen(WebSocketSession session, StreamFilter filter, boolean verifySignatures) {
        Assert.checkNotNullParam("session", session);
        WebSocketStreamConnection connection = new WebSocketStreamConnection(session, filter, verifySignatures,
                bufferSize);
        String agentId = authenticate(session);
        webSockets.put(session.id(), new WebSocketBinding(connection, agentId));
        streamer.addConnection(connection);
        if (agentId != null) {
            subscriptions.attachEndpoint(agentId, message -> {
                if (!connection.offerText(channelMessageFrame(message))) {
                    throw new IllegalStateException("WebSocket session " + session.id() + " is not accepting frames");
                }
            });
        }
        LOGGER.debug("Opened WebSocket session {} for {}", session.id(), agentId == null ? "anonymous client" : agentId);
        return agentId;
    }

    /**
     * Handles an inbound text frame as a JSON-RPC request or batch.
     */
    public void onText(WebSocketSession session, String text) {
        WebSocketBinding binding = webSockets.get(session.id());
        if (binding == null) {
            LOGGER.warn("Frame on unknown WebSocket session {} dropped", session.id());
            return;
        }
        rpcHandler.handle(text, session.headers()).whenComplete((response, failure) -> {
            if (failure != null) {
                LOGGER.error("JSON-RPC frame on WebSocket session {} failed", session.id(), failure);
                return;
            }
            if (response != null && !binding.connection.offerText(response)) {
                LOGGER.warn("WebSocket session {} cannot take the response, closing it", session.id());
                onClose(session);
            }
        });
    }

    public void onClose(WebSocketSession session) {
        WebSocketBinding binding = webSockets.remove(session.id());
        if (binding == null) {
            return;
        }
        streamer.removeConnection(binding.connection.id());
        if (binding.agentId != null) {
            subscriptions.detachEndpoint(binding.agentId);
        }
        binding.connection.close();
        LOGGER.debug("Closed WebSocket session {}", session.id());
    }

    public int openWebSockets() {
        return webSockets.size();
    }

    private @Nullable String authenticate(WebSocketSession session) {
        if (tokenManager == null) {
            return null;
        }
        Map<String, String> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.putAll(session.headers());
        String authorization = headers.get("Authorization");
        if (authorization == null || !authorization.regionMatches(true, 0, "Bearer ", 0, 7)) {
            return null;
        }
        try {
            SecurityContext context = tokenManager.validate(authorization.substring(7).trim());
            return context.agentId();
        } catch (AuthError e) {
            LOGGER.debug("WebSocket session {} presented a {} token, treated as anonymous", session.id(),
                    e.getReason().value());
            return null;
        }
    }

    static String channelMessageFrame(ChannelMessage message) {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", CHANNEL_MESSAGE_FRAME_TYPE);
        frame.put("message", message);
        try {
            return Utils.toJson(frame);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Channel message " + message.id() + " cannot be serialised", e);
        }
    }

    private static @Nullable String blankToNull(@Nullable String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private record WebSocketBinding(WebSocketStreamConnection connection, @Nullable String agentId) {
    }
}
