package io.hermes.server.methods;

import static io.hermes.server.methods.MethodSupport.agentIdOrCaller;
import static io.hermes.server.methods.MethodSupport.checkActingAs;
import static io.hermes.server.methods.MethodSupport.optionalAgentId;
import static io.hermes.server.methods.MethodSupport.result;

import java.util.Map;

import io.hermes.server.dispatch.A2AMethods;
import io.hermes.server.dispatch.MethodDispatcher;
import io.hermes.server.dispatch.MethodParams;
import io.hermes.server.events.ChannelBridge;
import io.hermes.server.security.SecurityContext;
import io.hermes.spec.Subscription;
import org.jspecify.annotations.Nullable;

/**
 * The {@code channel.*} methods.
 */
public class ChannelMethods {

    private final ChannelBridge bridge;

    public ChannelMethods(ChannelBridge bridge) {
        this.bridge = bridge;
    }

    public void registerWith(MethodDispatcher dispatcher) {
        dispatcher.registerMethod(A2AMethods.CHANNEL_SUBSCRIBE, this::subscribe);
        dispatcher.registerMethod(A2AMethods.CHANNEL_UNSUBSCRIBE, this::unsubscribe);
        dispatcher.registerMethod(A2AMethods.CHANNEL_PUBLISH, this::publish);
        dispatcher.registerMethod(A2AMethods.CHANNEL_LIST, (params, context) ->
                bridge.listChannels(params.optionalString("pattern")));
        dispatcher.registerMethod(A2AMethods.CHANNEL_INFO, (params, context) ->
                bridge.getChannelInfo(params.requireString("channel")));
        dispatcher.registerMethod(A2AMethods.CHANNEL_SUBSCRIBE_PATTERN, this::subscribePattern);
    }

    Object subscribe(MethodParams params, @Nullable SecurityContext context) {
        String agentId = agentIdOrCaller(params, "agent_id", context);
        String channel = params.requireString("channel");
        Subscription subscription = bridge.subscribe(agentId, channel);
        return result("success", true, "agent_id", agentId, "channel", channel,
                "subscription_id", subscription.id());
    }

    Object unsubscribe(MethodParams params, @Nullable SecurityContext context) {
        String agentId = agentIdOrCaller(params, "agent_id", context);
        String channel = params.requireString("channel");
        boolean removed = bridge.unsubscribe(agentId, channel);
        return result("success", true, "agent_id", agentId, "channel", channel, "removed", removed);
    }

    /**
     * Publishes {@code message} on {@code channel}. The sender is {@code sender_id}, the
     * message's own {@code sender_id} member, or the authenticated caller. An authenticated caller
     * may only publish as itself unless it is an admin.
     */
    Object publish(MethodParams params, @Nullable SecurityContext context) {
        String channel = params.requireString("channel");
        Map<String, Object> message = params.requireMap("message");
        String senderId = optionalAgentId(params, "sender_id", context);
        if (senderId == null && message.get("sender_id") instanceof String embedded) {
            senderId = checkActingAs(embedded, context);
        }
        if (senderId == null) {
            senderId = context == null ? "unknown" : context.agentId();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> metadata = message.get("metadata") instanceof Map<?, ?> map
                ? (Map<String, Object>) map : Map.of();
        return bridge.publishWithMetadata(channel, senderId, message, metadata);
    }

    Object subscribePattern(MethodParams params, @Nullable SecurityContext context) {
        String agentId = agentIdOrCaller(params, "agent_id", context);
        String pattern = params.requireString("pattern");
        Subscription subscription = bridge.subscribe(agentId, pattern);
        return result("success", true, "agent_id", agentId, "pattern", pattern,
                "subscription_id", subscription.id());
    }
}
