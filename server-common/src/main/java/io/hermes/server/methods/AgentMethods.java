package io.hermes.server.methods;

import static io.hermes.server.methods.MethodSupport.found;
import static io.hermes.server.methods.MethodSupport.result;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

import io.hermes.server.bus.MessageBus;
import io.hermes.server.dispatch.A2AMethods;
import io.hermes.server.dispatch.MethodDispatcher;
import io.hermes.server.dispatch.MethodParams;
import io.hermes.server.registry.AgentRegistry;
import io.hermes.server.security.SecurityContext;
import io.hermes.spec.AgentCard;
import io.hermes.spec.AgentStatus;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The {@code agent.*} methods.
 */
public class AgentMethods {

    private static final Logger LOGGER = LoggerFactory.getLogger(AgentMethods.class);

    public static final String REQUEST_TOPIC_FORMAT = "agent.%s.request";

    private final AgentRegistry registry;
    private final MessageBus messageBus;

    public AgentMethods(AgentRegistry registry, MessageBus messageBus) {
        this.registry = registry;
        this.messageBus = messageBus;
    }

    public void registerWith(MethodDispatcher dispatcher) {
        dispatcher.registerMethod(A2AMethods.AGENT_REGISTER, this::register);
        dispatcher.registerMethod(A2AMethods.AGENT_UNREGISTER, this::unregister);
        dispatcher.registerMethod(A2AMethods.AGENT_HEARTBEAT, this::heartbeat);
        dispatcher.registerMethod(A2AMethods.AGENT_UPDATE_STATUS, this::updateStatus);
        dispatcher.registerMethod(A2AMethods.AGENT_GET, this::get);
        dispatcher.registerMethod(A2AMethods.AGENT_LIST, this::list);
        dispatcher.registerMethod(A2AMethods.AGENT_FORWARD, this::forward);
    }

    /**
     * Registers a card given either as an {@code agent_card} object or as flat parameters.
     */
    Object register(MethodParams params, @Nullable SecurityContext context) {
        MethodParams cardParams = params.has("agent_card") ? params.nested("agent_card") : params;
        AgentCard card = toCard(cardParams);
        AgentCard previous = registry.register(card);
        return result("success", true, "agent_id", card.id(), "replaced", previous != null);
    }

    Object unregister(MethodParams params, @Nullable SecurityContext context) {
        String agentId = params.requireString("agent_id");
        found(registry.unregister(agentId), "Agent", agentId);
        return result("success", true, "agent_id", agentId);
    }

    Object heartbeat(MethodParams params, @Nullable SecurityContext context) {
        String agentId = MethodSupport.agentIdOrCaller(params, "agent_id", context);
        AgentCard card = registry.updateHeartbeat(agentId);
        return result("success", true, "agent_id", agentId, "status", card.status().value());
    }

    Object updateStatus(MethodParams params, @Nullable SecurityContext context) {
        String agentId = params.requireString("agent_id");
        AgentStatus status = params.requireEnum("status", AgentStatus::fromValue);
        return registry.updateStatus(agentId, status);
    }

    Object get(MethodParams params, @Nullable SecurityContext context) {
        String agentId = params.requireString("agent_id");
        return found(registry.get(agentId), "Agent", agentId);
    }

    Object list(MethodParams params, @Nullable SecurityContext context) {
        return registry.list(params.optionalEnum("status", AgentStatus::fromValue, null));
    }

    /**
     * Hands a method call to another agent over the message bus topic {@code agent.<id>.request}.
     */
    Object forward(MethodParams params, @Nullable SecurityContext context) {
        String agentId = params.requireString("agent_id");
        String method = params.requireString("method");
        Map<String, Object> forwardedParams = params.optionalMap("params");
        found(registry.get(agentId), "Agent", agentId);

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("method", method);
        message.put("params", forwardedParams == null ? Map.of() : forwardedParams);
        if (context != null) {
            message.put("from_agent", context.agentId());
            message.put("authenticated", true);
        }
        messageBus.publish(String.format(REQUEST_TOPIC_FORMAT, agentId), message);
        LOGGER.debug("Forwarded {} to agent {}", method, agentId);
        return result("forwarded", true, "agent_id", agentId, "method", method);
    }

    static AgentCard toCard(MethodParams params) {
        return AgentCard.builder()
                .id(params.optionalString("id", UUID.randomUUID().toString()))
                .name(params.requireString("name"))
                .description(params.optionalString("description"))
                .version(params.optionalString("version"))
                .capabilities(params.optionalStringList("capabilities"))
                .supportedMethods(params.optionalStringList("supported_methods"))
                .endpoint(params.optionalString("endpoint"))
                .tags(params.optionalStringList("tags"))
                .metadata(params.optionalMap("metadata"))
                .build();
    }
}
