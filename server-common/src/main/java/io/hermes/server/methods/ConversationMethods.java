package io.hermes.server.methods;

import static io.hermes.server.methods.MethodSupport.agentIdOrCaller;
import static io.hermes.server.methods.MethodSupport.found;
import static io.hermes.server.methods.MethodSupport.optionalAgentId;
import static io.hermes.server.methods.MethodSupport.result;

import java.util.LinkedHashMap;
import java.util.Map;

import io.hermes.server.conversations.ConversationManager;
import io.hermes.server.dispatch.A2AMethods;
import io.hermes.server.dispatch.MethodDispatcher;
import io.hermes.server.dispatch.MethodParams;
import io.hermes.server.security.SecurityContext;
import io.hermes.spec.Conversation;
import io.hermes.spec.ConversationMessage;
import io.hermes.spec.ConversationRole;
import io.hermes.spec.ConversationState;
import io.hermes.spec.InvalidParamsError;
import io.hermes.spec.Participant;
import io.hermes.spec.TurnTakingMode;
import org.jspecify.annotations.Nullable;

/**
 * The {@code conversation.*} methods.
 */
public class ConversationMethods {

    private final ConversationManager conversations;

    public ConversationMethods(ConversationManager conversations) {
        this.conversations = conversations;
    }

    public void registerWith(MethodDispatcher dispatcher) {
        dispatcher.registerMethod(A2AMethods.CONVERSATION_CREATE, this::create);
        dispatcher.registerMethod(A2AMethods.CONVERSATION_JOIN, this::join);
        dispatcher.registerMethod(A2AMethods.CONVERSATION_LEAVE, this::leave);
        dispatcher.registerMethod(A2AMethods.CONVERSATION_SEND, this::send);
        dispatcher.registerMethod(A2AMethods.CONVERSATION_LIST, (params, context) ->
                conversations.listConversations(params.optionalString("agent_id"),
                        params.optionalEnum("state", ConversationState::fromValue, null)));
        dispatcher.registerMethod(A2AMethods.CONVERSATION_INFO, (params, context) -> {
            String conversationId = params.requireString("conversation_id");
            return found(conversations.getConversation(conversationId, optionalAgentId(params, "agent_id", context)),
                    "Conversation", conversationId);
        });
        dispatcher.registerMethod(A2AMethods.CONVERSATION_REQUEST_TURN, this::requestTurn);
        dispatcher.registerMethod(A2AMethods.CONVERSATION_GRANT_TURN, this::grantTurn);
        dispatcher.registerMethod(A2AMethods.CONVERSATION_END, this::end);
    }

    /**
     * Creates a conversation; {@code initial_participants} is a list of {@code {agent_id, role}}.
     */
    Object create(MethodParams params, @Nullable SecurityContext context) {
        Map<String, ConversationRole> initial = new LinkedHashMap<>();
        for (Map<String, Object> entry : params.optionalMapList("initial_participants")) {
            MethodParams participant = MethodParams.of(entry);
            initial.put(participant.requireString("agent_id"),
                    participant.optionalEnum("role", ConversationRole::fromValue, ConversationRole.PARTICIPANT));
        }
        Conversation conversation = conversations.createConversation(
                params.requireString("topic"),
                agentIdOrCaller(params, "created_by", context),
                params.optionalString("description"),
                params.optionalEnum("turn_taking_mode", TurnTakingMode::fromValue, TurnTakingMode.FREE_FORM),
                params.optionalMap("settings"),
                initial);
        return conversation.withoutMessages();
    }

    Object join(MethodParams params, @Nullable SecurityContext context) {
        String conversationId = params.requireString("conversation_id");
        String agentId = agentIdOrCaller(params, "agent_id", context);
        Participant participant = conversations.join(conversationId, agentId,
                params.optionalEnum("role", ConversationRole::fromValue, null));
        return result("success", true, "conversation_id", conversationId, "agent_id", agentId,
                "role", participant.role().value(), "joined_at", participant.joinedAt().toString());
    }

    Object leave(MethodParams params, @Nullable SecurityContext context) {
        String conversationId = params.requireString("conversation_id");
        String agentId = agentIdOrCaller(params, "agent_id", context);
        conversations.leave(conversationId, agentId);
        return result("success", true, "conversation_id", conversationId, "agent_id", agentId);
    }

    Object send(MethodParams params, @Nullable SecurityContext context) {
        Object content = params.get("content");
        if (content == null) {
            throw new InvalidParamsError("Missing required parameter: content");
        }
        ConversationMessage message = conversations.sendMessage(
                params.requireString("conversation_id"),
                agentIdOrCaller(params, "sender_id", context),
                content,
                params.optionalString("in_reply_to"),
                params.optionalMap("metadata"));
        return result("success", true, "message_id", message.id(), "timestamp", message.timestamp().toString());
    }

    Object requestTurn(MethodParams params, @Nullable SecurityContext context) {
        Integer position = conversations.requestTurn(params.requireString("conversation_id"),
                agentIdOrCaller(params, "agent_id", context));
        return result("success", true, "position", position, "can_speak_now", position == null);
    }

    Object grantTurn(MethodParams params, @Nullable SecurityContext context) {
        String agentId = params.requireString("agent_id");
        conversations.grantTurn(params.requireString("conversation_id"),
                agentIdOrCaller(params, "moderator_id", context), agentId);
        return result("success", true, "agent_id", agentId);
    }

    Object end(MethodParams params, @Nullable SecurityContext context) {
        String conversationId = params.requireString("conversation_id");
        conversations.endConversation(conversationId, agentIdOrCaller(params, "agent_id", context));
        return result("success", true, "conversation_id", conversationId);
    }
}
