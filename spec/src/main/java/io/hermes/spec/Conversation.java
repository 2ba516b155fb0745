package io.hermes.spec;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import io.hermes.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * An immutable snapshot of a multi-agent conversation.
 *
 * @param id the conversation id
 * @param topic the conversation topic
 * @param description free text description
 * @param createdBy the creating agent, who joins as moderator
 * @param turnTakingMode the turn discipline
 * @param participants agent id to participant, in join order
 * @param messages the ordered message log
 * @param turnQueue agents waiting for the turn, head first
 * @param currentTurn the agent holding the turn, if any
 * @param state the conversation state
 * @param settings free form settings such as {@code max_participants}
 * @param createdAt creation time
 * @param endedAt time the conversation ended
 */
public record Conversation(String id, String topic, String description, String createdBy,
                           TurnTakingMode turnTakingMode, Map<String, Participant> participants,
                           List<ConversationMessage> messages, List<String> turnQueue,
                           @Nullable String currentTurn, ConversationState state, Map<String, Object> settings,
                           Instant createdAt, @Nullable Instant endedAt) {

    public Conversation {
        description = Utils.defaultIfNull(description, "");
        participants = Utils.copyOf(participants);
        messages = List.copyOf(messages);
        turnQueue = List.copyOf(turnQueue);
        settings = Utils.copyOf(settings);
    }

    public boolean isParticipant(String agentId) {
        return participants.containsKey(agentId);
    }

    /**
     * Returns a copy without the message log, used for listings.
     */
    public Conversation withoutMessages() {
        return new Conversation(id, topic, description, createdBy, turnTakingMode, participants, List.of(),
                turnQueue, currentTurn, state, settings, createdAt, endedAt);
    }
}
