package io.hermes.server.conversations;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.hermes.server.events.ChannelBridge;
import io.hermes.spec.Conversation;
import io.hermes.spec.ConversationEndedError;
import io.hermes.spec.ConversationMessage;
import io.hermes.spec.ConversationRole;
import io.hermes.spec.ConversationState;
import io.hermes.spec.InvalidParamsError;
import io.hermes.spec.InvalidRequestError;
import io.hermes.spec.Participant;
import io.hermes.spec.PermissionDeniedError;
import io.hermes.spec.TurnTakingMode;
import io.hermes.spec.TurnViolationError;
import io.hermes.util.Assert;
import io.hermes.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multi-agent conversations with turn-taking.
 * <p>
 * In {@link TurnTakingMode#FREE_FORM} every participant may send at any time. In the other modes
 * only the turn holder may send. The creator holds the first turn; after the holder sends, the
 * turn passes to the head of the FIFO turn queue, and in {@link TurnTakingMode#ROUND_ROBIN} the
 * speaker re-joins the queue at its tail. With an empty queue the holder keeps the turn. A
 * moderator may hand the turn to any participant.
 * <p>
 * Messages are published on {@code conversation.<id>.messages}, membership and turn changes on
 * {@code conversation.<id>.events}.
 */
@ApplicationScoped
public class ConversationManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConversationManager.class);

    public static final String MAX_PARTICIPANTS_SETTING = "max_participants";
    public static final String MESSAGES_CHANNEL_FORMAT = "conversation.%s.messages";
    public static final String EVENTS_CHANNEL_FORMAT = "conversation.%s.events";

    private final ChannelBridge channelBridge;
    private final Clock clock;
    private final ConcurrentMap<String, ConversationEntry> conversations = new ConcurrentHashMap<>();

    @Inject
    public ConversationManager(ChannelBridge channelBridge) {
        this(channelBridge, Clock.systemUTC());
    }

    public ConversationManager(ChannelBridge channelBridge, Clock clock) {
        this.channelBridge = channelBridge;
        this.clock = clock;
    }

    /**
     * Creates a conversation. The creator joins as moderator.
     *
     * @param initialParticipants agent id to role of further participants
     */
    public Conversation createConversation(String topic, String createdBy, @Nullable String description,
                                           TurnTakingMode mode, @Nullable Map<String, Object> settings,
                                           @Nullable Map<String, ConversationRole> initialParticipants) {
        Assert.checkNotBlankParam("topic", topic);
        Assert.checkNotBlankParam("createdBy", createdBy);
        Assert.checkNotNullParam("mode", mode);
        Instant now = clock.instant();
        ConversationEntry conversation = new ConversationEntry(UUID.randomUUID().toString(), topic,
                Utils.defaultIfNull(description, ""), createdBy, mode, Utils.copyOf(settings), now);
        Integer maxParticipants = conversation.maxParticipants();
        conversation.participants.put(createdBy, new Participant(createdBy, ConversationRole.MODERATOR, now));
        if (initialParticipants != null) {
            initialParticipants.forEach((agentId, role) -> {
                if (!conversation.participants.containsKey(agentId)) {
                    if (maxParticipants != null && conversation.participants.size() >= maxParticipants) {
                        throw new InvalidRequestError("Conversation is limited to " + maxParticipants + " participants");
                    }
                    conversation.participants.put(agentId, new Participant(agentId, role, now));
                }
            });
        }
        if (mode != TurnTakingMode.FREE_FORM) {
            conversation.currentTurn = createdBy;
        }
        conversations.put(conversation.id, conversation);
        channelBridge.createChannel(messagesChannel(conversation.id), "Messages of conversation " + topic);
        channelBridge.createChannel(eventsChannel(conversation.id), "Events of conversation " + topic);
        LOGGER.info("Created {} conversation {} ({}) by {}", mode.value(), conversation.id, topic, createdBy);
        return conversation.snapshot(true);
    }

    /**
     * Adds an agent to a conversation; joining again returns the existing membership.
     *
     * @param role the role to join with, {@link ConversationRole#PARTICIPANT} when {@code null}
     */
    public Participant join(String conversationId, String agentId, @Nullable ConversationRole role) {
        Assert.checkNotBlankParam("agentId", agentId);
        ConversationEntry conversation = require(conversationId);
        Participant participant;
        conversation.lock.lock();
        try {
            requireActive(conversation);
            Participant existing = conversation.participants.get(agentId);
            if (existing != null) {
                return existing;
            }
            Integer maxParticipants = conversation.maxParticipants();
            if (maxParticipants != null && conversation.participants.size() >= maxParticipants) {
                throw new InvalidRequestError("Conversation " + conversationId + " is limited to "
                        + maxParticipants + " participants");
            }
            participant = new Participant(agentId, role == null ? ConversationRole.PARTICIPANT : role, clock.instant());
            conversation.participants.put(agentId, participant);
        } finally {
            conversation.lock.unlock();
        }
        LOGGER.debug("Agent {} joined conversation {} as {}", agentId, conversationId, participant.role().value());
        publishEvent(conversationId, "participant_joined", agentId, Map.of("role", participant.role().value()));
        return participant;
    }

    /**
     * Removes an agent. If it held the turn, the turn passes to the next queued agent at once.
     */
    public void leave(String conversationId, String agentId) {
        ConversationEntry conversation = require(conversationId);
        String nextTurn;
        conversation.lock.lock();
        try {
            if (conversation.participants.remove(agentId) == null) {
                throw new InvalidRequestError("Agent " + agentId + " is not in conversation " + conversationId);
            }
            conversation.turnQueue.remove(agentId);
            if (agentId.equals(conversation.currentTurn)) {
                conversation.currentTurn = conversation.turnQueue.pollFirst();
            }
            nextTurn = conversation.currentTurn;
        } finally {
            conversation.lock.unlock();
        }
        LOGGER.debug("Agent {} left conversation {}", agentId, conversationId);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("current_turn", nextTurn);
        publishEvent(conversationId, "participant_left", agentId, details);
    }

    /**
     * Appends a message to the conversation log.
     *
     * @throws InvalidRequestError if the sender is not a participant
     * @throws PermissionDeniedError if the sender is an observer
     * @throws TurnViolationError if the mode requires a turn and the sender does not hold it
     * @throws ConversationEndedError if the conversation has ended
     */
    public ConversationMessage sendMessage(String conversationId, String senderId, Object content,
                                           @Nullable String inReplyTo, @Nullable Map<String, Object> metadata) {
        ConversationEntry conversation = require(conversationId);
        ConversationMessage message;
        conversation.lock.lock();
        try {
            requireActive(conversation);
            Participant sender = requireParticipant(conversation, senderId);
            if (sender.role() == ConversationRole.OBSERVER) {
                throw new PermissionDeniedError("Observers cannot send messages");
            }
            if (conversation.mode != TurnTakingMode.FREE_FORM && !senderId.equals(conversation.currentTurn)) {
                throw new TurnViolationError("Agent " + senderId + " does not hold the turn in conversation "
                        + conversationId + "; current turn: " + conversation.currentTurn);
            }
            message = new ConversationMessage(UUID.randomUUID().toString(), conversationId, senderId, content,
                    inReplyTo, Utils.copyOf(metadata), clock.instant());
            conversation.messages.add(message);
            boolean turnChanged = conversation.mode != TurnTakingMode.FREE_FORM
                    && advanceAfterSpeaking(conversation, senderId);
            String nextTurn = conversation.currentTurn;

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("message_id", message.id());
            body.put("conversation_id", conversationId);
            body.put("sender_id", senderId);
            body.put("sequence", conversation.messages.size());
            body.put("content", content);
            body.put("in_reply_to", inReplyTo);
            body.put("timestamp", message.timestamp().toString());
            // queued under the lock so subscribers see messages in log order
            Map<String, Object> messageMetadata = message.metadata();
            conversation.outbox.add(() -> publishMessage(conversationId, senderId, body, messageMetadata));
            if (turnChanged) {
                conversation.outbox.add(() -> publishEvent(conversationId, "turn_changed", nextTurn, Map.of()));
            }
        } finally {
            conversation.lock.unlock();
        }
        drainOutbox(conversation);
        return message;
    }

    private void publishMessage(String conversationId, String senderId, Map<String, Object> body,
                                Map<String, Object> metadata) {
        try {
            channelBridge.publishWithMetadata(messagesChannel(conversationId), senderId, body, metadata);
        } catch (RuntimeException e) {
            LOGGER.error("Publishing message {} of conversation {} failed", body.get("message_id"), conversationId, e);
        }
    }

    /**
     * Runs queued publications one at a time in queue order. A publication that sends another
     * message from the same thread only queues it; the running drain picks it up afterwards.
     */
    private static void drainOutbox(ConversationEntry conversation) {
        while (!conversation.outbox.isEmpty() && conversation.draining.compareAndSet(false, true)) {
            try {
                Runnable publication;
                while ((publication = conversation.outbox.poll()) != null) {
                    publication.run();
                }
            } finally {
                conversation.draining.set(false);
            }
        }
    }

    private static boolean advanceAfterSpeaking(ConversationEntry conversation, String speaker) {
        String next = conversation.turnQueue.pollFirst();
        if (next == null) {
            return false;
        }
        if (conversation.mode == TurnTakingMode.ROUND_ROBIN) {
            conversation.turnQueue.addLast(speaker);
        }
        conversation.currentTurn = next;
        return true;
    }

    /**
     * Asks for the turn.
     *
     * @return the 1-based position in the turn queue, or {@code null} if the agent holds the turn
     *         now, either already or because nobody held it
     */
    public @Nullable Integer requestTurn(String conversationId, String agentId) {
        ConversationEntry conversation = require(conversationId);
        Integer position;
        boolean granted = false;
        conversation.lock.lock();
        try {
            requireActive(conversation);
            Participant participant = requireParticipant(conversation, agentId);
            if (participant.role() == ConversationRole.OBSERVER) {
                throw new PermissionDeniedError("Observers cannot take the turn");
            }
            if (agentId.equals(conversation.currentTurn)) {
                return null;
            }
            if (conversation.currentTurn == null && conversation.turnQueue.isEmpty()) {
                conversation.currentTurn = agentId;
                granted = true;
                position = null;
            } else {
                if (!conversation.turnQueue.contains(agentId)) {
                    conversation.turnQueue.addLast(agentId);
                }
                position = indexOf(conversation.turnQueue, agentId) + 1;
            }
        } finally {
            conversation.lock.unlock();
        }
        if (granted) {
            publishEvent(conversationId, "turn_changed", agentId, Map.of());
        } else {
            publishEvent(conversationId, "turn_requested", agentId, Map.of("position", position));
        }
        return position;
    }

    /**
     * Hands the turn to {@code agentId}, bypassing the queue.
     *
     * @throws PermissionDeniedError unless {@code moderatorId} is a moderator of the conversation
     * @throws InvalidRequestError if {@code agentId} is not a participant
     */
    public void grantTurn(String conversationId, String moderatorId, String agentId) {
        ConversationEntry conversation = require(conversationId);
        conversation.lock.lock();
        try {
            requireActive(conversation);
            Participant moderator = conversation.participants.get(moderatorId);
            if (moderator == null || moderator.role() != ConversationRole.MODERATOR) {
                throw new PermissionDeniedError("Only a moderator can grant the turn");
            }
            requireParticipant(conversation, agentId);
            conversation.turnQueue.remove(agentId);
            conversation.currentTurn = agentId;
        } finally {
            conversation.lock.unlock();
        }
        LOGGER.debug("Moderator {} granted the turn in {} to {}", moderatorId, conversationId, agentId);
        publishEvent(conversationId, "turn_changed", agentId, Map.of("granted_by", moderatorId));
    }

    /**
     * Ends a conversation. Only its creator or a moderator may end it.
     *
     * @throws ConversationEndedError if it already ended
     */
    public Conversation endConversation(String conversationId, String agentId) {
        ConversationEntry conversation = require(conversationId);
        Conversation snapshot;
        conversation.lock.lock();
        try {
            requireActive(conversation);
            Participant participant = conversation.participants.get(agentId);
            boolean moderator = participant != null && participant.role() == ConversationRole.MODERATOR;
            if (!agentId.equals(conversation.createdBy) && !moderator) {
                throw new PermissionDeniedError("Only the creator or a moderator can end the conversation");
            }
            conversation.state = ConversationState.ENDED;
            conversation.endedAt = clock.instant();
            conversation.currentTurn = null;
            conversation.turnQueue.clear();
            snapshot = conversation.snapshot(false);
        } finally {
            conversation.lock.unlock();
        }
        LOGGER.info("Conversation {} ended by {}", conversationId, agentId);
        publishEvent(conversationId, "conversation_ended", agentId, Map.of());
        return snapshot;
    }

    /**
     * Returns a conversation with its message log.
     *
     * @param agentId when given, the agent must be a participant
     * @return the conversation or {@code null} if unknown
     */
    public @Nullable Conversation getConversation(String conversationId, @Nullable String agentId) {
        ConversationEntry conversation = conversations.get(conversationId);
        if (conversation == null) {
            return null;
        }
        conversation.lock.lock();
        try {
            if (agentId != null && !conversation.participants.containsKey(agentId)) {
                throw new PermissionDeniedError("Agent " + agentId + " is not in conversation " + conversationId);
            }
            return conversation.snapshot(true);
        } finally {
            conversation.lock.unlock();
        }
    }

    /**
     * Lists conversations without their message logs, oldest first.
     */
    public List<Conversation> listConversations(@Nullable String agentId, @Nullable ConversationState state) {
        List<Conversation> result = new ArrayList<>();
        for (ConversationEntry conversation : conversations.values()) {
            conversation.lock.lock();
            try {
                if ((agentId == null || conversation.participants.containsKey(agentId))
                        && (state == null || conversation.state == state)) {
                    result.add(conversation.snapshot(false));
                }
            } finally {
                conversation.lock.unlock();
            }
        }
        result.sort(Comparator.comparing(Conversation::createdAt).thenComparing(Conversation::id));
        return result;
    }

    public static String messagesChannel(String conversationId) {
        return String.format(MESSAGES_CHANNEL_FORMAT, conversationId);
    }

    public static String eventsChannel(String conversationId) {
        return String.format(EVENTS_CHANNEL_FORMAT, conversationId);
    }

    private void publishEvent(String conversationId, String type, @Nullable String agentId,
                              Map<String, Object> details) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("type", type);
        body.put("conversation_id", conversationId);
        body.put("agent_id", agentId);
        body.putAll(details);
        try {
            channelBridge.publishWithMetadata(eventsChannel(conversationId), agentId == null ? "system" : agentId,
                    body, Map.of());
        } catch (RuntimeException e) {
            LOGGER.error("Publishing {} for conversation {} failed", type, conversationId, e);
        }
    }

    private ConversationEntry require(String conversationId) {
        ConversationEntry conversation = conversations.get(conversationId);
        if (conversation == null) {
            throw new InvalidRequestError("Conversation not found: " + conversationId);
        }
        return conversation;
    }

    private static void requireActive(ConversationEntry conversation) {
        if (conversation.state == ConversationState.ENDED) {
            throw new ConversationEndedError("Conversation " + conversation.id + " has ended");
        }
    }

    private static Participant requireParticipant(ConversationEntry conversation, String agentId) {
        Participant participant = conversation.participants.get(agentId);
        if (participant == null) {
            throw new InvalidRequestError("Agent " + agentId + " is not in conversation " + conversation.id);
        }
        return participant;
    }

    private static int indexOf(Deque<String> queue, String agentId) {
        int index = 0;
        for (String queued : queue) {
            if (queued.equals(agentId)) {
                return index;
            }
            index++;
        }
        return -1;
    }

    /**
     * Mutable state of one conversation, guarded by {@link #lock}.
     */
    private static final class ConversationEntry {
        final ReentrantLock lock = new ReentrantLock();
        final String id;
        final String topic;
        final String description;
        final String createdBy;
        final TurnTakingMode mode;
        final Map<String, Object> settings;
        final Instant createdAt;
        final Map<String, Participant> participants = new LinkedHashMap<>();
        final List<ConversationMessage> messages = new ArrayList<>();
        final Deque<String> turnQueue = new ArrayDeque<>();
        final Queue<Runnable> outbox = new ConcurrentLinkedQueue<>();
        final AtomicBoolean draining = new AtomicBoolean();
        @Nullable String currentTurn;
        ConversationState state = ConversationState.ACTIVE;
        @Nullable Instant endedAt;

        ConversationEntry(String id, String topic, String description, String createdBy, TurnTakingMode mode,
                          Map<String, Object> settings, Instant createdAt) {
            this.id = id;
            this.topic = topic;
            this.description = description;
            this.createdBy = createdBy;
            this.mode = mode;
            this.settings = settings;
            this.createdAt = createdAt;
        }

        @Nullable Integer maxParticipants() {
            Object value = settings.get(MAX_PARTICIPANTS_SETTING);
            if (value == null) {
                return null;
            }
            if (value instanceof Number number) {
                return number.intValue();
            }
            try {
                return Integer.parseInt(value.toString());
            } catch (NumberFormatException e) {
                throw new InvalidParamsError("Setting " + MAX_PARTICIPANTS_SETTING + " must be a number: " + value);
            }
        }

        Conversation snapshot(boolean withMessages) {
            return new Conversation(id, topic, description, createdBy, mode, participants,
                    withMessages ? messages : List.of(), new ArrayList<>(turnQueue), currentTurn, state, settings,
                    createdAt, endedAt);
        }
    }
}
