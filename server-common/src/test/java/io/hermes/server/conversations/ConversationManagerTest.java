package io.hermes.server.conversations;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.hermes.server.MutableClock;
import io.hermes.server.bus.LocalMessageBus;
import io.hermes.server.events.ChannelBridge;
import io.hermes.server.events.SubscriptionManager;
import io.hermes.spec.ChannelMessage;
import io.hermes.spec.Conversation;
import io.hermes.spec.ConversationEndedError;
import io.hermes.spec.ConversationMessage;
import io.hermes.spec.ConversationRole;
import io.hermes.spec.ConversationState;
import io.hermes.spec.InvalidRequestError;
import io.hermes.spec.Participant;
import io.hermes.spec.PermissionDeniedError;
import io.hermes.spec.TurnTakingMode;
import io.hermes.spec.TurnViolationError;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

public class ConversationManagerTest {

    private LocalMessageBus bus;
    private ChannelBridge bridge;
    private ConversationManager manager;
    private List<ChannelMessage> received;

    @BeforeEach
    public void setUp() {
        MutableClock clock = new MutableClock();
        bus = new LocalMessageBus();
        SubscriptionManager subscriptions = new SubscriptionManager(bus, false, Runnable::run, clock);
        bridge = new ChannelBridge(bus, subscriptions, clock);
        manager = new ConversationManager(bridge, clock);
        received = new ArrayList<>();
        subscriptions.attachEndpoint("watcher", received::add);
        bridge.subscribe("watcher", "conversation.*.messages");
        bridge.subscribe("watcher", "conversation.*.events");
    }

    private Conversation create(TurnTakingMode mode, String... participants) {
        Map<String, ConversationRole> initial = new LinkedHashMap<>();
        for (String participant : participants) {
            initial.put(participant, ConversationRole.PARTICIPANT);
        }
        return manager.createConversation("design review", "alice", null, mode, null, initial);
    }

    private List<String> eventTypes() {
        List<String> types = new ArrayList<>();
        for (ChannelMessage message : received) {
            if (message.channel().endsWith(".events")) {
                types.add((String) ((Map<?, ?>) message.content()).get("type"));
            }
        }
        return types;
    }

    @Test
    public void testCreateConversation() {
        Conversation conversation = create(TurnTakingMode.MODERATED, "bob");

        assertEquals(ConversationState.ACTIVE, conversation.state());
        assertEquals(ConversationRole.MODERATOR, conversation.participants().get("alice").role());
        assertEquals(ConversationRole.PARTICIPANT, conversation.participants().get("bob").role());
        assertEquals("alice", conversation.currentTurn());
        assertEquals("", conversation.description());
        assertTrue(bus.hasChannel(ConversationManager.messagesChannel(conversation.id())));
        assertTrue(bus.hasChannel(ConversationManager.eventsChannel(conversation.id())));
    }

    @Test
    public void testFreeFormAllowsEveryParticipant() {
        Conversation conversation = create(TurnTakingMode.FREE_FORM, "bob");
        assertNull(conversation.currentTurn());

        manager.sendMessage(conversation.id(), "bob", "hello", null, null);
        ConversationMessage reply = manager.sendMessage(conversation.id(), "alice", "hi", null, null);
        manager.sendMessage(conversation.id(), "bob", "how are you", reply.id(), Map.of("lang", "en"));

        Conversation current = manager.getConversation(conversation.id(), "bob");
        assertEquals(3, current.messages().size());
        assertEquals(reply.id(), current.messages().get(2).inReplyTo());
        assertTrue(eventTypes().isEmpty());
        assertEquals(3, received.size());
        Map<?, ?> body = (Map<?, ?>) received.get(0).content();
        assertEquals("hello", body.get("content"));
        assertEquals("bob", received.get(0).senderId());
    }

    @Test
    public void testReplySentDuringDeliveryIsPublishedAfterTheMessageItAnswers() {
        Conversation conversation = create(TurnTakingMode.FREE_FORM, "bob");
        String channel = ConversationManager.messagesChannel(conversation.id());
        bus.subscribe(channel, published -> {
            Map<?, ?> body = (Map<?, ?>) published.get("content");
            if ("bob".equals(body.get("sender_id"))) {
                manager.sendMessage(conversation.id(), "alice", "auto reply", (String) body.get("message_id"), null);
            }
        });
        List<Object> sequences = new ArrayList<>();
        List<Object> publishedIds = new ArrayList<>();
        bus.subscribe(channel, published -> {
            Map<?, ?> body = (Map<?, ?>) published.get("content");
            sequences.add(body.get("sequence"));
            publishedIds.add(body.get("message_id"));
        });

        manager.sendMessage(conversation.id(), "bob", "ping", null, null);

        List<Object> loggedIds = new ArrayList<>();
        manager.getConversation(conversation.id(), null).messages().forEach(message -> loggedIds.add(message.id()));
        assertEquals(2, loggedIds.size());
        assertEquals(loggedIds, publishedIds);
        assertEquals(List.of(1, 2), sequences);
    }

    @Test
    public void testModeratedConversationRejectsSpeakerWithoutTurn() {
        Conversation conversation = create(TurnTakingMode.MODERATED, "bob");

        assertThrows(TurnViolationError.class,
                () -> manager.sendMessage(conversation.id(), "bob", "may I?", null, null));
        assertTrue(manager.getConversation(conversation.id(), null).messages().isEmpty());

        manager.grantTurn(conversation.id(), "alice", "bob");
        manager.sendMessage(conversation.id(), "bob", "thanks", null, null);

        assertEquals("bob", manager.getConversation(conversation.id(), null).currentTurn());
        assertThrows(TurnViolationError.class,
                () -> manager.sendMessage(conversation.id(), "alice", "back to me", null, null));
    }

    @Test
    public void testOnlyModeratorsGrantTheTurn() {
        Conversation conversation = create(TurnTakingMode.MODERATED, "bob", "carol");

        assertThrows(PermissionDeniedError.class, () -> manager.grantTurn(conversation.id(), "bob", "carol"));
        assertThrows(InvalidRequestError.class, () -> manager.grantTurn(conversation.id(), "alice", "mallory"));
    }

    @Test
    public void testTurnPassesToQueueHead() {
        Conversation conversation = create(TurnTakingMode.MODERATED, "bob", "carol");

        assertEquals(1, manager.requestTurn(conversation.id(), "bob"));
        assertEquals(2, manager.requestTurn(conversation.id(), "carol"));
        assertEquals(1, manager.requestTurn(conversation.id(), "bob"));
        assertNull(manager.requestTurn(conversation.id(), "alice"));

        manager.sendMessage(conversation.id(), "alice", "bob, go ahead", null, null);
        Conversation current = manager.getConversation(conversation.id(), null);
        assertEquals("bob", current.currentTurn());
        assertEquals(List.of("carol"), current.turnQueue());

        manager.sendMessage(conversation.id(), "bob", "done", null, null);
        manager.sendMessage(conversation.id(), "carol", "me too", null, null);

        // nobody queued, carol keeps the turn
        assertEquals("carol", manager.getConversation(conversation.id(), null).currentTurn());
        assertTrue(eventTypes().contains("turn_requested"));
        assertTrue(eventTypes().contains("turn_changed"));
    }

    @Test
    public void testRoundRobinRequeuesSpeaker() {
        Conversation conversation = create(TurnTakingMode.ROUND_ROBIN, "bob", "carol");
        manager.requestTurn(conversation.id(), "bob");
        manager.requestTurn(conversation.id(), "carol");

        List<String> speakers = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            String speaker = manager.getConversation(conversation.id(), null).currentTurn();
            speakers.add(speaker);
            manager.sendMessage(conversation.id(), speaker, "turn " + i, null, null);
        }

        assertEquals(List.of("alice", "bob", "carol", "alice", "bob", "carol"), speakers);
    }

    @Test
    public void testObserversCannotSpeak() {
        Conversation conversation = create(TurnTakingMode.FREE_FORM);
        Participant observer = manager.join(conversation.id(), "olga", ConversationRole.OBSERVER);
        assertEquals(ConversationRole.OBSERVER, observer.role());

        assertThrows(PermissionDeniedError.class,
                () -> manager.sendMessage(conversation.id(), "olga", "psst", null, null));
        assertThrows(PermissionDeniedError.class, () -> manager.requestTurn(conversation.id(), "olga"));
    }

    @Test
    public void testNonParticipantCannotSpeakOrRead() {
        Conversation conversation = create(TurnTakingMode.FREE_FORM);

        assertThrows(InvalidRequestError.class,
                () -> manager.sendMessage(conversation.id(), "mallory", "hi", null, null));
        assertThrows(PermissionDeniedError.class, () -> manager.getConversation(conversation.id(), "mallory"));
        assertNull(manager.getConversation("missing", null));
        assertThrows(InvalidRequestError.class, () -> manager.join("missing", "bob", null));
    }

    @Test
    public void testJoinIsIdempotentAndBoundedByMaxParticipants() {
        Conversation conversation = manager.createConversation("small", "alice", null, TurnTakingMode.FREE_FORM,
                Map.of(ConversationManager.MAX_PARTICIPANTS_SETTING, 2), null);

        Participant bob = manager.join(conversation.id(), "bob", null);
        assertEquals(ConversationRole.PARTICIPANT, bob.role());
        assertSame(bob, manager.join(conversation.id(), "bob", ConversationRole.MODERATOR));
        assertThrows(InvalidRequestError.class, () -> manager.join(conversation.id(), "carol", null));

        manager.leave(conversation.id(), "bob");
        manager.join(conversation.id(), "carol", null);
        assertEquals(List.of("participant_joined", "participant_left", "participant_joined"), eventTypes());
    }

    @Test
    public void testInitialParticipantsRespectMaxParticipants() {
        assertThrows(InvalidRequestError.class, () -> manager.createConversation("small", "alice", null,
                TurnTakingMode.FREE_FORM, Map.of(ConversationManager.MAX_PARTICIPANTS_SETTING, 2),
                Map.of("bob", ConversationRole.PARTICIPANT, "carol", ConversationRole.PARTICIPANT)));
    }

    @Test
    public void testLeavingTurnHolderPassesTheTurn() {
        Conversation conversation = create(TurnTakingMode.MODERATED, "bob");
        manager.requestTurn(conversation.id(), "bob");

        manager.leave(conversation.id(), "alice");

        assertEquals("bob", manager.getConversation(conversation.id(), null).currentTurn());
        assertThrows(InvalidRequestError.class, () -> manager.leave(conversation.id(), "alice"));
    }

    @Test
    public void testEndConversation() {
        Conversation conversation = create(TurnTakingMode.FREE_FORM, "bob");

        assertThrows(PermissionDeniedError.class, () -> manager.endConversation(conversation.id(), "bob"));

        Conversation ended = manager.endConversation(conversation.id(), "alice");

        assertEquals(ConversationState.ENDED, ended.state());
        assertTrue(ended.endedAt() != null);
        assertThrows(ConversationEndedError.class,
                () -> manager.sendMessage(conversation.id(), "bob", "late", null, null));
        assertThrows(ConversationEndedError.class, () -> manager.join(conversation.id(), "carol", null));
        assertThrows(ConversationEndedError.class, () -> manager.endConversation(conversation.id(), "alice"));
        assertEquals("conversation_ended", eventTypes().get(eventTypes().size() - 1));
    }

    @Test
    public void testListConversations() {
        Conversation first = create(TurnTakingMode.FREE_FORM, "bob");
        Conversation second = create(TurnTakingMode.FREE_FORM);
        manager.sendMessage(first.id(), "bob", "hi", null, null);
        manager.endConversation(second.id(), "alice");

        List<Conversation> bobs = manager.listConversations("bob", null);
        assertEquals(1, bobs.size());
        assertEquals(first.id(), bobs.get(0).id());
        assertTrue(bobs.get(0).messages().isEmpty());
        assertEquals(List.of(second.id()),
                manager.listConversations(null, ConversationState.ENDED).stream().map(Conversation::id).toList());
        assertEquals(2, manager.listConversations("alice", null).size());
    }
}
