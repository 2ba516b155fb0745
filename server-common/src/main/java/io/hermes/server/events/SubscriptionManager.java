package io.hermes.server.events;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Queue;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.hermes.server.bus.MessageBus;
import io.hermes.server.config.A2AConfig;
import io.hermes.spec.ChannelMessage;
import io.hermes.spec.Subscription;
import io.hermes.util.Assert;
import io.hermes.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Channel subscriptions of agents and delivery of channel messages to them.
 * <p>
 * Every agent owns a mailbox drained by at most one task at a time on the delivery executor, so
 * an agent receives messages in publish order and a slow agent only delays itself. The
 * publishing thread only enqueues.
 * <p>
 * A message goes to the agent's attached {@link SubscriberEndpoint}, or to the message bus
 * topic {@code agent.<id>.inbox} when none is attached.
 */
@ApplicationScoped
public class SubscriptionManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubscriptionManager.class);

    public static final String INBOX_TOPIC_FORMAT = "agent.%s.inbox";

    private final MessageBus messageBus;
    private final boolean allowMultiSegment;
    private final Executor executor;
    private final @Nullable ExecutorService ownedExecutor;
    private final Clock clock;

    private final ConcurrentMap<String, Registered> subscriptions = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, SubscriberEndpoint> endpoints = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();

    @Inject
    public SubscriptionManager(MessageBus messageBus, A2AConfig config) {
        this(messageBus, config.multiSegmentWildcards(), newDeliveryPool(), Clock.systemUTC(), true);
    }

    public SubscriptionManager(MessageBus messageBus, boolean allowMultiSegment, Executor executor, Clock clock) {
        this(messageBus, allowMultiSegment, executor, clock, false);
    }

    private SubscriptionManager(MessageBus messageBus, boolean allowMultiSegment, Executor executor, Clock clock,
                                boolean owned) {
        this.messageBus = messageBus;
        this.allowMultiSegment = allowMultiSegment;
        this.executor = executor;
        this.ownedExecutor = owned ? (ExecutorService) executor : null;
        this.clock = clock;
    }

    private static ExecutorService newDeliveryPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread thread = new Thread(r, "hermes-delivery-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public boolean allowsMultiSegment() {
        return allowMultiSegment;
    }

    /**
     * Subscribes an agent to every channel matching a pattern. Subscribing twice with the same
     * pattern returns the existing subscription.
     *
     * @throws io.hermes.spec.InvalidParamsError if the pattern is malformed
     */
    public Subscription createPatternSubscription(String agentId, String pattern) {
        Assert.checkNotBlankParam("agentId", agentId);
        ChannelPattern compiled = ChannelPattern.compile(pattern, allowMultiSegment);
        synchronized (subscriptions) {
            for (Registered registered : subscriptions.values()) {
                if (registered.subscription.agentId().equals(agentId)
                        && registered.subscription.channelPattern().equals(pattern)) {
                    return registered.subscription;
                }
            }
            Subscription subscription = new Subscription(UUID.randomUUID().toString(), agentId, pattern,
                    clock.instant());
            subscriptions.put(subscription.id(), new Registered(subscription, compiled));
            LOGGER.debug("Agent {} subscribed to {} ({})", agentId, pattern, subscription.id());
            return subscription;
        }
    }

    public boolean removeSubscription(String subscriptionId) {
        Registered removed = subscriptions.remove(subscriptionId);
        if (removed != null) {
            LOGGER.debug("Removed subscription {} of {}", subscriptionId, removed.subscription.agentId());
        }
        return removed != null;
    }

    /**
     * Removes the subscription of an agent to a pattern, if any.
     */
    public boolean unsubscribe(String agentId, String pattern) {
        synchronized (subscriptions) {
            return subscriptions.values().removeIf(registered -> registered.subscription.agentId().equals(agentId)
                    && registered.subscription.channelPattern().equals(pattern));
        }
    }

    /**
     * Drops every subscription and the endpoint of an agent.
     *
     * @return the number of subscriptions removed
     */
    public int removeAgent(String agentId) {
        int removed = 0;
        synchronized (subscriptions) {
            for (Registered registered : new ArrayList<>(subscriptions.values())) {
                if (registered.subscription.agentId().equals(agentId)
                        && subscriptions.remove(registered.subscription.id()) != null) {
                    removed++;
                }
            }
        }
        endpoints.remove(agentId);
        mailboxes.remove(agentId);
        if (removed > 0) {
            LOGGER.info("Removed {} subscriptions of agent {}", removed, agentId);
        }
        return removed;
    }

    public List<Subscription> subscriptionsFor(String agentId) {
        return subscriptions.values().stream()
                .map(registered -> registered.subscription)
                .filter(subscription -> subscription.agentId().equals(agentId))
                .sorted(Comparator.comparing(Subscription::createdAt).thenComparing(Subscription::id))
                .toList();
    }

    /**
     * Agents with at least one subscription matching the channel.
     */
    public Set<String> subscribersOf(String channel) {
        Set<String> agents = new LinkedHashSet<>();
        for (Registered registered : subscriptions.values()) {
            if (registered.pattern.matches(channel)) {
                agents.add(registered.subscription.agentId());
            }
        }
        return agents;
    }

    public int countMatching(String channel) {
        return subscribersOf(channel).size();
    }

    public void attachEndpoint(String agentId, SubscriberEndpoint endpoint) {
        endpoints.put(Assert.checkNotBlankParam("agentId", agentId), Assert.checkNotNullParam("endpoint", endpoint));
        LOGGER.debug("Attached endpoint for agent {}", agentId);
    }

    public void detachEndpoint(String agentId) {
        endpoints.remove(agentId);
    }

    /**
     * Schedules delivery of a message to every agent subscribed to its channel. An agent with
     * several matching subscriptions receives the message once.
     *
     * @return the agents the message was scheduled for
     */
    public Set<String> deliver(ChannelMessage message) {
        Set<String> recipients = subscribersOf(message.channel());
        for (String agentId : recipients) {
            mailboxes.computeIfAbsent(agentId, Mailbox::new).post(message);
        }
        return recipients;
    }

    @PreDestroy
    public void shutdown() {
        if (ownedExecutor != null) {
            ownedExecutor.shutdownNow();
        }
    }

    private void deliverTo(String agentId, ChannelMessage message) {
        SubscriberEndpoint endpoint = endpoints.get(agentId);
        if (endpoint == null) {
            messageBus.publish(String.format(INBOX_TOPIC_FORMAT, agentId), Utils.toMap(message));
            return;
        }
        try {
            endpoint.deliver(message);
        } catch (Exception e) {
            endpoints.remove(agentId, endpoint);
            LOGGER.warn("Delivery of message {} on {} to agent {} failed, endpoint detached", message.id(),
                    message.channel(), agentId, e);
        }
    }

    private record Registered(Subscription subscription, ChannelPattern pattern) {
    }

    /**
     * Serial per-agent queue: at most one drain task is scheduled at a time.
     */
    private final class Mailbox {
        private final String agentId;
        private final Queue<ChannelMessage> queue = new ConcurrentLinkedQueue<>();
        private final AtomicBoolean scheduled = new AtomicBoolean();

        Mailbox(String agentId) {
            this.agentId = agentId;
        }

        void post(ChannelMessage message) {
            queue.add(message);
            schedule();
        }

        private void schedule() {
            if (scheduled.compareAndSet(false, true)) {
                try {
                    executor.execute(this::drain);
                } catch (RejectedExecutionException e) {
                    scheduled.set(false);
                    LOGGER.warn("Delivery to agent {} rejected, {} messages pending", agentId, queue.size());
                }
            }
        }

        private void drain() {
            try {
                ChannelMessage message;
                while ((message = queue.poll()) != null) {
                    try {
                        deliverTo(agentId, message);
                    } catch (RuntimeException e) {
                        LOGGER.error("Delivery of message {} to agent {} failed", message.id(), agentId, e);
                    }
                }
            } finally {
                scheduled.set(false);
            }
            if (!queue.isEmpty()) {
                schedule();
            }
        }
    }
}
