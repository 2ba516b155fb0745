package io.hermes.server.events;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.hermes.server.bus.MessageBus;
import io.hermes.spec.ChannelInfo;
import io.hermes.spec.ChannelMessage;
import io.hermes.spec.InvalidParamsError;
import io.hermes.spec.Subscription;
import io.hermes.util.Assert;
import io.hermes.util.Utils;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Connects named channels on the {@link MessageBus} with agent subscriptions.
 * <p>
 * Publishing through the bridge mirrors the message onto the bus channel, updates the channel's
 * bookkeeping and hands the message to the {@link SubscriptionManager} for delivery to exact and
 * pattern subscribers. Publishing on an unknown channel creates it.
 */
@ApplicationScoped
public class ChannelBridge {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChannelBridge.class);

    private final MessageBus messageBus;
    private final SubscriptionManager subscriptions;
    private final Clock clock;
    private final ConcurrentMap<String, ChannelStats> channels = new ConcurrentHashMap<>();

    @Inject
    public ChannelBridge(MessageBus messageBus, SubscriptionManager subscriptions) {
        this(messageBus, subscriptions, Clock.systemUTC());
    }

    public ChannelBridge(MessageBus messageBus, SubscriptionManager subscriptions, Clock clock) {
        this.messageBus = messageBus;
        this.subscriptions = subscriptions;
        this.clock = clock;
    }

    public SubscriptionManager subscriptions() {
        return subscriptions;
    }

    /**
     * Creates a channel on the bus, or returns the existing one unchanged.
     */
    public ChannelInfo createChannel(String name, @Nullable String description) {
        ChannelStats stats = ensureChannel(name, description);
        return stats.toInfo(subscriptions.countMatching(name));
    }

    /**
     * Subscribes an agent to a channel or channel pattern. A channel named without wildcards is
     * created if needed.
     */
    public Subscription subscribe(String agentId, String channelOrPattern) {
        Subscription subscription = subscriptions.createPatternSubscription(agentId, channelOrPattern);
        if (ChannelPattern.compile(channelOrPattern, subscriptions.allowsMultiSegment()).isLiteral()) {
            ensureChannel(channelOrPattern, null);
        }
        return subscription;
    }

    public boolean unsubscribe(String agentId, String channelOrPattern) {
        return subscriptions.unsubscribe(agentId, channelOrPattern);
    }

    /**
     * Publishes a message on a channel.
     *
     * @param channel the concrete channel
     * @param senderId the publishing agent
     * @param content the message body
     * @param metadata publisher supplied metadata
     * @return {@code success}, {@code message_id}, {@code channel} and {@code delivered_to}, the
     *         number of subscribed agents the message was scheduled for
     */
    public Map<String, Object> publishWithMetadata(String channel, String senderId, Object content,
                                                   @Nullable Map<String, Object> metadata) {
        Assert.checkNotBlankParam("channel", channel);
        if (!ChannelPattern.compile(channel, false).isLiteral()) {
            throw new InvalidParamsError("Cannot publish on a channel pattern: " + channel);
        }
        Instant now = clock.instant();
        ChannelMessage message = new ChannelMessage(UUID.randomUUID().toString(), channel, senderId, content,
                Utils.copyOf(metadata), now);
        ChannelStats stats = ensureChannel(channel, null);
        stats.record(now);
        messageBus.publish(channel, Utils.toMap(message));
        Set<String> recipients = subscriptions.deliver(message);
        LOGGER.debug("Published {} on {} from {} to {} subscribers", message.id(), channel, senderId,
                recipients.size());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("success", true);
        result.put("message_id", message.id());
        result.put("channel", channel);
        result.put("delivered_to", recipients.size());
        return result;
    }

    /**
     * Lists known channels, optionally only those matching a pattern, sorted by name.
     */
    public List<ChannelInfo> listChannels(@Nullable String pattern) {
        ChannelPattern filter = pattern == null ? null : ChannelPattern.compile(pattern,
                subscriptions.allowsMultiSegment());
        return channels.values().stream()
                .filter(stats -> filter == null || filter.matches(stats.name))
                .map(stats -> stats.toInfo(subscriptions.countMatching(stats.name)))
                .sorted(Comparator.comparing(ChannelInfo::name))
                .toList();
    }

    public @Nullable ChannelInfo getChannelInfo(String channel) {
        ChannelStats stats = channels.get(channel);
        return stats == null ? null : stats.toInfo(subscriptions.countMatching(channel));
    }

    private ChannelStats ensureChannel(String name, @Nullable String description) {
        Assert.checkNotBlankParam("name", name);
        return channels.computeIfAbsent(name, n -> {
            String text = description == null ? "Channel for " + n : description;
            messageBus.createChannel(n, text);
            LOGGER.debug("Created channel {}", n);
            return new ChannelStats(n, text, clock.instant());
        });
    }

    private static final class ChannelStats {
        final String name;
        final String description;
        final Instant createdAt;
        final AtomicLong messageCount = new AtomicLong();
        volatile @Nullable Instant lastMessageAt;

        ChannelStats(String name, String description, Instant createdAt) {
            this.name = name;
            this.description = description;
            this.createdAt = createdAt;
        }

        void record(Instant timestamp) {
            messageCount.incrementAndGet();
            lastMessageAt = timestamp;
        }

        ChannelInfo toInfo(int subscriberCount) {
            return new ChannelInfo(name, description, createdAt, messageCount.get(), lastMessageAt, subscriberCount);
        }
    }
}
