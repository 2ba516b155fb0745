package io.hermes.server.bus;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

import jakarta.enterprise.context.ApplicationScoped;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process {@link MessageBus} that delivers synchronously on the publishing thread.
 * <p>
 * Used when the engine runs embedded without an external broker, and in tests. A subscriber
 * that throws is logged and does not affect the other subscribers of the topic.
 */
@ApplicationScoped
public class LocalMessageBus implements MessageBus {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalMessageBus.class);

    private final ConcurrentMap<String, String> channels = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, List<Consumer<Map<String, Object>>>> subscribers = new ConcurrentHashMap<>();

    @Override
    public void createChannel(String name, String description) {
        if (channels.putIfAbsent(name, description) == null) {
            LOGGER.debug("Created channel {}", name);
        }
    }

    @Override
    public void publish(String topic, Map<String, Object> message) {
        List<Consumer<Map<String, Object>>> topicSubscribers = subscribers.get(topic);
        if (topicSubscribers == null) {
            LOGGER.debug("No subscribers for topic {}", topic);
            return;
        }
        for (Consumer<Map<String, Object>> subscriber : topicSubscribers) {
            try {
                subscriber.accept(message);
            } catch (RuntimeException e) {
                LOGGER.error("Subscriber of topic {} failed", topic, e);
            }
        }
    }

    @Override
    public AutoCloseable subscribe(String topic, Consumer<Map<String, Object>> subscriber) {
        subscribers.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(subscriber);
        return () -> {
            List<Consumer<Map<String, Object>>> topicSubscribers = subscribers.get(topic);
            if (topicSubscribers != null) {
                topicSubscribers.remove(subscriber);
            }
        };
    }

    public boolean hasChannel(String name) {
        return channels.containsKey(name);
    }
}
