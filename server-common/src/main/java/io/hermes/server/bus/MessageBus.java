package io.hermes.server.bus;

import java.util.Map;
import java.util.function.Consumer;

/**
 * The generic publish/subscribe primitive the engine is deployed on.
 * <p>
 * The engine only creates named channels, publishes JSON-shaped messages and subscribes to the
 * registration manager's topic. Implementations must not call subscribers on the publisher's
 * lock; whether delivery is synchronous is up to the implementation.
 */
public interface MessageBus {

    /**
     * Creates a channel, or does nothing if it already exists.
     *
     * @param name the channel name
     * @param description free text description
     */
    void createChannel(String name, String description);

    /**
     * Publishes a message on a topic.
     *
     * @param topic the topic or channel name
     * @param message the message body
     */
    void publish(String topic, Map<String, Object> message);

    /**
     * Subscribes to a topic.
     *
     * @param topic the topic or channel name
     * @param subscriber called for every message published on the topic
     * @return a handle that removes the subscription when closed
     */
    AutoCloseable subscribe(String topic, Consumer<Map<String, Object>> subscriber);
}
