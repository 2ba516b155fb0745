package io.hermes.server.events;

import io.hermes.spec.ChannelMessage;

/**
 * Receives the channel messages delivered to one agent.
 * <p>
 * Calls for one agent are made one at a time and in publish order. An endpoint that throws is
 * detached; later deliveries fall back to the message bus.
 */
@FunctionalInterface
public interface SubscriberEndpoint {

    void deliver(ChannelMessage message) throws Exception;
}
