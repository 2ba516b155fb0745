package io.hermes.server.events;

import io.hermes.spec.Event;

/**
 * An open streaming consumer, such as an SSE response or a WebSocket session.
 * <p>
 * {@link #offer(Event)} must not block: a connection that cannot take the event immediately
 * returns {@code false} and is closed by the {@link EventStreamer}.
 */
public interface StreamConnection {

    String id();

    StreamFilter filter();

    /**
     * Whether events must carry a valid signature to be sent on this connection.
     */
    boolean verifiesSignatures();

    /**
     * Hands an event to the connection.
     *
     * @return {@code false} if the connection is full or gone
     */
    boolean offer(Event event);

    void close();
}
