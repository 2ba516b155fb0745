package io.hermes.transport.jsonrpc.streaming;

import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * The slice of a server WebSocket session the transport needs. Implemented by the embedding
 * HTTP server.
 */
public interface WebSocketSession {

    String id();

    /**
     * Handshake headers, e.g. {@code Authorization}.
     */
    Map<String, String> headers();

    /**
     * Sends a text frame. The returned stage completes once the frame is written, or
     * exceptionally if the session is gone.
     */
    CompletionStage<?> sendText(String text);

    void close();
}
