package io.hermes.transport.jsonrpc.streaming;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.hermes.spec.Event;
import io.hermes.util.Utils;

/**
 * Renders events as Server-Sent Events frames.
 * <p>
 * A frame is {@code id: <id>}, {@code event: <type>} and {@code data: <json>} lines followed by
 * a blank line, where the data line carries the canonical JSON envelope of the event.
 */
public final class SseEventFormatter {

    private SseEventFormatter() {
    }

    public static String format(Event event) {
        return "id: " + event.id() + "\n"
                + "event: " + event.type() + "\n"
                + "data: " + envelope(event) + "\n\n";
    }

    /**
     * A comment frame, ignored by SSE clients, used to keep idle connections open.
     */
    public static String keepAlive() {
        return ": keep-alive\n\n";
    }

    static String envelope(Event event) {
        try {
            return Utils.toJson(event);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event " + event.id() + " cannot be serialised", e);
        }
    }
}
