package io.hermes.spec;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import io.hermes.util.Assert;
import io.hermes.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * The canonical envelope every domain event is converted to before it is streamed.
 *
 * @param id unique event id
 * @param type the event type value, e.g. {@code task.completed}
 * @param timestamp when the event was emitted
 * @param source the emitting system
 * @param payload the event body
 * @param signature optional signature over the other members
 */
public record Event(String id, String type, Instant timestamp, String source, Map<String, Object> payload,
                    @Nullable String signature) {

    public Event {
        Assert.checkNotNullParam("id", id);
        Assert.checkNotNullParam("type", type);
        Assert.checkNotNullParam("timestamp", timestamp);
        Assert.checkNotNullParam("source", source);
        payload = Utils.copyOf(payload);
    }

    /**
     * Creates an unsigned event with a random id.
     */
    public static Event of(String type, String source, Map<String, Object> payload, Instant timestamp) {
        return new Event(UUID.randomUUID().toString(), type, timestamp, source, payload, null);
    }

    public Event withSignature(String newSignature) {
        return new Event(id, type, timestamp, source, payload, newSignature);
    }

    public Event unsigned() {
        return signature == null ? this : new Event(id, type, timestamp, source, payload, null);
    }

    /**
     * Returns the string payload member {@code key}, if present.
     */
    public @Nullable String payloadString(String key) {
        Object value = payload.get(key);
        return value == null ? null : value.toString();
    }
}
