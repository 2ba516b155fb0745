package io.hermes.server.events;

import java.util.Set;

import io.hermes.spec.Event;
import org.jspecify.annotations.Nullable;

/**
 * Restricts the events a {@link StreamConnection} receives. Empty members do not filter.
 *
 * @param taskId only events whose payload carries this {@code task_id}
 * @param agentId only events whose payload carries this {@code agent_id}
 * @param eventTypes only events of these types
 */
public record StreamFilter(@Nullable String taskId, @Nullable String agentId, Set<String> eventTypes) {

    public static final StreamFilter NONE = new StreamFilter(null, null, Set.of());

    public StreamFilter {
        eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
    }

    public boolean matches(Event event) {
        if (!eventTypes.isEmpty() && !eventTypes.contains(event.type())) {
            return false;
        }
        if (taskId != null && !taskId.equals(event.payloadString("task_id"))) {
            return false;
        }
        return agentId == null || agentId.equals(event.payloadString("agent_id"));
    }
}
