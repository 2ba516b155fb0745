package io.hermes.server.tasks;

import java.time.Instant;

import io.hermes.spec.EventType;
import io.hermes.spec.Task;
import io.hermes.spec.TaskState;
import org.jspecify.annotations.Nullable;

/**
 * A task transition, as seen by {@link TaskLifecycleListener}s.
 *
 * @param type one of the {@code task.*} event types
 * @param task the snapshot after the transition
 * @param previousState the state before the transition, {@code null} for creation
 * @param timestamp when the transition was applied
 */
public record TaskLifecycleEvent(EventType type, Task task, @Nullable TaskState previousState, Instant timestamp) {
}
