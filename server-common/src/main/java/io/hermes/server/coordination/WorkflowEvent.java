package io.hermes.server.coordination;

import java.time.Instant;

import io.hermes.spec.EventType;
import io.hermes.spec.TaskWorkflow;
import org.jspecify.annotations.Nullable;

/**
 * A workflow lifecycle change.
 *
 * @param type one of the {@code workflow.*} event types
 * @param workflow the snapshot at the time of the event
 * @param reason failure, cancellation or timeout reason
 * @param timestamp when the change happened
 */
public record WorkflowEvent(EventType type, TaskWorkflow workflow, @Nullable String reason, Instant timestamp) {
}
