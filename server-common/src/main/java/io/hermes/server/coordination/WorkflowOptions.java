package io.hermes.server.coordination;

import io.hermes.util.Assert;
import org.jspecify.annotations.Nullable;

/**
 * Optional settings of a new workflow.
 *
 * @param description free text description
 * @param maxParallel bound on concurrently running tasks, {@code null} for unbounded
 * @param retryFailed whether failed tasks are re-created and retried
 * @param timeoutSeconds deadline measured from the start, {@code null} for none
 */
public record WorkflowOptions(@Nullable String description, @Nullable Integer maxParallel, boolean retryFailed,
                              @Nullable Long timeoutSeconds) {

    public WorkflowOptions {
        if (maxParallel != null) {
            Assert.isTrue(maxParallel > 0, "max_parallel must be positive");
        }
        if (timeoutSeconds != null) {
            Assert.isTrue(timeoutSeconds > 0, "timeout_seconds must be positive");
        }
    }

    public static WorkflowOptions defaults() {
        return new WorkflowOptions(null, null, false, null);
    }

    public WorkflowOptions withMaxParallel(@Nullable Integer newMaxParallel) {
        return new WorkflowOptions(description, newMaxParallel, retryFailed, timeoutSeconds);
    }

    public WorkflowOptions withRetryFailed(boolean newRetryFailed) {
        return new WorkflowOptions(description, maxParallel, newRetryFailed, timeoutSeconds);
    }

    public WorkflowOptions withTimeoutSeconds(@Nullable Long newTimeoutSeconds) {
        return new WorkflowOptions(description, maxParallel, retryFailed, newTimeoutSeconds);
    }
}
