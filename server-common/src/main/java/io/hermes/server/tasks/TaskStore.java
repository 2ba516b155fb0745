package io.hermes.server.tasks;

import java.util.List;

import io.hermes.spec.Task;
import io.hermes.spec.TaskState;
import org.jspecify.annotations.Nullable;

/**
 * Storage of task snapshots.
 * <p>
 * The {@link TaskManager} is the only writer and serialises writes per task, so implementations
 * only need to be safe for concurrent access to different tasks and for concurrent reads.
 */
public interface TaskStore {

    /**
     * Saves or replaces the snapshot of a task.
     *
     * @param task the task snapshot
     */
    void save(Task task);

    /**
     * Retrieves the latest snapshot of a task.
     *
     * @param taskId the task identifier
     * @return the task, or {@code null} if unknown
     */
    @Nullable Task get(String taskId);

    /**
     * Deletes a task; a no-op for unknown ids.
     */
    void delete(String taskId);

    /**
     * Lists tasks matching every non-null filter, oldest first.
     *
     * @param state the required state
     * @param agentId the required assigned agent
     * @param createdBy the required creator
     * @return the matching tasks
     */
    List<Task> list(@Nullable TaskState state, @Nullable String agentId, @Nullable String createdBy);
}
