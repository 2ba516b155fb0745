package io.hermes.server.tasks;

import io.hermes.spec.Task;
import io.hermes.spec.TaskState;

/**
 * Veto point consulted before a legal transition is applied.
 * <p>
 * Guards run while the task's lock is held and must not call back into the {@link TaskManager}
 * for the same task.
 */
@FunctionalInterface
public interface TaskTransitionGuard {

    /**
     * Checks a transition.
     *
     * @param task the current snapshot
     * @param target the requested state
     * @throws io.hermes.spec.A2AError to reject the transition
     */
    void check(Task task, TaskState target);
}
