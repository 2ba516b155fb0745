package io.hermes.server.tasks;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.UnaryOperator;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.hermes.spec.A2AError;
import io.hermes.spec.EventType;
import io.hermes.spec.InvalidParamsError;
import io.hermes.spec.InvalidRequestError;
import io.hermes.spec.InvalidStateError;
import io.hermes.spec.Task;
import io.hermes.spec.TaskState;
import io.hermes.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns tasks and their lifecycle state machine.
 * <p>
 * Every operation on a task runs under that task's own lock: validation against the transition
 * table of {@link TaskState}, the {@link TaskTransitionGuard}s, the store write and the enqueueing
 * of the resulting {@link TaskLifecycleEvent}. Events are delivered after the lock is released, by
 * whichever thread finds the task's event queue idle, so listeners observe a task's events in
 * transition order and may call back into the manager.
 * <p>
 * Terminal states reject every further transition with {@link InvalidStateError} and leave the
 * task unchanged.
 */
@ApplicationScoped
public class TaskManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskManager.class);

    private final TaskStore taskStore;
    private final Clock clock;
    private final ConcurrentMap<String, TaskEntry> entries = new ConcurrentHashMap<>();
    private final List<TaskLifecycleListener> listeners = new CopyOnWriteArrayList<>();
    private final List<TaskTransitionGuard> guards = new CopyOnWriteArrayList<>();

    @Inject
    public TaskManager(TaskStore taskStore) {
        this(taskStore, Clock.systemUTC());
    }

    public TaskManager(TaskStore taskStore, Clock clock) {
        this.taskStore = taskStore;
        this.clock = clock;
    }

    public void addListener(TaskLifecycleListener listener) {
        listeners.add(Assert.checkNotNullParam("listener", listener));
    }

    public void removeListener(TaskLifecycleListener listener) {
        listeners.remove(listener);
    }

    public void addGuard(TaskTransitionGuard guard) {
        guards.add(Assert.checkNotNullParam("guard", guard));
    }

    /**
     * Creates a task in state {@link TaskState#CREATED}.
     *
     * @param name the task name
     * @param createdBy the creating agent
     * @param description optional description
     * @param inputData optional input
     * @param metadata optional metadata
     * @return the new task
     */
    public Task createTask(String name, String createdBy, @Nullable String description,
                           @Nullable Map<String, Object> inputData, @Nullable Map<String, Object> metadata) {
        Assert.checkNotBlankParam("name", name);
        Assert.checkNotBlankParam("createdBy", createdBy);
        Instant now = clock.instant();
        Task task = Task.builder()
                .id(UUID.randomUUID().toString())
                .name(name)
                .createdBy(createdBy)
                .description(description)
                .inputData(inputData)
                .metadata(metadata)
                .state(TaskState.CREATED)
                .createdAt(now)
                .updatedAt(now)
                .build();
        TaskEntry entry = new TaskEntry();
        entry.lock.lock();
        try {
            entries.put(task.id(), entry);
            taskStore.save(task);
            entry.enqueue(new TaskLifecycleEvent(EventType.TASK_CREATED, task, null, now));
        } finally {
            entry.lock.unlock();
        }
        LOGGER.debug("Created task {} ({}) for {}", task.id(), name, createdBy);
        drain(entry);
        return task;
    }

    /**
     * Assigns a task to an agent. Allowed from CREATED and ASSIGNED.
     */
    public Task assignTask(String taskId, String agentId) {
        Assert.checkNotBlankParam("agentId", agentId);
        return transition(taskId, TaskState.ASSIGNED, EventType.TASK_ASSIGNED,
                builder -> builder.agentId(agentId));
    }

    /**
     * Starts a task. Allowed from CREATED and ASSIGNED.
     */
    public Task startTask(String taskId) {
        return transition(taskId, TaskState.RUNNING, EventType.TASK_STATE_CHANGED,
                builder -> builder.startedAt(clock.instant()));
    }

    /**
     * Reports progress of a running task.
     *
     * @param progress completion ratio in {@code [0, 1]}
     * @param message optional status message
     * @throws InvalidParamsError if progress is out of range
     * @throws InvalidStateError if the task is not running
     */
    public Task updateProgress(String taskId, double progress, @Nullable String message) {
        if (Double.isNaN(progress) || progress < 0.0 || progress > 1.0) {
            throw new InvalidParamsError("Progress must be between 0 and 1: " + progress);
        }
        return mutate(taskId, current -> {
            if (current.state() != TaskState.RUNNING) {
                throw new InvalidStateError("Task " + taskId + " is " + current.state().value()
                        + ", progress can only be reported while running");
            }
            Task.Builder builder = Task.builder(current).progress(progress).updatedAt(clock.instant());
            if (message != null) {
                builder.statusMessage(message);
            }
            return builder.build();
        }, EventType.TASK_PROGRESS);
    }

    /**
     * Completes a running task.
     */
    public Task completeTask(String taskId, @Nullable Map<String, Object> output) {
        return transition(taskId, TaskState.COMPLETED, EventType.TASK_COMPLETED,
                builder -> builder.outputData(output == null ? Map.of() : output).progress(1.0));
    }

    /**
     * Fails a task from any non-terminal state.
     */
    public Task failTask(String taskId, String error) {
        return transition(taskId, TaskState.FAILED, EventType.TASK_FAILED, builder -> builder.error(error));
    }

    /**
     * Cancels a task from any non-terminal state.
     */
    public Task cancelTask(String taskId, @Nullable String reason) {
        return transition(taskId, TaskState.CANCELLED, EventType.TASK_CANCELLED,
                builder -> builder.statusMessage(reason));
    }

    /**
     * Applies a transition through the generic state table.
     *
     * @param state the target state
     * @param message optional message; becomes the error for {@link TaskState#FAILED}
     * @throws InvalidParamsError when moving to ASSIGNED without an assigned agent
     */
    public Task updateState(String taskId, TaskState state, @Nullable String message) {
        Assert.checkNotNullParam("state", state);
        return switch (state) {
            case CREATED -> throw new InvalidStateError("Tasks cannot return to created");
            case ASSIGNED -> {
                Task current = requireTask(taskId);
                if (current.agentId() == null) {
                    throw new InvalidParamsError("Task " + taskId + " has no agent; use task.assign");
                }
                yield assignTask(taskId, current.agentId());
            }
            case RUNNING -> transition(taskId, TaskState.RUNNING, EventType.TASK_STATE_CHANGED,
                    builder -> builder.startedAt(clock.instant()).statusMessage(message));
            case COMPLETED -> transition(taskId, TaskState.COMPLETED, EventType.TASK_COMPLETED,
                    builder -> builder.progress(1.0).statusMessage(message));
            case FAILED -> failTask(taskId, message == null ? "Task failed" : message);
            case CANCELLED -> cancelTask(taskId, message);
        };
    }

    /**
     * Replaces the input of a task that has not started yet.
     */
    public Task updateInput(String taskId, Map<String, Object> inputData) {
        return mutate(taskId, current -> {
            if (current.state() != TaskState.CREATED && current.state() != TaskState.ASSIGNED) {
                throw new InvalidStateError("Task " + taskId + " has already started");
            }
            return Task.builder(current).inputData(inputData).updatedAt(clock.instant()).build();
        }, null);
    }

    public @Nullable Task getTask(String taskId) {
        return taskStore.get(taskId);
    }

    public List<Task> listTasks(@Nullable TaskState state, @Nullable String agentId, @Nullable String createdBy) {
        return taskStore.list(state, agentId, createdBy);
    }

    /**
     * Cancels every running task independently. A task that cannot be cancelled is logged and skipped.
     *
     * @return the number of tasks cancelled
     */
    public int cancelAllRunning(String reason) {
        int cancelled = 0;
        for (Task task : taskStore.list(TaskState.RUNNING, null, null)) {
            try {
                cancelTask(task.id(), reason);
                cancelled++;
            } catch (RuntimeException e) {
                LOGGER.warn("Failed to cancel task {} during shutdown", task.id(), e);
            }
        }
        LOGGER.info("Cancelled {} running tasks: {}", cancelled, reason);
        return cancelled;
    }

    private Task requireTask(String taskId) {
        Task task = taskStore.get(taskId);
        if (task == null) {
            throw new InvalidRequestError("Task not found: " + taskId);
        }
        return task;
    }

    private Task transition(String taskId, TaskState target, EventType eventType, UnaryOperator<Task.Builder> changes) {
        return mutate(taskId, current -> {
            if (!current.state().canTransitionTo(target)) {
                throw new InvalidStateError("Task " + taskId + " cannot move from " + current.state().value()
                        + " to " + target.value());
            }
            for (TaskTransitionGuard guard : guards) {
                guard.check(current, target);
            }
            Instant now = clock.instant();
            Task.Builder builder = Task.builder(current).state(target).updatedAt(now);
            if (target.isFinal()) {
                builder.completedAt(now);
            }
            return changes.apply(builder).build();
        }, eventType);
    }

    private Task mutate(String taskId, UnaryOperator<Task> operation, @Nullable EventType eventType) {
        TaskEntry entry = entries.get(taskId);
        if (entry == null) {
            throw new InvalidRequestError("Task not found: " + taskId);
        }
        Task updated;
        entry.lock.lock();
        try {
            Task current = requireTask(taskId);
            updated = operation.apply(current);
            taskStore.save(updated);
            if (eventType != null) {
                entry.enqueue(new TaskLifecycleEvent(eventType, updated, current.state(), updated.updatedAt()));
            }
        } finally {
            entry.lock.unlock();
        }
        if (eventType != null) {
            LOGGER.debug("Task {} {}: {}", taskId, eventType.value(), updated.state().value());
        }
        drain(entry);
        return updated;
    }

    private void drain(TaskEntry entry) {
        TaskLifecycleEvent event;
        while ((event = entry.claimNext()) != null) {
            try {
                notifyListeners(event);
            } finally {
                entry.release();
            }
        }
    }

    private void notifyListeners(TaskLifecycleEvent event) {
        for (TaskLifecycleListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (A2AError e) {
                LOGGER.error("Task listener rejected {} for task {}: {}", event.type().value(), event.task().id(),
                        e.getMessage(), e);
            } catch (Exception e) {
                LOGGER.error("Task listener failed on {} for task {}", event.type().value(), event.task().id(), e);
            }
        }
    }

    /**
     * Lock and pending events of one task. At most one thread delivers a task's events at a time.
     */
    private static final class TaskEntry {
        final ReentrantLock lock = new ReentrantLock();
        private final Deque<TaskLifecycleEvent> pending = new ArrayDeque<>();
        private boolean delivering;

        synchronized void enqueue(TaskLifecycleEvent event) {
            pending.addLast(event);
        }

        synchronized @Nullable TaskLifecycleEvent claimNext() {
            if (delivering) {
                return null;
            }
            TaskLifecycleEvent next = pending.pollFirst();
            if (next != null) {
                delivering = true;
            }
            return next;
        }

        synchronized void release() {
            delivering = false;
        }
    }
}
