package io.hermes.server.tasks;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import jakarta.enterprise.context.ApplicationScoped;

import io.hermes.spec.Task;
import io.hermes.spec.TaskState;
import org.jspecify.annotations.Nullable;

/**
 * In-memory implementation of {@link TaskStore}.
 * <p>
 * This implementation uses a {@link ConcurrentHashMap} to store tasks in memory.
 * Tasks are lost on restart; durable storage is out of scope for the engine.
 *
 * <h2>Thread Safety</h2>
 * All operations are thread-safe via {@link ConcurrentHashMap}. Snapshots are immutable, so
 * readers never observe a partially applied transition.
 */
@ApplicationScoped
public class InMemoryTaskStore implements TaskStore {

    private final ConcurrentMap<String, Task> tasks = new ConcurrentHashMap<>();

    @Override
    public void save(Task task) {
        tasks.put(task.id(), task);
    }

    @Override
    public @Nullable Task get(String taskId) {
        return tasks.get(taskId);
    }

    @Override
    public void delete(String taskId) {
        tasks.remove(taskId);
    }

    @Override
    public List<Task> list(@Nullable TaskState state, @Nullable String agentId, @Nullable String createdBy) {
        return tasks.values().stream()
                .filter(task -> state == null || task.state() == state)
                .filter(task -> agentId == null || agentId.equals(task.agentId()))
                .filter(task -> createdBy == null || createdBy.equals(task.createdBy()))
                .sorted(Comparator.comparing(Task::createdAt).thenComparing(Task::id))
                .toList();
    }
}
