package io.hermes.server.coordination;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.hermes.server.config.A2AConfig;
import io.hermes.server.tasks.TaskLifecycleEvent;
import io.hermes.server.tasks.TaskLifecycleListener;
import io.hermes.server.tasks.TaskManager;
import io.hermes.server.tasks.TaskTransitionGuard;
import io.hermes.spec.A2AError;
import io.hermes.spec.CoordinationPattern;
import io.hermes.spec.CycleDetectedError;
import io.hermes.spec.DependencyType;
import io.hermes.spec.EventType;
import io.hermes.spec.InvalidParamsError;
import io.hermes.spec.InvalidRequestError;
import io.hermes.spec.InvalidStateError;
import io.hermes.spec.Task;
import io.hermes.spec.TaskDependency;
import io.hermes.spec.TaskState;
import io.hermes.spec.TaskWorkflow;
import io.hermes.spec.TimeoutError;
import io.hermes.spec.WorkflowState;
import io.hermes.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds and runs task workflows over the {@link TaskManager}.
 * <p>
 * A workflow is a dependency graph of tasks. Once started, the coordinator reacts to task
 * lifecycle events: each event re-evaluates which tasks became ready, admits them through a FIFO
 * queue bounded by {@code max_parallel}, and decides whether the workflow completed or can no
 * longer make progress. Nothing is polled.
 *
 * <h2>Readiness</h2>
 * <ul>
 *   <li>{@link DependencyType#FINISH_TO_START}: the predecessor completed</li>
 *   <li>{@link DependencyType#START_TO_START}: the predecessor has started</li>
 *   <li>{@link DependencyType#FINISH_TO_FINISH}: no start condition; completion of the successor is
 *       rejected until the predecessor completed</li>
 * </ul>
 *
 * <h2>Locking</h2>
 * Each workflow has its own lock. Decisions are taken under it; calls into the
 * {@link TaskManager} that start, cancel or re-create tasks are made after it is released.
 */
@ApplicationScoped
public class TaskCoordinator implements TaskLifecycleListener, TaskTransitionGuard {

    private static final Logger LOGGER = LoggerFactory.getLogger(TaskCoordinator.class);

    public static final String WORKFLOW_ID_KEY = "workflow_id";
    public static final String WORKFLOW_TASK_ID_KEY = "workflow_task_id";
    public static final String ATTEMPT_KEY = "attempt";
    public static final String PREVIOUS_OUTPUT_KEY = "previous_output";

    private final TaskManager taskManager;
    private final int maxAttempts;
    private final Clock clock;
    private final ScheduledExecutorService scheduler;
    private final ConcurrentMap<String, WorkflowRun> workflows = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, String> taskToWorkflow = new ConcurrentHashMap<>();
    private final List<WorkflowEventListener> listeners = new CopyOnWriteArrayList<>();

    @Inject
    public TaskCoordinator(TaskManager taskManager, A2AConfig config) {
        this(taskManager, config.workflowMaxAttempts(), Clock.systemUTC());
    }

    public TaskCoordinator(TaskManager taskManager, int maxAttempts, Clock clock) {
        Assert.isTrue(maxAttempts > 0, "maxAttempts must be positive");
        this.taskManager = taskManager;
        this.maxAttempts = maxAttempts;
        this.clock = clock;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "hermes-workflow-timeout");
            thread.setDaemon(true);
            return thread;
        });
        taskManager.addListener(this);
        taskManager.addGuard(this);
    }

    public void addListener(WorkflowEventListener listener) {
        listeners.add(Assert.checkNotNullParam("listener", listener));
    }

    public void removeListener(WorkflowEventListener listener) {
        listeners.remove(listener);
    }

    /**
     * Creates a workflow and its tasks.
     *
     * @param name the workflow name
     * @param createdBy the creating agent
     * @param pattern the coordination pattern
     * @param definitions the task definitions, in order
     * @param dependencies dependency edges between workflow task ids
     * @param options optional settings
     * @return the new workflow
     * @throws InvalidParamsError for duplicate workflow task ids
     * @throws InvalidRequestError if an edge refers to an unknown workflow task
     * @throws CycleDetectedError if the edges contain a cycle
     */
    public TaskWorkflow createWorkflow(String name, String createdBy, CoordinationPattern pattern,
                                       List<TaskDefinition> definitions, List<TaskDependency> dependencies,
                                       WorkflowOptions options) {
        Assert.checkNotBlankParam("name", name);
        Assert.checkNotBlankParam("createdBy", createdBy);
        Assert.checkNotNullParam("pattern", pattern);
        List<TaskDefinition> identified = withIds(definitions);
        Map<String, TaskDefinition> byId = new LinkedHashMap<>();
        for (TaskDefinition definition : identified) {
            if (byId.put(definition.id(), definition) != null) {
                throw new InvalidParamsError("Duplicate workflow task id: " + definition.id());
            }
        }
        List<TaskDependency> edges = new ArrayList<>();
        for (TaskDependency dependency : dependencies) {
            checkEdge(byId.keySet(), dependency);
            if (!edges.contains(dependency)) {
                edges.add(dependency);
            }
        }
        List<String> cycle = findCycle(byId.keySet(), edges);
        if (cycle != null) {
            throw new CycleDetectedError(cycle);
        }

        WorkflowRun run = new WorkflowRun(UUID.randomUUID().toString(), name, createdBy, pattern, options,
                clock.instant());
        for (TaskDefinition definition : byId.values()) {
            Task task = createTaskFor(run, definition, 1);
            run.register(definition, task.id());
            taskToWorkflow.put(task.id(), run.id);
        }
        run.dependencies.addAll(edges);
        workflows.put(run.id, run);
        LOGGER.info("Created {} workflow {} ({}) with {} tasks", pattern.value(), run.id, name, byId.size());

        TaskWorkflow snapshot = snapshot(run);
        fire(List.of(new WorkflowEvent(EventType.WORKFLOW_CREATED, snapshot, null, run.createdAt)));
        return snapshot;
    }

    /**
     * Creates a workflow where each task waits for the previous one to complete.
     */
    public TaskWorkflow createSequentialWorkflow(String name, String createdBy, List<TaskDefinition> definitions,
                                                 WorkflowOptions options) {
        List<TaskDefinition> identified = withIds(definitions);
        return createWorkflow(name, createdBy, CoordinationPattern.SEQUENTIAL, identified, chain(identified), options);
    }

    /**
     * Creates a workflow of independent tasks, at most {@code maxParallel} running at once.
     */
    public TaskWorkflow createParallelWorkflow(String name, String createdBy, List<TaskDefinition> definitions,
                                               @Nullable Integer maxParallel, WorkflowOptions options) {
        return createWorkflow(name, createdBy, CoordinationPattern.PARALLEL, definitions, List.of(),
                options.withMaxParallel(maxParallel));
    }

    /**
     * Creates a chain of stages where each stage receives the previous stage's output under
     * {@value #PREVIOUS_OUTPUT_KEY} in its input before it starts.
     */
    public TaskWorkflow createPipelineWorkflow(String name, String createdBy, List<TaskDefinition> stages,
                                               WorkflowOptions options) {
        List<TaskDefinition> identified = withIds(stages);
        return createWorkflow(name, createdBy, CoordinationPattern.PIPELINE, identified, chain(identified), options);
    }

    /**
     * Creates a workflow where every target starts once the source task completed.
     */
    public TaskWorkflow createFanoutWorkflow(String name, String createdBy, TaskDefinition source,
                                             List<TaskDefinition> targets, WorkflowOptions options) {
        List<TaskDefinition> all = new ArrayList<>();
        all.add(source);
        all.addAll(targets);
        List<TaskDefinition> identified = withIds(all);
        String sourceId = identified.get(0).id();
        List<TaskDependency> edges = new ArrayList<>();
        for (TaskDefinition target : identified.subList(1, identified.size())) {
            edges.add(new TaskDependency(sourceId, target.id(), DependencyType.FINISH_TO_START));
        }
        return createWorkflow(name, createdBy, CoordinationPattern.FANOUT, identified, edges, options);
    }

    /**
     * Adds a task to a workflow that has not started.
     *
     * @param workflowId the workflow
     * @param workflowTaskId the id of the new workflow task; taken from the definition or generated when {@code null}
     * @param definition the task definition
     * @return the workflow task id
     */
    public String addTask(String workflowId, @Nullable String workflowTaskId, TaskDefinition definition) {
        WorkflowRun run = requireRun(workflowId);
        run.lock.lock();
        try {
            requireState(run, WorkflowState.CREATED, "add tasks to");
            String id = workflowTaskId != null ? workflowTaskId : definition.id();
            if (id == null) {
                int n = run.order.size() + 1;
                while (run.taskIds.containsKey("task-" + n)) {
                    n++;
                }
                id = "task-" + n;
            } else if (run.taskIds.containsKey(id)) {
                throw new InvalidParamsError("Duplicate workflow task id: " + id);
            }
            TaskDefinition identified = definition.withId(id);
            Task task = createTaskFor(run, identified, 1);
            run.register(identified, task.id());
            taskToWorkflow.put(task.id(), run.id);
            LOGGER.debug("Added task {} to workflow {}", id, workflowId);
            return id;
        } finally {
            run.lock.unlock();
        }
    }

    /**
     * Adds a dependency edge to a workflow that has not started.
     * <p>
     * The edge is checked against a copy of the graph; on failure the graph is unchanged.
     *
     * @return {@code false} if an identical edge already exists
     * @throws InvalidRequestError if the workflow or a workflow task is unknown
     * @throws CycleDetectedError if the edge would close a cycle
     */
    public boolean addDependency(String workflowId, String predecessor, String successor, DependencyType type) {
        WorkflowRun run = requireRun(workflowId);
        TaskDependency dependency = new TaskDependency(predecessor, successor, type);
        run.lock.lock();
        try {
            requireState(run, WorkflowState.CREATED, "add dependencies to");
            checkEdge(run.taskIds.keySet(), dependency);
            if (run.dependencies.contains(dependency)) {
                return false;
            }
            List<TaskDependency> candidate = new ArrayList<>(run.dependencies);
            candidate.add(dependency);
            List<String> cycle = findCycle(run.order, candidate);
            if (cycle != null) {
                LOGGER.debug("Rejected dependency {} -> {} in workflow {}: cycle {}", predecessor, successor,
                        workflowId, cycle);
                throw new CycleDetectedError(cycle);
            }
            run.dependencies.add(dependency);
            return true;
        } finally {
            run.lock.unlock();
        }
    }

    /**
     * Starts a workflow: starts the initially ready tasks and from then on follows task events.
     *
     * @throws InvalidStateError if the workflow was already started
     */
    public TaskWorkflow startWorkflow(String workflowId) {
        WorkflowRun run = requireRun(workflowId);
        List<Runnable> actions = new ArrayList<>();
        List<WorkflowEvent> events = new ArrayList<>();
        run.lock.lock();
        try {
            requireState(run, WorkflowState.CREATED, "start");
            run.state = WorkflowState.RUNNING;
            run.startedAt = clock.instant();
            for (String workflowTaskId : run.order) {
                Task task = taskManager.getTask(run.taskIds.get(workflowTaskId));
                TaskState state = task == null ? TaskState.CANCELLED : task.state();
                run.observed.put(workflowTaskId, state);
                if (state.hasStarted()) {
                    run.everStarted.add(workflowTaskId);
                    run.launched.add(workflowTaskId);
                }
            }
            events.add(new WorkflowEvent(EventType.WORKFLOW_STARTED, snapshot(run), null, run.startedAt));
            if (run.timeoutSeconds != null) {
                run.timeout = scheduler.schedule(() -> onTimeout(workflowId), run.timeoutSeconds, TimeUnit.SECONDS);
            }
            reconcile(run, actions, events);
        } finally {
            run.lock.unlock();
        }
        LOGGER.info("Started workflow {}", workflowId);
        fire(events);
        actions.forEach(Runnable::run);
        return snapshot(run);
    }

    /**
     * Cancels a workflow and every non-terminal task in it.
     *
     * @throws InvalidStateError if the workflow already reached a terminal state
     */
    public TaskWorkflow cancelWorkflow(String workflowId, @Nullable String reason) {
        WorkflowRun run = requireRun(workflowId);
        String effectiveReason = reason == null ? "Workflow cancelled" : reason;
        List<String> toCancel = new ArrayList<>();
        List<WorkflowEvent> events = new ArrayList<>();
        run.lock.lock();
        try {
            if (run.state.isFinal()) {
                throw new InvalidStateError("Workflow " + workflowId + " is already " + run.state.value());
            }
            for (String workflowTaskId : run.order) {
                if (!run.observed.get(workflowTaskId).isFinal()) {
                    toCancel.add(run.taskIds.get(workflowTaskId));
                }
            }
            run.admission.clear();
            finish(run, WorkflowState.CANCELLED, effectiveReason, events);
        } finally {
            run.lock.unlock();
        }
        LOGGER.info("Cancelled workflow {}: {}", workflowId, effectiveReason);
        fire(events);
        cancelTasks(toCancel, effectiveReason);
        return snapshot(run);
    }

    public @Nullable TaskWorkflow getWorkflow(String workflowId) {
        WorkflowRun run = workflows.get(workflowId);
        return run == null ? null : snapshot(run);
    }

    public List<TaskWorkflow> listWorkflows(@Nullable String createdBy, @Nullable WorkflowState state) {
        return workflows.values().stream()
                .map(this::snapshot)
                .filter(workflow -> createdBy == null || createdBy.equals(workflow.createdBy()))
                .filter(workflow -> state == null || workflow.state() == state)
                .sorted(Comparator.comparing(TaskWorkflow::createdAt).thenComparing(TaskWorkflow::id))
                .toList();
    }

    @PreDestroy
    public void shutdown() {
        scheduler.shutdownNow();
    }

    @Override
    public void onEvent(TaskLifecycleEvent event) {
        Task task = event.task();
        String workflowId = taskToWorkflow.get(task.id());
        if (workflowId == null) {
            return;
        }
        WorkflowRun run = workflows.get(workflowId);
        if (run == null) {
            return;
        }
        List<Runnable> actions = new ArrayList<>();
        List<WorkflowEvent> events = new ArrayList<>();
        run.lock.lock();
        try {
            String workflowTaskId = run.workflowTaskIdOf(task.id());
            if (workflowTaskId == null) {
                // event of a task replaced by a retry
                return;
            }
            TaskState state = task.state();
            run.observed.put(workflowTaskId, state);
            if (state.hasStarted()) {
                run.everStarted.add(workflowTaskId);
            }
            if (state == TaskState.COMPLETED) {
                run.outputs.put(workflowTaskId, task.outputData() == null ? Map.of() : task.outputData());
            }
            if (run.state != WorkflowState.RUNNING) {
                return;
            }
            if (state == TaskState.FAILED && run.retryFailed
                    && run.attempts.getOrDefault(workflowTaskId, 0) < maxAttempts) {
                run.retrying.add(workflowTaskId);
                run.launched.remove(workflowTaskId);
                actions.add(() -> retry(run, workflowTaskId, task.error()));
            }
            reconcile(run, actions, events);
        } finally {
            run.lock.unlock();
        }
        fire(events);
        actions.forEach(Runnable::run);
    }

    /**
     * Rejects completion of a task while a finish-to-finish predecessor has not completed.
     */
    @Override
    public void check(Task task, TaskState target) {
        if (target != TaskState.COMPLETED) {
            return;
        }
        String workflowId = taskToWorkflow.get(task.id());
        WorkflowRun run = workflowId == null ? null : workflows.get(workflowId);
        if (run == null) {
            return;
        }
        String workflowTaskId = run.workflowTaskIdOf(task.id());
        if (workflowTaskId == null) {
            return;
        }
        for (TaskDependency dependency : run.dependencies) {
            if (dependency.type() != DependencyType.FINISH_TO_FINISH || !dependency.successor().equals(workflowTaskId)) {
                continue;
            }
            String predecessorTaskId = run.taskIds.get(dependency.predecessor());
            Task predecessor = predecessorTaskId == null ? null : taskManager.getTask(predecessorTaskId);
            if (predecessor == null || predecessor.state() != TaskState.COMPLETED) {
                throw new InvalidStateError("Task " + workflowTaskId + " cannot complete before "
                        + dependency.predecessor() + " has completed");
            }
        }
    }

    private void reconcile(WorkflowRun run, List<Runnable> actions, List<WorkflowEvent> events) {
        if (run.state != WorkflowState.RUNNING) {
            return;
        }
        for (String workflowTaskId : run.order) {
            if (run.launched.contains(workflowTaskId) || run.retrying.contains(workflowTaskId)
                    || run.admission.contains(workflowTaskId)) {
                continue;
            }
            TaskState state = run.observed.get(workflowTaskId);
            if ((state == TaskState.CREATED || state == TaskState.ASSIGNED) && isReady(run, workflowTaskId)) {
                run.admission.addLast(workflowTaskId);
            }
        }
        while (!run.admission.isEmpty() && (run.maxParallel == null || activeCount(run) < run.maxParallel)) {
            String workflowTaskId = run.admission.pollFirst();
            run.launched.add(workflowTaskId);
            run.attempts.merge(workflowTaskId, 1, Integer::sum);
            String taskId = run.taskIds.get(workflowTaskId);
            Map<String, Object> input = pipelineInput(run, workflowTaskId, taskId);
            actions.add(() -> launch(run.id, taskId, input));
        }

        if (run.order.stream().allMatch(id -> run.observed.get(id) == TaskState.COMPLETED)) {
            finish(run, WorkflowState.COMPLETED, null, events);
            LOGGER.info("Workflow {} completed", run.id);
            return;
        }
        if (progressingCount(run) > 0 || !run.admission.isEmpty() || !run.retrying.isEmpty()) {
            return;
        }
        List<String> failed = run.order.stream()
                .filter(id -> run.observed.get(id) == TaskState.FAILED || run.observed.get(id) == TaskState.CANCELLED)
                .toList();
        String reason = failed.isEmpty()
                ? "Workflow cannot make progress"
                : "Workflow tasks did not complete: " + String.join(", ", failed);
        List<String> blocked = new ArrayList<>();
        for (String workflowTaskId : run.order) {
            if (!run.observed.get(workflowTaskId).isFinal()) {
                blocked.add(run.taskIds.get(workflowTaskId));
            }
        }
        finish(run, WorkflowState.FAILED, reason, events);
        LOGGER.info("Workflow {} failed: {}", run.id, reason);
        if (!blocked.isEmpty()) {
            actions.add(() -> cancelTasks(blocked, "Blocked by failed dependency"));
        }
    }

    private boolean isReady(WorkflowRun run, String workflowTaskId) {
        for (TaskDependency dependency : run.dependencies) {
            if (!dependency.successor().equals(workflowTaskId)) {
                continue;
            }
            String predecessor = dependency.predecessor();
            boolean satisfied = switch (dependency.type()) {
                case FINISH_TO_START -> run.observed.get(predecessor) == TaskState.COMPLETED;
                case START_TO_START -> run.everStarted.contains(predecessor);
                case FINISH_TO_FINISH -> !hasFailed(run, predecessor);
            };
            if (!satisfied) {
                return false;
            }
        }
        return true;
    }

    private static long activeCount(WorkflowRun run) {
        return run.launched.stream()
                .filter(id -> !run.observed.get(id).isFinal())
                .count();
    }

    /**
     * Counts launched tasks that can still finish. A task whose finish-to-finish predecessor
     * failed for good can never complete, so it does not keep the workflow alive.
     */
    private static long progressingCount(WorkflowRun run) {
        return run.launched.stream()
                .filter(id -> !run.observed.get(id).isFinal() && !isFinishBlocked(run, id))
                .count();
    }

    private static boolean isFinishBlocked(WorkflowRun run, String workflowTaskId) {
        for (TaskDependency dependency : run.dependencies) {
            if (dependency.type() == DependencyType.FINISH_TO_FINISH
                    && dependency.successor().equals(workflowTaskId)
                    && hasFailed(run, dependency.predecessor())) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasFailed(WorkflowRun run, String workflowTaskId) {
        TaskState state = run.observed.get(workflowTaskId);
        return (state == TaskState.FAILED || state == TaskState.CANCELLED) && !run.retrying.contains(workflowTaskId);
    }

    private @Nullable Map<String, Object> pipelineInput(WorkflowRun run, String workflowTaskId, String taskId) {
        if (run.pattern != CoordinationPattern.PIPELINE) {
            return null;
        }
        Map<String, Object> previousOutput = null;
        for (TaskDependency dependency : run.dependencies) {
            if (dependency.successor().equals(workflowTaskId) && dependency.type() == DependencyType.FINISH_TO_START) {
                previousOutput = run.outputs.get(dependency.predecessor());
            }
        }
        if (previousOutput == null) {
            return null;
        }
        Task task = taskManager.getTask(taskId);
        Map<String, Object> input = new LinkedHashMap<>(task == null ? Map.of() : task.inputData());
        input.put(PREVIOUS_OUTPUT_KEY, previousOutput);
        return input;
    }

    private void launch(String workflowId, String taskId, @Nullable Map<String, Object> input) {
        try {
            if (input != null) {
                taskManager.updateInput(taskId, input);
            }
            taskManager.startTask(taskId);
        } catch (A2AError e) {
            // the task changed state concurrently; its own lifecycle event drives the workflow
            LOGGER.warn("Could not start task {} of workflow {}: {}", taskId, workflowId, e.getMessage());
        }
    }

    private void retry(WorkflowRun run, String workflowTaskId, @Nullable String error) {
        TaskDefinition definition;
        int attempt;
        run.lock.lock();
        try {
            definition = run.definitions.get(workflowTaskId);
            attempt = run.attempts.getOrDefault(workflowTaskId, 0) + 1;
        } finally {
            run.lock.unlock();
        }
        LOGGER.info("Retrying task {} of workflow {} (attempt {} of {}) after: {}", workflowTaskId, run.id, attempt,
                maxAttempts, error);
        Task replacement = createTaskFor(run, definition, attempt);

        List<Runnable> actions = new ArrayList<>();
        List<WorkflowEvent> events = new ArrayList<>();
        boolean stale;
        run.lock.lock();
        try {
            run.retrying.remove(workflowTaskId);
            stale = run.state != WorkflowState.RUNNING;
            if (!stale) {
                String previous = run.taskIds.put(workflowTaskId, replacement.id());
                if (previous != null) {
                    taskToWorkflow.remove(previous);
                }
                taskToWorkflow.put(replacement.id(), run.id);
                run.observed.put(workflowTaskId, replacement.state());
                run.outputs.remove(workflowTaskId);
                reconcile(run, actions, events);
            }
        } finally {
            run.lock.unlock();
        }
        if (stale) {
            cancelTasks(List.of(replacement.id()), "Workflow no longer running");
        }
        fire(events);
        actions.forEach(Runnable::run);
    }

    private void onTimeout(String workflowId) {
        WorkflowRun run = workflows.get(workflowId);
        if (run == null) {
            return;
        }
        TaskWorkflow snapshot;
        run.lock.lock();
        try {
            if (run.state.isFinal()) {
                return;
            }
            snapshot = snapshot(run);
        } finally {
            run.lock.unlock();
        }
        TimeoutError timeout = new TimeoutError("Workflow " + workflowId + " exceeded its timeout of "
                + run.timeoutSeconds + " seconds");
        LOGGER.warn(timeout.getMessage());
        fire(List.of(new WorkflowEvent(EventType.WORKFLOW_TIMEOUT, snapshot, timeout.getMessage(), clock.instant())));
        try {
            cancelWorkflow(workflowId, timeout.getMessage());
        } catch (InvalidStateError e) {
            LOGGER.debug("Workflow {} finished before its timeout could cancel it", workflowId);
        }
    }

    private void finish(WorkflowRun run, WorkflowState state, @Nullable String reason, List<WorkflowEvent> events) {
        Instant now = clock.instant();
        run.state = state;
        run.error = reason;
        run.completedAt = now;
        if (run.timeout != null) {
            run.timeout.cancel(false);
            run.timeout = null;
        }
        EventType type = switch (state) {
            case COMPLETED -> EventType.WORKFLOW_COMPLETED;
            case FAILED -> EventType.WORKFLOW_FAILED;
            case CANCELLED -> EventType.WORKFLOW_CANCELLED;
            default -> throw new IllegalStateException("Not a terminal workflow state: " + state);
        };
        events.add(new WorkflowEvent(type, snapshot(run), reason, now));
    }

    private void cancelTasks(Collection<String> taskIds, String reason) {
        for (String taskId : taskIds) {
            try {
                taskManager.cancelTask(taskId, reason);
            } catch (A2AError e) {
                LOGGER.debug("Task {} not cancelled: {}", taskId, e.getMessage());
            }
        }
    }

    private Task createTaskFor(WorkflowRun run, TaskDefinition definition, int attempt) {
        Map<String, Object> metadata = new LinkedHashMap<>(definition.metadata());
        metadata.put(WORKFLOW_ID_KEY, run.id);
        metadata.put(WORKFLOW_TASK_ID_KEY, definition.id());
        metadata.put(ATTEMPT_KEY, attempt);
        return taskManager.createTask(definition.effectiveName(), run.createdBy, definition.description(),
                definition.inputData(), metadata);
    }

    private void fire(List<WorkflowEvent> events) {
        for (WorkflowEvent event : events) {
            for (WorkflowEventListener listener : listeners) {
                try {
                    listener.onEvent(event);
                } catch (Exception e) {
                    LOGGER.error("Workflow listener failed on {} for workflow {}", event.type().value(),
                            event.workflow().id(), e);
                }
            }
        }
    }

    private WorkflowRun requireRun(String workflowId) {
        WorkflowRun run = workflows.get(workflowId);
        if (run == null) {
            throw new InvalidRequestError("Workflow not found: " + workflowId);
        }
        return run;
    }

    private static void requireState(WorkflowRun run, WorkflowState expected, String action) {
        if (run.state != expected) {
            throw new InvalidStateError("Cannot " + action + " workflow " + run.id + " in state " + run.state.value());
        }
    }

    private static void checkEdge(Set<String> workflowTaskIds, TaskDependency dependency) {
        if (!workflowTaskIds.contains(dependency.predecessor())) {
            throw new InvalidRequestError("Unknown workflow task: " + dependency.predecessor());
        }
        if (!workflowTaskIds.contains(dependency.successor())) {
            throw new InvalidRequestError("Unknown workflow task: " + dependency.successor());
        }
        if (dependency.predecessor().equals(dependency.successor())) {
            throw new CycleDetectedError(List.of(dependency.predecessor(), dependency.successor()));
        }
    }

    private static List<TaskDefinition> withIds(List<TaskDefinition> definitions) {
        List<TaskDefinition> identified = new ArrayList<>(definitions.size());
        for (int i = 0; i < definitions.size(); i++) {
            TaskDefinition definition = definitions.get(i);
            identified.add(definition.id() == null ? definition.withId("task-" + (i + 1)) : definition);
        }
        return identified;
    }

    private static List<TaskDependency> chain(List<TaskDefinition> definitions) {
        List<TaskDependency> edges = new ArrayList<>();
        for (int i = 1; i < definitions.size(); i++) {
            edges.add(new TaskDependency(definitions.get(i - 1).id(), definitions.get(i).id(),
                    DependencyType.FINISH_TO_START));
        }
        return edges;
    }

    /**
     * Depth first search for a cycle.
     *
     * @return the cycle as a path that starts and ends at the same node, or {@code null}
     */
    static @Nullable List<String> findCycle(Collection<String> nodes, List<TaskDependency> edges) {
        Map<String, List<String>> successors = new HashMap<>();
        for (TaskDependency edge : edges) {
            successors.computeIfAbsent(edge.predecessor(), k -> new ArrayList<>()).add(edge.successor());
        }
        Set<String> done = new HashSet<>();
        for (String node : nodes) {
            List<String> cycle = visit(node, successors, done, new ArrayList<>(), new HashSet<>());
            if (cycle != null) {
                return cycle;
            }
        }
        return null;
    }

    private static @Nullable List<String> visit(String node, Map<String, List<String>> successors, Set<String> done,
                                                List<String> path, Set<String> onPath) {
        if (onPath.contains(node)) {
            List<String> cycle = new ArrayList<>(path.subList(path.indexOf(node), path.size()));
            cycle.add(node);
            return cycle;
        }
        if (done.contains(node)) {
            return null;
        }
        path.add(node);
        onPath.add(node);
        for (String next : successors.getOrDefault(node, List.of())) {
            List<String> cycle = visit(next, successors, done, path, onPath);
            if (cycle != null) {
                return cycle;
            }
        }
        path.remove(path.size() - 1);
        onPath.remove(node);
        done.add(node);
        return null;
    }

    private TaskWorkflow snapshot(WorkflowRun run) {
        run.lock.lock();
        try {
            Map<String, String> tasks = new LinkedHashMap<>();
            for (String workflowTaskId : run.order) {
                tasks.put(workflowTaskId, run.taskIds.get(workflowTaskId));
            }
            return TaskWorkflow.builder()
                    .id(run.id)
                    .name(run.name)
                    .description(run.description)
                    .createdBy(run.createdBy)
                    .pattern(run.pattern)
                    .tasks(tasks)
                    .dependencies(List.copyOf(run.dependencies))
                    .maxParallel(run.maxParallel)
                    .retryFailed(run.retryFailed)
                    .timeoutSeconds(run.timeoutSeconds)
                    .state(run.state)
                    .attempts(new LinkedHashMap<>(run.attempts))
                    .error(run.error)
                    .createdAt(run.createdAt)
                    .startedAt(run.startedAt)
                    .completedAt(run.completedAt)
                    .build();
        } finally {
            run.lock.unlock();
        }
    }

    /**
     * Mutable state of one workflow, guarded by {@link #lock}.
     * <p>
     * {@link #taskIds} and {@link #dependencies} are concurrent collections because the completion
     * guard reads them without taking the lock.
     */
    private static final class WorkflowRun {
        final ReentrantLock lock = new ReentrantLock();
        final String id;
        final String name;
        final @Nullable String description;
        final String createdBy;
        final CoordinationPattern pattern;
        final @Nullable Integer maxParallel;
        final boolean retryFailed;
        final @Nullable Long timeoutSeconds;
        final Instant createdAt;

        final List<String> order = new ArrayList<>();
        final Map<String, TaskDefinition> definitions = new HashMap<>();
        final Map<String, String> taskIds = new ConcurrentHashMap<>();
        final List<TaskDependency> dependencies = new CopyOnWriteArrayList<>();
        final Map<String, TaskState> observed = new HashMap<>();
        final Set<String> everStarted = new HashSet<>();
        final Set<String> launched = new HashSet<>();
        final Set<String> retrying = new HashSet<>();
        final Deque<String> admission = new ArrayDeque<>();
        final Map<String, Integer> attempts = new LinkedHashMap<>();
        final Map<String, Map<String, Object>> outputs = new HashMap<>();

        WorkflowState state = WorkflowState.CREATED;
        @Nullable String error;
        @Nullable Instant startedAt;
        @Nullable Instant completedAt;
        @Nullable ScheduledFuture<?> timeout;

        WorkflowRun(String id, String name, String createdBy, CoordinationPattern pattern, WorkflowOptions options,
                    Instant createdAt) {
            this.id = id;
            this.name = name;
            this.description = options.description();
            this.createdBy = createdBy;
            this.pattern = pattern;
            this.maxParallel = options.maxParallel();
            this.retryFailed = options.retryFailed();
            this.timeoutSeconds = options.timeoutSeconds();
            this.createdAt = createdAt;
        }

        void register(TaskDefinition definition, String taskId) {
            String workflowTaskId = definition.id();
            order.add(workflowTaskId);
            definitions.put(workflowTaskId, definition);
            taskIds.put(workflowTaskId, taskId);
            observed.put(workflowTaskId, TaskState.CREATED);
        }

        @Nullable String workflowTaskIdOf(String taskId) {
            for (Map.Entry<String, String> entry : taskIds.entrySet()) {
                if (entry.getValue().equals(taskId)) {
                    return entry.getKey();
                }
            }
            return null;
        }
    }
}
