package io.hermes.server.tasks;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import io.hermes.server.MutableClock;
import io.hermes.spec.EventType;
import io.hermes.spec.InvalidParamsError;
import io.hermes.spec.InvalidRequestError;
import io.hermes.spec.InvalidStateError;
import io.hermes.spec.Task;
import io.hermes.spec.TaskState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;

public class TaskManagerTest {

    private MutableClock clock;
    private TaskManager taskManager;
    private List<TaskLifecycleEvent> events;
    private ListAppender<ILoggingEvent> logAppender;

    @BeforeEach
    public void setUp() {
        clock = new MutableClock();
        taskManager = new TaskManager(new InMemoryTaskStore(), clock);
        events = Collections.synchronizedList(new ArrayList<>());
        taskManager.addListener(events::add);

        Logger logger = (Logger) LoggerFactory.getLogger(TaskManager.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        logger.addAppender(logAppender);
    }

    @AfterEach
    public void tearDown() {
        Logger logger = (Logger) LoggerFactory.getLogger(TaskManager.class);
        logger.detachAppender(logAppender);
    }

    private Task newTask() {
        return taskManager.createTask("build", "creator", "compile it", Map.of("target", "all"), null);
    }

    private List<EventType> eventTypes() {
        return events.stream().map(TaskLifecycleEvent::type).toList();
    }

    @Test
    public void testCreateTask() {
        Task task = newTask();

        assertEquals(TaskState.CREATED, task.state());
        assertEquals("creator", task.createdBy());
        assertEquals(Map.of("target", "all"), task.inputData());
        assertEquals(clock.instant(), task.createdAt());
        assertEquals(task, taskManager.getTask(task.id()));
        assertEquals(List.of(EventType.TASK_CREATED), eventTypes());
        assertNull(events.get(0).previousState());
    }

    @Test
    public void testHappyPathLifecycle() {
        Task task = newTask();
        taskManager.assignTask(task.id(), "worker");
        clock.advance(Duration.ofSeconds(1));
        Task running = taskManager.startTask(task.id());
        taskManager.updateProgress(task.id(), 0.5, "halfway");
        clock.advance(Duration.ofSeconds(1));
        Task done = taskManager.completeTask(task.id(), Map.of("artifact", "app.jar"));

        assertEquals("worker", running.agentId());
        assertEquals(clock.instant().minusSeconds(1), running.startedAt());
        assertEquals(TaskState.COMPLETED, done.state());
        assertEquals(1.0, done.progress());
        assertEquals(Map.of("artifact", "app.jar"), done.outputData());
        assertEquals(clock.instant(), done.completedAt());
        assertEquals(List.of(EventType.TASK_CREATED, EventType.TASK_ASSIGNED, EventType.TASK_STATE_CHANGED,
                EventType.TASK_PROGRESS, EventType.TASK_COMPLETED), eventTypes());
        assertEquals(TaskState.RUNNING, events.get(4).previousState());
    }

    @Test
    public void testTerminalStatesAreFinal() {
        Task task = newTask();
        taskManager.cancelTask(task.id(), "not needed");

        assertThrows(InvalidStateError.class, () -> taskManager.startTask(task.id()));
        assertThrows(InvalidStateError.class, () -> taskManager.failTask(task.id(), "late"));
        assertThrows(InvalidStateError.class, () -> taskManager.cancelTask(task.id(), "again"));
        assertEquals(TaskState.CANCELLED, taskManager.getTask(task.id()).state());
        assertEquals("not needed", taskManager.getTask(task.id()).statusMessage());
    }

    @Test
    public void testCompleteRequiresRunning() {
        Task task = newTask();

        assertThrows(InvalidStateError.class, () -> taskManager.completeTask(task.id(), null));
        assertEquals(TaskState.CREATED, taskManager.getTask(task.id()).state());
    }

    @Test
    public void testProgressValidation() {
        Task task = newTask();
        assertThrows(InvalidStateError.class, () -> taskManager.updateProgress(task.id(), 0.1, null));

        taskManager.startTask(task.id());
        assertThrows(InvalidParamsError.class, () -> taskManager.updateProgress(task.id(), 1.5, null));
        assertThrows(InvalidParamsError.class, () -> taskManager.updateProgress(task.id(), Double.NaN, null));
        assertEquals(0.25, taskManager.updateProgress(task.id(), 0.25, null).progress());
    }

    @Test
    public void testUnknownTask() {
        assertThrows(InvalidRequestError.class, () -> taskManager.startTask("missing"));
        assertNull(taskManager.getTask("missing"));
    }

    @Test
    public void testUpdateStateGeneric() {
        Task task = newTask();
        assertThrows(InvalidParamsError.class, () -> taskManager.updateState(task.id(), TaskState.ASSIGNED, null));
        assertThrows(InvalidStateError.class, () -> taskManager.updateState(task.id(), TaskState.CREATED, null));

        taskManager.updateState(task.id(), TaskState.RUNNING, "go");
        Task failed = taskManager.updateState(task.id(), TaskState.FAILED, "crashed");

        assertEquals(TaskState.FAILED, failed.state());
        assertEquals("crashed", failed.error());
    }

    @Test
    public void testUpdateInputOnlyBeforeStart() {
        Task task = newTask();
        assertEquals(Map.of("x", 1), taskManager.updateInput(task.id(), Map.of("x", 1)).inputData());

        taskManager.startTask(task.id());
        assertThrows(InvalidStateError.class, () -> taskManager.updateInput(task.id(), Map.of()));
    }

    @Test
    public void testGuardCanVetoTransition() {
        Task task = newTask();
        taskManager.startTask(task.id());
        taskManager.addGuard((current, target) -> {
            if (target == TaskState.COMPLETED) {
                throw new InvalidStateError("not yet");
            }
        });

        assertThrows(InvalidStateError.class, () -> taskManager.completeTask(task.id(), null));
        assertEquals(TaskState.RUNNING, taskManager.getTask(task.id()).state());
    }

    @Test
    public void testFailingListenerDoesNotAffectOthers() {
        List<TaskLifecycleEvent> seen = new ArrayList<>();
        taskManager.addListener(event -> {
            throw new IllegalStateException("listener bug");
        });
        taskManager.addListener(seen::add);

        Task task = newTask();
        taskManager.startTask(task.id());

        assertEquals(2, seen.size());
        assertEquals(TaskState.RUNNING, taskManager.getTask(task.id()).state());
        assertTrue(logAppender.list.stream().anyMatch(event -> event.getLevel() == Level.ERROR
                && event.getFormattedMessage().contains("Task listener failed")));
    }

    @Test
    public void testListenerTransitionIsDeliveredInOrder() {
        Task task = newTask();
        taskManager.addListener(event -> {
            if (event.type() == EventType.TASK_STATE_CHANGED && event.task().id().equals(task.id())) {
                taskManager.completeTask(task.id(), null);
            }
        });

        taskManager.startTask(task.id());

        assertEquals(List.of(EventType.TASK_CREATED, EventType.TASK_STATE_CHANGED, EventType.TASK_COMPLETED),
                eventTypes());
        assertEquals(TaskState.COMPLETED, taskManager.getTask(task.id()).state());
    }

    @Test
    public void testConcurrentTerminalTransitionsHaveOneWinner() throws InterruptedException {
        Task task = newTask();
        taskManager.startTask(task.id());
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(4);
        List<Throwable> failures = Collections.synchronizedList(new ArrayList<>());
        try {
            for (int i = 0; i < 4; i++) {
                int n = i;
                pool.execute(() -> {
                    try {
                        start.await();
                        if (n % 2 == 0) {
                            taskManager.completeTask(task.id(), null);
                        } else {
                            taskManager.failTask(task.id(), "boom");
                        }
                    } catch (InvalidStateError e) {
                        failures.add(e);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(5, TimeUnit.SECONDS));
        } finally {
            pool.shutdownNow();
        }

        assertEquals(3, failures.size());
        long terminalEvents = events.stream()
                .filter(event -> event.type() == EventType.TASK_COMPLETED || event.type() == EventType.TASK_FAILED)
                .count();
        assertEquals(1, terminalEvents);
    }

    @Test
    public void testCancelAllRunning() {
        Task first = newTask();
        Task second = newTask();
        Task idle = newTask();
        taskManager.startTask(first.id());
        taskManager.startTask(second.id());

        assertEquals(2, taskManager.cancelAllRunning("shutdown"));
        assertEquals(TaskState.CANCELLED, taskManager.getTask(first.id()).state());
        assertEquals(TaskState.CANCELLED, taskManager.getTask(second.id()).state());
        assertEquals(TaskState.CREATED, taskManager.getTask(idle.id()).state());
    }

    @Test
    public void testListTasksFilters() {
        Task first = newTask();
        Task second = newTask();
        taskManager.assignTask(first.id(), "worker");
        assertNotNull(second);

        assertEquals(List.of(first.id()),
                taskManager.listTasks(null, "worker", null).stream().map(Task::id).toList());
        assertEquals(List.of(second.id()),
                taskManager.listTasks(TaskState.CREATED, null, null).stream().map(Task::id).toList());
        assertEquals(2, taskManager.listTasks(null, null, "creator").size());
    }
}
