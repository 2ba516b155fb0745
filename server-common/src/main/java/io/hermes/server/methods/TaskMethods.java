package io.hermes.server.methods;

import static io.hermes.server.methods.MethodSupport.found;

import io.hermes.server.dispatch.A2AMethods;
import io.hermes.server.dispatch.MethodDispatcher;
import io.hermes.server.dispatch.MethodParams;
import io.hermes.server.security.SecurityContext;
import io.hermes.server.tasks.TaskManager;
import io.hermes.spec.Task;
import io.hermes.spec.TaskState;
import org.jspecify.annotations.Nullable;

/**
 * The {@code task.*} methods. Every method returns the task as it is after the operation.
 */
public class TaskMethods {

    private final TaskManager taskManager;

    public TaskMethods(TaskManager taskManager) {
        this.taskManager = taskManager;
    }

    public void registerWith(MethodDispatcher dispatcher) {
        dispatcher.registerMethod(A2AMethods.TASK_CREATE, this::create);
        dispatcher.registerMethod(A2AMethods.TASK_ASSIGN, (params, context) ->
                taskManager.assignTask(params.requireString("task_id"), params.requireString("agent_id")));
        dispatcher.registerMethod(A2AMethods.TASK_START, (params, context) ->
                taskManager.startTask(params.requireString("task_id")));
        dispatcher.registerMethod(A2AMethods.TASK_UPDATE_STATE, (params, context) ->
                taskManager.updateState(params.requireString("task_id"),
                        params.requireEnum("state", TaskState::fromValue),
                        params.optionalString("message")));
        dispatcher.registerMethod(A2AMethods.TASK_UPDATE_PROGRESS, (params, context) ->
                taskManager.updateProgress(params.requireString("task_id"), params.requireDouble("progress"),
                        params.optionalString("message")));
        dispatcher.registerMethod(A2AMethods.TASK_COMPLETE, (params, context) ->
                taskManager.completeTask(params.requireString("task_id"), params.optionalMap("output_data")));
        dispatcher.registerMethod(A2AMethods.TASK_FAIL, (params, context) ->
                taskManager.failTask(params.requireString("task_id"), params.requireString("error")));
        dispatcher.registerMethod(A2AMethods.TASK_CANCEL, (params, context) ->
                taskManager.cancelTask(params.requireString("task_id"), params.optionalString("reason")));
        dispatcher.registerMethod(A2AMethods.TASK_GET, this::get);
        dispatcher.registerMethod(A2AMethods.TASK_LIST, (params, context) ->
                taskManager.listTasks(params.optionalEnum("state", TaskState::fromValue, null),
                        params.optionalString("agent_id"), params.optionalString("created_by")));
    }

    /**
     * Creates a task, and assigns it when {@code agent_id} is given.
     */
    Object create(MethodParams params, @Nullable SecurityContext context) {
        Task task = taskManager.createTask(
                params.requireString("name"),
                MethodSupport.agentIdOrCaller(params, "created_by", context),
                params.optionalString("description"),
                params.optionalMap("input_data"),
                params.optionalMap("metadata"));
        String agentId = params.optionalString("agent_id");
        return agentId == null ? task : taskManager.assignTask(task.id(), agentId);
    }

    Object get(MethodParams params, @Nullable SecurityContext context) {
        String taskId = params.requireString("task_id");
        return found(taskManager.getTask(taskId), "Task", taskId);
    }
}
