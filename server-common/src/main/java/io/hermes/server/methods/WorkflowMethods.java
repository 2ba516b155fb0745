package io.hermes.server.methods;

import static io.hermes.server.methods.MethodSupport.agentIdOrCaller;
import static io.hermes.server.methods.MethodSupport.found;
import static io.hermes.server.methods.MethodSupport.result;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import io.hermes.server.coordination.TaskCoordinator;
import io.hermes.server.coordination.TaskDefinition;
import io.hermes.server.coordination.WorkflowOptions;
import io.hermes.server.dispatch.A2AMethods;
import io.hermes.server.dispatch.MethodDispatcher;
import io.hermes.server.dispatch.MethodParams;
import io.hermes.server.security.SecurityContext;
import io.hermes.spec.CoordinationPattern;
import io.hermes.spec.DependencyType;
import io.hermes.spec.TaskDependency;
import io.hermes.spec.TaskWorkflow;
import io.hermes.spec.WorkflowState;
import org.jspecify.annotations.Nullable;

/**
 * The {@code workflow.*} methods.
 * <p>
 * Task definitions are objects with {@code id}, {@code name}, {@code description},
 * {@code input_data} and {@code metadata}; dependencies are objects with {@code predecessor_id},
 * {@code successor_id} and {@code dependency_type}.
 */
public class WorkflowMethods {

    private final TaskCoordinator coordinator;

    public WorkflowMethods(TaskCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    public void registerWith(MethodDispatcher dispatcher) {
        dispatcher.registerMethod(A2AMethods.WORKFLOW_CREATE, this::create);
        dispatcher.registerMethod(A2AMethods.WORKFLOW_CREATE_SEQUENTIAL, (params, context) ->
                coordinator.createSequentialWorkflow(params.requireString("name"),
                        agentIdOrCaller(params, "created_by", context), definitions(params, "tasks"),
                        options(params)));
        dispatcher.registerMethod(A2AMethods.WORKFLOW_CREATE_PARALLEL, (params, context) ->
                coordinator.createParallelWorkflow(params.requireString("name"),
                        agentIdOrCaller(params, "created_by", context), definitions(params, "tasks"),
                        params.optionalInt("max_parallel"), options(params)));
        dispatcher.registerMethod(A2AMethods.WORKFLOW_CREATE_PIPELINE, (params, context) ->
                coordinator.createPipelineWorkflow(params.requireString("name"),
                        agentIdOrCaller(params, "created_by", context), definitions(params, "stages"),
                        options(params)));
        dispatcher.registerMethod(A2AMethods.WORKFLOW_CREATE_FANOUT, (params, context) ->
                coordinator.createFanoutWorkflow(params.requireString("name"),
                        agentIdOrCaller(params, "created_by", context),
                        TaskDefinition.fromMap(params.requireMap("source_task")),
                        definitions(params, "target_tasks"), options(params)));
        dispatcher.registerMethod(A2AMethods.WORKFLOW_START, this::start);
        dispatcher.registerMethod(A2AMethods.WORKFLOW_CANCEL, this::cancel);
        dispatcher.registerMethod(A2AMethods.WORKFLOW_INFO, (params, context) -> {
            String workflowId = params.requireString("workflow_id");
            return found(coordinator.getWorkflow(workflowId), "Workflow", workflowId);
        });
        dispatcher.registerMethod(A2AMethods.WORKFLOW_LIST, (params, context) ->
                coordinator.listWorkflows(params.optionalString("created_by"),
                        params.optionalEnum("state", WorkflowState::fromValue, null)));
        dispatcher.registerMethod(A2AMethods.WORKFLOW_ADD_TASK, this::addTask);
        dispatcher.registerMethod(A2AMethods.WORKFLOW_ADD_DEPENDENCY, this::addDependency);
    }

    /**
     * Creates a workflow of any pattern, with optional {@code tasks} and {@code dependencies}.
     */
    Object create(MethodParams params, @Nullable SecurityContext context) {
        List<TaskDependency> dependencies = new ArrayList<>();
        for (Map<String, Object> entry : params.optionalMapList("dependencies")) {
            dependencies.add(dependency(MethodParams.of(entry)));
        }
        return coordinator.createWorkflow(
                params.requireString("name"),
                agentIdOrCaller(params, "created_by", context),
                params.optionalEnum("pattern", CoordinationPattern::fromValue, CoordinationPattern.SEQUENTIAL),
                definitions(params, "tasks"),
                dependencies,
                options(params));
    }

    Object start(MethodParams params, @Nullable SecurityContext context) {
        TaskWorkflow workflow = coordinator.startWorkflow(params.requireString("workflow_id"));
        return result("success", true, "workflow_id", workflow.id(), "state", workflow.state().value());
    }

    Object cancel(MethodParams params, @Nullable SecurityContext context) {
        TaskWorkflow workflow = coordinator.cancelWorkflow(params.requireString("workflow_id"),
                params.optionalString("reason"));
        return result("success", true, "workflow_id", workflow.id());
    }

    Object addTask(MethodParams params, @Nullable SecurityContext context) {
        String workflowId = params.requireString("workflow_id");
        String workflowTaskId = coordinator.addTask(workflowId, params.optionalString("workflow_task_id"),
                TaskDefinition.fromMap(params.requireMap("task_definition")));
        TaskWorkflow workflow = found(coordinator.getWorkflow(workflowId), "Workflow", workflowId);
        return result("success", true, "workflow_task_id", workflowTaskId,
                "task_id", workflow.tasks().get(workflowTaskId));
    }

    Object addDependency(MethodParams params, @Nullable SecurityContext context) {
        TaskDependency dependency = dependency(params);
        boolean added = coordinator.addDependency(params.requireString("workflow_id"), dependency.predecessor(),
                dependency.successor(), dependency.type());
        return result("success", true, "added", added);
    }

    private static TaskDependency dependency(MethodParams params) {
        return new TaskDependency(
                params.requireString("predecessor_id"),
                params.requireString("successor_id"),
                params.optionalEnum("dependency_type", DependencyType::fromValue, DependencyType.FINISH_TO_START));
    }

    private static List<TaskDefinition> definitions(MethodParams params, String name) {
        List<TaskDefinition> definitions = new ArrayList<>();
        for (Map<String, Object> entry : params.optionalMapList(name)) {
            definitions.add(TaskDefinition.fromMap(entry));
        }
        return definitions;
    }

    private static WorkflowOptions options(MethodParams params) {
        return new WorkflowOptions(
                params.optionalString("description"),
                params.optionalInt("max_parallel"),
                params.optionalBoolean("retry_failed", false),
                params.optionalLong("timeout_seconds"));
    }
}
