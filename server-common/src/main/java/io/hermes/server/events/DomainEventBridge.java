package io.hermes.server.events;

import java.util.LinkedHashMap;
import java.util.Map;

import io.hermes.server.coordination.WorkflowEvent;
import io.hermes.server.coordination.WorkflowEventListener;
import io.hermes.server.registry.AgentRegistryEvent;
import io.hermes.server.registry.AgentRegistryListener;
import io.hermes.server.tasks.TaskLifecycleEvent;
import io.hermes.server.tasks.TaskLifecycleListener;
import io.hermes.spec.Event;
import io.hermes.util.Utils;

/**
 * Converts task, agent and workflow events into canonical {@link Event}s and hands them to the
 * {@link EventStreamer}.
 */
public class DomainEventBridge {

    private final EventStreamer streamer;

    public DomainEventBridge(EventStreamer streamer) {
        this.streamer = streamer;
    }

    public TaskLifecycleListener taskListener() {
        return event -> streamer.broadcast(toEvent(event));
    }

    public AgentRegistryListener agentListener() {
        return event -> streamer.broadcast(toEvent(event));
    }

    public WorkflowEventListener workflowListener() {
        return event -> streamer.broadcast(toEvent(event));
    }

    Event toEvent(TaskLifecycleEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("task_id", event.task().id());
        payload.put("state", event.task().state().value());
        if (event.previousState() != null) {
            payload.put("previous_state", event.previousState().value());
        }
        if (event.task().agentId() != null) {
            payload.put("agent_id", event.task().agentId());
        }
        payload.put("task", Utils.toMap(event.task()));
        return Event.of(event.type().value(), streamer.source(), payload, event.timestamp());
    }

    Event toEvent(AgentRegistryEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agent_id", event.card().id());
        payload.put("status", event.card().status().value());
        if (event.previousStatus() != null) {
            payload.put("previous_status", event.previousStatus().value());
        }
        payload.put("agent", Utils.toMap(event.card()));
        return Event.of(event.type().value(), streamer.source(), payload, event.timestamp());
    }

    Event toEvent(WorkflowEvent event) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("workflow_id", event.workflow().id());
        payload.put("state", event.workflow().state().value());
        if (event.reason() != null) {
            payload.put("reason", event.reason());
        }
        payload.put("workflow", Utils.toMap(event.workflow()));
        return Event.of(event.type().value(), streamer.source(), payload, event.timestamp());
    }
}
