package io.hermes.server.coordination;

/**
 * Observer of workflow lifecycle changes. Exceptions thrown by a listener are logged and ignored.
 */
@FunctionalInterface
public interface WorkflowEventListener {

    void onEvent(WorkflowEvent event);
}
