package io.hermes.server.tasks;

/**
 * Observer of task transitions.
 * <p>
 * Events of one task arrive in transition order; there is no order across tasks. Exceptions thrown
 * by a listener are logged and never reach the code that performed the transition.
 */
@FunctionalInterface
public interface TaskLifecycleListener {

    void onEvent(TaskLifecycleEvent event);
}
