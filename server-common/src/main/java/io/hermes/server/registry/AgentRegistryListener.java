package io.hermes.server.registry;

/**
 * Observer of registry changes. Exceptions thrown by a listener are logged and otherwise ignored.
 */
@FunctionalInterface
public interface AgentRegistryListener {

    void onEvent(AgentRegistryEvent event);
}
