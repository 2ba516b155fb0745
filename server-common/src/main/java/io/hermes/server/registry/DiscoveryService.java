package io.hermes.server.registry;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.hermes.spec.AgentCard;

/**
 * Capability and method indexed lookups over the {@link AgentRegistry}.
 * <p>
 * Lookups read the registry's current cards; there is no separate index to keep consistent.
 */
@ApplicationScoped
public class DiscoveryService {

    private final AgentRegistry registry;

    @Inject
    public DiscoveryService(AgentRegistry registry) {
        this.registry = registry;
    }

    /**
     * Finds agents advertising a capability.
     *
     * @param capability the capability
     * @param includeOffline whether degraded and offline agents are included
     * @return the matching agents ordered by id
     */
    public List<AgentCard> findForCapability(String capability, boolean includeOffline) {
        return query(AgentQuery.forCapability(capability, includeOffline));
    }

    /**
     * Finds online agents that support an RPC method.
     */
    public List<AgentCard> findForMethod(String method) {
        return query(new AgentQuery(Set.of(), Set.of(method), null, null, null, false));
    }

    public List<AgentCard> query(AgentQuery query) {
        return registry.list(null).stream()
                .filter(query::matches)
                .toList();
    }

    /**
     * Returns capability to the ids of all registered agents advertising it, whatever their status.
     */
    public Map<String, Set<String>> capabilityMap() {
        Map<String, Set<String>> map = new TreeMap<>();
        for (AgentCard card : registry.list(null)) {
            for (String capability : card.capabilities()) {
                map.computeIfAbsent(capability, c -> new TreeSet<>()).add(card.id());
            }
        }
        return map;
    }

    /**
     * Returns RPC method name to the ids of all registered agents supporting it.
     */
    public Map<String, Set<String>> methodMap() {
        Map<String, Set<String>> map = new TreeMap<>();
        for (AgentCard card : registry.list(null)) {
            for (String method : card.supportedMethods()) {
                map.computeIfAbsent(method, m -> new TreeSet<>()).add(card.id());
            }
        }
        return map;
    }
}
