package io.hermes.server.methods;

import java.util.LinkedHashSet;

import io.hermes.server.dispatch.A2AMethods;
import io.hermes.server.dispatch.MethodDispatcher;
import io.hermes.server.dispatch.MethodParams;
import io.hermes.server.registry.AgentQuery;
import io.hermes.server.registry.DiscoveryService;
import io.hermes.server.security.SecurityContext;
import io.hermes.spec.AgentStatus;
import org.jspecify.annotations.Nullable;

/**
 * The {@code discovery.*} methods.
 */
public class DiscoveryMethods {

    private final DiscoveryService discovery;

    public DiscoveryMethods(DiscoveryService discovery) {
        this.discovery = discovery;
    }

    public void registerWith(MethodDispatcher dispatcher) {
        dispatcher.registerMethod(A2AMethods.DISCOVERY_QUERY, this::query);
        dispatcher.registerMethod(A2AMethods.DISCOVERY_FIND_FOR_METHOD, this::findForMethod);
        dispatcher.registerMethod(A2AMethods.DISCOVERY_FIND_FOR_CAPABILITY, this::findForCapability);
        dispatcher.registerMethod(A2AMethods.DISCOVERY_CAPABILITY_MAP, (params, context) -> discovery.capabilityMap());
        dispatcher.registerMethod(A2AMethods.DISCOVERY_METHOD_MAP, (params, context) -> discovery.methodMap());
    }

    Object query(MethodParams params, @Nullable SecurityContext context) {
        AgentQuery query = new AgentQuery(
                new LinkedHashSet<>(params.optionalStringList("capabilities")),
                new LinkedHashSet<>(params.optionalStringList("methods")),
                params.optionalEnum("status", AgentStatus::fromValue, null),
                params.optionalString("tag"),
                params.optionalString("name"),
                params.optionalBoolean("include_offline", false));
        return discovery.query(query);
    }

    Object findForMethod(MethodParams params, @Nullable SecurityContext context) {
        return discovery.findForMethod(params.requireString("method"));
    }

    Object findForCapability(MethodParams params, @Nullable SecurityContext context) {
        return discovery.findForCapability(params.requireString("capability"),
                params.optionalBoolean("include_offline", false));
    }
}
