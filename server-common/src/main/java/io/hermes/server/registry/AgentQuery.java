package io.hermes.server.registry;

import java.util.Locale;
import java.util.Set;

import io.hermes.spec.AgentCard;
import io.hermes.spec.AgentStatus;
import org.jspecify.annotations.Nullable;

/**
 * Criteria of a discovery query. All given criteria must hold.
 *
 * @param capabilities capabilities the agent must all have
 * @param methods methods the agent must all support
 * @param status required status; when absent only online agents match unless {@code includeOffline} is set
 * @param tag a tag the agent must carry
 * @param nameContains case insensitive substring of the agent name
 * @param includeOffline whether agents of any status match when no status is given
 */
public record AgentQuery(Set<String> capabilities, Set<String> methods, @Nullable AgentStatus status,
                         @Nullable String tag, @Nullable String nameContains, boolean includeOffline) {

    public AgentQuery {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        methods = methods == null ? Set.of() : Set.copyOf(methods);
    }

    public static AgentQuery forCapability(String capability, boolean includeOffline) {
        return new AgentQuery(Set.of(capability), Set.of(), null, null, null, includeOffline);
    }

    public boolean matches(AgentCard card) {
        if (status != null) {
            if (card.status() != status) {
                return false;
            }
        } else if (!includeOffline && card.status() != AgentStatus.ONLINE) {
            return false;
        }
        if (!card.capabilities().containsAll(capabilities) || !card.supportedMethods().containsAll(methods)) {
            return false;
        }
        if (tag != null && !card.tags().contains(tag)) {
            return false;
        }
        return nameContains == null
                || card.name().toLowerCase(Locale.ROOT).contains(nameContains.toLowerCase(Locale.ROOT));
    }
}
