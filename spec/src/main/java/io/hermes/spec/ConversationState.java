package io.hermes.spec;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a conversation; {@link #ENDED} is terminal.
 */
public enum ConversationState {
    ACTIVE,
    ENDED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConversationState fromValue(String value) {
        for (ConversationState candidate : values()) {
            if (candidate.value().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ConversationState: " + value);
    }
}
