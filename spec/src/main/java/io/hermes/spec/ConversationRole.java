package io.hermes.spec;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Role of a conversation participant. Observers read but never send.
 */
public enum ConversationRole {
    MODERATOR,
    PARTICIPANT,
    OBSERVER;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConversationRole fromValue(String value) {
        for (ConversationRole candidate : values()) {
            if (candidate.value().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown ConversationRole: " + value);
    }
}
