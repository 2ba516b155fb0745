package io.hermes.spec;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Turn discipline of a conversation. Only {@link #FREE_FORM} accepts messages without a turn.
 */
public enum TurnTakingMode {
    FREE_FORM,
    ROUND_ROBIN,
    MODERATED;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TurnTakingMode fromValue(String value) {
        for (TurnTakingMode candidate : values()) {
            if (candidate.value().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown TurnTakingMode: " + value);
    }
}
