package io.hermes.spec;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How the tasks of a workflow are wired together when the workflow is built.
 */
public enum CoordinationPattern {
    SEQUENTIAL,
    PARALLEL,
    PIPELINE,
    FANOUT,
    CUSTOM;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static CoordinationPattern fromValue(String value) {
        for (CoordinationPattern candidate : values()) {
            if (candidate.value().equalsIgnoreCase(value)) {
                return candidate;
            }
        }
        throw new IllegalArgumentException("Unknown CoordinationPattern: " + value);
    }
}
