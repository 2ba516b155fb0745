package io.hermes.spec;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Defines the lifecycle states of a {@link Task}.
 * <p>
 * <b>Transitional States:</b>
 * <ul>
 *   <li><b>CREATED:</b> the task exists but nobody works on it yet</li>
 *   <li><b>ASSIGNED:</b> an agent has been chosen; reassignment is still allowed</li>
 *   <li><b>RUNNING:</b> the agent is working on the task and may report progress</li>
 * </ul>
 * <p>
 * <b>Terminal States:</b>
 * <ul>
 *   <li><b>COMPLETED:</b> finished with output, reachable only from RUNNING</li>
 *   <li><b>FAILED:</b> finished with an error</li>
 *   <li><b>CANCELLED:</b> cancelled explicitly, by a workflow or at shutdown</li>
 * </ul>
 * <p>
 * A terminal state accepts no further transition, see {@link #canTransitionTo(TaskState)}.
 */
public enum TaskState {
    CREATED(false),
    ASSIGNED(false),
    RUNNING(false),
    COMPLETED(true),
    FAILED(true),
    CANCELLED(true);

    private final boolean isFinal;

    TaskState(boolean isFinal) {
        this.isFinal = isFinal;
    }

    /**
     * Determines whether this state is a terminal (final) state.
     *
     * @return {@code true} if this is a terminal state, {@code false} else.
     */
    public boolean isFinal() {
        return isFinal;
    }

    /**
     * Returns whether a task in this state has been started at some point.
     */
    public boolean hasStarted() {
        return this == RUNNING || this == COMPLETED;
    }

    /**
     * Returns the states directly reachable from this state.
     *
     * @return the allowed target states, empty for terminal states
     */
    public Set<TaskState> allowedTransitions() {
        return switch (this) {
            case CREATED, ASSIGNED -> EnumSet.of(ASSIGNED, RUNNING, FAILED, CANCELLED);
            case RUNNING -> EnumSet.of(COMPLETED, FAILED, CANCELLED);
            case COMPLETED, FAILED, CANCELLED -> EnumSet.noneOf(TaskState.class);
        };
    }

    public boolean canTransitionTo(TaskState target) {
        return allowedTransitions().contains(target);
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TaskState fromValue(String value) {
        for (TaskState state : values()) {
            if (state.value().equalsIgnoreCase(value)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown task state: " + value);
    }
}
