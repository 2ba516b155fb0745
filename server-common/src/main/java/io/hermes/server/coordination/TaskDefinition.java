package io.hermes.server.coordination;

import java.util.Map;

import io.hermes.spec.InvalidParamsError;
import io.hermes.util.Utils;
import org.jspecify.annotations.Nullable;

/**
 * Definition of one workflow task. Retries re-create the task from the same definition.
 *
 * @param id the workflow task id, generated as {@code task-<n>} when absent
 * @param name the task name, defaults to the workflow task id
 * @param description optional description
 * @param inputData input of the task
 * @param metadata metadata of the task
 */
public record TaskDefinition(@Nullable String id, @Nullable String name, @Nullable String description,
                             Map<String, Object> inputData, Map<String, Object> metadata) {

    public TaskDefinition {
        inputData = Utils.copyOf(inputData);
        metadata = Utils.copyOf(metadata);
    }

    public static TaskDefinition of(String id, String name) {
        return new TaskDefinition(id, name, null, Map.of(), Map.of());
    }

    public TaskDefinition withId(String newId) {
        return new TaskDefinition(newId, name, description, inputData, metadata);
    }

    public String effectiveName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return id == null ? "task" : id;
    }

    /**
     * Reads a definition from its JSON object form: {@code id}, {@code name}, {@code description},
     * {@code input_data}, {@code metadata}.
     *
     * @throws InvalidParamsError if a member has the wrong type
     */
    public static TaskDefinition fromMap(Map<String, Object> map) {
        return new TaskDefinition(
                string(map, "id"),
                string(map, "name"),
                string(map, "description"),
                object(map, "input_data"),
                object(map, "metadata"));
    }

    private static @Nullable String string(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value != null && !(value instanceof String)) {
            throw new InvalidParamsError("Task definition member '" + key + "' must be a string");
        }
        return (String) value;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> object(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Map.of();
        }
        if (!(value instanceof Map)) {
            throw new InvalidParamsError("Task definition member '" + key + "' must be an object");
        }
        return (Map<String, Object>) value;
    }
}
