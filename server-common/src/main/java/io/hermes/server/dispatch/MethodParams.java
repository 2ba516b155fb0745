package io.hermes.server.dispatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import io.hermes.spec.InvalidParamsError;
import org.jspecify.annotations.Nullable;

/**
 * The named parameter bag of a request, with typed accessors that validate as they read.
 * <p>
 * Every accessor throws {@link InvalidParamsError} when a required member is missing or a member
 * has the wrong JSON type. Numbers are accepted in any JSON numeric form.
 */
public final class MethodParams {

    private final Map<String, Object> values;

    public MethodParams(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public static MethodParams of(Map<String, Object> values) {
        return new MethodParams(values);
    }

    public boolean has(String name) {
        return values.get(name) != null;
    }

    public @Nullable Object get(String name) {
        return values.get(name);
    }

    public Object require(String name) {
        Object value = values.get(name);
        if (value == null) {
            throw new InvalidParamsError("Missing required parameter: " + name);
        }
        return value;
    }

    public String requireString(String name) {
        String value = optionalString(name);
        if (value == null || value.isBlank()) {
            throw new InvalidParamsError("Missing required parameter: " + name);
        }
        return value;
    }

    public @Nullable String optionalString(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String)) {
            throw wrongType(name, "a string");
        }
        return (String) value;
    }

    public String optionalString(String name, String defaultValue) {
        String value = optionalString(name);
        return value == null ? defaultValue : value;
    }

    public int requireInt(String name) {
        Integer value = optionalInt(name);
        if (value == null) {
            throw new InvalidParamsError("Missing required parameter: " + name);
        }
        return value;
    }

    public @Nullable Integer optionalInt(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number) || number.doubleValue() != Math.rint(number.doubleValue())) {
            throw wrongType(name, "an integer");
        }
        return number.intValue();
    }

    public @Nullable Long optionalLong(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Number number) || number.doubleValue() != Math.rint(number.doubleValue())) {
            throw wrongType(name, "an integer");
        }
        return number.longValue();
    }

    public double requireDouble(String name) {
        Object value = require(name);
        if (!(value instanceof Number number)) {
            throw wrongType(name, "a number");
        }
        return number.doubleValue();
    }

    public boolean optionalBoolean(String name, boolean defaultValue) {
        Object value = values.get(name);
        if (value == null) {
            return defaultValue;
        }
        if (!(value instanceof Boolean)) {
            throw wrongType(name, "a boolean");
        }
        return (Boolean) value;
    }

    @SuppressWarnings("unchecked")
    public @Nullable Map<String, Object> optionalMap(String name) {
        Object value = values.get(name);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map)) {
            throw wrongType(name, "an object");
        }
        return (Map<String, Object>) value;
    }

    public Map<String, Object> requireMap(String name) {
        Map<String, Object> value = optionalMap(name);
        if (value == null) {
            throw new InvalidParamsError("Missing required parameter: " + name);
        }
        return value;
    }

    public List<String> optionalStringList(String name) {
        Object value = values.get(name);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw wrongType(name, "an array of strings");
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object element : list) {
            if (!(element instanceof String)) {
                throw wrongType(name, "an array of strings");
            }
            result.add((String) element);
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> optionalMapList(String name) {
        Object value = values.get(name);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> list)) {
            throw wrongType(name, "an array of objects");
        }
        for (Object element : list) {
            if (!(element instanceof Map)) {
                throw wrongType(name, "an array of objects");
            }
        }
        return (List<Map<String, Object>>) list;
    }

    public List<Map<String, Object>> requireMapList(String name) {
        require(name);
        return optionalMapList(name);
    }

    /**
     * Reads an enum member through its wire value parser.
     *
     * @param name the parameter name
     * @param parser converts the wire value, throwing {@link IllegalArgumentException} for unknown values
     * @param defaultValue returned when the member is absent
     * @return the parsed value
     */
    public <E extends Enum<E>> @Nullable E optionalEnum(String name, Function<String, E> parser, @Nullable E defaultValue) {
        String value = optionalString(name);
        if (value == null) {
            return defaultValue;
        }
        try {
            return parser.apply(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidParamsError("Invalid value for parameter " + name + ": " + value);
        }
    }

    public <E extends Enum<E>> E requireEnum(String name, Function<String, E> parser) {
        E value = optionalEnum(name, parser, null);
        if (value == null) {
            throw new InvalidParamsError("Missing required parameter: " + name);
        }
        return value;
    }

    /**
     * Returns the parameters of a nested object member.
     */
    public MethodParams nested(String name) {
        return new MethodParams(requireMap(name));
    }

    public Map<String, Object> asMap() {
        return values;
    }

    private static InvalidParamsError wrongType(String name, String expected) {
        return new InvalidParamsError("Parameter '" + name + "' must be " + expected);
    }
}
