package com.acme.wizard.core;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.LinkedHashMap;
import java.util.Map;

public final class Jsons {
    private static final ObjectMapper M = new ObjectMapper().registerModule(new JavaTimeModule());
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private Jsons() {
    }

    public static ObjectMapper mapper() {
        return M;
    }

    public static String toJson(Object o) {
        try {
            return M.writeValueAsString(o);
        } catch (Exception e) {
            throw new PermanentException("Failed to serialize " + typeName(o) + " to JSON", e);
        }
    }

    public static <T> T fromJson(String json, Class<T> clazz) {
        try {
            return M.readValue(json, clazz);
        } catch (Exception e) {
            throw new PermanentException("Failed to parse JSON as " + clazz.getSimpleName(), e);
        }
    }

    public static <T> T fromJson(String json, TypeReference<T> type) {
        try {
            return M.readValue(json, type);
        } catch (Exception e) {
            throw new PermanentException("Failed to parse JSON as " + type.getType(), e);
        }
    }

    /**
     * Parse a JSON object into an insertion-ordered map. Blank input yields an empty map.
     */
    public static Map<String, Object> toMap(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        return fromJson(json, MAP_TYPE);
    }

    /**
     * Convert an object to a Map<String, Object> by serializing through Jackson. Useful for
     * turning step records into context values.
     */
    public static Map<String, Object> toMap(Object o) {
        try {
            return M.convertValue(o, MAP_TYPE);
        } catch (Exception e) {
            throw new PermanentException("Failed to convert " + typeName(o) + " to map", e);
        }
    }

    /**
     * Structural copy of a JSON-compatible map. Nested maps and lists are not shared with the
     * source afterwards.
     */
    public static Map<String, Object> deepCopy(Map<String, Object> source) {
        if (source == null) {
            return new LinkedHashMap<>();
        }
        return toMap(toJson(source));
    }

    /**
     * Convert a value into the plain JSON structure it has after being written and read back
     * (records become maps, collections become lists, numbers take the type Jackson parses them
     * into, so a Long that fits an int becomes an Integer and a Float a Double).
     */
    public static Object normalize(Object value) {
        if (value == null || value instanceof String || value instanceof Boolean) {
            return value;
        }
        String json;
        try {
            json = M.writeValueAsString(value);
        } catch (Exception e) {
            throw new PermanentException("Value of type " + typeName(value) + " is not JSON compatible", e);
        }
        return fromJson(json, Object.class);
    }

    private static String typeName(Object o) {
        return o == null ? "null" : o.getClass().getSimpleName();
    }
}
