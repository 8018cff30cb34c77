package com.deadswitch.core;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.ToNumberPolicy;
import com.google.gson.reflect.TypeToken;

import java.lang.reflect.Type;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * JSON serialization of job arguments.
 *
 * <p>Arguments are a flat map of primitive values. Numbers without a fractional part are
 * read back as {@link Long} so ids survive the round trip unchanged.</p>
 */
public final class JobArgs {
    // Shared Gson instance - thread-safe
    private static final Gson gson = new GsonBuilder()
            .setObjectToNumberStrategy(ToNumberPolicy.LONG_OR_DOUBLE)
            .serializeNulls()
            .create();

    private static final Type MAP_TYPE = new TypeToken<LinkedHashMap<String, Object>>() { }.getType();

    private JobArgs() {
    }

    /**
     * Serialize arguments for storage.
     *
     * @param args the arguments (may be null)
     * @return JSON object text, "{}" for null or empty arguments
     */
    public static String toJson(Map<String, Object> args) {
        if (args == null || args.isEmpty()) {
            return "{}";
        }
        return gson.toJson(args);
    }

    /**
     * Deserialize stored arguments.
     *
     * @param json JSON object text (null or blank yields an empty map)
     * @return the arguments
     * @throws JsonParseException if the text is not a JSON object
     */
    public static Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        Map<String, Object> args = gson.fromJson(json, MAP_TYPE);
        if (args == null) {
            throw new JsonParseException("Job args are not a JSON object: " + json);
        }
        return args;
    }

    /**
     * Read a required integral argument.
     *
     * @throws IllegalArgumentException if the key is missing or not numeric
     */
    public static long getLong(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong((String) value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Job arg '" + key + "' is not a number: " + value, e);
            }
        }
        throw new IllegalArgumentException("Job arg '" + key + "' is missing");
    }

    /**
     * Read an optional string argument.
     *
     * @return the value as a string, or {@code defaultValue} when absent
     */
    public static String getString(Map<String, Object> args, String key, String defaultValue) {
        Object value = args.get(key);
        return value == null ? defaultValue : value.toString();
    }
}
