package com.cybershieldx.agent.store;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Persistent key/value map that survives process restarts.
 * Every mutating call is one atomic write; concurrent writers are last-writer-wins.
 */
public interface ConfigStore {

    /**
     * Get a value, or the store default for the key, or null
     */
    JsonNode get(String key);

    default String getString(String key) {
        JsonNode value = get(key);
        return value == null || value.isNull() ? null : value.asText();
    }

    default String getString(String key, String defaultValue) {
        String value = getString(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    default boolean getBoolean(String key, boolean defaultValue) {
        JsonNode value = get(key);
        return value == null || value.isNull() ? defaultValue : value.asBoolean(defaultValue);
    }

    /**
     * Whether the key has been written (defaults do not count)
     */
    boolean contains(String key);

    void set(String key, Object value);

    void delete(String key);

    /**
     * Apply several changes in one write. A null value deletes the key.
     */
    void apply(Map<String, ?> changes);

    /**
     * Copy of all written keys, without defaults
     */
    Map<String, JsonNode> snapshot();
}
