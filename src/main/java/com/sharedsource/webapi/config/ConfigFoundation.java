package com.sharedsource.webapi.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;

import java.io.IOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Map backed container with typed accessors.
 * <br>Files are JSON5 and parsed leniently so comments and unquoted keys are accepted.
 * <br>Keys may be dotted paths into nested maps, {@code credentials.username} for example.
 */
@SuppressWarnings("unchecked")
public class ConfigFoundation {
    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    /**
     * Configuration map.
     */
    protected Map<String, Object> map = new HashMap<>();

    /**
     * Constructs a new ConfigFoundation instance.
     */
    public ConfigFoundation() {
        // Empty configuration.
    }

    /**
     * Constructs a new ConfigFoundation instance.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        if (map != null) {
            this.map = map;
        }
    }

    /**
     * Constructs a new ConfigFoundation instance with configuration path.
     *
     * @param path Path to configuration file.
     * @throws IOException Unable to read or parse file.
     */
    public ConfigFoundation(String path) throws IOException {
        Path file = Paths.get(path);
        if (!Files.isRegularFile(file)) {
            throw new IOException("Configuration file not found: " + path);
        }

        String content = Files.readString(file, StandardCharsets.UTF_8);
        try {
            Map<String, Object> parsed = new Gson().fromJson(content, MAP_TYPE);
            if (parsed != null) {
                this.map = parsed;
            }
        } catch (JsonParseException e) {
            throw new IOException("Invalid configuration file: " + path, e);
        }
    }

    /**
     * Checks if property exists.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return getProperty(name) != null;
    }

    /**
     * Gets property as Object.
     *
     * @param name Property name.
     * @return Object or null.
     */
    public Object getProperty(String name) {
        if (map.containsKey(name)) {
            return map.get(name);
        }

        Object current = map;
        for (String part : name.split("\\.")) {
            if (!(current instanceof Map)) {
                return null;
            }
            current = ((Map<String, Object>) current).get(part);
        }

        return current;
    }

    /**
     * Gets String property.
     *
     * @param name Property name.
     * @return String or null.
     */
    public String getStringProperty(String name) {
        return getStringProperty(name, null);
    }

    /**
     * Gets String property with default.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return String.
     */
    public String getStringProperty(String name, String defaultValue) {
        Object value = getProperty(name);
        return value != null ? String.valueOf(value) : defaultValue;
    }

    /**
     * Gets Boolean property with default.
     * <p>Accepts booleans and the strings true and false.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Boolean.
     */
    public boolean getBooleanProperty(String name, boolean defaultValue) {
        Object value = getProperty(name);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return defaultValue;
    }

    /**
     * Gets Long property with default.
     * <p>Gson reads all numbers as doubles, those are truncated.
     *
     * @param name         Property name.
     * @param defaultValue Default value.
     * @return Long.
     */
    public long getLongProperty(String name, long defaultValue) {
        Object value = getProperty(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return defaultValue;
            }
        }
        return defaultValue;
    }

    /**
     * Gets Map property.
     *
     * @param name Property name.
     * @return Map, empty if missing.
     */
    public Map<String, Object> getMapProperty(String name) {
        Object value = getProperty(name);
        return value instanceof Map ? (Map<String, Object>) value : new HashMap<>();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{keys=" + map.keySet() + "}";
    }
}
