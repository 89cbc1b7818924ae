package com.mimecast.mailbuilder.config;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;

import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Configuration foundation.
 *
 * <p>Map backed container providing type safe accessors for configuration values.
 * <br>Configuration files are JSON5 flavoured JSON and are read leniently so comments are permitted.
 */
public class ConfigFoundation {

    /**
     * Map type used for deserialization.
     */
    private static final Type MAP_TYPE = new TypeToken<Map<String, Object>>() {}.getType();

    /**
     * Configuration map.
     */
    protected final Map<String, Object> map;

    /**
     * Constructs a new ConfigFoundation instance with an empty map.
     */
    public ConfigFoundation() {
        this.map = new HashMap<>();
    }

    /**
     * Constructs a new ConfigFoundation instance with given map.
     *
     * @param map Configuration map.
     */
    public ConfigFoundation(Map<String, Object> map) {
        this.map = map != null ? map : new HashMap<>();
    }

    /**
     * Reads a configuration file into a map.
     *
     * @param path File path.
     * @return Configuration map.
     * @throws IOException Unable to read or parse file.
     */
    protected static Map<String, Object> readFile(String path) throws IOException {
        return readJson(new String(Files.readAllBytes(Paths.get(path)), StandardCharsets.UTF_8));
    }

    /**
     * Parses a JSON5 string into a map.
     *
     * @param json JSON string.
     * @return Configuration map.
     * @throws IOException Unable to parse.
     */
    protected static Map<String, Object> readJson(String json) throws IOException {
        try (Reader reader = new StringReader(json)) {
            JsonReader jsonReader = new JsonReader(reader);
            jsonReader.setLenient(true);

            Map<String, Object> parsed = new Gson().fromJson(jsonReader, MAP_TYPE);
            return parsed != null ? parsed : new HashMap<>();

        } catch (JsonParseException e) {
            throw new IOException("Unable to parse configuration: " + e.getMessage(), e);
        }
    }

    /**
     * Gets the underlying map.
     *
     * @return Map instance.
     */
    public Map<String, Object> getMap() {
        return map;
    }

    /**
     * Checks if property exists.
     *
     * @param name Property name.
     * @return Boolean.
     */
    public boolean hasProperty(String name) {
        return map.containsKey(name);
    }

    /**
     * Gets string property.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return String.
     */
    public String getStringProperty(String name, String def) {
        Object value = map.get(name);
        return value != null ? String.valueOf(value) : def;
    }

    /**
     * Gets long property.
     * <p>Gson reads every JSON number as double so any Number is accepted.
     *
     * @param name Property name.
     * @param def  Default value.
     * @return Long.
     */
    public Long getLongProperty(String name, Long def) {
        Object value = map.get(name);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        if (value instanceof String) {
            try {
                return Long.parseLong(((String) value).trim());
            } catch (NumberFormatException e) {
                return def;
            }
        }
        return def;
    }
}
