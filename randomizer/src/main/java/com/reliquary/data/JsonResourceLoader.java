package com.reliquary.data;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import lombok.extern.slf4j.Slf4j;

import javax.annotation.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;

/**
 * Utility class for loading JSON data from classpath resources.
 *
 * <p>Usage:
 * <pre>
 * JsonObject data = JsonResourceLoader.load(gson, "/data/relics.json");
 * CatalogData catalog = JsonResourceLoader.loadAs(gson, "/data/relics.json", CatalogData.class);
 * </pre>
 */
@Slf4j
public final class JsonResourceLoader {

    private JsonResourceLoader() {
        // Utility class - prevent instantiation
    }

    /**
     * Load a JSON object resource.
     *
     * @param gson         the Gson instance for parsing
     * @param resourcePath the classpath resource path (e.g., "/data/relics.json")
     * @return the parsed JsonObject
     * @throws JsonLoadException if the resource is missing or unreadable
     */
    public static JsonObject load(Gson gson, String resourcePath) {
        return loadAs(gson, resourcePath, JsonObject.class);
    }

    /**
     * Load a JSON resource and bind it to a type.
     *
     * @param gson         the Gson instance for parsing
     * @param resourcePath the classpath resource path
     * @param type         the target type
     * @param <T>          the result type
     * @return the parsed value, never null
     * @throws JsonLoadException if the resource is missing, unreadable or empty
     */
    public static <T> T loadAs(Gson gson, String resourcePath, Class<T> type) {
        try (InputStream is = JsonResourceLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new JsonLoadException("Resource not found: " + resourcePath);
            }
            try (Reader reader = new InputStreamReader(is, StandardCharsets.UTF_8)) {
                T result = gson.fromJson(reader, type);
                if (result == null) {
                    throw new JsonLoadException("Parsed JSON is null for: " + resourcePath);
                }
                return result;
            }
        } catch (IOException e) {
            throw new JsonLoadException("I/O error reading " + resourcePath, e);
        } catch (JsonParseException e) {
            throw new JsonLoadException("Malformed JSON in " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Try to load a JSON object resource. Returns null if the resource doesn't
     * exist or cannot be parsed.
     */
    @Nullable
    public static JsonObject tryLoadOptional(Gson gson, String resourcePath) {
        try {
            return load(gson, resourcePath);
        } catch (JsonLoadException e) {
            log.debug("Optional JSON resource not loaded: {} ({})", resourcePath, e.getMessage());
            return null;
        }
    }

    /**
     * Get a required array field.
     *
     * @throws JsonLoadException if the field is missing or not an array
     */
    public static JsonArray getRequiredArray(JsonObject root, String fieldName) {
        JsonElement element = root.get(fieldName);
        if (element == null || !element.isJsonArray()) {
            throw new JsonLoadException("Required array '" + fieldName + "' not found in JSON");
        }
        return element.getAsJsonArray();
    }

    /**
     * Get a required string field.
     *
     * @throws JsonLoadException if the field is missing or not a string
     */
    public static String getRequiredString(JsonObject root, String fieldName) {
        JsonElement element = root.get(fieldName);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new JsonLoadException("Required string '" + fieldName + "' not found in JSON");
        }
        return element.getAsString();
    }

    /**
     * Exception thrown when JSON loading fails.
     */
    public static class JsonLoadException extends RuntimeException {
        public JsonLoadException(String message) {
            super(message);
        }

        public JsonLoadException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
