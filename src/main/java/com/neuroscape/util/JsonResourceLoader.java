package com.neuroscape.util;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.function.Function;

/**
 * Utility class for loading JSON data from classpath resources.
 *
 * <p>Usage:
 * <pre>
 * JsonObject data = JsonResourceLoader.load(gson, "/levels.json");
 * List<LevelConfig> table = JsonResourceLoader.loadAndParse(gson, "/levels.json", LevelProgression::parseTable);
 * </pre>
 */
@Slf4j
public final class JsonResourceLoader {

    private JsonResourceLoader() {
        // Utility class - prevent instantiation
    }

    /**
     * Load a JSON object from the classpath.
     *
     * @param gson         the Gson instance for parsing
     * @param resourcePath the classpath resource path (e.g., "/levels.json")
     * @return the parsed JsonObject
     * @throws JsonLoadException if the resource is missing, unreadable or not a JSON object
     */
    public static JsonObject load(Gson gson, String resourcePath) {
        try (InputStream is = JsonResourceLoader.class.getResourceAsStream(resourcePath)) {
            if (is == null) {
                throw new JsonLoadException("Resource not found: " + resourcePath);
            }

            JsonObject result = gson.fromJson(
                    new InputStreamReader(is, StandardCharsets.UTF_8),
                    JsonObject.class
            );

            if (result == null) {
                throw new JsonLoadException("Parsed JSON is null for: " + resourcePath);
            }

            log.debug("Loaded JSON resource {}", resourcePath);
            return result;
        } catch (IOException e) {
            throw new JsonLoadException("I/O error reading " + resourcePath, e);
        } catch (JsonParseException e) {
            throw new JsonLoadException("Malformed JSON in " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Load a JSON resource and parse it using a custom parser function.
     *
     * @param gson         the Gson instance for parsing
     * @param resourcePath the classpath resource path
     * @param parser       function to turn the JsonObject into the desired type
     * @param <T>          the result type
     * @return the parsed result
     * @throws JsonLoadException if loading or parsing fails
     */
    public static <T> T loadAndParse(Gson gson, String resourcePath, Function<JsonObject, T> parser) {
        JsonObject json = load(gson, resourcePath);
        try {
            return parser.apply(json);
        } catch (RuntimeException e) {
            throw new JsonLoadException(
                    "Failed to parse JSON from " + resourcePath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Get a required array field from a JsonObject.
     *
     * @param root      the parent JsonObject
     * @param fieldName the field name
     * @return the array
     * @throws JsonLoadException if the field is missing or not an array
     */
    public static JsonArray getRequiredArray(JsonObject root, String fieldName) {
        JsonElement child = root.get(fieldName);
        if (child == null || !child.isJsonArray()) {
            throw new JsonLoadException("Required array '" + fieldName + "' not found in JSON");
        }
        return child.getAsJsonArray();
    }

    /**
     * Get a required integer field from a JsonObject.
     *
     * @throws JsonLoadException if the field is missing or not a number
     */
    public static int getRequiredInt(JsonObject root, String fieldName) {
        JsonElement child = root.get(fieldName);
        if (child == null || !child.isJsonPrimitive() || !child.getAsJsonPrimitive().isNumber()) {
            throw new JsonLoadException("Required number '" + fieldName + "' not found in JSON");
        }
        return child.getAsInt();
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
