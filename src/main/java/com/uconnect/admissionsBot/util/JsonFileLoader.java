package com.uconnect.admissionsBot.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Utility class for loading JSON datasets from the classpath.
 * Datasets are UTF-8 encoded, since program and faculty names carry Spanish accents.
 */
public class JsonFileLoader {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    private JsonFileLoader() {
        // Utility class
    }

    /**
     * Loads a classpath resource as a UTF-8 String.
     * 
     * @param resourcePath The path to the JSON file (e.g., "data/programs.json")
     * @return The JSON content as a String
     * @throws IOException if the file cannot be read or doesn't exist
     */
    public static String loadAsString(String resourcePath) throws IOException {
        try (InputStream inputStream = JsonFileLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
            if (inputStream == null) {
                throw new IOException("Resource not found: " + resourcePath);
            }
            return new String(inputStream.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * Loads a classpath resource as a JSON array.
     * 
     * @param resourcePath The path to the JSON file
     * @return The array node
     * @throws IOException if the file cannot be read, is not valid JSON, or is not an array
     */
    public static JsonNode loadAsArray(String resourcePath) throws IOException {
        JsonNode node = objectMapper.readTree(loadAsString(resourcePath));
        if (!node.isArray()) {
            throw new IOException("JSON file " + resourcePath + " does not contain an array");
        }
        return node;
    }
}
