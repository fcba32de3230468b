package com.uconnect.admissionsBot.repository;

import com.uconnect.admissionsBot.util.JsonFileLoader;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Read-only catalog of the academic reference datasets, exposed as BSON documents so the
 * same shape serves a MongoDB-backed deployment.
 * 
 * Each collection maps to a JSON array in resources/data and is parsed once on first use.
 */
@Repository
public class AcademicCatalogRepository {

    public static final String FACULTIES = "facultades";
    public static final String PROGRAMS = "programas";
    public static final String CURRICULUM = "pensum";
    public static final String PROGRAM_DOCUMENTS = "pep_profiles";

    private static final Logger log = LoggerFactory.getLogger(AcademicCatalogRepository.class);
    private static final ObjectMapper objectMapper = new ObjectMapper();

    // Map collection names to JSON file paths in resources/data
    private static final Map<String, String> COLLECTION_TO_FILE_MAP = Map.of(
        FACULTIES, "data/faculties.json",
        PROGRAMS, "data/programs.json",
        CURRICULUM, "data/curriculum.json",
        PROGRAM_DOCUMENTS, "data/program-documents.json"
    );

    private final Map<String, List<Document>> loaded = new ConcurrentHashMap<>();

    /**
     * Returns every document of a collection. Unknown or unreadable collections are empty.
     * 
     * @param collection The collection name (maps to a JSON file)
     * @return Documents in file order
     */
    public List<Document> findAll(String collection) {
        String filePath = COLLECTION_TO_FILE_MAP.get(collection);
        if (filePath == null) {
            log.warn("Unknown collection: {}", collection);
            return List.of();
        }
        return loaded.computeIfAbsent(collection, key -> load(filePath));
    }

    /**
     * Finds the first document whose {@code field} equals {@code value}.
     * 
     * @return The matching Document, or null if not found
     */
    public Document findFirstBy(String collection, String field, String value) {
        return findAll(collection).stream()
                .filter(document -> value != null && value.equals(document.getString(field)))
                .findFirst()
                .orElse(null);
    }

    private List<Document> load(String filePath) {
        try {
            JsonNode jsonArray = JsonFileLoader.loadAsArray(filePath);
            List<Document> documents = new ArrayList<>(jsonArray.size());
            for (JsonNode jsonObject : jsonArray) {
                // Document.parse keeps nested arrays and objects intact
                documents.add(Document.parse(objectMapper.writeValueAsString(jsonObject)));
            }
            log.info("Loaded catalog collection - file: {}, documents: {}", filePath, documents.size());
            return List.copyOf(documents);
        } catch (IOException e) {
            log.error("Failed to load JSON file: {}", filePath, e);
            return List.of();
        }
    }
}
