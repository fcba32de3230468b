package com.uconnect.admissionsBot.orchestrator.model;

import com.uconnect.admissionsBot.util.TextNormalizer;

import java.util.Arrays;
import java.util.Optional;

/**
 * The three lookups the academic data provider answers.
 */
public enum AcademicEndpoint {

    FACULTIES("facultades"),
    PROGRAMS("programas"),
    CURRICULUM("pensum");

    private final String spanishName;

    AcademicEndpoint(String spanishName) {
        this.spanishName = spanishName;
    }

    public String getSpanishName() {
        return spanishName;
    }

    /**
     * Accepts the enum name or the Spanish endpoint name, with or without a leading slash.
     */
    public static Optional<AcademicEndpoint> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String candidate = TextNormalizer.normalize(name).replace("/", "");
        return Arrays.stream(values())
                .filter(endpoint -> endpoint.name().equalsIgnoreCase(candidate)
                        || endpoint.spanishName.equals(candidate))
                .findFirst();
    }
}
