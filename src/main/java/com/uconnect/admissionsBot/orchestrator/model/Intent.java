package com.uconnect.admissionsBot.orchestrator.model;

import com.uconnect.admissionsBot.util.TextNormalizer;

import java.util.Arrays;
import java.util.Optional;

/**
 * Classified purpose of a user utterance.
 * 
 * Each constant also carries the Spanish label used by the language model prompts, so
 * that AI replies may name intents either way.
 */
public enum Intent {

    GREETING("SALUDO"),
    FAREWELL("DESPEDIDA"),
    ADMISSIONS_INFO("ADMISION"),
    FACULTY_INFO("INFO_FACULTAD"),
    PROGRAM_INFO("INFO_PROGRAMA"),
    COURSE_INFO("INFO_MATERIA"),
    CURRICULUM_INFO("INFO_PENSUM"),
    LIST_FACULTIES("LISTAR_FACULTADES"),
    LIST_PROGRAMS("LISTAR_PROGRAMAS"),
    LIST_COURSES("LISTAR_MATERIAS"),
    CREDITS("CREDITOS"),
    SCHEDULE_TRACK("JORNADA"),
    GENERAL("GENERAL");

    private final String label;

    Intent(String label) {
        this.label = label;
    }

    public boolean isListing() {
        return this == LIST_FACULTIES || this == LIST_PROGRAMS || this == LIST_COURSES;
    }

    public boolean isConversational() {
        return this == GREETING || this == FAREWELL;
    }

    /**
     * Resolves an intent from its enum name or Spanish label, ignoring case and accents.
     * The bare Spanish "LISTAR" is read as a program listing. Unknown labels yield empty.
     */
    public static Optional<Intent> fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String candidate = TextNormalizer.normalize(value).toUpperCase().replace(' ', '_');
        if ("LISTAR".equals(candidate)) {
            return Optional.of(LIST_PROGRAMS);
        }
        return Arrays.stream(values())
                .filter(intent -> intent.name().equals(candidate) || intent.label.equals(candidate))
                .findFirst();
    }
}
