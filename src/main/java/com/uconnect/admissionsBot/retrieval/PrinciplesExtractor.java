package com.uconnect.admissionsBot.retrieval;

import com.uconnect.admissionsBot.retrieval.model.ProgramPrinciple;
import com.uconnect.admissionsBot.util.TextNormalizer;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the "principles and values" section of a program document into named items.
 * 
 * The section starts at the sentence that introduces the program's principles (not the table of
 * contents entry) and ends at the next numbered title.
 */
@Component
public class PrinciplesExtractor {

    static final int MAX_PRINCIPLES = 15;
    static final int MAX_SECTION_LENGTH = 8_000;
    static final int MAX_DESCRIPTION_LENGTH = 500;

    private static final Pattern SECTION_START = Pattern.compile(
            "los\\s+principios\\s+y\\s+valores\\s+que\\s+se\\s+acogen\\s+para\\s+el\\s+programa[^:]*:\\s*",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    private static final Pattern SECTION_END = Pattern.compile("\\n\\d+\\.\\s+[A-ZÁÉÍÓÚÑ]");

    // "Responsabilidad Social: descripcion..." with a capitalized name of one or more words.
    private static final Pattern ITEM = Pattern.compile(
            "^([A-ZÁÉÍÓÚÑ][a-záéíóúñ]+(?:\\s+(?:y\\s+)?[A-ZÁÉÍÓÚÑ][a-záéíóúñ]+)*)[:.]\\s+(.+)$");

    private static final Pattern TRAILING_PAGE_NUMBER = Pattern.compile("\\s\\d+\\s*$");
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Set<String> EXCLUDED_NAMES = Set.of("Laboratorio", "Facultad", "Departamento", "Coordinador");

    /**
     * True when the question is about the program's principles or values.
     */
    public boolean shouldParse(String query) {
        String normalized = TextNormalizer.normalizeForOcr(query);
        return normalized.contains("principio")
                || normalized.contains("valor")
                || (normalized.contains("cuales") && normalized.contains("rigen"));
    }

    public List<ProgramPrinciple> extract(String rawText) {
        List<ProgramPrinciple> principles = new ArrayList<>();
        if (rawText == null || rawText.isBlank()) {
            return principles;
        }

        Matcher start = SECTION_START.matcher(rawText);
        if (!start.find()) {
            return principles;
        }
        int from = start.end();
        Matcher end = SECTION_END.matcher(rawText);
        int to = end.find(from) ? end.start() : Math.min(rawText.length(), from + MAX_SECTION_LENGTH);

        for (String line : rawText.substring(from, to).split("\\n")) {
            if (principles.size() >= MAX_PRINCIPLES) {
                break;
            }
            Matcher item = ITEM.matcher(line.trim());
            if (!item.matches()) {
                continue;
            }
            String name = item.group(1).trim();
            String description = cleanDescription(item.group(2));
            if (isValid(name, description)) {
                principles.add(new ProgramPrinciple(name, TextNormalizer.truncate(description, MAX_DESCRIPTION_LENGTH)));
            }
        }
        return principles;
    }

    /**
     * Numbered list block placed ahead of the raw excerpt; empty when nothing was parsed.
     */
    public String formatForContext(List<ProgramPrinciple> principles) {
        if (principles.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder("PRINCIPIOS Y VALORES DEL PROGRAMA:\n\n");
        for (int i = 0; i < principles.size(); i++) {
            ProgramPrinciple principle = principles.get(i);
            builder.append(i + 1).append(". ").append(principle.name()).append(": ")
                    .append(principle.description()).append("\n\n");
        }
        return builder.toString();
    }

    private static boolean isValid(String name, String description) {
        return name.length() >= 4
                && name.length() <= 45
                && description.length() > 20
                && !LEADING_NUMBER.matcher(description).find()
                && !EXCLUDED_NAMES.contains(name);
    }

    private static String cleanDescription(String description) {
        String cleaned = TRAILING_PAGE_NUMBER.matcher(description).replaceAll("");
        return WHITESPACE.matcher(cleaned).replaceAll(" ").trim();
    }
}
