package com.uconnect.admissionsBot.retrieval;

import com.uconnect.admissionsBot.util.TextNormalizer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Widens query keywords with the vocabulary program documents actually use, so a question about
 * "metas" still finds the "objetivos" section.
 */
public final class KeywordExpander {

    private record Expansion(List<String> triggers, List<String> related) {

        boolean triggeredBy(String keyword) {
            return triggers.stream().anyMatch(keyword::contains);
        }
    }

    private static final List<Expansion> EXPANSIONS = List.of(
            new Expansion(List.of("objetivo"), List.of("objetivos", "meta", "metas", "proposito", "fin")),
            new Expansion(List.of("competencia"), List.of("competencias", "habilidad", "habilidades", "capacidad")),
            new Expansion(List.of("perfil"), List.of("perfil", "profesional", "ocupacional", "egresado")),
            new Expansion(List.of("mision", "vision"), List.of("mision", "vision", "proposito")),
            new Expansion(List.of("campo"), List.of("campos", "ocupacional", "laboral", "trabajo")),
            new Expansion(List.of("linea", "investigacion"), List.of("lineas", "investigacion", "investigativas", "investigar")),
            new Expansion(List.of("principio"), List.of("principios", "valores", "valor")),
            new Expansion(List.of("valor"), List.of("valores", "principios", "principio"))
    );

    private static final Set<String> RELATED_TERMS = EXPANSIONS.stream()
            .flatMap(expansion -> expansion.related().stream())
            .collect(Collectors.toUnmodifiableSet());

    private KeywordExpander() {
        // Utility class
    }

    /**
     * Keywords of {@code query} followed by their related terms, deduplicated in insertion order.
     */
    public static List<String> expandQuery(String query) {
        return expand(TextNormalizer.extractKeywords(query));
    }

    public static List<String> expand(List<String> keywords) {
        Set<String> expanded = new LinkedHashSet<>();
        for (String keyword : keywords) {
            expanded.add(keyword);
            for (Expansion expansion : EXPANSIONS) {
                if (expansion.triggeredBy(keyword)) {
                    expanded.addAll(expansion.related());
                }
            }
        }
        return new ArrayList<>(expanded);
    }

    /**
     * Whether {@code keyword} is one of the expansion terms. These are whole words and are only
     * matched as such, so "fin" does not hit "define".
     */
    public static boolean isRelatedTerm(String keyword) {
        return RELATED_TERMS.contains(keyword);
    }
}
