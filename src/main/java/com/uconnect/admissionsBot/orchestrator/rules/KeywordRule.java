package com.uconnect.admissionsBot.orchestrator.rules;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A (pattern, tag) pair. Patterns are written against normalized text: lower case, no accents.
 */
public record KeywordRule(Pattern pattern, String value) {

    public static KeywordRule of(String regex, String value) {
        return new KeywordRule(Pattern.compile(regex), value);
    }

    public boolean matches(String normalizedText) {
        return pattern.matcher(normalizedText).find();
    }

    /**
     * Value of the first rule in {@code rules} that matches, in list order.
     */
    public static Optional<String> firstMatch(List<KeywordRule> rules, String normalizedText) {
        return rules.stream()
                .filter(rule -> rule.matches(normalizedText))
                .map(KeywordRule::value)
                .findFirst();
    }
}
