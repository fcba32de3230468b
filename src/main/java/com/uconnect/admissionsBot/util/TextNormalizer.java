package com.uconnect.admissionsBot.util;

import java.text.Normalizer;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Case and accent insensitive text helpers shared by extraction, data lookups and retrieval.
 * 
 * All methods are pure and null-tolerant: a null input is treated as the empty string.
 */
public final class TextNormalizer {

    private static final Pattern COMBINING_MARKS = Pattern.compile("[\\u0300-\\u036f]");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern NON_WORD = Pattern.compile("[^\\w\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final String ELLIPSIS = "...";

    /**
     * Spanish function words and request fillers that carry no search value.
     */
    private static final Set<String> STOP_WORDS = Set.of(
            "el", "la", "los", "las", "un", "una", "unos", "unas",
            "de", "del", "al", "a", "en", "con", "por", "para",
            "que", "cual", "cuales", "como", "donde", "cuando",
            "es", "son", "tiene", "tienen", "hay", "puede", "pueden",
            "me", "te", "se", "nos", "les", "lo", "le",
            "y", "o", "pero", "si", "no", "mas", "menos",
            "este", "esta", "estos", "estas", "ese", "esa",
            "mi", "tu", "su", "mis", "tus", "sus",
            "quiero", "necesito", "busco", "quisiera", "podria", "puedo",
            "saber", "conocer", "informacion", "sobre", "acerca"
    );

    private TextNormalizer() {
        // Utility class
    }

    /**
     * Lower-cases, strips combining accent marks and trims. Idempotent.
     */
    public static String normalize(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text.toLowerCase(Locale.ROOT), Normalizer.Form.NFD);
        return COMBINING_MARKS.matcher(decomposed).replaceAll("").trim();
    }

    /**
     * Normalization tolerant to OCR noise: punctuation becomes whitespace and runs of
     * whitespace collapse to a single space.
     */
    public static String normalizeForOcr(String text) {
        String normalized = NON_ALPHANUMERIC.matcher(normalize(text)).replaceAll(" ");
        return WHITESPACE.matcher(normalized).replaceAll(" ").trim();
    }

    /**
     * Levenshtein based similarity in [0, 1] over normalized inputs.
     */
    public static double similarity(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        if (left.equals(right)) {
            return 1.0;
        }
        if (left.isEmpty() || right.isEmpty()) {
            return 0.0;
        }
        int distance = levenshtein(left, right);
        return 1.0 - ((double) distance / Math.max(left.length(), right.length()));
    }

    /**
     * True when either normalized string contains the other.
     */
    public static boolean fuzzyContains(String a, String b) {
        String left = normalize(a);
        String right = normalize(b);
        return left.contains(right) || right.contains(left);
    }

    /**
     * Search keywords of a free-text query: normalized tokens longer than two characters
     * that are not stop words, deduplicated in order of first appearance.
     */
    public static List<String> extractKeywords(String text) {
        String cleaned = NON_WORD.matcher(normalize(text)).replaceAll(" ");
        Set<String> keywords = new LinkedHashSet<>();
        for (String token : WHITESPACE.split(cleaned)) {
            if (token.length() > 2 && !STOP_WORDS.contains(token)) {
                keywords.add(token);
            }
        }
        return new ArrayList<>(keywords);
    }

    /**
     * Hard cut to {@code maxLength} characters, ellipsis included.
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= ELLIPSIS.length()) {
            return text.substring(0, Math.max(0, maxLength));
        }
        return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    private static int levenshtein(String a, String b) {
        int[] previous = new int[b.length() + 1];
        int[] current = new int[b.length() + 1];
        for (int j = 0; j <= b.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= a.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= b.length(); j++) {
                int cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        return previous[b.length()];
    }
}
