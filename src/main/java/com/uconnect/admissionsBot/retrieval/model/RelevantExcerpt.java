package com.uconnect.admissionsBot.retrieval.model;

import java.util.List;

/**
 * Result of relevance extraction over a long document.
 *
 * @param text          selected segments in document order, separated by a visible divider
 * @param foundKeywords keywords matched by the selected segments; empty on fallback
 * @param chunksUsed    number of segments in {@code text}; 0 on fallback
 */
public record RelevantExcerpt(String text, List<String> foundKeywords, int chunksUsed) {

    public static RelevantExcerpt empty() {
        return new RelevantExcerpt("", List.of(), 0);
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }
}
