package com.uconnect.admissionsBot.retrieval.model;

import java.util.Set;

public record ScoredChunk(String text, int score, Set<String> matchedKeywords, int position) {

    public ScoredChunk withText(String newText) {
        return new ScoredChunk(newText, score, matchedKeywords, position);
    }
}
