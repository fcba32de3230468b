package com.uconnect.admissionsBot.retrieval;

import com.uconnect.admissionsBot.retrieval.model.DocumentSegment;
import com.uconnect.admissionsBot.retrieval.model.ScoredChunk;
import com.uconnect.admissionsBot.util.TextNormalizer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Relevance score of a document segment against expanded query keywords.
 * 
 * Matching runs over the OCR-tolerant form of both sides, so punctuation and line-break noise
 * in scanned documents does not split words. A segment that matches no keyword scores 0 and
 * receives none of the length bonuses.
 */
@Component
public class ChunkScorer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern NUMBER = Pattern.compile("\\d+");
    private static final String WORD_START = "(?<![\\p{L}\\p{N}])";
    private static final String WORD_END = "(?![\\p{L}\\p{N}])";

    @Getter
    private final ChunkScoringWeights weights;

    public ChunkScorer() {
        this(ChunkScoringWeights.DEFAULTS);
    }

    public ChunkScorer(ChunkScoringWeights weights) {
        this.weights = weights;
    }

    public ScoredChunk score(DocumentSegment segment, List<String> keywords) {
        return score(segment, compile(keywords));
    }

    public ScoredChunk score(DocumentSegment segment, CompiledKeywords compiled) {
        String text = segment.text();
        String normalized = TextNormalizer.normalizeForOcr(text);
        List<String> keywords = compiled.keywords();

        int score = 0;
        Set<String> matched = new LinkedHashSet<>();
        List<Integer> matchedIndexes = new ArrayList<>();
        for (int i = 0; i < keywords.size(); i++) {
            Pattern pattern = compiled.keywordPatterns().get(i);
            if (pattern == null) {
                continue;
            }
            int occurrences = countMatches(pattern, normalized);
            if (occurrences > 0 && matched.add(keywords.get(i))) {
                score += occurrences * weights.getKeywordOccurrence();
                matchedIndexes.add(i);
            }
        }

        if (matched.isEmpty()) {
            return new ScoredChunk(text, 0, Set.of(), segment.position());
        }

        score += proximityScore(compiled, matchedIndexes, normalized);
        score += coverageScore(matched.size(), keywords.size());

        int length = text.length();
        if (length > weights.getReadableMinLength() && length < weights.getReadableMaxLength()) {
            score += weights.getReadableBonus();
        }
        if (length > weights.getSubstantiveMinLength()) {
            score += weights.getSubstantiveBonus();
        }
        if (looksLikeIndex(text)) {
            score -= weights.getIndexPenalty();
        }

        return new ScoredChunk(text, score, Set.copyOf(matched), segment.position());
    }

    /**
     * Keyword and keyword-pair proximity patterns for one query, built once and reused for
     * every segment of a document.
     */
    public CompiledKeywords compile(List<String> keywords) {
        List<Pattern> keywordPatterns = new ArrayList<>(keywords.size());
        List<String> sources = new ArrayList<>(keywords.size());
        for (String keyword : keywords) {
            String source = keywordPattern(keyword);
            sources.add(source);
            keywordPatterns.add(source.isEmpty() ? null : Pattern.compile(source));
        }

        String window = ".{0," + weights.getProximityWindow() + "}";
        Pattern[][] proximity = new Pattern[keywords.size()][keywords.size()];
        for (int i = 0; i < keywords.size() - 1; i++) {
            for (int j = i + 1; j < keywords.size(); j++) {
                String first = sources.get(i);
                String second = sources.get(j);
                if (!first.isEmpty() && !second.isEmpty()) {
                    proximity[i][j] = Pattern.compile(first + window + second + "|" + second + window + first);
                }
            }
        }
        return new CompiledKeywords(List.copyOf(keywords), Collections.unmodifiableList(keywordPatterns), proximity);
    }

    /**
     * One bonus per pair of different keywords found within the proximity window of each other,
     * in either order.
     */
    private int proximityScore(CompiledKeywords compiled, List<Integer> matchedIndexes, String normalized) {
        int bonus = 0;
        for (int a = 0; a < matchedIndexes.size() - 1; a++) {
            for (int b = a + 1; b < matchedIndexes.size(); b++) {
                Pattern proximity = compiled.proximity(matchedIndexes.get(a), matchedIndexes.get(b));
                if (proximity != null && proximity.matcher(normalized).find()) {
                    bonus += weights.getProximityBonus();
                }
            }
        }
        return bonus;
    }

    private int coverageScore(int matchedCount, int keywordCount) {
        if (matchedCount >= Math.min(weights.getCompletenessKeywordCount(), keywordCount)) {
            return weights.getCompletenessBonus();
        }
        if (matchedCount >= keywordCount * weights.getPartialCoverageRatio()) {
            return weights.getPartialCoverageBonus();
        }
        return 0;
    }

    private boolean looksLikeIndex(String text) {
        int wordCount = WHITESPACE.split(text.trim()).length;
        int numberCount = countMatches(NUMBER, text);
        return numberCount > wordCount * weights.getIndexNumberRatio() && text.length() < weights.getIndexMaxLength();
    }

    // Multi-word keywords tolerate any run of whitespace between their tokens.
    private static String keywordPattern(String keyword) {
        String normalized = TextNormalizer.normalizeForOcr(keyword);
        if (normalized.isEmpty()) {
            return "";
        }
        List<String> quoted = new ArrayList<>();
        for (String token : WHITESPACE.split(normalized)) {
            quoted.add(Pattern.quote(token));
        }
        String pattern = String.join("\\s+", quoted);
        if (KeywordExpander.isRelatedTerm(keyword)) {
            return WORD_START + "(?:" + pattern + ")" + WORD_END;
        }
        return pattern;
    }

    /**
     * Query keywords with their compiled patterns. A {@code null} pattern marks a keyword that
     * normalizes to nothing.
     */
    public record CompiledKeywords(List<String> keywords, List<Pattern> keywordPatterns, Pattern[][] proximityPatterns) {

        Pattern proximity(int first, int second) {
            return first < second ? proximityPatterns[first][second] : proximityPatterns[second][first];
        }
    }

    private static int countMatches(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        int count = 0;
        while (matcher.find()) {
            count++;
        }
        return count;
    }
}
