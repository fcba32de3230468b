package com.uconnect.admissionsBot.retrieval;

import lombok.Builder;
import lombok.Value;

/**
 * Tunable constants of {@link ChunkScorer}. The proximity bonus dominates every other term so
 * that segments where two different concepts co-occur always outrank isolated mentions.
 */
@Value
@Builder
public class ChunkScoringWeights {

    public static final ChunkScoringWeights DEFAULTS = ChunkScoringWeights.builder().build();

    @Builder.Default
    int keywordOccurrence = 10;

    @Builder.Default
    int proximityBonus = 50_000;

    @Builder.Default
    int proximityWindow = 50;

    @Builder.Default
    int completenessBonus = 10_000;

    @Builder.Default
    int completenessKeywordCount = 3;

    @Builder.Default
    int partialCoverageBonus = 1_000;

    @Builder.Default
    double partialCoverageRatio = 0.6;

    @Builder.Default
    int readableMinLength = 200;

    @Builder.Default
    int readableMaxLength = 2_000;

    @Builder.Default
    int readableBonus = 5;

    @Builder.Default
    int substantiveMinLength = 300;

    @Builder.Default
    int substantiveBonus = 15;

    @Builder.Default
    double indexNumberRatio = 0.3;

    @Builder.Default
    int indexMaxLength = 500;

    @Builder.Default
    int indexPenalty = 20;

    /**
     * A lone first chunk must score above this to be admitted past the budget.
     */
    @Builder.Default
    int minFirstChunkScore = 10;
}
