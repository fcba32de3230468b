package com.uconnect.admissionsBot.orchestrator.ai;

import java.util.Optional;

/**
 * Optional AI assistance for entity extraction. Returns the model's raw JSON reply, or empty
 * when no contribution is available. Never throws.
 */
public interface EntityExtractorAi {

    /**
     * Pure rule-based operation.
     */
    EntityExtractorAi NONE = new EntityExtractorAi() {
        @Override
        public boolean isAvailable() {
            return false;
        }

        @Override
        public Optional<String> extractEntities(String utterance) {
            return Optional.empty();
        }
    };

    boolean isAvailable();

    Optional<String> extractEntities(String utterance);
}
