package com.uconnect.admissionsBot.orchestrator.ai;

import java.util.Optional;

/**
 * Optional AI assistance for query planning. Returns the model's raw JSON plan, or empty
 * when no contribution is available. Never throws.
 */
public interface PlanOptimizerAi {

    PlanOptimizerAi NONE = new PlanOptimizerAi() {
        @Override
        public boolean isAvailable() {
            return false;
        }

        @Override
        public Optional<String> optimizeQueryPlan(String utterance, String entitiesJson, int maxResults, int maxCalls) {
            return Optional.empty();
        }
    };

    boolean isAvailable();

    Optional<String> optimizeQueryPlan(String utterance, String entitiesJson, int maxResults, int maxCalls);
}
