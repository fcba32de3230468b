package com.uconnect.admissionsBot.orchestrator.ai;

import com.uconnect.admissionsBot.llm.service.GenerationClient;
import com.uconnect.admissionsBot.orchestrator.prompt.QueryPlanPrompt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Query plan suggestions backed by the language model.
 */
@Slf4j
@RequiredArgsConstructor
public class LlmPlanOptimizerAi implements PlanOptimizerAi {

    private final GenerationClient generationClient;

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Optional<String> optimizeQueryPlan(String utterance, String entitiesJson, int maxResults, int maxCalls) {
        try {
            return Optional.ofNullable(generationClient.complete(
                    QueryPlanPrompt.SYSTEM_PROMPT,
                    QueryPlanPrompt.userPrompt(utterance, entitiesJson, maxResults, maxCalls)));
        } catch (RuntimeException e) {
            log.warn("AI plan optimization unavailable - error: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
