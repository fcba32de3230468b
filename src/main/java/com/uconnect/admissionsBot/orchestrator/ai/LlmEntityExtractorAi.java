package com.uconnect.admissionsBot.orchestrator.ai;

import com.uconnect.admissionsBot.llm.service.GenerationClient;
import com.uconnect.admissionsBot.orchestrator.prompt.EntityExtractionPrompt;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;

/**
 * Entity extraction backed by the language model.
 */
@Slf4j
@RequiredArgsConstructor
public class LlmEntityExtractorAi implements EntityExtractorAi {

    private final GenerationClient generationClient;

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public Optional<String> extractEntities(String utterance) {
        try {
            return Optional.ofNullable(generationClient.complete(
                    EntityExtractionPrompt.SYSTEM_PROMPT,
                    EntityExtractionPrompt.userPrompt(utterance)));
        } catch (RuntimeException e) {
            log.warn("AI entity extraction unavailable - error: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
