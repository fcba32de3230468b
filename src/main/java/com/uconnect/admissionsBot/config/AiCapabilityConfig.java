package com.uconnect.admissionsBot.config;

import com.uconnect.admissionsBot.llm.service.GenerationClient;
import com.uconnect.admissionsBot.orchestrator.ai.EntityExtractorAi;
import com.uconnect.admissionsBot.orchestrator.ai.LlmEntityExtractorAi;
import com.uconnect.admissionsBot.orchestrator.ai.LlmPlanOptimizerAi;
import com.uconnect.admissionsBot.orchestrator.ai.PlanOptimizerAi;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the optional AI capabilities. A disabled capability is its no-op implementation,
 * which leaves extraction and planning purely rule-based.
 */
@Slf4j
@Configuration
public class AiCapabilityConfig {

    @Bean
    public EntityExtractorAi entityExtractorAi(
            GenerationClient generationClient,
            @Value("${uconnect.ai.entity-extraction.enabled:true}") boolean enabled) {
        log.info("AI entity extraction enabled: {}", enabled);
        return enabled ? new LlmEntityExtractorAi(generationClient) : EntityExtractorAi.NONE;
    }

    @Bean
    public PlanOptimizerAi planOptimizerAi(
            GenerationClient generationClient,
            @Value("${uconnect.ai.plan-optimization.enabled:false}") boolean enabled) {
        log.info("AI plan optimization enabled: {}", enabled);
        return enabled ? new LlmPlanOptimizerAi(generationClient) : PlanOptimizerAi.NONE;
    }
}
