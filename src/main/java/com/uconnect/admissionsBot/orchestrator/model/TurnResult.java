package com.uconnect.admissionsBot.orchestrator.model;

import com.uconnect.admissionsBot.repository.model.ChatMessage;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Everything one processed turn produced, up to (not including) the generated answer.
 */
@Value
@Builder
public class TurnResult {

    String sessionId;

    ExtractedEntities entities;

    QueryPlan plan;

    AcademicData academicData;

    AssembledContext assembledContext;

    /**
     * Transcript before this turn, oldest first.
     */
    @Builder.Default
    List<ChatMessage> history = List.of();

    /**
     * Admissions questions without a program get the fixed admissions answer.
     */
    public boolean isGeneralAdmissions() {
        return entities.hasIntent(Intent.ADMISSIONS_INFO) && entities.getPrograms().isEmpty();
    }

    /**
     * True when the answer must come from the language model rather than a canned reply.
     */
    public boolean requiresGeneration() {
        return !entities.isConversational() && !isGeneralAdmissions();
    }
}
