package com.uconnect.admissionsBot.gateway.dto;

import com.uconnect.admissionsBot.orchestrator.model.ExtractedEntities;
import com.uconnect.admissionsBot.orchestrator.model.Intent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for chat messages.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatResponse {

    private String answer;
    private String sessionId;
    private List<Intent> intents;
    private ExtractedEntities entities;

    /**
     * Human-readable names of the data the answer was grounded on.
     */
    private List<String> sources;
}
