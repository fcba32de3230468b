package com.uconnect.admissionsBot.llm.service;

import com.uconnect.admissionsBot.repository.model.ChatMessage;

import java.util.List;

/**
 * Language model as seen by the rest of the service.
 * Both operations throw {@link com.uconnect.admissionsBot.llm.exception.GenerationUnavailableException}
 * when the model cannot answer.
 */
public interface GenerationClient {

    /**
     * Single-shot completion expected to return JSON.
     */
    String complete(String systemPrompt, String userPrompt);

    /**
     * Grounded answer to {@code question} using only {@code context}.
     */
    String generate(String context, String question, List<ChatMessage> history);
}
