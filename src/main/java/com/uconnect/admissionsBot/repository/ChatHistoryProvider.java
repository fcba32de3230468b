package com.uconnect.admissionsBot.repository;

import com.uconnect.admissionsBot.repository.model.ChatMessage;

import java.util.List;

/**
 * Per-session chat transcript.
 */
public interface ChatHistoryProvider {

    /**
     * Most recent messages of a session, oldest first. Unknown sessions have no history.
     */
    List<ChatMessage> getHistory(String sessionId, int limit);

    void append(String sessionId, String role, String content);

    void delete(String sessionId);

    boolean exists(String sessionId);
}
