package com.uconnect.admissionsBot.repository;

import com.uconnect.admissionsBot.repository.model.ChatMessage;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Chat history kept in a Caffeine cache. Transcripts expire with the same idle TTL as
 * session context and are capped at {@value #MAX_STORED_MESSAGES} messages.
 */
@Slf4j
@Repository
@ConditionalOnProperty(name = "uconnect.history.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryChatHistoryRepository implements ChatHistoryProvider {

    static final int MAX_STORED_MESSAGES = 100;

    private final Cache<String, List<ChatMessage>> transcripts;

    public InMemoryChatHistoryRepository(
            @Value("${uconnect.session.ttl:30m}") Duration ttl,
            @Value("${uconnect.session.max-sessions:10000}") long maxSessions) {
        this.transcripts = Caffeine.newBuilder()
                .expireAfterAccess(ttl)
                .maximumSize(maxSessions)
                .build();
    }

    @Override
    public List<ChatMessage> getHistory(String sessionId, int limit) {
        List<ChatMessage> messages = transcripts.getIfPresent(sessionId);
        if (messages == null || limit <= 0) {
            return List.of();
        }
        return List.copyOf(messages.subList(Math.max(0, messages.size() - limit), messages.size()));
    }

    @Override
    public void append(String sessionId, String role, String content) {
        ChatMessage message = ChatMessage.builder()
                .role(role)
                .content(content)
                .timestamp(Instant.now())
                .build();
        transcripts.asMap().compute(sessionId, (key, current) -> {
            List<ChatMessage> updated = current == null ? new ArrayList<>() : new ArrayList<>(current);
            updated.add(message);
            if (updated.size() > MAX_STORED_MESSAGES) {
                updated = new ArrayList<>(updated.subList(updated.size() - MAX_STORED_MESSAGES, updated.size()));
            }
            return List.copyOf(updated);
        });
        log.debug("Message appended - sessionId: {}, role: {}", sessionId, role);
    }

    @Override
    public void delete(String sessionId) {
        transcripts.invalidate(sessionId);
    }

    @Override
    public boolean exists(String sessionId) {
        return transcripts.getIfPresent(sessionId) != null;
    }
}
