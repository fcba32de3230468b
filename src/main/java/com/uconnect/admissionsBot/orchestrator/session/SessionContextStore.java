package com.uconnect.admissionsBot.orchestrator.session;

import com.uconnect.admissionsBot.orchestrator.model.SessionContext;

import java.time.Duration;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Key-value store of per-conversation context, keyed by session id.
 */
public interface SessionContextStore {

    Optional<SessionContext> get(String sessionId);

    void put(String sessionId, SessionContext context);

    /**
     * Atomically replaces the entry for {@code sessionId} with {@code update} applied to the
     * current value, or to an empty context when there is none.
     */
    SessionContext update(String sessionId, UnaryOperator<SessionContext> update);

    void delete(String sessionId);

    /**
     * Removes entries not updated within {@code maxAge}.
     * 
     * @return number of entries removed
     */
    int evictOlderThan(Duration maxAge);

    long size();
}
