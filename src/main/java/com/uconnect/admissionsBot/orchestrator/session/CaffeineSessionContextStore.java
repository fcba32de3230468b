package com.uconnect.admissionsBot.orchestrator.session;

import com.uconnect.admissionsBot.orchestrator.model.SessionContext;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Session context store backed by a Caffeine cache.
 * 
 * Entries expire after the configured idle time (30 minutes by default) and the cache is
 * bounded, so abandoned conversations do not accumulate. Updates go through the map's
 * compute so two turns of the same session never lose each other's writes.
 */
@Slf4j
@Component
public class CaffeineSessionContextStore implements SessionContextStore {

    private final Cache<String, SessionContext> sessionCache;
    private final Clock clock;

    @Autowired
    public CaffeineSessionContextStore(
            @Value("${uconnect.session.ttl:30m}") Duration sessionTtl,
            @Value("${uconnect.session.max-sessions:10000}") long maxSessions) {
        this(sessionTtl, maxSessions, Clock.systemUTC());
    }

    CaffeineSessionContextStore(Duration sessionTtl, long maxSessions, Clock clock) {
        this.clock = clock;
        this.sessionCache = Caffeine.newBuilder()
                .expireAfterAccess(sessionTtl)
                .maximumSize(maxSessions)
                .removalListener((String key, SessionContext value, RemovalCause cause) -> {
                    if (value != null && cause.wasEvicted()) {
                        log.debug("Session context evicted - sessionId: {}, cause: {}", key, cause);
                    }
                })
                .build();
    }

    @Override
    public Optional<SessionContext> get(String sessionId) {
        return Optional.ofNullable(sessionCache.getIfPresent(sessionId));
    }

    @Override
    public void put(String sessionId, SessionContext context) {
        sessionCache.put(sessionId, stamp(context));
    }

    @Override
    public SessionContext update(String sessionId, UnaryOperator<SessionContext> update) {
        return sessionCache.asMap().compute(sessionId, (key, current) -> {
            SessionContext base = current != null ? current : SessionContext.builder().build();
            return stamp(update.apply(base));
        });
    }

    @Override
    public void delete(String sessionId) {
        sessionCache.invalidate(sessionId);
    }

    @Override
    public int evictOlderThan(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        int removed = 0;
        for (Map.Entry<String, SessionContext> entry : sessionCache.asMap().entrySet()) {
            SessionContext context = entry.getValue();
            boolean stale = context.getUpdatedAt() == null || context.getUpdatedAt().isBefore(cutoff);
            if (stale && sessionCache.asMap().remove(entry.getKey(), context)) {
                removed++;
            }
        }
        if (removed > 0) {
            log.info("Evicted stale session contexts - removed: {}, maxAge: {}", removed, maxAge);
        }
        return removed;
    }

    @Override
    public long size() {
        return sessionCache.estimatedSize();
    }

    private SessionContext stamp(SessionContext context) {
        return context.toBuilder().updatedAt(clock.instant()).build();
    }
}
