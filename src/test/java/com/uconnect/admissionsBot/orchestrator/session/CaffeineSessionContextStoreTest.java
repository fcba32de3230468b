package com.uconnect.admissionsBot.orchestrator.session;

import com.uconnect.admissionsBot.orchestrator.model.Intent;
import com.uconnect.admissionsBot.orchestrator.model.SessionContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class CaffeineSessionContextStoreTest {

    private static final Instant START = Instant.parse("2024-03-01T10:00:00Z");

    private MutableClock clock;
    private CaffeineSessionContextStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        store = new CaffeineSessionContextStore(Duration.ofMinutes(30), 100, clock);
    }

    @Test
    void update_shouldStartFromEmptyContextAndStampTime() {
        SessionContext updated = store.update("s1", current -> current.toBuilder().program("DERECHO").build());

        assertThat(updated.getProgram()).isEqualTo("DERECHO");
        assertThat(updated.getUpdatedAt()).isEqualTo(START);
        assertThat(store.get("s1")).contains(updated);
    }

    @Test
    void update_shouldApplyToCurrentValue() {
        store.put("s1", SessionContext.builder().program("DERECHO").build());

        store.update("s1", current -> current.toBuilder().lastTopic(Intent.CREDITS).build());

        SessionContext context = store.get("s1").orElseThrow();
        assertThat(context.getProgram()).isEqualTo("DERECHO");
        assertThat(context.getLastTopic()).isEqualTo(Intent.CREDITS);
    }

    @Test
    void delete_shouldRemoveEntry() {
        store.put("s1", SessionContext.builder().program("DERECHO").build());

        store.delete("s1");

        assertThat(store.get("s1")).isEmpty();
        assertThat(store.get("unknown")).isEmpty();
    }

    @Test
    void evictOlderThan_shouldRemoveOnlyStaleEntries() {
        store.put("old", SessionContext.builder().program("DERECHO").build());
        clock.advance(Duration.ofMinutes(20));
        store.put("fresh", SessionContext.builder().program("QUIMICA").build());
        clock.advance(Duration.ofMinutes(5));

        int removed = store.evictOlderThan(Duration.ofMinutes(10));

        assertThat(removed).isEqualTo(1);
        assertThat(store.get("old")).isEmpty();
        assertThat(store.get("fresh")).isPresent();
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
