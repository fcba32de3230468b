package com.uconnect.admissionsBot.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Optional;

/**
 * Short-term memory of one conversation: what was last talked about.
 */
@Value
@Builder(toBuilder = true)
public class SessionContext {

    String program;

    String faculty;

    Intent lastTopic;

    Instant updatedAt;

    public Optional<String> program() {
        return Optional.ofNullable(program);
    }

    public Optional<String> faculty() {
        return Optional.ofNullable(faculty);
    }

    public boolean isEmpty() {
        return program == null && faculty == null && lastTopic == null;
    }
}
