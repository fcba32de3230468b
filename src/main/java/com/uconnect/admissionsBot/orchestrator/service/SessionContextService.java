package com.uconnect.admissionsBot.orchestrator.service;

import com.uconnect.admissionsBot.orchestrator.model.ExtractedEntities;
import com.uconnect.admissionsBot.orchestrator.model.Intent;
import com.uconnect.admissionsBot.orchestrator.model.SessionContext;
import com.uconnect.admissionsBot.orchestrator.rules.ConversationPatterns;
import com.uconnect.admissionsBot.orchestrator.session.SessionContextStore;
import com.uconnect.admissionsBot.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashSet;
import java.util.Optional;
import java.util.Set;

/**
 * Session context service - conversational memory used to resolve follow-up questions.
 * 
 * Responsibilities:
 * - Enrich a turn's entities with the remembered program/faculty when the turn is a follow-up
 * - Remember the program, faculty and topic of each turn
 * - Forget everything on farewell or explicit reset
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionContextService {

    private final SessionContextStore sessionContextStore;

    public Optional<SessionContext> get(String sessionId) {
        return sessionContextStore.get(sessionId);
    }

    /**
     * Fills in a remembered program or faculty when the current turn lacks one and reads as a
     * follow-up ("y de ...", "que tal ...", "cuales ...", or a semester mention). Explicitly
     * stated values are never replaced. A program together with a semester always asks for
     * the curriculum.
     */
    public ExtractedEntities enrich(ExtractedEntities entities, Optional<SessionContext> context) {
        if (entities.isConversational()) {
            return entities;
        }

        String text = TextNormalizer.normalize(entities.getRawQuery());
        boolean followUp = ConversationPatterns.FOLLOW_UP.matcher(text).find()
                || ConversationPatterns.SEMESTER_MENTION.matcher(text).find();

        ExtractedEntities.ExtractedEntitiesBuilder builder = entities.toBuilder();
        boolean programInjected = false;
        if (followUp && entities.getPrograms().isEmpty()) {
            Optional<String> remembered = context.flatMap(SessionContext::program);
            remembered.ifPresent(builder::program);
            programInjected = remembered.isPresent();
        }
        boolean facultyInjected = false;
        if (followUp && entities.getFaculties().isEmpty()) {
            Optional<String> remembered = context.flatMap(SessionContext::faculty);
            remembered.ifPresent(builder::faculty);
            facultyInjected = remembered.isPresent();
        }
        ExtractedEntities enriched = builder.build();

        if (!enriched.getSemesters().isEmpty() && !enriched.getPrograms().isEmpty()
                && (!enriched.hasIntent(Intent.CURRICULUM_INFO) || enriched.hasIntent(Intent.GENERAL))) {
            Set<Intent> intents = new LinkedHashSet<>(enriched.getIntents());
            intents.remove(Intent.GENERAL);
            intents.add(Intent.CURRICULUM_INFO);
            enriched = enriched.toBuilder().clearIntents().intents(intents).build();
        }

        if (programInjected || facultyInjected) {
            log.info("Follow-up resolved from session context - program: {}, faculty: {}, intents: {}",
                    enriched.firstProgram().orElse(null), enriched.firstFaculty().orElse(null), enriched.getIntents());
        }
        return enriched;
    }

    /**
     * Remembers what this turn was about. Absent signals keep the previous values; a
     * farewell clears the session.
     */
    public void update(String sessionId, ExtractedEntities entities) {
        if (entities.hasIntent(Intent.FAREWELL)) {
            clear(sessionId);
            return;
        }
        SessionContext updated = sessionContextStore.update(sessionId, current -> {
            SessionContext.SessionContextBuilder builder = current.toBuilder();
            entities.firstProgram().ifPresent(builder::program);
            entities.firstFaculty().ifPresent(builder::faculty);
            entities.primaryTopic().ifPresent(builder::lastTopic);
            return builder.build();
        });
        log.debug("Session context updated - sessionId: {}, program: {}, faculty: {}, lastTopic: {}",
                sessionId, updated.getProgram(), updated.getFaculty(), updated.getLastTopic());
    }

    public void clear(String sessionId) {
        sessionContextStore.delete(sessionId);
        log.info("Session context cleared - sessionId: {}", sessionId);
    }
}
