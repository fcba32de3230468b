package com.uconnect.admissionsBot.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uconnect.admissionsBot.orchestrator.ai.EntityExtractorAi;
import com.uconnect.admissionsBot.orchestrator.model.ExtractedEntities;
import com.uconnect.admissionsBot.orchestrator.model.Intent;
import com.uconnect.admissionsBot.orchestrator.model.SessionContext;
import com.uconnect.admissionsBot.orchestrator.session.CaffeineSessionContextStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class SessionContextServiceTest {

    private static final String SESSION_ID = "session-1";

    private final EntityExtractionService extractor =
            new EntityExtractionService(EntityExtractorAi.NONE, new ObjectMapper());

    private SessionContextService service;

    @BeforeEach
    void setUp() {
        service = new SessionContextService(new CaffeineSessionContextStore(Duration.ofMinutes(30), 100));
    }

    // --- enrich ---

    @Test
    void enrich_shouldInjectRememberedProgramIntoFollowUp() {
        service.update(SESSION_ID, extractor.extract("materias de sistemas"));

        ExtractedEntities followUp = extractor.extract("y de quinto semestre?");
        ExtractedEntities enriched = service.enrich(followUp, service.get(SESSION_ID));

        assertThat(enriched.getPrograms()).containsExactly("INGENIERIA DE SISTEMAS");
        assertThat(enriched.getSemesters()).containsExactly("5");
        assertThat(enriched.getIntents()).containsExactly(Intent.CURRICULUM_INFO);
    }

    @Test
    void enrich_shouldRecognizeFollowUpOpenedWithInvertedQuestionMark() {
        service.update(SESSION_ID, extractor.extract("materias de quinto semestre de sistemas"));

        ExtractedEntities requirements = service.enrich(
                extractor.extract("¿y cuáles son los requisitos de grado?"), service.get(SESSION_ID));
        ExtractedEntities profile = service.enrich(
                extractor.extract("¿Qué tal el perfil del egresado?"), service.get(SESSION_ID));

        assertThat(requirements.getPrograms()).containsExactly("INGENIERIA DE SISTEMAS");
        assertThat(profile.getPrograms()).containsExactly("INGENIERIA DE SISTEMAS");
    }

    @Test
    void enrich_shouldNeverReplaceAStatedProgram() {
        service.update(SESSION_ID, extractor.extract("materias de sistemas"));

        ExtractedEntities enriched = service.enrich(extractor.extract("y de derecho?"), service.get(SESSION_ID));

        assertThat(enriched.getPrograms()).containsExactly("DERECHO");
    }

    @Test
    void enrich_shouldInjectRememberedFaculty() {
        SessionContext context = SessionContext.builder().faculty("FACULTAD DE CIENCIAS BASICAS").build();

        ExtractedEntities enriched = service.enrich(extractor.extract("cuales programas hay?"), Optional.of(context));

        assertThat(enriched.getFaculties()).containsExactly("FACULTAD DE CIENCIAS BASICAS");
    }

    @Test
    void enrich_shouldLeaveStandaloneQuestionUntouched() {
        SessionContext context = SessionContext.builder().program("DERECHO").build();
        ExtractedEntities entities = extractor.extract("necesito informacion de la universidad");

        assertThat(service.enrich(entities, Optional.of(context))).isEqualTo(entities);
    }

    @Test
    void enrich_shouldLeaveConversationalTurnUntouched() {
        SessionContext context = SessionContext.builder().program("DERECHO").build();
        ExtractedEntities greeting = extractor.extract("hola");

        assertThat(service.enrich(greeting, Optional.of(context))).isSameAs(greeting);
    }

    @Test
    void enrich_shouldAskForCurriculumWhenProgramAndSemesterAreStated() {
        ExtractedEntities enriched = service.enrich(extractor.extract("tercer semestre de enfermeria"), Optional.empty());

        assertThat(enriched.getIntents()).contains(Intent.CURRICULUM_INFO).doesNotContain(Intent.GENERAL);
    }

    // --- update / clear ---

    @Test
    void update_shouldKeepPreviousValuesWhenTurnHasNoSignal() {
        service.update(SESSION_ID, extractor.extract("pensum de derecho"));
        service.update(SESSION_ID, extractor.extract("necesito informacion de la universidad"));

        SessionContext context = service.get(SESSION_ID).orElseThrow();
        assertThat(context.getProgram()).isEqualTo("DERECHO");
        assertThat(context.getFaculty()).isEqualTo("FACULTAD DE CIENCIAS ECONOMICAS, JURIDICAS Y ADMINISTRATIVAS");
        assertThat(context.getLastTopic()).isEqualTo(Intent.CURRICULUM_INFO);
        assertThat(context.getUpdatedAt()).isNotNull();
    }

    @Test
    void update_shouldClearSessionOnFarewell() {
        service.update(SESSION_ID, extractor.extract("pensum de derecho"));

        service.update(SESSION_ID, extractor.extract("adios"));

        assertThat(service.get(SESSION_ID)).isEmpty();
    }

    @Test
    void clear_shouldForgetSession() {
        service.update(SESSION_ID, extractor.extract("pensum de derecho"));

        service.clear(SESSION_ID);

        assertThat(service.get(SESSION_ID)).isEmpty();
    }
}
