package com.uconnect.admissionsBot.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uconnect.admissionsBot.orchestrator.ai.PlanOptimizerAi;
import com.uconnect.admissionsBot.orchestrator.model.AcademicEndpoint;
import com.uconnect.admissionsBot.orchestrator.model.ApiCall;
import com.uconnect.admissionsBot.orchestrator.model.ExtractedEntities;
import com.uconnect.admissionsBot.orchestrator.model.FetchStrategy;
import com.uconnect.admissionsBot.orchestrator.model.Intent;
import com.uconnect.admissionsBot.orchestrator.model.QueryParams;
import com.uconnect.admissionsBot.orchestrator.model.QueryPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QueryPlannerServiceTest {

    @Mock
    private PlanOptimizerAi planOptimizerAi;

    private QueryPlannerService planner;

    @BeforeEach
    void setUp() {
        planner = new QueryPlannerService(planOptimizerAi, new ObjectMapper(), 50, 3);
    }

    // --- Rule plan ---

    @Test
    void planQuery_shouldPlanNothingForGreeting() {
        QueryPlan plan = planner.planQuery(ExtractedEntities.only(Intent.GREETING, "hola"));

        assertThat(plan.isEmpty()).isTrue();
        verify(planOptimizerAi, never()).optimizeQueryPlan(anyString(), anyString(), anyInt(), anyInt());
    }

    @Test
    void buildPlan_shouldPlanProgramAndCurriculumForProgramWithSemester() {
        ExtractedEntities entities = ExtractedEntities.builder()
                .program("INGENIERIA DE SISTEMAS")
                .semester("5")
                .intent(Intent.CURRICULUM_INFO)
                .rawQuery("materias de quinto semestre de sistemas")
                .build();

        QueryPlan plan = planner.buildPlan(entities);

        assertThat(plan.getCalls()).extracting(ApiCall::getEndpoint)
                .containsExactly(AcademicEndpoint.PROGRAMS, AcademicEndpoint.CURRICULUM);
        assertThat(plan.getCalls().get(0).param(QueryParams.PROGRAM_NAME)).contains("ingeni");
        ApiCall curriculum = plan.getCalls().get(1);
        assertThat(curriculum.param(QueryParams.PROGRAM_NAME)).contains("INGENIERIA DE SISTEMAS");
        assertThat(curriculum.param(QueryParams.SEMESTER)).contains("5");
        assertThat(plan.getStrategy()).isEqualTo(FetchStrategy.PARALLEL);
        assertThat(plan.getResultCap()).isEqualTo(50);
    }

    @Test
    void buildPlan_shouldOrderCallsByPriorityAndScopeProgramsByFaculty() {
        ExtractedEntities entities = ExtractedEntities.builder()
                .faculty("FACULTAD DE CIENCIAS DE LA SALUD")
                .program("ENFERMERIA")
                .intent(Intent.CREDITS)
                .intent(Intent.FACULTY_INFO)
                .rawQuery("creditos de enfermeria")
                .build();

        QueryPlan plan = planner.buildPlan(entities);

        assertThat(plan.getCalls()).extracting(ApiCall::getEndpoint)
                .containsExactly(AcademicEndpoint.FACULTIES, AcademicEndpoint.PROGRAMS, AcademicEndpoint.CURRICULUM);
        assertThat(plan.getCalls().get(0).param(QueryParams.NAME)).contains("FACULTAD DE CIENCIAS DE LA SALUD");
        assertThat(plan.getCalls().get(1).param(QueryParams.FACULTY_NAME)).contains("FACULTAD DE CIENCIAS DE LA SALUD");
        assertThat(plan.getCalls().get(1).param(QueryParams.PROGRAM_NAME)).contains("enferm");
    }

    @Test
    void buildPlan_shouldListAllFacultiesWithoutFilter() {
        QueryPlan plan = planner.buildPlan(ExtractedEntities.only(Intent.LIST_FACULTIES, "cuantas facultades hay"));

        assertThat(plan.getCalls()).hasSize(1);
        assertThat(plan.getCalls().get(0).getEndpoint()).isEqualTo(AcademicEndpoint.FACULTIES);
        assertThat(plan.getCalls().get(0).getParams()).isEmpty();
        assertThat(plan.getStrategy()).isEqualTo(FetchStrategy.SEQUENTIAL);
    }

    @Test
    void buildPlan_shouldFallBackToKeywordProgramLookup() {
        QueryPlan plan = planner.buildPlan(ExtractedEntities.general("informacion sobre becas"));

        assertThat(plan.getCalls()).hasSize(1);
        ApiCall call = plan.getCalls().get(0);
        assertThat(call.getEndpoint()).isEqualTo(AcademicEndpoint.PROGRAMS);
        assertThat(call.param(QueryParams.PROGRAM_NAME)).contains("becas");
    }

    @Test
    void buildPlan_shouldPlanNothingWhenQueryHasNoKeywords() {
        assertThat(planner.buildPlan(ExtractedEntities.general("que es")).isEmpty()).isTrue();
    }

    // --- AI plan ---

    @Test
    void planQuery_shouldUseValidAiPlanAndCapResults() {
        // GIVEN
        when(planOptimizerAi.isAvailable()).thenReturn(true);
        when(planOptimizerAi.optimizeQueryPlan(eq("pensum de derecho"), anyString(), eq(50), eq(3)))
                .thenReturn(Optional.of("""
                        {"apis": [
                            {"endpoint": "/pensum", "params": {"programa_nombre": "DERECHO", "semestre": ""}, "priority": 2},
                            {"endpoint": "programas", "params": {"programa_nombre": "derech"}, "priority": 1}
                          ],
                          "strategy": "sequential", "maxResults": 200}
                        """));

        // WHEN
        QueryPlan plan = planner.planQuery(ExtractedEntities.builder()
                .program("DERECHO")
                .intent(Intent.CURRICULUM_INFO)
                .rawQuery("pensum de derecho")
                .build());

        // THEN
        assertThat(plan.getCalls()).extracting(ApiCall::getEndpoint)
                .containsExactly(AcademicEndpoint.PROGRAMS, AcademicEndpoint.CURRICULUM);
        assertThat(plan.getCalls().get(1).getParams()).containsOnlyKeys(QueryParams.PROGRAM_NAME);
        assertThat(plan.getStrategy()).isEqualTo(FetchStrategy.SEQUENTIAL);
        assertThat(plan.getResultCap()).isEqualTo(50);
    }

    @Test
    void planQuery_shouldTruncateAiPlanToMaxCalls() {
        when(planOptimizerAi.isAvailable()).thenReturn(true);
        when(planOptimizerAi.optimizeQueryPlan(anyString(), anyString(), anyInt(), anyInt()))
                .thenReturn(Optional.of("""
                        {"apis": [{"endpoint": "facultades"}, {"endpoint": "programas"},
                                  {"endpoint": "pensum"}, {"endpoint": "programas"}]}
                        """));

        QueryPlan plan = planner.planQuery(ExtractedEntities.only(Intent.LIST_PROGRAMS, "lista de programas"));

        assertThat(plan.getCalls()).hasSize(3);
        assertThat(plan.getStrategy()).isEqualTo(FetchStrategy.PARALLEL);
    }

    @Test
    void planQuery_shouldFallBackToRulePlanOnUnknownEndpoint() {
        ExtractedEntities entities = ExtractedEntities.only(Intent.LIST_FACULTIES, "cuantas facultades hay");
        when(planOptimizerAi.isAvailable()).thenReturn(true);
        when(planOptimizerAi.optimizeQueryPlan(anyString(), anyString(), anyInt(), anyInt()))
                .thenReturn(Optional.of("{\"apis\": [{\"endpoint\": \"/becas\"}]}"));

        assertThat(planner.planQuery(entities)).isEqualTo(planner.buildPlan(entities));
    }

    @Test
    void planQuery_shouldFallBackToRulePlanOnEmptyAiPlan() {
        ExtractedEntities entities = ExtractedEntities.only(Intent.LIST_FACULTIES, "cuantas facultades hay");
        when(planOptimizerAi.isAvailable()).thenReturn(true);
        when(planOptimizerAi.optimizeQueryPlan(anyString(), anyString(), anyInt(), anyInt()))
                .thenReturn(Optional.of("{\"apis\": [], \"strategy\": \"parallel\"}"));

        assertThat(planner.planQuery(entities)).isEqualTo(planner.buildPlan(entities));
    }
}
