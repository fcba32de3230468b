package com.uconnect.admissionsBot.orchestrator.service;

import com.uconnect.admissionsBot.orchestrator.ai.AiJsonReplies;
import com.uconnect.admissionsBot.orchestrator.ai.PlanOptimizerAi;
import com.uconnect.admissionsBot.orchestrator.dto.AiQueryPlanResponse;
import com.uconnect.admissionsBot.orchestrator.model.AcademicEndpoint;
import com.uconnect.admissionsBot.orchestrator.model.ApiCall;
import com.uconnect.admissionsBot.orchestrator.model.ExtractedEntities;
import com.uconnect.admissionsBot.orchestrator.model.FetchStrategy;
import com.uconnect.admissionsBot.orchestrator.model.Intent;
import com.uconnect.admissionsBot.orchestrator.model.QueryParams;
import com.uconnect.admissionsBot.orchestrator.model.QueryPlan;
import com.uconnect.admissionsBot.util.TextNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Query planner - decides which academic lookups a turn needs.
 * 
 * Rules, each adding at most one call:
 * - faculties: faculty listing, a detected faculty, or a faculty question
 * - programs: program listing or question, or a detected program (matched by a short prefix)
 * - curriculum: course/curriculum/credits questions, a course, or program plus semester
 * - fallback: a programs lookup on the first query keyword
 * 
 * Greetings and farewells never plan anything. The optional AI planner may propose a plan;
 * it is validated and discarded in favor of the rule plan on any problem.
 */
@Slf4j
@Service
public class QueryPlannerService {

    private static final int PROGRAM_PREFIX_LENGTH = 6;

    private static final int FACULTIES_PRIORITY = 1;
    private static final int PROGRAMS_PRIORITY = 2;
    private static final int CURRICULUM_PRIORITY = 3;

    private final PlanOptimizerAi planOptimizerAi;
    private final ObjectMapper objectMapper;
    private final int maxApiResults;
    private final int maxPlanCalls;

    public QueryPlannerService(
            PlanOptimizerAi planOptimizerAi,
            ObjectMapper objectMapper,
            @Value("${uconnect.chatbot.max-api-results:50}") int maxApiResults,
            @Value("${uconnect.chatbot.max-plan-calls:3}") int maxPlanCalls) {
        this.planOptimizerAi = planOptimizerAi;
        this.objectMapper = objectMapper;
        this.maxApiResults = maxApiResults;
        this.maxPlanCalls = maxPlanCalls;
    }

    /**
     * Plans the turn, preferring a valid AI plan when the AI planner is enabled.
     */
    public QueryPlan planQuery(ExtractedEntities entities) {
        QueryPlan rulePlan = buildPlan(entities);
        if (entities.isConversational() || !planOptimizerAi.isAvailable()) {
            return rulePlan;
        }

        String entitiesJson;
        try {
            entitiesJson = objectMapper.writeValueAsString(entities);
        } catch (Exception e) {
            log.warn("Could not serialize entities for AI planning - using rule plan, error: {}", e.getMessage());
            return rulePlan;
        }

        Optional<QueryPlan> aiPlan = planOptimizerAi
                .optimizeQueryPlan(entities.getRawQuery(), entitiesJson, maxApiResults, maxPlanCalls)
                .flatMap(this::parseAiPlan);
        if (aiPlan.isEmpty()) {
            return rulePlan;
        }
        log.info("Using AI query plan - calls: {}, strategy: {}", aiPlan.get().getCalls().size(), aiPlan.get().getStrategy());
        return aiPlan.get();
    }

    /**
     * Deterministic rule-based plan.
     */
    public QueryPlan buildPlan(ExtractedEntities entities) {
        if (entities.isConversational()) {
            return QueryPlan.empty();
        }

        Optional<String> faculty = entities.firstFaculty();
        Optional<String> program = entities.firstProgram();
        Optional<String> semester = entities.firstSemester();
        Optional<String> course = entities.firstCourse();
        List<ApiCall> calls = new ArrayList<>();

        if (entities.hasIntent(Intent.LIST_FACULTIES) || faculty.isPresent() || entities.hasIntent(Intent.FACULTY_INFO)) {
            ApiCall.ApiCallBuilder call = ApiCall.builder()
                    .endpoint(AcademicEndpoint.FACULTIES)
                    .priority(FACULTIES_PRIORITY);
            faculty.ifPresent(name -> call.param(QueryParams.NAME, name));
            calls.add(call.build());
        }

        if (entities.hasAnyIntent(Intent.LIST_PROGRAMS, Intent.PROGRAM_INFO) || program.isPresent()) {
            ApiCall.ApiCallBuilder call = ApiCall.builder()
                    .endpoint(AcademicEndpoint.PROGRAMS)
                    .priority(PROGRAMS_PRIORITY);
            program.ifPresent(name -> call.param(QueryParams.PROGRAM_NAME, programPrefix(name)));
            faculty.ifPresent(name -> call.param(QueryParams.FACULTY_NAME, name));
            calls.add(call.build());
        }

        boolean asksForCourses = entities.hasAnyIntent(
                Intent.COURSE_INFO, Intent.CURRICULUM_INFO, Intent.LIST_COURSES, Intent.CREDITS);
        if (asksForCourses || course.isPresent() || (program.isPresent() && semester.isPresent())) {
            ApiCall.ApiCallBuilder call = ApiCall.builder()
                    .endpoint(AcademicEndpoint.CURRICULUM)
                    .priority(CURRICULUM_PRIORITY);
            program.ifPresent(name -> call.param(QueryParams.PROGRAM_NAME, name));
            semester.ifPresent(value -> call.param(QueryParams.SEMESTER, value));
            course.ifPresent(name -> call.param(QueryParams.COURSE_NAME, name));
            entities.firstScheduleTrack().ifPresent(track -> call.param(QueryParams.SCHEDULE_TRACK, track));
            calls.add(call.build());
        }

        if (calls.isEmpty()) {
            TextNormalizer.extractKeywords(entities.getRawQuery()).stream().findFirst()
                    .ifPresent(token -> calls.add(ApiCall.builder()
                            .endpoint(AcademicEndpoint.PROGRAMS)
                            .param(QueryParams.PROGRAM_NAME, token)
                            .priority(PROGRAMS_PRIORITY)
                            .build()));
        }

        QueryPlan plan = finish(calls, null, maxApiResults);
        log.debug("Rule-based plan - calls: {}, strategy: {}", plan.getCalls(), plan.getStrategy());
        return plan;
    }

    private Optional<QueryPlan> parseAiPlan(String reply) {
        Optional<String> json = AiJsonReplies.extractJsonObject(reply);
        if (json.isEmpty()) {
            log.warn("AI plan reply has no JSON object - using rule plan");
            return Optional.empty();
        }

        AiQueryPlanResponse response;
        try {
            response = objectMapper.readValue(json.get(), AiQueryPlanResponse.class);
        } catch (Exception e) {
            log.warn("AI plan reply is not valid JSON - using rule plan, error: {}", e.getMessage());
            return Optional.empty();
        }
        if (response.getApis() == null || response.getApis().isEmpty()) {
            log.warn("AI plan has no calls - using rule plan");
            return Optional.empty();
        }

        List<ApiCall> calls = new ArrayList<>();
        for (int i = 0; i < response.getApis().size(); i++) {
            AiQueryPlanResponse.PlannedCall planned = response.getApis().get(i);
            if (planned == null) {
                log.warn("AI plan contains an empty call - using rule plan");
                return Optional.empty();
            }
            Optional<AcademicEndpoint> endpoint = AcademicEndpoint.fromName(planned.getEndpoint());
            if (endpoint.isEmpty()) {
                log.warn("AI plan names an unknown endpoint '{}' - using rule plan", planned.getEndpoint());
                return Optional.empty();
            }
            ApiCall.ApiCallBuilder call = ApiCall.builder()
                    .endpoint(endpoint.get())
                    .priority(planned.getPriority() != null ? planned.getPriority() : i + 1);
            if (planned.getParams() != null) {
                planned.getParams().forEach((key, value) -> {
                    if (key != null && value != null && !value.toString().isBlank()) {
                        call.param(key, value.toString());
                    }
                });
            }
            calls.add(call.build());
        }

        int requestedCap = response.getMaxResults() != null && response.getMaxResults() > 0
                ? response.getMaxResults()
                : maxApiResults;
        return Optional.of(finish(calls, response.getStrategy(), Math.min(requestedCap, maxApiResults)));
    }

    private QueryPlan finish(List<ApiCall> calls, String requestedStrategy, int resultCap) {
        List<ApiCall> ordered = calls.stream()
                .sorted(Comparator.comparingInt(ApiCall::getPriority))
                .limit(maxPlanCalls)
                .toList();
        FetchStrategy strategy = ordered.size() > 1 ? FetchStrategy.PARALLEL : FetchStrategy.SEQUENTIAL;
        if (ordered.size() > 1 && "sequential".equalsIgnoreCase(requestedStrategy)) {
            strategy = FetchStrategy.SEQUENTIAL;
        }
        return QueryPlan.builder()
                .calls(ordered)
                .strategy(strategy)
                .resultCap(resultCap)
                .build();
    }

    private static String programPrefix(String programName) {
        String normalized = TextNormalizer.normalize(programName);
        return normalized.length() <= PROGRAM_PREFIX_LENGTH ? normalized : normalized.substring(0, PROGRAM_PREFIX_LENGTH);
    }
}
