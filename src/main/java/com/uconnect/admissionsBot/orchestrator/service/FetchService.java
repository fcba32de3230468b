package com.uconnect.admissionsBot.orchestrator.service;

import com.uconnect.admissionsBot.academicApi.AcademicDataProvider;
import com.uconnect.admissionsBot.academicApi.exception.AcademicDataUnavailableException;
import com.uconnect.admissionsBot.academicApi.model.CourseEntry;
import com.uconnect.admissionsBot.academicApi.model.Faculty;
import com.uconnect.admissionsBot.academicApi.model.Program;
import com.uconnect.admissionsBot.orchestrator.model.AcademicData;
import com.uconnect.admissionsBot.orchestrator.model.ApiCall;
import com.uconnect.admissionsBot.orchestrator.model.FetchStrategy;
import com.uconnect.admissionsBot.orchestrator.model.QueryPlan;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Fetch service - runs a {@link QueryPlan} against the academic data provider.
 * 
 * PARALLEL plans are issued concurrently and awaited jointly. A failing call is logged and
 * skipped, and whatever resolved is returned; only a plan where every call failed is an error.
 */
@Slf4j
@Service
public class FetchService {

    private final AcademicDataProvider academicDataProvider;
    private final Executor fetchExecutor;

    public FetchService(AcademicDataProvider academicDataProvider,
                        @Qualifier("academicFetchExecutor") Executor fetchExecutor) {
        this.academicDataProvider = academicDataProvider;
        this.fetchExecutor = fetchExecutor;
    }

    /**
     * @throws AcademicDataUnavailableException if the plan has calls and none of them succeeded
     */
    public AcademicData fetchData(QueryPlan plan, String sessionId) {
        if (plan.isEmpty()) {
            return AcademicData.empty();
        }
        log.info("Step FETCH - sessionId: {}, calls: {}, strategy: {}", sessionId, plan.getCalls().size(), plan.getStrategy());

        List<CallOutcome> outcomes = plan.getStrategy() == FetchStrategy.PARALLEL
                ? fetchInParallel(plan.getCalls())
                : fetchSequentially(plan.getCalls());

        List<Faculty> faculties = new ArrayList<>();
        List<Program> programs = new ArrayList<>();
        List<CourseEntry> courses = new ArrayList<>();
        int failed = 0;
        Exception lastError = null;
        for (CallOutcome outcome : outcomes) {
            if (outcome.error() != null) {
                failed++;
                lastError = outcome.error();
                log.warn("Academic lookup failed - sessionId: {}, endpoint: {}, error: {}",
                        sessionId, outcome.call().getEndpoint(), outcome.error().getMessage());
                continue;
            }
            switch (outcome.call().getEndpoint()) {
                case FACULTIES -> faculties.addAll(cast(outcome.results()));
                case PROGRAMS -> programs.addAll(cast(outcome.results()));
                case CURRICULUM -> courses.addAll(cast(outcome.results()));
            }
        }

        if (failed == outcomes.size()) {
            throw new AcademicDataUnavailableException(
                    "All " + failed + " academic lookups failed", lastError);
        }

        int cap = plan.getResultCap();
        AcademicData data = AcademicData.builder()
                .faculties(capped(faculties, cap))
                .programs(capped(programs, cap))
                .courses(capped(courses, cap))
                .failedCalls(failed)
                .build();
        log.info("Fetch completed - sessionId: {}, faculties: {}, programs: {}, courses: {}, failedCalls: {}",
                sessionId, data.getFaculties().size(), data.getPrograms().size(), data.getCourses().size(), failed);
        return data;
    }

    private List<CallOutcome> fetchSequentially(List<ApiCall> calls) {
        List<CallOutcome> outcomes = new ArrayList<>();
        for (ApiCall call : calls) {
            outcomes.add(execute(call));
        }
        return outcomes;
    }

    private List<CallOutcome> fetchInParallel(List<ApiCall> calls) {
        List<CompletableFuture<CallOutcome>> futures = calls.stream()
                .map(call -> CompletableFuture.supplyAsync(() -> execute(call), fetchExecutor)
                        .exceptionally(error -> new CallOutcome(call, List.of(), unwrap(error))))
                .toList();
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private CallOutcome execute(ApiCall call) {
        try {
            List<?> results = switch (call.getEndpoint()) {
                case FACULTIES -> academicDataProvider.listFaculties(call.getParams());
                case PROGRAMS -> academicDataProvider.listPrograms(call.getParams());
                case CURRICULUM -> academicDataProvider.listCurriculum(call.getParams());
            };
            return new CallOutcome(call, results != null ? results : List.of(), null);
        } catch (Exception e) {
            return new CallOutcome(call, List.of(), e);
        }
    }

    private static Exception unwrap(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause instanceof Exception exception ? exception : new IllegalStateException(cause);
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> cast(List<?> results) {
        return (List<T>) results;
    }

    private static <T> List<T> capped(List<T> items, int cap) {
        if (cap <= 0 || items.size() <= cap) {
            return List.copyOf(items);
        }
        return List.copyOf(items.subList(0, cap));
    }

    private record CallOutcome(ApiCall call, List<?> results, Exception error) {}
}
