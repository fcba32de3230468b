package com.uconnect.admissionsBot.orchestrator.service;

import com.uconnect.admissionsBot.academicApi.AcademicDataProvider;
import com.uconnect.admissionsBot.academicApi.exception.AcademicDataUnavailableException;
import com.uconnect.admissionsBot.academicApi.model.CourseEntry;
import com.uconnect.admissionsBot.academicApi.model.Faculty;
import com.uconnect.admissionsBot.academicApi.model.Program;
import com.uconnect.admissionsBot.orchestrator.model.AcademicData;
import com.uconnect.admissionsBot.orchestrator.model.AcademicEndpoint;
import com.uconnect.admissionsBot.orchestrator.model.ApiCall;
import com.uconnect.admissionsBot.orchestrator.model.FetchStrategy;
import com.uconnect.admissionsBot.orchestrator.model.QueryParams;
import com.uconnect.admissionsBot.orchestrator.model.QueryPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class FetchServiceTest {

    @Mock
    private AcademicDataProvider academicDataProvider;

    private FetchService fetchService;

    @BeforeEach
    void setUp() {
        fetchService = new FetchService(academicDataProvider, Runnable::run);
    }

    @Test
    void fetchData_shouldReturnEmptyDataForEmptyPlan() {
        AcademicData data = fetchService.fetchData(QueryPlan.empty(), "s1");

        assertThat(data.hasFacts()).isFalse();
        verifyNoInteractions(academicDataProvider);
    }

    @Test
    void fetchData_shouldCollectResultsOfEveryEndpoint() {
        Map<String, String> programFilter = Map.of(QueryParams.PROGRAM_NAME, "derech");
        when(academicDataProvider.listFaculties(Map.of())).thenReturn(List.of(faculty("FACULTAD DE INGENIERIAS")));
        when(academicDataProvider.listPrograms(programFilter)).thenReturn(List.of(program("DERECHO")));
        when(academicDataProvider.listCurriculum(anyMap())).thenReturn(List.of(course("CONSTITUCIONAL")));

        QueryPlan plan = plan(FetchStrategy.PARALLEL, 50,
                call(AcademicEndpoint.FACULTIES, Map.of()),
                call(AcademicEndpoint.PROGRAMS, programFilter),
                call(AcademicEndpoint.CURRICULUM, Map.of(QueryParams.PROGRAM_NAME, "DERECHO")));

        AcademicData data = fetchService.fetchData(plan, "s1");

        assertThat(data.getFaculties()).extracting(Faculty::getName).containsExactly("FACULTAD DE INGENIERIAS");
        assertThat(data.getPrograms()).extracting(Program::getName).containsExactly("DERECHO");
        assertThat(data.getCourses()).extracting(CourseEntry::getCourse).containsExactly("CONSTITUCIONAL");
        assertThat(data.getFailedCalls()).isZero();
    }

    @Test
    void fetchData_shouldKeepPartialResultsWhenOneCallFails() {
        when(academicDataProvider.listPrograms(anyMap())).thenReturn(List.of(program("DERECHO")));
        when(academicDataProvider.listCurriculum(anyMap())).thenThrow(new IllegalStateException("timeout"));

        QueryPlan plan = plan(FetchStrategy.PARALLEL, 50,
                call(AcademicEndpoint.PROGRAMS, Map.of()),
                call(AcademicEndpoint.CURRICULUM, Map.of()));

        AcademicData data = fetchService.fetchData(plan, "s1");

        assertThat(data.getPrograms()).hasSize(1);
        assertThat(data.getCourses()).isEmpty();
        assertThat(data.getFailedCalls()).isEqualTo(1);
    }

    @Test
    void fetchData_shouldThrowWhenEveryCallFails() {
        when(academicDataProvider.listFaculties(anyMap())).thenThrow(new IllegalStateException("connection refused"));

        QueryPlan plan = plan(FetchStrategy.SEQUENTIAL, 50, call(AcademicEndpoint.FACULTIES, Map.of()));

        assertThatThrownBy(() -> fetchService.fetchData(plan, "s1"))
                .isInstanceOf(AcademicDataUnavailableException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    void fetchData_shouldCapResultsPerCategory() {
        List<Program> programs = IntStream.range(0, 8).mapToObj(i -> program("PROGRAMA " + i)).toList();
        when(academicDataProvider.listPrograms(anyMap())).thenReturn(programs);

        AcademicData data = fetchService.fetchData(
                plan(FetchStrategy.SEQUENTIAL, 5, call(AcademicEndpoint.PROGRAMS, Map.of())), "s1");

        assertThat(data.getPrograms()).hasSize(5);
        assertThat(data.getPrograms().get(0).getName()).isEqualTo("PROGRAMA 0");
    }

    private static QueryPlan plan(FetchStrategy strategy, int cap, ApiCall... calls) {
        return QueryPlan.builder().calls(List.of(calls)).strategy(strategy).resultCap(cap).build();
    }

    private static ApiCall call(AcademicEndpoint endpoint, Map<String, String> params) {
        return ApiCall.builder().endpoint(endpoint).params(params).priority(1).build();
    }

    private static Faculty faculty(String name) {
        return Faculty.builder().id("1").name(name).build();
    }

    private static Program program(String name) {
        return Program.builder().id(name.toLowerCase()).name(name).build();
    }

    private static CourseEntry course(String name) {
        return CourseEntry.builder().program("DERECHO").semester("1").course(name).credits("3").build();
    }
}
