package com.uconnect.admissionsBot.academicApi;

import com.uconnect.admissionsBot.academicApi.model.CourseEntry;
import com.uconnect.admissionsBot.academicApi.model.Faculty;
import com.uconnect.admissionsBot.academicApi.model.Program;
import com.uconnect.admissionsBot.orchestrator.model.QueryParams;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AcademicFiltersTest {

    private static final List<Program> PROGRAMS = List.of(
            program("INGENIERIA DE SISTEMAS", "FACULTAD DE INGENIERIAS"),
            program("INGENIERIA INDUSTRIAL", "FACULTAD DE INGENIERIAS"),
            program("MAESTRIA EN INGENIERIA AMBIENTAL", "FACULTAD DE INGENIERIAS"),
            program("ENFERMERÍA", "FACULTAD DE CIENCIAS DE LA SALUD"));

    // --- Faculties ---

    @Test
    void filterFaculties_shouldMatchNameIgnoringCaseAndAccents() {
        List<Faculty> faculties = List.of(
                Faculty.builder().id("1").name("FACULTAD DE INGENIERÍAS").build(),
                Faculty.builder().id("2").name("FACULTAD DE CIENCIAS BASICAS").build());

        assertThat(AcademicFilters.filterFaculties(faculties, Map.of(QueryParams.NAME, "ingenierias")))
                .extracting(Faculty::getId).containsExactly("1");
        assertThat(AcademicFilters.filterFaculties(faculties, Map.of())).hasSize(2);
    }

    // --- Programs ---

    @Test
    void filterPrograms_shouldMatchByPrefixAndSkipPostgraduate() {
        List<Program> results = AcademicFilters.filterPrograms(PROGRAMS, Map.of(QueryParams.PROGRAM_NAME, "ingeni"));

        assertThat(results).extracting(Program::getName)
                .containsExactly("INGENIERIA DE SISTEMAS", "INGENIERIA INDUSTRIAL");
    }

    @Test
    void filterPrograms_shouldScopeByFaculty() {
        List<Program> results = AcademicFilters.filterPrograms(PROGRAMS,
                Map.of(QueryParams.FACULTY_NAME, "ciencias de la salud"));

        assertThat(results).extracting(Program::getName).containsExactly("ENFERMERÍA");
    }

    @Test
    void isPostgraduate_shouldRecognizeGraduateDegrees() {
        assertThat(AcademicFilters.isPostgraduate("Especialización en Gerencia")).isTrue();
        assertThat(AcademicFilters.isPostgraduate("DOCTORADO EN CIENCIAS")).isTrue();
        assertThat(AcademicFilters.isPostgraduate("QUIMICA")).isFalse();
    }

    // --- Curriculum ---

    @Test
    void filterCurriculum_shouldFilterBySemesterAndDropDuplicates() {
        List<CourseEntry> rows = List.of(
                row("INGENIERIA DE SISTEMAS", "1", "CALCULO", "DIURNA"),
                row("INGENIERIA DE SISTEMAS", "1", "CALCULO", "DIURNA"),
                row("INGENIERIA DE SISTEMAS", "10", "TRABAJO DE GRADO", "DIURNA"),
                row("INGENIERIA INDUSTRIAL", "1", "DIBUJO", "DIURNA"));

        List<CourseEntry> results = AcademicFilters.filterCurriculum(rows,
                Map.of(QueryParams.PROGRAM_NAME, "INGENIERIA DE SISTEMAS", QueryParams.SEMESTER, "1"));

        assertThat(results).extracting(CourseEntry::getCourse).containsExactly("CALCULO");
    }

    @Test
    void filterCurriculum_shouldKeepFirstTrackWhenNoneRequested() {
        List<CourseEntry> rows = List.of(
                row("DERECHO", "1", "INTRODUCCION AL DERECHO", "DIURNA"),
                row("DERECHO", "1", "INTRODUCCION AL DERECHO", "NOCTURNA"),
                row("DERECHO", "2", "DERECHO ROMANO", "DIURNA"));

        assertThat(AcademicFilters.filterCurriculum(rows, Map.of(QueryParams.PROGRAM_NAME, "derecho")))
                .extracting(CourseEntry::getScheduleTrack).containsOnly("DIURNA").hasSize(2);
        assertThat(AcademicFilters.filterCurriculum(rows,
                Map.of(QueryParams.PROGRAM_NAME, "derecho", QueryParams.SCHEDULE_TRACK, "nocturna")))
                .extracting(CourseEntry::getCourse).containsExactly("INTRODUCCION AL DERECHO");
    }

    private static Program program(String name, String faculty) {
        return Program.builder().id(name).name(name).facultyName(faculty).build();
    }

    private static CourseEntry row(String program, String semester, String course, String track) {
        return CourseEntry.builder()
                .program(program)
                .semester(semester)
                .course(course)
                .scheduleTrack(track)
                .credits("3")
                .build();
    }
}
