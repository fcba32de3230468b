package com.uconnect.admissionsBot.academicApi;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.uconnect.admissionsBot.academicApi.model.CourseEntry;
import com.uconnect.admissionsBot.academicApi.model.Faculty;
import com.uconnect.admissionsBot.academicApi.model.Program;
import com.uconnect.admissionsBot.academicApi.model.ProgramDocument;
import com.uconnect.admissionsBot.orchestrator.model.QueryParams;
import com.uconnect.admissionsBot.repository.AcademicCatalogRepository;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class LocalAcademicDataServiceTest {

    private final AcademicCatalogRepository catalogRepository = new AcademicCatalogRepository();
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final LocalAcademicDataService dataService = new LocalAcademicDataService(catalogRepository, objectMapper);
    private final ProgramDocumentService documentService = new ProgramDocumentService(catalogRepository, objectMapper);

    @Test
    void listFaculties_shouldLoadBundledDataset() {
        List<Faculty> faculties = dataService.listFaculties(Map.of());

        assertThat(faculties).hasSize(7);
        assertThat(faculties.get(0).getName()).isEqualTo("FACULTAD DE INGENIERIAS");
    }

    @Test
    void listPrograms_shouldExcludePostgraduateOfferings() {
        List<Program> programs = dataService.listPrograms(Map.of(QueryParams.FACULTY_NAME, "FACULTAD DE INGENIERIAS"));

        assertThat(programs).extracting(Program::getName)
                .contains("INGENIERIA DE SISTEMAS")
                .doesNotContain("MAESTRIA EN CIENCIAS DE LA COMPUTACION");
    }

    @Test
    void listCurriculum_shouldReturnOneTrackWithoutDuplicates() {
        List<CourseEntry> courses = dataService.listCurriculum(Map.of(
                QueryParams.PROGRAM_NAME, "INGENIERIA DE SISTEMAS",
                QueryParams.SEMESTER, "5"));

        assertThat(courses).hasSize(5);
        assertThat(courses).extracting(CourseEntry::getScheduleTrack).containsOnly("DIURNA");
        assertThat(courses).extracting(CourseEntry::getCourse).contains("BASES DE DATOS I", "SISTEMAS OPERATIVOS");
    }

    // --- Program documents ---

    @Test
    void selectProgram_shouldPickClosestName() {
        List<Program> candidates = dataService.listPrograms(Map.of(QueryParams.PROGRAM_NAME, "ingeni"));

        Optional<Program> selected = documentService.selectProgram(candidates, "INGENIERIA DE SISTEMAS");

        assertThat(selected).map(Program::getName).contains("INGENIERIA DE SISTEMAS");
        assertThat(documentService.selectProgram(List.of(), "DERECHO")).isEmpty();
    }

    @Test
    void findForProgram_shouldLoadDocumentById() {
        Program sistemas = Program.builder().id("101").name("INGENIERIA DE SISTEMAS").build();

        ProgramDocument document = documentService.findForProgram(sistemas).orElseThrow();

        assertThat(document.getProgramName()).isEqualTo("INGENIERIA DE SISTEMAS");
        assertThat(document.getRawText()).isNotBlank();
    }

    @Test
    void findForProgram_shouldFallBackToNameMatch() {
        Program enfermeria = Program.builder().id("unknown").name("Enfermería").build();

        assertThat(documentService.findForProgram(enfermeria)).map(ProgramDocument::getProgramId).contains("131");
        assertThat(documentService.findForProgram(Program.builder().id("x").name("DERECHO").build())).isEmpty();
    }
}
