package com.uconnect.admissionsBot.academicApi;

import com.uconnect.admissionsBot.academicApi.model.CourseEntry;
import com.uconnect.admissionsBot.academicApi.model.Faculty;
import com.uconnect.admissionsBot.academicApi.model.Program;
import com.uconnect.admissionsBot.repository.AcademicCatalogRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Academic data served from the bundled catalog datasets.
 * Also the fallback source when the remote institutional API is down.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocalAcademicDataService implements AcademicDataProvider {

    private final AcademicCatalogRepository catalogRepository;
    private final ObjectMapper objectMapper;

    @Override
    public List<Faculty> listFaculties(Map<String, String> filter) {
        List<Faculty> results = AcademicFilters.filterFaculties(
                load(AcademicCatalogRepository.FACULTIES, Faculty.class), filter);
        log.debug("Local faculties lookup - filter: {}, results: {}", filter, results.size());
        return results;
    }

    @Override
    public List<Program> listPrograms(Map<String, String> filter) {
        List<Program> results = AcademicFilters.filterPrograms(
                load(AcademicCatalogRepository.PROGRAMS, Program.class), filter);
        log.debug("Local programs lookup - filter: {}, results: {}", filter, results.size());
        return results;
    }

    @Override
    public List<CourseEntry> listCurriculum(Map<String, String> filter) {
        List<CourseEntry> results = AcademicFilters.filterCurriculum(
                load(AcademicCatalogRepository.CURRICULUM, CourseEntry.class), filter);
        log.debug("Local curriculum lookup - filter: {}, results: {}", filter, results.size());
        return results;
    }

    private <T> List<T> load(String collection, Class<T> type) {
        List<Document> documents = catalogRepository.findAll(collection);
        return documents.stream()
                .map(document -> objectMapper.convertValue(document, type))
                .collect(Collectors.toList());
    }
}
