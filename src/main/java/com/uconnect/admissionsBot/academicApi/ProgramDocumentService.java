package com.uconnect.admissionsBot.academicApi;

import com.uconnect.admissionsBot.academicApi.model.Program;
import com.uconnect.admissionsBot.academicApi.model.ProgramDocument;
import com.uconnect.admissionsBot.repository.AcademicCatalogRepository;
import com.uconnect.admissionsBot.util.TextNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bson.Document;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Lookup of long-form program description documents (PEP).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProgramDocumentService {

    private final AcademicCatalogRepository catalogRepository;
    private final ObjectMapper objectMapper;

    /**
     * Picks the fetched program whose name is closest to the one the user asked for.
     * Prefix lookups return several programs, so the first row is not necessarily the right one.
     */
    public Optional<Program> selectProgram(List<Program> programs, String requestedName) {
        if (programs == null || programs.isEmpty()) {
            return Optional.empty();
        }
        return programs.stream()
                .max(Comparator.comparingDouble(program -> TextNormalizer.similarity(program.getName(), requestedName)));
    }

    /**
     * Finds the document of a program by id, falling back to a normalized name match.
     */
    public Optional<ProgramDocument> findForProgram(Program program) {
        if (program == null) {
            return Optional.empty();
        }
        Document document = catalogRepository.findFirstBy(
                AcademicCatalogRepository.PROGRAM_DOCUMENTS, "programaId", program.getId());
        if (document == null) {
            String wanted = TextNormalizer.normalize(program.getName());
            document = catalogRepository.findAll(AcademicCatalogRepository.PROGRAM_DOCUMENTS).stream()
                    .filter(candidate -> wanted.equals(TextNormalizer.normalize(candidate.getString("programaNombre"))))
                    .findFirst()
                    .orElse(null);
        }
        if (document == null) {
            log.debug("No program document - programId: {}, program: {}", program.getId(), program.getName());
            return Optional.empty();
        }
        ProgramDocument programDocument = objectMapper.convertValue(document, ProgramDocument.class);
        log.info("Program document loaded - program: {}, rawTextChars: {}", programDocument.getProgramName(),
                programDocument.getRawText() != null ? programDocument.getRawText().length() : 0);
        return Optional.of(programDocument);
    }
}
