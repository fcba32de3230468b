package com.uconnect.admissionsBot.orchestrator.service;

import com.uconnect.admissionsBot.academicApi.model.CourseEntry;
import com.uconnect.admissionsBot.academicApi.model.ProgramDocument;
import com.uconnect.admissionsBot.orchestrator.model.AcademicData;
import com.uconnect.admissionsBot.orchestrator.model.AssembledContext;
import com.uconnect.admissionsBot.orchestrator.model.ExtractedEntities;
import com.uconnect.admissionsBot.orchestrator.model.Intent;
import com.uconnect.admissionsBot.repository.model.ChatMessage;
import com.uconnect.admissionsBot.retrieval.PrinciplesExtractor;
import com.uconnect.admissionsBot.retrieval.RelevanceChunker;
import com.uconnect.admissionsBot.retrieval.model.ProgramPrinciple;
import com.uconnect.admissionsBot.retrieval.model.RelevantExcerpt;
import com.uconnect.admissionsBot.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Context assembler - turns fetched facts, the program document and recent history into the
 * bounded text the model answers from.
 * 
 * Section order is fixed: summary, program document, faculties, programs, curriculum, history.
 * The joined text is hard-truncated to {@code maxContextTokens * 4} characters.
 */
@Slf4j
@Service
public class ContextAssemblerService {

    static final int CHARS_PER_TOKEN = 4;
    static final int MAX_FACULTIES = 10;
    static final int MAX_PROGRAMS = 20;
    static final int MAX_COURSES_PER_GROUP = 10;
    static final int MAX_COURSE_GROUPS = 5;

    private static final String SECTION_SEPARATOR = "\n\n";

    private final RelevanceChunker relevanceChunker;
    private final PrinciplesExtractor principlesExtractor;
    private final int maxContextTokens;
    private final int maxApiResults;
    private final int excerptBudget;
    private final int historyTurns;
    private final int historyTurnChars;

    public ContextAssemblerService(
            RelevanceChunker relevanceChunker,
            PrinciplesExtractor principlesExtractor,
            @Value("${uconnect.chatbot.max-context-tokens:4000}") int maxContextTokens,
            @Value("${uconnect.chatbot.max-api-results:50}") int maxApiResults,
            @Value("${uconnect.retrieval.excerpt-budget:6000}") int excerptBudget,
            @Value("${uconnect.chatbot.history-turns-in-context:4}") int historyTurns,
            @Value("${uconnect.chatbot.history-turn-chars:200}") int historyTurnChars) {
        this.relevanceChunker = relevanceChunker;
        this.principlesExtractor = principlesExtractor;
        this.maxContextTokens = maxContextTokens;
        this.maxApiResults = maxApiResults;
        this.excerptBudget = excerptBudget;
        this.historyTurns = historyTurns;
        this.historyTurnChars = historyTurnChars;
    }

    public AssembledContext assemble(ExtractedEntities entities, AcademicData data, List<ChatMessage> history) {
        AssembledContext.AssembledContextBuilder builder = AssembledContext.builder();
        List<String> sections = new ArrayList<>();

        String summary = summarize(entities, data);
        if (!summary.isEmpty()) {
            sections.add("RESUMEN: " + summary);
        }

        ProgramDocument document = data.getProgramDocument();
        if (document != null) {
            RelevantExcerpt excerpt = relevanceChunker.extract(document.getRawText(), entities.getRawQuery(), excerptBudget);
            builder.excerpt(excerpt);
            sections.add(formatDocument(document, excerpt, entities.getRawQuery()));
        }

        if (!data.getFaculties().isEmpty()) {
            sections.add("FACULTADES:\n" + formatItems(data.getFaculties(), MAX_FACULTIES,
                    faculty -> fields("facultad", faculty.getName())));
        }
        if (!data.getPrograms().isEmpty()) {
            sections.add("PROGRAMAS ACADEMICOS:\n" + formatItems(data.getPrograms(), MAX_PROGRAMS,
                    program -> fields("programa", program.getName(), "facultad", program.getFacultyName())));
        }
        if (!data.getCourses().isEmpty()) {
            sections.add("MATERIAS DEL PENSUM:\n" + groupCourses(data.getCourses()));
        }

        String recentHistory = formatHistory(history);
        if (!recentHistory.isEmpty()) {
            sections.add("HISTORIAL RECIENTE:\n" + recentHistory);
        }

        String joined = String.join(SECTION_SEPARATOR, sections);
        String text = TextNormalizer.truncate(joined, maxContextTokens * CHARS_PER_TOKEN);
        boolean truncated = text.length() < joined.length();

        log.info("Step ASSEMBLE - sections: {}, charsBefore: {}, charsAfter: {}, truncated: {}, estimatedTokens: {}",
                sections.size(), joined.length(), text.length(), truncated, (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN);

        return builder.sections(sections)
                .text(text)
                .totalChars(text.length())
                .truncated(truncated)
                .build();
    }

    /**
     * One-line description of what the facts are about.
     */
    String summarize(ExtractedEntities entities, AcademicData data) {
        if (entities.firstProgram().isPresent()) {
            String program = entities.firstProgram().get();
            return entities.firstSemester()
                    .map(semester -> "Materias del semestre " + semester + " del programa " + program)
                    .orElse("Informacion del programa " + program);
        }
        if (!data.getPrograms().isEmpty()) {
            int count = data.getPrograms().size();
            return entities.firstFaculty()
                    .map(faculty -> "Programas academicos de la " + faculty + ": " + count + " encontrados")
                    .orElse("Lista de " + count + " programas academicos disponibles");
        }
        if (!data.getFaculties().isEmpty() && entities.hasAnyIntent(Intent.LIST_FACULTIES, Intent.FACULTY_INFO)) {
            return "Facultades de la universidad: " + data.getFaculties().size() + " encontradas";
        }
        return "";
    }

    private String formatDocument(ProgramDocument document, RelevantExcerpt excerpt, String query) {
        List<String> parts = new ArrayList<>();
        parts.add("Programa: " + document.getProgramName());
        addIfPresent(parts, "Resumen", document.getSummary());
        addIfPresent(parts, "Historia", document.getHistory());
        addIfPresent(parts, "Perfil profesional", document.getProfessionalProfile());
        addIfPresent(parts, "Perfil ocupacional", document.getOccupationalProfile());
        addIfPresent(parts, "Mision", document.getMission());
        addIfPresent(parts, "Vision", document.getVision());
        addIfPresent(parts, "Objetivos", joinList(document.getObjectives()));
        addIfPresent(parts, "Competencias", joinList(document.getCompetencies()));
        addIfPresent(parts, "Campos ocupacionales", joinList(document.getOccupationalFields()));
        addIfPresent(parts, "Lineas de investigacion", joinList(document.getResearchLines()));
        addIfPresent(parts, "Requisitos de ingreso", document.getAdmissionRequirements());
        addIfPresent(parts, "Requisitos de grado", document.getGraduationRequirements());

        String documentText = excerpt.text();
        if (principlesExtractor.shouldParse(query)) {
            List<ProgramPrinciple> principles = principlesExtractor.extract(document.getRawText());
            if (!principles.isEmpty()) {
                log.info("Program principles parsed - count: {}, names: {}",
                        principles.size(), principles.stream().map(ProgramPrinciple::name).toList());
                documentText = principlesExtractor.formatForContext(principles) + "---\n\n" + documentText;
            }
        }
        addIfPresent(parts, "Texto del documento (fragmentos relevantes)", documentText);

        return "INFO GENERAL DEL PROGRAMA (PEP):\n" + String.join("\n", parts);
    }

    private String groupCourses(List<CourseEntry> courses) {
        Map<String, List<CourseEntry>> grouped = new LinkedHashMap<>();
        for (CourseEntry course : courses.subList(0, Math.min(courses.size(), maxApiResults))) {
            String key = course.getProgram() + " - Sem " + course.getSemester();
            grouped.computeIfAbsent(key, k -> new ArrayList<>()).add(course);
        }

        List<String> groups = new ArrayList<>();
        for (Map.Entry<String, List<CourseEntry>> entry : grouped.entrySet()) {
            if (groups.size() == MAX_COURSE_GROUPS) {
                break;
            }
            List<String> lines = new ArrayList<>();
            for (CourseEntry course : entry.getValue().subList(0, Math.min(entry.getValue().size(), MAX_COURSES_PER_GROUP))) {
                lines.add("  - " + course.getCourse() + " (" + course.getCredits() + " creditos)");
            }
            groups.add(entry.getKey() + ":\n" + String.join("\n", lines));
        }
        return String.join("\n\n", groups);
    }

    private String formatHistory(List<ChatMessage> history) {
        if (history == null || history.isEmpty()) {
            return "";
        }
        List<String> lines = new ArrayList<>();
        for (ChatMessage message : history.subList(Math.max(0, history.size() - historyTurns), history.size())) {
            String speaker = message.isFromUser() ? "Usuario" : "Asistente";
            lines.add(speaker + ": " + TextNormalizer.truncate(message.getContent(), historyTurnChars));
        }
        return String.join("\n", lines);
    }

    private static <T> String formatItems(List<T> items, int maxItems, Function<T, String> formatter) {
        return items.stream().limit(maxItems).map(formatter).reduce((a, b) -> a + "\n" + b).orElse("");
    }

    // "key: value | key: value"
    private static String fields(String... keyValues) {
        List<String> parts = new ArrayList<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            parts.add(keyValues[i] + ": " + keyValues[i + 1]);
        }
        return String.join(" | ", parts);
    }

    private static void addIfPresent(List<String> parts, String label, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(label + ": " + value);
        }
    }

    private static String joinList(List<String> values) {
        return values == null ? null : String.join("; ", values);
    }
}
