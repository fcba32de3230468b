package com.uconnect.admissionsBot.orchestrator.service;

import com.uconnect.admissionsBot.orchestrator.ai.AiJsonReplies;
import com.uconnect.admissionsBot.orchestrator.ai.EntityExtractorAi;
import com.uconnect.admissionsBot.orchestrator.dto.AiEntityExtractionResponse;
import com.uconnect.admissionsBot.orchestrator.model.ExtractedEntities;
import com.uconnect.admissionsBot.orchestrator.model.Intent;
import com.uconnect.admissionsBot.orchestrator.rules.AcademicKeywordRules;
import com.uconnect.admissionsBot.orchestrator.rules.ConversationPatterns;
import com.uconnect.admissionsBot.util.TextNormalizer;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Intent and entity extraction - turns a raw utterance into {@link ExtractedEntities}.
 * 
 * Rule pass, in order:
 * 1. Greeting / farewell short-circuit
 * 2. Program (tiered keyword table), semester, schedule tracks, faculty
 * 3. Admissions and topic intents
 * 4. Listing-vs-program disambiguation as a post-pass
 * 5. GENERAL when nothing else was set
 * 
 * When the rules find nothing specific, the optional AI extractor is asked and its reply is
 * merged as a set union. Extraction never throws.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EntityExtractionService {

    private static final Pattern SEMESTER_VALUE = Pattern.compile("^(10|[1-9])$");

    private final EntityExtractorAi entityExtractorAi;
    private final ObjectMapper objectMapper;

    /**
     * Extracts entities with the rules, then with AI help if the rules found nothing usable.
     */
    public ExtractedEntities extract(String utterance) {
        ExtractedEntities ruleBased = extractWithRules(utterance);
        if (ruleBased.hasEnoughEntities() || !entityExtractorAi.isAvailable()) {
            return ruleBased;
        }

        log.info("Rule-based extraction found no specific entities, asking AI - intents: {}", ruleBased.getIntents());
        Optional<AiEntityExtractionResponse> aiResponse = entityExtractorAi.extractEntities(utterance)
                .flatMap(this::parseAiReply);
        if (aiResponse.isEmpty()) {
            return ruleBased;
        }
        ExtractedEntities merged = merge(ruleBased, aiResponse.get());
        log.info("AI entities merged - programs: {}, faculties: {}, intents: {}",
                merged.getPrograms(), merged.getFaculties(), merged.getIntents());
        return merged;
    }

    /**
     * Deterministic keyword-rule extraction.
     */
    public ExtractedEntities extractWithRules(String utterance) {
        String rawQuery = utterance == null ? "" : utterance.trim();
        String text = TextNormalizer.normalize(rawQuery);
        if (text.isEmpty()) {
            return ExtractedEntities.general(rawQuery);
        }

        if (ConversationPatterns.GREETING.matcher(text).matches()) {
            return ExtractedEntities.only(Intent.GREETING, rawQuery);
        }
        if (ConversationPatterns.FAREWELL.matcher(text).find()) {
            return ExtractedEntities.only(Intent.FAREWELL, rawQuery);
        }

        ExtractedEntities.ExtractedEntitiesBuilder builder = ExtractedEntities.builder().rawQuery(rawQuery);
        Optional<String> program = AcademicKeywordRules.resolveProgram(text);
        Optional<String> faculty = AcademicKeywordRules.resolveFaculty(text);
        List<String> tracks = AcademicKeywordRules.resolveScheduleTracks(text);
        AcademicKeywordRules.resolveSemester(text).ifPresent(builder::semester);
        builder.scheduleTracks(tracks);
        faculty.ifPresent(builder::faculty);

        Set<Intent> intents = detectIntents(text, faculty.isPresent(), !tracks.isEmpty());

        // A listing-by-faculty request wins over an incidental program keyword
        boolean listsByFaculty = intents.contains(Intent.LIST_PROGRAMS) || intents.contains(Intent.LIST_FACULTIES);
        if (program.isPresent() && faculty.isPresent() && listsByFaculty) {
            log.debug("Dropping program in favor of faculty listing - program: {}, faculty: {}", program.get(), faculty.get());
        } else {
            program.ifPresent(builder::program);
        }

        if (intents.isEmpty()) {
            intents.add(Intent.GENERAL);
        }
        ExtractedEntities entities = builder.intents(intents).build();
        log.debug("Rule-based extraction - programs: {}, faculties: {}, semesters: {}, tracks: {}, intents: {}",
                entities.getPrograms(), entities.getFaculties(), entities.getSemesters(),
                entities.getScheduleTracks(), entities.getIntents());
        return entities;
    }

    private Set<Intent> detectIntents(String text, boolean facultyDetected, boolean trackDetected) {
        Set<Intent> intents = new LinkedHashSet<>();
        if (ConversationPatterns.ADMISSIONS.matcher(text).find()) {
            intents.add(Intent.ADMISSIONS_INFO);
        }
        if (ConversationPatterns.CURRICULUM.matcher(text).find()) {
            intents.add(Intent.CURRICULUM_INFO);
        }
        if (ConversationPatterns.CREDITS.matcher(text).find()) {
            intents.add(Intent.CREDITS);
        }
        if (facultyDetected || ConversationPatterns.FACULTY.matcher(text).find()) {
            intents.add(Intent.FACULTY_INFO);
        }
        if (ConversationPatterns.PROGRAM.matcher(text).find()) {
            intents.add(Intent.PROGRAM_INFO);
        }
        if (ConversationPatterns.COURSE.matcher(text).find()) {
            intents.add(Intent.COURSE_INFO);
        }
        if (trackDetected) {
            intents.add(Intent.SCHEDULE_TRACK);
        }
        intents.addAll(detectListingIntents(text));
        return intents;
    }

    /**
     * Specific listing phrases first; a bare listing cue is classified by the category noun
     * it appears with, programs by default.
     */
    private List<Intent> detectListingIntents(String text) {
        List<Intent> listings = new ArrayList<>();
        if (ConversationPatterns.LIST_FACULTIES.matcher(text).find()) {
            listings.add(Intent.LIST_FACULTIES);
        }
        if (ConversationPatterns.LIST_PROGRAMS.matcher(text).find()) {
            listings.add(Intent.LIST_PROGRAMS);
        }
        if (ConversationPatterns.LIST_COURSES.matcher(text).find()) {
            listings.add(Intent.LIST_COURSES);
        }
        if (listings.isEmpty() && ConversationPatterns.GENERIC_LISTING.matcher(text).find()) {
            if (ConversationPatterns.FACULTY.matcher(text).find()) {
                listings.add(Intent.LIST_FACULTIES);
            } else if (ConversationPatterns.CURRICULUM.matcher(text).find()) {
                listings.add(Intent.LIST_COURSES);
            } else {
                listings.add(Intent.LIST_PROGRAMS);
            }
        }
        return listings;
    }

    private Optional<AiEntityExtractionResponse> parseAiReply(String reply) {
        Optional<String> json = AiJsonReplies.extractJsonObject(reply);
        if (json.isEmpty()) {
            log.warn("AI entity extraction reply has no JSON object - discarding");
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(json.get(), AiEntityExtractionResponse.class));
        } catch (Exception e) {
            log.warn("AI entity extraction reply is not valid JSON - discarding, error: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Field-wise set union. AI names are mapped onto canonical catalog names where the
     * keyword tables recognize them; greetings and farewells are never taken from the AI.
     */
    ExtractedEntities merge(ExtractedEntities ruleBased, AiEntityExtractionResponse ai) {
        ExtractedEntities.ExtractedEntitiesBuilder builder = ruleBased.toBuilder();

        nonBlank(ai.getPrograms()).forEach(name -> builder.program(
                AcademicKeywordRules.resolveProgram(TextNormalizer.normalize(name)).orElse(canonical(name))));
        nonBlank(ai.getFaculties()).forEach(name -> builder.faculty(
                AcademicKeywordRules.resolveFaculty(TextNormalizer.normalize(name)).orElse(canonical(name))));
        nonBlank(ai.getCourses()).forEach(name -> builder.course(canonical(name)));
        nonBlank(ai.getSemesters()).stream()
                .map(String::trim)
                .filter(value -> SEMESTER_VALUE.matcher(value).matches())
                .forEach(builder::semester);
        nonBlank(ai.getScheduleTracks()).forEach(track -> builder.scheduleTrack(canonical(track)));

        Set<Intent> intents = new LinkedHashSet<>(ruleBased.getIntents());
        nonBlank(ai.getIntents()).stream()
                .map(Intent::fromLabel)
                .flatMap(Optional::stream)
                .filter(intent -> !intent.isConversational())
                .forEach(intents::add);
        if (intents.size() > 1) {
            intents.remove(Intent.GENERAL);
        }
        return builder.clearIntents().intents(intents).build();
    }

    private static List<String> nonBlank(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream().filter(value -> value != null && !value.isBlank()).toList();
    }

    private static String canonical(String name) {
        return TextNormalizer.normalize(name).toUpperCase();
    }
}
