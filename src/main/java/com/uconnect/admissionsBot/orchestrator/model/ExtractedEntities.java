package com.uconnect.admissionsBot.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Structured reading of one utterance: slots plus the ordered intents.
 * Immutable; derive variants with {@link #toBuilder()}.
 */
@Value
@Builder(toBuilder = true)
public class ExtractedEntities {

    @Singular
    Set<String> faculties;

    @Singular
    Set<String> programs;

    @Singular
    Set<String> courses;

    /**
     * Numeric strings "1".."10".
     */
    @Singular
    Set<String> semesters;

    @Singular
    Set<String> scheduleTracks;

    @Singular
    List<Intent> intents;

    String rawQuery;

    public static ExtractedEntities general(String rawQuery) {
        return ExtractedEntities.builder()
                .intent(Intent.GENERAL)
                .rawQuery(rawQuery)
                .build();
    }

    public static ExtractedEntities only(Intent intent, String rawQuery) {
        return ExtractedEntities.builder()
                .intent(intent)
                .rawQuery(rawQuery)
                .build();
    }

    public boolean hasIntent(Intent intent) {
        return intents.contains(intent);
    }

    public boolean hasAnyIntent(Intent... candidates) {
        for (Intent candidate : candidates) {
            if (intents.contains(candidate)) {
                return true;
            }
        }
        return false;
    }

    public boolean hasListingIntent() {
        return intents.stream().anyMatch(Intent::isListing);
    }

    /**
     * Greeting or farewell turns carry nothing else.
     */
    @JsonIgnore
    public boolean isConversational() {
        return intents.stream().anyMatch(Intent::isConversational);
    }

    /**
     * First intent other than GENERAL, used as the remembered topic.
     */
    public Optional<Intent> primaryTopic() {
        return intents.stream().filter(intent -> intent != Intent.GENERAL).findFirst();
    }

    public Optional<String> firstProgram() {
        return programs.stream().findFirst();
    }

    public Optional<String> firstFaculty() {
        return faculties.stream().findFirst();
    }

    public Optional<String> firstSemester() {
        return semesters.stream().findFirst();
    }

    public Optional<String> firstScheduleTrack() {
        return scheduleTracks.stream().findFirst();
    }

    public Optional<String> firstCourse() {
        return courses.stream().findFirst();
    }

    /**
     * True when a lookup can be planned without help: a specific faculty, program or
     * course, a listing request, or a greeting/farewell.
     */
    public boolean hasEnoughEntities() {
        return isConversational()
                || !faculties.isEmpty()
                || !programs.isEmpty()
                || !courses.isEmpty()
                || hasListingIntent();
    }
}
