package com.uconnect.admissionsBot.orchestrator.model;

import com.uconnect.admissionsBot.academicApi.model.CourseEntry;
import com.uconnect.admissionsBot.academicApi.model.Faculty;
import com.uconnect.admissionsBot.academicApi.model.Program;
import com.uconnect.admissionsBot.academicApi.model.ProgramDocument;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Facts fetched for one turn.
 */
@Value
@Builder(toBuilder = true)
public class AcademicData {

    @Builder.Default
    List<Faculty> faculties = List.of();

    @Builder.Default
    List<Program> programs = List.of();

    @Builder.Default
    List<CourseEntry> courses = List.of();

    /**
     * Description document of the program the turn is about, if one was attached.
     */
    ProgramDocument programDocument;

    /**
     * Planned lookups that failed; their results are simply missing.
     */
    int failedCalls;

    public static AcademicData empty() {
        return AcademicData.builder().build();
    }

    public boolean hasFacts() {
        return !faculties.isEmpty() || !programs.isEmpty() || !courses.isEmpty() || programDocument != null;
    }
}
