package com.uconnect.admissionsBot.academicApi;

import com.uconnect.admissionsBot.academicApi.model.CourseEntry;
import com.uconnect.admissionsBot.academicApi.model.Faculty;
import com.uconnect.admissionsBot.academicApi.model.Program;
import com.uconnect.admissionsBot.orchestrator.model.QueryParams;
import com.uconnect.admissionsBot.util.TextNormalizer;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Filter semantics shared by every data source: case and accent insensitive "contains"
 * on names, exact match on semester.
 */
public final class AcademicFilters {

    private static final Pattern POSTGRADUATE = Pattern.compile("maestria|doctorado|especializacion");

    private AcademicFilters() {
        // Utility class
    }

    public static List<Faculty> filterFaculties(List<Faculty> faculties, Map<String, String> filter) {
        String name = firstPresent(filter, QueryParams.NAME, QueryParams.FACULTY_NAME);
        return faculties.stream()
                .filter(faculty -> matches(faculty.getName(), name))
                .collect(Collectors.toList());
    }

    /**
     * Undergraduate programs only; postgraduate offerings are never listed.
     */
    public static List<Program> filterPrograms(List<Program> programs, Map<String, String> filter) {
        String name = firstPresent(filter, QueryParams.PROGRAM_NAME, QueryParams.NAME);
        String faculty = firstPresent(filter, QueryParams.FACULTY_NAME);
        return programs.stream()
                .filter(program -> !isPostgraduate(program.getName()))
                .filter(program -> matches(program.getName(), name))
                .filter(program -> matches(program.getFacultyName(), faculty))
                .collect(Collectors.toList());
    }

    /**
     * Filters curriculum rows, drops duplicates and, without an explicit track, keeps only
     * the rows of the first track present.
     */
    public static List<CourseEntry> filterCurriculum(List<CourseEntry> rows, Map<String, String> filter) {
        String program = firstPresent(filter, QueryParams.PROGRAM_NAME);
        String semester = firstPresent(filter, QueryParams.SEMESTER);
        String course = firstPresent(filter, QueryParams.COURSE_NAME);
        String track = firstPresent(filter, QueryParams.SCHEDULE_TRACK);

        Set<String> seen = new HashSet<>();
        List<CourseEntry> results = rows.stream()
                .filter(row -> matches(row.getProgram(), program))
                .filter(row -> semester == null || semester.equals(row.getSemester()))
                .filter(row -> matches(row.getCourse(), course))
                .filter(row -> matches(row.getScheduleTrack(), track))
                .filter(row -> seen.add(row.dedupeKey()))
                .collect(Collectors.toList());

        if (track == null && !results.isEmpty()) {
            String firstTrack = results.get(0).getScheduleTrack();
            results = results.stream()
                    .filter(row -> firstTrack == null ? row.getScheduleTrack() == null : firstTrack.equals(row.getScheduleTrack()))
                    .collect(Collectors.toList());
        }
        return results;
    }

    public static boolean isPostgraduate(String programName) {
        return POSTGRADUATE.matcher(TextNormalizer.normalize(programName)).find();
    }

    private static boolean matches(String value, String wanted) {
        if (wanted == null) {
            return true;
        }
        return value != null && TextNormalizer.normalize(value).contains(TextNormalizer.normalize(wanted));
    }

    private static String firstPresent(Map<String, String> filter, String... keys) {
        if (filter == null) {
            return null;
        }
        for (String key : keys) {
            String value = filter.get(key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return null;
    }
}
