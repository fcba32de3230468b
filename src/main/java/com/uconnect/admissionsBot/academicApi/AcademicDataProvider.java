package com.uconnect.admissionsBot.academicApi;

import com.uconnect.admissionsBot.academicApi.model.CourseEntry;
import com.uconnect.admissionsBot.academicApi.model.Faculty;
import com.uconnect.admissionsBot.academicApi.model.Program;

import java.util.List;
import java.util.Map;

/**
 * Read-only lookups over the academic reference data.
 * 
 * Filters are bags of {@link com.uconnect.admissionsBot.orchestrator.model.QueryParams} keys;
 * an empty bag means "no filter". Implementations throw an unchecked exception when the
 * source itself is unreachable.
 */
public interface AcademicDataProvider {

    List<Faculty> listFaculties(Map<String, String> filter);

    List<Program> listPrograms(Map<String, String> filter);

    List<CourseEntry> listCurriculum(Map<String, String> filter);
}
