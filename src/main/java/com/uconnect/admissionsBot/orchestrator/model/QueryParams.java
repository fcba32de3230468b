package com.uconnect.admissionsBot.orchestrator.model;

/**
 * Filter keys understood by the academic data provider.
 * Names follow the institutional API's query parameters.
 */
public final class QueryParams {

    public static final String NAME = "nombre";
    public static final String FACULTY_NAME = "facultad_nombre";
    public static final String PROGRAM_NAME = "programa_nombre";
    public static final String SEMESTER = "semestre";
    public static final String COURSE_NAME = "materia_nombre";
    public static final String SCHEDULE_TRACK = "lugar_desarrollo";

    private QueryParams() {
        // Constants class
    }
}
