package com.uconnect.admissionsBot.academicApi.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of a program's curriculum (pensum): a course in a semester and schedule track.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class CourseEntry {

    @JsonProperty("programa")
    private String program;

    @JsonProperty("unid_nombre")
    private String facultyName;

    @JsonProperty("jornada")
    private String scheduleTrack;

    @JsonProperty("pensum")
    private String curriculumVersion;

    @JsonProperty("numero_de_creditos_pensum")
    private String curriculumCredits;

    @JsonProperty("semestre")
    private String semester;

    @JsonProperty("materia")
    private String course;

    @JsonProperty("codigo_materia")
    private String courseCode;

    @JsonProperty("creditos")
    private String credits;

    @JsonProperty("total_creditos_semestre")
    private String semesterCredits;

    /**
     * Identity used to drop duplicate rows.
     */
    public String dedupeKey() {
        return program + "|" + semester + "|" + course + "|" + scheduleTrack;
    }
}
