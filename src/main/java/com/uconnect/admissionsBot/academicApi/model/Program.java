package com.uconnect.admissionsBot.academicApi.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Academic program (carrera) with its owning faculty.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class Program {

    @JsonProperty("prog_id")
    private String id;

    @JsonProperty("prog_nombre")
    private String name;

    @JsonProperty("facultad_id")
    private String facultyId;

    @JsonProperty("facultad_nombre")
    private String facultyName;
}
