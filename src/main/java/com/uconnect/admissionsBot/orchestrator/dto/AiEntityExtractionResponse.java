package com.uconnect.admissionsBot.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON reply of the language model when asked to extract entities.
 * Field names follow the Spanish extraction prompt.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class AiEntityExtractionResponse {

    @JsonProperty("facultades")
    @Builder.Default
    private List<String> faculties = new ArrayList<>();

    @JsonProperty("programas")
    @Builder.Default
    private List<String> programs = new ArrayList<>();

    @JsonProperty("materias")
    @Builder.Default
    private List<String> courses = new ArrayList<>();

    @JsonProperty("semestres")
    @Builder.Default
    private List<String> semesters = new ArrayList<>();

    @JsonProperty("jornadas")
    @Builder.Default
    private List<String> scheduleTracks = new ArrayList<>();

    @JsonProperty("intenciones")
    @Builder.Default
    private List<String> intents = new ArrayList<>();

    @JsonProperty("rawQuery")
    private String rawQuery;
}
