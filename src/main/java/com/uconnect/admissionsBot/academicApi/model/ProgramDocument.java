package com.uconnect.admissionsBot.academicApi.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Long-form program description (PEP). {@code rawText} holds the full extracted text and is
 * usually far larger than the context window.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class ProgramDocument {

    @JsonProperty("programaId")
    private String programId;

    @JsonProperty("programaNombre")
    private String programName;

    @JsonProperty("resumen")
    private String summary;

    @JsonProperty("rawText")
    private String rawText;

    @JsonProperty("historia")
    private String history;

    @JsonProperty("mision")
    private String mission;

    @JsonProperty("vision")
    private String vision;

    @JsonProperty("perfilProfesional")
    private String professionalProfile;

    @JsonProperty("perfilOcupacional")
    private String occupationalProfile;

    @JsonProperty("objetivos")
    @Builder.Default
    private List<String> objectives = new ArrayList<>();

    @JsonProperty("competencias")
    @Builder.Default
    private List<String> competencies = new ArrayList<>();

    @JsonProperty("camposOcupacionales")
    @Builder.Default
    private List<String> occupationalFields = new ArrayList<>();

    @JsonProperty("lineasInvestigacion")
    @Builder.Default
    private List<String> researchLines = new ArrayList<>();

    @JsonProperty("requisitosIngreso")
    private String admissionRequirements;

    @JsonProperty("requisitosGrado")
    private String graduationRequirements;
}
