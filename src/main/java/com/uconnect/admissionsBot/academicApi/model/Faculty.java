package com.uconnect.admissionsBot.academicApi.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Academic unit (facultad) as published by the institutional API.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class Faculty {

    @JsonProperty("unid_id")
    private String id;

    @JsonProperty("unid_nombre")
    private String name;
}
