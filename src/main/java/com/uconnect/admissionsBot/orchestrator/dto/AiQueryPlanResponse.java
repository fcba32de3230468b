package com.uconnect.admissionsBot.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * JSON plan proposed by the language model. Validated before use.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class AiQueryPlanResponse {

    @JsonProperty("apis")
    private List<PlannedCall> apis;

    @JsonProperty("strategy")
    private String strategy; // "sequential" | "parallel"

    @JsonProperty("maxResults")
    private Integer maxResults;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class PlannedCall {
        @JsonProperty("endpoint")
        private String endpoint;

        @JsonProperty("params")
        private Map<String, Object> params;

        @JsonProperty("priority")
        private Integer priority;
    }
}
