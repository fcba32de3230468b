package com.uconnect.admissionsBot.orchestrator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.Optional;

/**
 * One planned lookup against the academic data provider.
 */
@Value
@Builder
public class ApiCall {

    AcademicEndpoint endpoint;

    @Singular
    Map<String, String> params;

    /**
     * Lower runs first.
     */
    int priority;

    public Optional<String> param(String key) {
        return Optional.ofNullable(params.get(key)).filter(value -> !value.isBlank());
    }
}
