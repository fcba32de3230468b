package com.uconnect.admissionsBot.orchestrator.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Ordered set of lookups for one turn. Built fresh each turn and never mutated.
 */
@Value
@Builder
public class QueryPlan {

    @Singular
    List<ApiCall> calls;

    FetchStrategy strategy;

    int resultCap;

    public static QueryPlan empty() {
        return QueryPlan.builder()
                .strategy(FetchStrategy.SEQUENTIAL)
                .resultCap(0)
                .build();
    }

    public boolean isEmpty() {
        return calls.isEmpty();
    }
}
