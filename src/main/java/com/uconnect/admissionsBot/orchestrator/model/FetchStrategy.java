package com.uconnect.admissionsBot.orchestrator.model;

public enum FetchStrategy {
    SEQUENTIAL,
    PARALLEL
}
