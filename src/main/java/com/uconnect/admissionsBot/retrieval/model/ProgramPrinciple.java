package com.uconnect.admissionsBot.retrieval.model;

public record ProgramPrinciple(String name, String description) {
}
