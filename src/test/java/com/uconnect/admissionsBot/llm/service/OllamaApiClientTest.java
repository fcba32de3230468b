package com.uconnect.admissionsBot.llm.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OllamaApiClientTest {

    @Test
    void cleanModelResponse_shouldStripReasoningBlocks() {
        String content = "<think>\nEl usuario pregunta por el pensum.\n</think>\n\nEl pensum tiene 10 semestres.";

        assertThat(OllamaApiClient.cleanModelResponse(content)).isEqualTo("El pensum tiene 10 semestres.");
    }

    @Test
    void cleanModelResponse_shouldKeepPlainAnswers() {
        assertThat(OllamaApiClient.cleanModelResponse("  {\"programas\": []}\n")).isEqualTo("{\"programas\": []}");
    }
}
