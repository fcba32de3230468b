package com.uconnect.admissionsBot.llm.service;

import com.uconnect.admissionsBot.llm.dto.OllamaChatRequest;
import com.uconnect.admissionsBot.llm.dto.OllamaChatResponse;
import com.uconnect.admissionsBot.llm.exception.GenerationUnavailableException;
import com.uconnect.admissionsBot.llm.prompt.ResponseGenerationPrompt;
import com.uconnect.admissionsBot.repository.model.ChatMessage;
import com.uconnect.admissionsBot.util.TextNormalizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Client for a local Ollama server.
 * Handles HTTP communication with the non-streaming chat endpoint.
 */
@Slf4j
@Service
public class OllamaApiClient implements GenerationClient {

    private static final String CHAT_PATH = "/api/chat";
    private static final Pattern THINK_BLOCK = Pattern.compile("(?s)<think>.*?</think>");
    private static final int HISTORY_MESSAGE_CHARS = 500;

    private RestClient restClient;

    @Value("${ollama.host:http://localhost:11434}")
    private String host;

    @Value("${ollama.model:glm-4.6:cloud}")
    private String model;

    @Value("${ollama.temperature:0.7}")
    private Double temperature;

    @Value("${ollama.json-temperature:0.1}")
    private Double jsonTemperature;

    @Value("${ollama.max-output-tokens:4096}")
    private Integer maxOutputTokens;

    @Value("${uconnect.chatbot.max-history-messages:10}")
    private int maxHistoryMessages;

    /**
     * Gets or initializes the RestClient instance.
     */
    private RestClient getRestClient() {
        if (restClient == null) {
            this.restClient = RestClient.builder()
                    .baseUrl(host)
                    .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                    .build();
        }
        return restClient;
    }

    @Override
    public String complete(String systemPrompt, String userPrompt) {
        List<OllamaChatRequest.Message> messages = List.of(
                message("system", systemPrompt),
                message("user", userPrompt));
        return chat(messages, "json", jsonTemperature);
    }

    @Override
    public String generate(String context, String question, List<ChatMessage> history) {
        List<OllamaChatRequest.Message> messages = new ArrayList<>();
        messages.add(message("system", ResponseGenerationPrompt.SYSTEM_PROMPT));
        if (history != null) {
            int from = Math.max(0, history.size() - maxHistoryMessages);
            for (ChatMessage previous : history.subList(from, history.size())) {
                messages.add(message(previous.getRole(), TextNormalizer.truncate(previous.getContent(), HISTORY_MESSAGE_CHARS)));
            }
        }
        messages.add(message("user", ResponseGenerationPrompt.userPrompt(context, question)));
        return chat(messages, null, temperature);
    }

    /**
     * Sends a chat request and returns the reply with reasoning blocks removed.
     * 
     * @throws GenerationUnavailableException if the call fails or the reply is empty
     */
    private String chat(List<OllamaChatRequest.Message> messages, String format, Double requestTemperature) {
        OllamaChatRequest request = OllamaChatRequest.builder()
                .model(model)
                .messages(messages)
                .stream(false)
                .format(format)
                .options(OllamaChatRequest.Options.builder()
                        .temperature(requestTemperature)
                        .numPredict(maxOutputTokens)
                        .build())
                .build();

        OllamaChatResponse response;
        try {
            log.debug("Calling Ollama API - model: {}, messages: {}, format: {}", model, messages.size(), format);

            response = getRestClient().post()
                    .uri(CHAT_PATH)
                    .body(request)
                    .retrieve()
                    .body(OllamaChatResponse.class);
        } catch (Exception e) {
            log.error("Error calling Ollama API - host: {}, model: {}", host, model, e);
            throw new GenerationUnavailableException("Failed to call Ollama API: " + e.getMessage(), e);
        }

        if (response == null || response.getContent() == null || response.getContent().isBlank()) {
            throw new GenerationUnavailableException("Ollama API returned an empty reply");
        }

        log.debug("Ollama API response received - model: {}, promptTokens: {}, outputTokens: {}",
                response.getModel(), response.getPromptEvalCount(), response.getEvalCount());

        return cleanModelResponse(response.getContent());
    }

    /**
     * Removes {@code <think>...</think>} reasoning blocks some models prepend to their answer.
     */
    static String cleanModelResponse(String content) {
        return THINK_BLOCK.matcher(content).replaceAll("").trim();
    }

    private static OllamaChatRequest.Message message(String role, String content) {
        return OllamaChatRequest.Message.builder()
                .role(role)
                .content(content)
                .build();
    }
}
