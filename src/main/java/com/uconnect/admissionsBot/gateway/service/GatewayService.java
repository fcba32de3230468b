package com.uconnect.admissionsBot.gateway.service;

import com.uconnect.admissionsBot.gateway.dto.ChatRequest;
import com.uconnect.admissionsBot.gateway.dto.ChatResponse;
import com.uconnect.admissionsBot.gateway.dto.HistoryResponse;
import com.uconnect.admissionsBot.gateway.dto.SessionResponse;
import com.uconnect.admissionsBot.gateway.exception.SessionNotFoundException;
import com.uconnect.admissionsBot.gateway.prompt.AdmissionsResponses;
import com.uconnect.admissionsBot.gateway.prompt.CannedReplies;
import com.uconnect.admissionsBot.llm.service.GenerationClient;
import com.uconnect.admissionsBot.orchestrator.model.AcademicData;
import com.uconnect.admissionsBot.orchestrator.model.ExtractedEntities;
import com.uconnect.admissionsBot.orchestrator.model.Intent;
import com.uconnect.admissionsBot.orchestrator.model.TurnResult;
import com.uconnect.admissionsBot.orchestrator.service.OrchestratorService;
import com.uconnect.admissionsBot.repository.ChatHistoryProvider;
import com.uconnect.admissionsBot.repository.model.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Gateway service - handles all business logic behind the chat endpoints.
 * 
 * Responsibilities:
 * - Resolve or create the session id
 * - Forward the utterance to the orchestrator
 * - Pick the answer: canned reply, fixed admissions answer, or a generated one
 * - Record both sides of the exchange in the chat history
 */
@Slf4j
@Service
public class GatewayService {

    static final int HISTORY_PAGE_SIZE = 50;

    private final SessionIdService sessionIdService;
    private final OrchestratorService orchestratorService;
    private final GenerationClient generationClient;
    private final ChatHistoryProvider chatHistoryProvider;
    private final String simulatorUrl;
    private final String referenceScoresUrl;

    public GatewayService(
            SessionIdService sessionIdService,
            OrchestratorService orchestratorService,
            GenerationClient generationClient,
            ChatHistoryProvider chatHistoryProvider,
            @Value("${uconnect.admissions.simulator-url:}") String simulatorUrl,
            @Value("${uconnect.admissions.reference-scores-url:}") String referenceScoresUrl) {
        this.sessionIdService = sessionIdService;
        this.orchestratorService = orchestratorService;
        this.generationClient = generationClient;
        this.chatHistoryProvider = chatHistoryProvider;
        this.simulatorUrl = simulatorUrl;
        this.referenceScoresUrl = referenceScoresUrl;
    }

    /**
     * Processes a chat request through the gateway.
     *
     * @param request chat request containing messageText and an optional sessionId
     * @return chat response with answer
     */
    public ChatResponse processChatRequest(ChatRequest request) {
        String sessionId = request.getSessionId() == null || request.getSessionId().isBlank()
                ? sessionIdService.generateSessionId()
                : request.getSessionId().trim();
        String messageText = request.getMessageText().trim();
        log.info("Chat request received - sessionId: {}, messageLength: {}", sessionId, messageText.length());

        TurnResult turn = orchestratorService.processTurn(sessionId, messageText);
        String answer = answer(turn, messageText);

        chatHistoryProvider.append(sessionId, ChatMessage.ROLE_USER, messageText);
        chatHistoryProvider.append(sessionId, ChatMessage.ROLE_ASSISTANT, answer);

        ExtractedEntities entities = turn.getEntities();
        return ChatResponse.builder()
                .answer(answer)
                .sessionId(sessionId)
                .intents(entities.getIntents())
                .entities(entities)
                .sources(sources(turn))
                .build();
    }

    public SessionResponse createSession() {
        String sessionId = sessionIdService.generateSessionId();
        log.info("Session created - sessionId: {}", sessionId);
        return SessionResponse.builder()
                .sessionId(sessionId)
                .createdAt(Instant.now())
                .build();
    }

    public void resetSession(String sessionId) {
        orchestratorService.resetSession(sessionId);
    }

    /**
     * @throws SessionNotFoundException if the session has no stored messages
     */
    public HistoryResponse getHistory(String sessionId) {
        if (!chatHistoryProvider.exists(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        return HistoryResponse.builder()
                .sessionId(sessionId)
                .messages(chatHistoryProvider.getHistory(sessionId, HISTORY_PAGE_SIZE))
                .build();
    }

    private String answer(TurnResult turn, String messageText) {
        if (!turn.requiresGeneration()) {
            return fixedAnswer(turn);
        }

        ExtractedEntities entities = turn.getEntities();
        boolean admissions = entities.hasIntent(Intent.ADMISSIONS_INFO);
        String context = turn.getAssembledContext().getText();
        if (admissions) {
            String notes = AdmissionsResponses.contextNotes(simulatorUrl, referenceScoresUrl, entities.firstProgram().orElse(""));
            context = context.isEmpty() ? notes : notes + "\n" + context;
        }

        String answer = generationClient.generate(context, messageText, turn.getHistory());
        if (admissions && !simulatorUrl.isEmpty() && !answer.contains(simulatorUrl)) {
            answer = answer + AdmissionsResponses.linksFooter(simulatorUrl, referenceScoresUrl);
        }
        return answer;
    }

    private String fixedAnswer(TurnResult turn) {
        ExtractedEntities entities = turn.getEntities();
        if (entities.hasIntent(Intent.GREETING)) {
            return CannedReplies.GREETING;
        }
        if (entities.hasIntent(Intent.FAREWELL)) {
            return CannedReplies.FAREWELL;
        }
        log.info("General admissions question - sessionId: {}, replying with fixed admissions answer", turn.getSessionId());
        return AdmissionsResponses.generalAnswer(simulatorUrl, referenceScoresUrl);
    }

    private static List<String> sources(TurnResult turn) {
        List<String> sources = new ArrayList<>();
        if (turn.getEntities().hasIntent(Intent.ADMISSIONS_INFO)) {
            sources.add("Proceso de Admisión - Universidad de Córdoba");
        }
        AcademicData data = turn.getAcademicData();
        if (!data.getFaculties().isEmpty()) {
            sources.add("Datos de Facultades");
        }
        if (!data.getPrograms().isEmpty()) {
            sources.add("Datos de Programas Académicos");
        }
        if (!data.getCourses().isEmpty()) {
            String version = data.getCourses().get(0).getCurriculumVersion();
            sources.add("Pensum " + (version != null ? version : "actualizado"));
        }
        if (data.getProgramDocument() != null) {
            sources.add("PEP " + data.getProgramDocument().getProgramName());
        }
        return sources;
    }
}
