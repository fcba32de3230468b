package com.uconnect.admissionsBot.orchestrator.service;

import com.uconnect.admissionsBot.academicApi.ProgramDocumentService;
import com.uconnect.admissionsBot.academicApi.model.ProgramDocument;
import com.uconnect.admissionsBot.orchestrator.model.AcademicData;
import com.uconnect.admissionsBot.orchestrator.model.AssembledContext;
import com.uconnect.admissionsBot.orchestrator.model.ExtractedEntities;
import com.uconnect.admissionsBot.orchestrator.model.Intent;
import com.uconnect.admissionsBot.orchestrator.model.QueryPlan;
import com.uconnect.admissionsBot.orchestrator.model.SessionContext;
import com.uconnect.admissionsBot.orchestrator.model.TurnResult;
import com.uconnect.admissionsBot.repository.ChatHistoryProvider;
import com.uconnect.admissionsBot.repository.model.ChatMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Orchestrator service - workflow owner for one conversational turn.
 * 
 * Workflow steps:
 * EXTRACT -> (IF GREETING/FAREWELL -> UPDATE_SESSION -> END)
 * -> ENRICH -> PLAN -> FETCH -> ATTACH_DOCUMENT -> LOAD_HISTORY -> ASSEMBLE -> UPDATE_SESSION
 * 
 * Extraction and planning never fail. Data provider failures propagate as
 * {@link com.uconnect.admissionsBot.academicApi.exception.AcademicDataUnavailableException}.
 */
@Slf4j
@Service
public class OrchestratorService {

    /**
     * Intents answered from structured data alone; a turn made only of these skips the program document.
     */
    private static final Set<Intent> STRUCTURED_ONLY_INTENTS = EnumSet.of(
            Intent.CURRICULUM_INFO, Intent.CREDITS, Intent.FACULTY_INFO,
            Intent.LIST_FACULTIES, Intent.LIST_PROGRAMS, Intent.LIST_COURSES);

    private final EntityExtractionService entityExtractionService;
    private final SessionContextService sessionContextService;
    private final QueryPlannerService queryPlannerService;
    private final FetchService fetchService;
    private final ProgramDocumentService programDocumentService;
    private final ContextAssemblerService contextAssemblerService;
    private final ChatHistoryProvider chatHistoryProvider;
    private final int maxHistoryMessages;

    public OrchestratorService(
            EntityExtractionService entityExtractionService,
            SessionContextService sessionContextService,
            QueryPlannerService queryPlannerService,
            FetchService fetchService,
            ProgramDocumentService programDocumentService,
            ContextAssemblerService contextAssemblerService,
            ChatHistoryProvider chatHistoryProvider,
            @Value("${uconnect.chatbot.max-history-messages:10}") int maxHistoryMessages) {
        this.entityExtractionService = entityExtractionService;
        this.sessionContextService = sessionContextService;
        this.queryPlannerService = queryPlannerService;
        this.fetchService = fetchService;
        this.programDocumentService = programDocumentService;
        this.contextAssemblerService = contextAssemblerService;
        this.chatHistoryProvider = chatHistoryProvider;
        this.maxHistoryMessages = maxHistoryMessages;
    }

    /**
     * Processes one user utterance into grounded context for the answer.
     *
     * @param sessionId conversation the utterance belongs to
     * @param utterance raw user text
     * @return extracted entities, the executed plan, fetched facts and the assembled context
     */
    public TurnResult processTurn(String sessionId, String utterance) {
        log.info("Starting turn - sessionId: {}", sessionId);

        // Step 1: EXTRACT
        ExtractedEntities extracted = entityExtractionService.extract(utterance);
        log.info("Step EXTRACT - sessionId: {}, intents: {}, programs: {}, faculties: {}, semesters: {}",
                sessionId, extracted.getIntents(), extracted.getPrograms(), extracted.getFaculties(), extracted.getSemesters());

        if (extracted.isConversational()) {
            log.info("Conversational turn - sessionId: {}, intent: {}", sessionId, extracted.getIntents());
            sessionContextService.update(sessionId, extracted);
            return TurnResult.builder()
                    .sessionId(sessionId)
                    .entities(extracted)
                    .plan(QueryPlan.empty())
                    .academicData(AcademicData.empty())
                    .assembledContext(AssembledContext.empty())
                    .build();
        }

        // Step 2: ENRICH
        Optional<SessionContext> sessionContext = sessionContextService.get(sessionId);
        ExtractedEntities entities = sessionContextService.enrich(extracted, sessionContext);

        // Step 3: PLAN
        QueryPlan plan = entities.hasIntent(Intent.ADMISSIONS_INFO) && entities.getPrograms().isEmpty()
                ? QueryPlan.empty()
                : queryPlannerService.planQuery(entities);
        log.info("Step PLAN - sessionId: {}, calls: {}, strategy: {}, resultCap: {}",
                sessionId, plan.getCalls().size(), plan.getStrategy(), plan.getResultCap());

        // Step 4: FETCH
        AcademicData data = fetchService.fetchData(plan, sessionId);

        // Step 5: ATTACH_DOCUMENT
        data = attachProgramDocument(entities, data);

        // Step 6: LOAD_HISTORY
        List<ChatMessage> history = chatHistoryProvider.getHistory(sessionId, maxHistoryMessages);

        // Step 7: ASSEMBLE
        AssembledContext context = contextAssemblerService.assemble(entities, data, history);

        // Step 8: UPDATE_SESSION
        sessionContextService.update(sessionId, entities);

        log.info("Turn processed - sessionId: {}, contextChars: {}, truncated: {}",
                sessionId, context.getTotalChars(), context.isTruncated());
        return TurnResult.builder()
                .sessionId(sessionId)
                .entities(entities)
                .plan(plan)
                .academicData(data)
                .assembledContext(context)
                .history(history)
                .build();
    }

    /**
     * Forgets the session's context and transcript.
     */
    public void resetSession(String sessionId) {
        sessionContextService.clear(sessionId);
        chatHistoryProvider.delete(sessionId);
        log.info("Session reset - sessionId: {}", sessionId);
    }

    private AcademicData attachProgramDocument(ExtractedEntities entities, AcademicData data) {
        Optional<String> requested = entities.firstProgram();
        if (requested.isEmpty() || STRUCTURED_ONLY_INTENTS.containsAll(entities.getIntents())) {
            return data;
        }
        Optional<ProgramDocument> document = programDocumentService
                .selectProgram(data.getPrograms(), requested.get())
                .flatMap(programDocumentService::findForProgram);
        if (document.isEmpty()) {
            log.warn("Program document not found - program: {}", requested.get());
            return data;
        }
        return data.toBuilder().programDocument(document.get()).build();
    }
}
