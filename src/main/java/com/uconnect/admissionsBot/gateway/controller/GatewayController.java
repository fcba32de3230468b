package com.uconnect.admissionsBot.gateway.controller;

import com.uconnect.admissionsBot.gateway.dto.ChatRequest;
import com.uconnect.admissionsBot.gateway.dto.ChatResponse;
import com.uconnect.admissionsBot.gateway.dto.HistoryResponse;
import com.uconnect.admissionsBot.gateway.dto.SessionResponse;
import com.uconnect.admissionsBot.gateway.service.GatewayService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Gateway REST controller - thin HTTP layer for chat requests.
 * 
 * Responsibilities:
 * - Handle HTTP requests/responses
 * - Validate request bodies
 * - Delegate business logic to GatewayService
 */
@RestController
@RequestMapping("/api/v1/chat")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class GatewayController {

    private final GatewayService gatewayService;

    /**
     * Chat endpoint - answers one user message.
     *
     * @param request Chat request containing messageText and an optional sessionId
     * @return Chat response with answer and the session it belongs to
     */
    @PostMapping
    public ResponseEntity<ChatResponse> chat(@Valid @RequestBody ChatRequest request) {
        return ResponseEntity.ok(gatewayService.processChatRequest(request));
    }

    @PostMapping("/sessions")
    public ResponseEntity<SessionResponse> createSession() {
        return ResponseEntity.status(HttpStatus.CREATED).body(gatewayService.createSession());
    }

    /**
     * Forgets the session's context and transcript. Unknown sessions are accepted.
     */
    @DeleteMapping("/sessions/{sessionId}")
    public ResponseEntity<Void> resetSession(@PathVariable String sessionId) {
        gatewayService.resetSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/sessions/{sessionId}/history")
    public ResponseEntity<HistoryResponse> history(@PathVariable String sessionId) {
        return ResponseEntity.ok(gatewayService.getHistory(sessionId));
    }
}
