package com.uconnect.admissionsBot.gateway.exception;

/**
 * Exception thrown when a session has no stored conversation.
 */
public class SessionNotFoundException extends RuntimeException {

    public SessionNotFoundException(String sessionId) {
        super("Session not found: " + sessionId);
    }
}
