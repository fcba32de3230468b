package com.uconnect.admissionsBot.llm.exception;

/**
 * Thrown when the language model cannot be reached or returns no usable reply.
 */
public class GenerationUnavailableException extends RuntimeException {

    public GenerationUnavailableException(String message) {
        super(message);
    }

    public GenerationUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
