package com.uconnect.admissionsBot.orchestrator.ai;

import java.util.Optional;

/**
 * Locates the JSON object inside a model reply that may carry prose or code fences around it.
 */
public final class AiJsonReplies {

    private AiJsonReplies() {
        // Utility class
    }

    /**
     * Span from the first '{' to the last '}', or empty if there is none.
     */
    public static Optional<String> extractJsonObject(String reply) {
        if (reply == null) {
            return Optional.empty();
        }
        int start = reply.indexOf('{');
        int end = reply.lastIndexOf('}');
        if (start < 0 || end <= start) {
            return Optional.empty();
        }
        return Optional.of(reply.substring(start, end + 1));
    }
}
