package com.uconnect.admissionsBot.orchestrator.model;

import com.uconnect.admissionsBot.retrieval.model.RelevantExcerpt;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Bounded grounding text handed to the language model for one turn.
 * {@code sections} are the untruncated blocks in emission order; {@code text} is their
 * concatenation after the overall budget was applied.
 */
@Value
@Builder
public class AssembledContext {

    @Singular
    List<String> sections;

    String text;

    int totalChars;

    boolean truncated;

    /**
     * Excerpt of the program document, when one was attached.
     */
    RelevantExcerpt excerpt;

    public static AssembledContext empty() {
        return AssembledContext.builder().text("").build();
    }

    public boolean isEmpty() {
        return text == null || text.isEmpty();
    }
}
