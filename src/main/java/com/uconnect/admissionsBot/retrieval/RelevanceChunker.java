package com.uconnect.admissionsBot.retrieval;

import com.uconnect.admissionsBot.retrieval.model.DocumentSegment;
import com.uconnect.admissionsBot.retrieval.model.RelevantExcerpt;
import com.uconnect.admissionsBot.retrieval.model.ScoredChunk;
import com.uconnect.admissionsBot.util.TextNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Picks the parts of a long document that answer a query, within a character budget.
 * 
 * Segments are selected by score but emitted in document order. The first selected segment may
 * be cut down to the budget; every later one must fit whole or the walk stops.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RelevanceChunker {

    public static final String SEPARATOR = "\n\n---\n\n";

    private final DocumentSegmenter segmenter;
    private final ChunkScorer scorer;

    public RelevantExcerpt extract(String document, String query, int budget) {
        if (document == null || document.isBlank()) {
            return RelevantExcerpt.empty();
        }
        if (document.length() <= budget) {
            return new RelevantExcerpt(document, List.of(), 1);
        }

        List<String> keywords = KeywordExpander.expandQuery(query);
        ChunkScorer.CompiledKeywords compiled = scorer.compile(keywords);
        List<ScoredChunk> ranked = new ArrayList<>();
        for (DocumentSegment segment : segmenter.segment(document)) {
            ranked.add(scorer.score(segment, compiled));
        }
        ranked.sort(Comparator.comparingInt(ScoredChunk::score).reversed());

        List<ScoredChunk> selected = select(ranked, budget);
        if (selected.isEmpty()) {
            log.info("No relevant segment found - keywords: {}, falling back to document start", keywords);
            return new RelevantExcerpt(TextNormalizer.truncate(document, budget), List.of(), 0);
        }

        selected.sort(Comparator.comparingInt(ScoredChunk::position));
        Set<String> found = new LinkedHashSet<>();
        List<String> texts = new ArrayList<>();
        for (ScoredChunk chunk : selected) {
            texts.add(chunk.text());
            found.addAll(chunk.matchedKeywords());
        }
        String text = String.join(SEPARATOR, texts);

        log.info("Extracted relevant excerpt - documentChars: {}, excerptChars: {}, chunks: {}, keywords: {}",
                document.length(), text.length(), selected.size(), found);
        return new RelevantExcerpt(text, List.copyOf(found), selected.size());
    }

    private List<ScoredChunk> select(List<ScoredChunk> ranked, int budget) {
        List<ScoredChunk> selected = new ArrayList<>();
        int used = 0;
        for (ScoredChunk chunk : ranked) {
            if (chunk.score() <= 0) {
                break;
            }
            if (selected.isEmpty() && chunk.score() > scorer.getWeights().getMinFirstChunkScore()) {
                ScoredChunk first = chunk.withText(TextNormalizer.truncate(chunk.text(), budget));
                selected.add(first);
                used = first.text().length();
                continue;
            }
            int cost = selected.isEmpty() ? chunk.text().length() : SEPARATOR.length() + chunk.text().length();
            if (used + cost > budget) {
                break;
            }
            selected.add(chunk);
            used += cost;
        }
        return selected;
    }
}
