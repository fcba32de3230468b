package com.uconnect.admissionsBot.retrieval;

import com.uconnect.admissionsBot.retrieval.model.DocumentSegment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a long document into scorable segments. Three strategies are tried in order and the
 * first that yields at least {@value #MIN_SEGMENTS} segments wins: heading sections, blank-line
 * paragraphs, then overlapping fixed windows.
 */
@Slf4j
@Component
public class DocumentSegmenter {

    static final int MIN_SEGMENTS = 3;

    static final int MIN_SECTION_LENGTH = 150;
    static final int MIN_PARAGRAPH_LENGTH = 50;
    static final int MIN_WINDOW_LENGTH = 100;
    static final int WINDOW_SIZE = 800;
    static final int WINDOW_OVERLAP = 200;

    // Numbered titles ("3. Mision", "4.2 Perfil del egresado") or long all-caps lines.
    private static final Pattern HEADING = Pattern.compile(
            "(?m)^(?:\\d+(?:\\.\\d+)*\\.?[ \\t]+[A-ZÑÁÉÍÓÚ][^\\n]{5,80}|[A-ZÑÁÉÍÓÚ][A-ZÑÁÉÍÓÚ \\t]{9,})[ \\t]*$");

    private static final Pattern BLANK_LINES = Pattern.compile("\\n\\s*\\n");

    public List<DocumentSegment> segment(String document) {
        if (document == null || document.isBlank()) {
            return List.of();
        }

        List<DocumentSegment> segments = bySections(document);
        if (segments.size() >= MIN_SEGMENTS) {
            log.debug("Segmented document by headings - segments: {}", segments.size());
            return segments;
        }

        segments = byParagraphs(document);
        if (segments.size() >= MIN_SEGMENTS) {
            log.debug("Segmented document by paragraphs - segments: {}", segments.size());
            return segments;
        }

        segments = byWindows(document);
        log.debug("Segmented document by fixed windows - segments: {}", segments.size());
        return segments;
    }

    /**
     * Each segment is the body strictly after a heading, up to the next heading.
     */
    List<DocumentSegment> bySections(String document) {
        Matcher matcher = HEADING.matcher(document);
        List<int[]> headings = new ArrayList<>();
        while (matcher.find()) {
            headings.add(new int[]{matcher.start(), matcher.end()});
        }
        if (headings.size() <= 2) {
            return List.of();
        }

        List<DocumentSegment> segments = new ArrayList<>();
        for (int i = 0; i < headings.size(); i++) {
            int bodyStart = headings.get(i)[1];
            int bodyEnd = i + 1 < headings.size() ? headings.get(i + 1)[0] : document.length();
            addTrimmed(segments, document, bodyStart, bodyEnd, MIN_SECTION_LENGTH);
        }
        return segments;
    }

    List<DocumentSegment> byParagraphs(String document) {
        List<DocumentSegment> segments = new ArrayList<>();
        Matcher matcher = BLANK_LINES.matcher(document);
        int start = 0;
        while (matcher.find()) {
            addTrimmed(segments, document, start, matcher.start(), MIN_PARAGRAPH_LENGTH);
            start = matcher.end();
        }
        addTrimmed(segments, document, start, document.length(), MIN_PARAGRAPH_LENGTH);
        return segments;
    }

    List<DocumentSegment> byWindows(String document) {
        List<DocumentSegment> segments = new ArrayList<>();
        int step = WINDOW_SIZE - WINDOW_OVERLAP;
        for (int start = 0; start < document.length(); start += step) {
            addTrimmed(segments, document, start, Math.min(start + WINDOW_SIZE, document.length()), MIN_WINDOW_LENGTH);
        }
        return segments;
    }

    private static void addTrimmed(List<DocumentSegment> segments, String document, int start, int end, int minLength) {
        int from = start;
        int to = end;
        while (from < to && Character.isWhitespace(document.charAt(from))) {
            from++;
        }
        while (to > from && Character.isWhitespace(document.charAt(to - 1))) {
            to--;
        }
        if (to - from > minLength) {
            segments.add(new DocumentSegment(document.substring(from, to), from));
        }
    }
}
