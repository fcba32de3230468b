package com.uconnect.admissionsBot.retrieval;

import com.uconnect.admissionsBot.retrieval.model.DocumentSegment;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentSegmenterTest {

    private static final String FILLER = "texto de relleno sobre el programa academico de la universidad ";

    private final DocumentSegmenter segmenter = new DocumentSegmenter();

    @Test
    void segment_shouldSplitOnHeadingsAndKeepOnlyTheBodies() {
        String document = "1. Historia del programa\n" + body(200) + "\n\n"
                + "2. Mision del programa\n" + body(200) + "\n\n"
                + "3. Vision del programa\n" + body(200) + "\n";

        List<DocumentSegment> segments = segmenter.segment(document);

        assertThat(segments).hasSize(3);
        assertThat(segments).allSatisfy(segment -> {
            assertThat(segment.text()).doesNotContain("del programa\n");
            assertThat(segment.text()).startsWith("texto de relleno");
        });
        assertThat(segments).extracting(DocumentSegment::position).isSorted();
    }

    @Test
    void segment_shouldDiscardShortSectionsAndFallBackToParagraphs() {
        // three headings but every body is too short to count as a section
        String document = "1. Historia del programa\n" + body(120) + "\n\n"
                + "2. Mision del programa\n" + body(120) + "\n\n"
                + "3. Vision del programa\n" + body(120) + "\n\n"
                + body(80);

        List<DocumentSegment> segments = segmenter.segment(document);

        assertThat(segments).hasSizeGreaterThanOrEqualTo(3);
        assertThat(segments).extracting(DocumentSegment::text)
                .anySatisfy(text -> assertThat(text).startsWith("1. Historia del programa"));
    }

    @Test
    void segment_shouldSplitOnBlankLinesWhenThereAreNoHeadings() {
        String document = body(80) + "\n\n" + body(90) + "\n   \n" + body(100) + "\n\n" + "corto";

        List<DocumentSegment> segments = segmenter.segment(document);

        assertThat(segments).hasSize(3);
        assertThat(segments.get(0).position()).isZero();
        assertThat(segments).extracting(DocumentSegment::position).isSorted();
    }

    @Test
    void segment_shouldUseOverlappingWindowsAsLastResort() {
        String document = body(2000).replace('\n', ' ');

        List<DocumentSegment> segments = segmenter.segment(document);

        // windows start every 600 characters and span at most 800
        assertThat(segments).hasSize(4);
        assertThat(segments).allSatisfy(segment -> assertThat(segment.text().length()).isLessThanOrEqualTo(800));
        assertThat(segments.get(1).position()).isEqualTo(600);
    }

    @Test
    void segment_shouldReturnNothingForBlankDocument() {
        assertThat(segmenter.segment(null)).isEmpty();
        assertThat(segmenter.segment("   ")).isEmpty();
    }

    private static String body(int length) {
        StringBuilder builder = new StringBuilder();
        while (builder.length() < length) {
            builder.append(FILLER);
        }
        return builder.substring(0, length).trim();
    }
}
