package com.uconnect.admissionsBot.retrieval;

import com.uconnect.admissionsBot.retrieval.model.RelevantExcerpt;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RelevanceChunkerTest {

    private static final String FILLER = "texto de relleno sobre el programa academico de la universidad ";

    private static final String OBJECTIVES_LEAD = "los objetivos del programa ";
    private static final String COMPETENCIES_LEAD = "las competencias y mas competencias del egresado ";

    private static final String DOCUMENT =
            section("1. Historia del programa", "")
                    + section("2. Objetivos del programa", OBJECTIVES_LEAD)
                    + section("3. Organizacion academica", "")
                    + section("4. Competencias del egresado", COMPETENCIES_LEAD)
                    + section("5. Bienestar universitario", "");

    private final RelevanceChunker chunker = new RelevanceChunker(new DocumentSegmenter(), new ChunkScorer());

    @Test
    void extract_shouldReturnEmptyExcerptForMissingDocument() {
        assertThat(chunker.extract(null, "objetivos", 1000)).isEqualTo(RelevantExcerpt.empty());
        assertThat(chunker.extract("  ", "objetivos", 1000).isEmpty()).isTrue();
    }

    @Test
    void extract_shouldReturnShortDocumentVerbatim() {
        RelevantExcerpt excerpt = chunker.extract("Documento breve del programa.", "objetivos", 1000);

        assertThat(excerpt.text()).isEqualTo("Documento breve del programa.");
        assertThat(excerpt.chunksUsed()).isEqualTo(1);
        assertThat(excerpt.foundKeywords()).isEmpty();
    }

    @Test
    void extract_shouldEmitSelectedSegmentsInDocumentOrderRegardlessOfScore() {
        // the competencies section scores higher but comes later in the document
        RelevantExcerpt excerpt = chunker.extract(DOCUMENT, "objetivos y competencias", 1000);

        assertThat(excerpt.chunksUsed()).isEqualTo(2);
        assertThat(excerpt.text()).contains(RelevanceChunker.SEPARATOR);
        assertThat(excerpt.text().indexOf(OBJECTIVES_LEAD.trim()))
                .isLessThan(excerpt.text().indexOf(COMPETENCIES_LEAD.trim()));
        assertThat(excerpt.foundKeywords()).containsExactlyInAnyOrder("objetivos", "competencias");
        assertThat(excerpt.text().length()).isLessThanOrEqualTo(1000);
    }

    @Test
    void extract_shouldTruncateAnOversizedFirstSegmentToTheBudget() {
        RelevantExcerpt excerpt = chunker.extract(DOCUMENT, "objetivos y competencias", 200);

        assertThat(excerpt.chunksUsed()).isEqualTo(1);
        assertThat(excerpt.text()).startsWith(COMPETENCIES_LEAD.trim()).endsWith("...");
        assertThat(excerpt.text()).hasSize(200);
    }

    @Test
    void extract_shouldFallBackToDocumentStartWhenNothingMatches() {
        RelevantExcerpt excerpt = chunker.extract(DOCUMENT, "horarios de la biblioteca", 500);

        assertThat(excerpt.foundKeywords()).isEmpty();
        assertThat(excerpt.chunksUsed()).isZero();
        assertThat(excerpt.text()).hasSize(500).startsWith("1. Historia del programa").endsWith("...");
    }

    @Test
    void extract_shouldNeverExceedTheBudget() {
        for (String query : List.of("objetivos y competencias", "competencias", "historia", "nada relacionado")) {
            for (int budget : new int[]{150, 400, 700, 1000, 1500}) {
                RelevantExcerpt excerpt = chunker.extract(DOCUMENT, query, budget);
                assertThat(excerpt.text().length())
                        .as("query '%s' with budget %d", query, budget)
                        .isLessThanOrEqualTo(budget);
            }
        }
    }

    private static String section(String title, String lead) {
        StringBuilder body = new StringBuilder(lead);
        while (body.length() < 320) {
            body.append(FILLER);
        }
        return title + "\n" + body.substring(0, 320).trim() + "\n\n";
    }
}
