package eu.virtualparadox.incidentkb.knowledge.context;

import eu.virtualparadox.incidentkb.ingest.model.ChunkMetadata;
import eu.virtualparadox.incidentkb.ingest.model.EChunkType;
import eu.virtualparadox.incidentkb.ingest.model.EDocumentType;
import eu.virtualparadox.incidentkb.rag.retriever.model.SearchResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContextFormatterTest {

    private final ContextFormatter formatter = new ContextFormatter();

    private static SearchResult result(final String filename, final EDocumentType type, final int rank,
                                       final String content, final List<String> keywords) {
        ChunkMetadata metadata = new ChunkMetadata(filename, type, 0, 1, EChunkType.CONCEPTUAL,
                keywords, 0, "es", "cybersecurity");
        return new SearchResult(filename + "#0", content, metadata, rank, 0.9, List.of());
    }

    private static List<SearchResult> results() {
        return List.of(
                result("magerit_v3.txt", EDocumentType.RISK_METHODOLOGY, 1, "  texto uno \n", List.of("riesgo", "amenaza")),
                result("compliance.txt", EDocumentType.COMPLIANCE, 2, "texto dos", List.of()));
    }

    @Test
    void testPromptBlock() {
        String expected = "=== BEGIN KNOWLEDGE ===\n"
                + "\n--- Source 1: Risk Methodology (magerit_v3) ---\n"
                + "Keywords: riesgo, amenaza\n"
                + "texto uno\n"
                + "\n--- Source 2: Compliance (compliance) ---\n"
                + "texto dos\n"
                + "\n=== END KNOWLEDGE ===\n";

        assertThat(formatter.formatForPrompt(results())).isEqualTo(expected);
    }

    @Test
    void testPromptBlockShowsFiveKeywordsAtMost() {
        SearchResult r = result("a.txt", EDocumentType.GENERAL, 1, "x",
                List.of("k1", "k2", "k3", "k4", "k5", "k6", "k7"));

        assertThat(formatter.formatForPrompt(List.of(r))).contains("Keywords: k1, k2, k3, k4, k5\n")
                .doesNotContain("k6");
    }

    @Test
    void testNoResultsGiveEmptyOutput() {
        assertThat(formatter.formatForPrompt(List.of())).isEmpty();
        assertThat(formatter.formatForPrompt(null)).isEmpty();
        assertThat(formatter.formatWithCitations(List.of())).isEqualTo(CitedContext.EMPTY);
    }

    @Test
    void testCitations() {
        CitedContext cited = formatter.formatWithCitations(results());

        assertThat(cited.text()).isEqualTo("=== BEGIN KNOWLEDGE ===\n"
                + "\n--- [ref_1] Risk Methodology (magerit_v3) ---\n"
                + "texto uno\n"
                + "\n--- [ref_2] Compliance (compliance) ---\n"
                + "texto dos\n"
                + "\n=== END KNOWLEDGE ===\n"
                + "\nReferences:\n"
                + "[ref_1] magerit_v3.txt - risk_methodology\n"
                + "[ref_2] compliance.txt - compliance");
        assertThat(cited.citations()).containsExactly(
                new Citation("ref_1", "magerit_v3.txt", "risk_methodology", "magerit_v3.txt#0", 1),
                new Citation("ref_2", "compliance.txt", "compliance", "compliance.txt#0", 2));
    }
}
