package eu.virtualparadox.incidentkb.ingest.keyword;

import eu.virtualparadox.incidentkb.ingest.model.EChunkType;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Extracts cybersecurity vocabulary terms from text and infers the semantic type of a chunk.
 * <p>
 * Matching is a case-insensitive substring test, so {@code "riesgo"} also matches
 * {@code "riesgos"}. Results keep the vocabulary order, not the order of appearance in the text.
 */
@Component
public class KeywordExtractor {

    /** Maximum number of keywords attached to a chunk. */
    public static final int MAX_KEYWORDS = 10;

    /** Domain vocabulary of the methodology corpus (Spanish, as the source documents). */
    public static final List<String> SECURITY_VOCABULARY = List.of(
            "magerit", "octave", "vulnerabilidad", "amenaza", "riesgo", "impacto",
            "control", "salvaguarda", "activo", "confidencialidad", "integridad",
            "disponibilidad", "iso", "nist", "ens", "ciberseguridad", "framework",
            "metodología", "análisis", "gestión", "evaluación", "mitigación",
            "compliance", "auditoria", "incidente", "contingencia"
    );

    /**
     * Spanish trigger terms per chunk type, checked in declaration order; first hit wins.
     */
    private static final Map<EChunkType, List<String>> CHUNK_TYPE_TRIGGERS = new LinkedHashMap<>();

    static {
        CHUNK_TYPE_TRIGGERS.put(EChunkType.VULNERABILITIES,
                List.of("vulnerabilidad", "amenaza", "exploit"));
        CHUNK_TYPE_TRIGGERS.put(EChunkType.CONTROLS,
                List.of("control", "salvaguarda", "mitigación"));
        CHUNK_TYPE_TRIGGERS.put(EChunkType.IMPACTS,
                List.of("impacto", "daño", "consecuencia"));
        CHUNK_TYPE_TRIGGERS.put(EChunkType.METHODOLOGY,
                List.of("metodología", "framework", "proceso"));
        CHUNK_TYPE_TRIGGERS.put(EChunkType.FRAMEWORK_REFERENCE,
                List.of("iso", "nist", "magerit", "octave"));
    }

    /**
     * Returns the vocabulary terms contained in {@code text}, limited to {@link #MAX_KEYWORDS}.
     *
     * @param text chunk or document text (may be null)
     * @return ordered, immutable keyword list
     */
    public List<String> extractKeywords(final String text) {
        return allKeywords(text).stream().limit(MAX_KEYWORDS).toList();
    }

    /**
     * Returns every vocabulary term contained in {@code text}, without truncation.
     */
    public List<String> allKeywords(final String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        final String lower = text.toLowerCase(Locale.ROOT);
        final List<String> found = new ArrayList<>();
        for (final String term : SECURITY_VOCABULARY) {
            if (lower.contains(term)) {
                found.add(term);
            }
        }
        return List.copyOf(found);
    }

    /**
     * Infers the semantic type of a chunk from trigger terms.
     *
     * @param text chunk text
     * @return the first matching type, or {@link EChunkType#CONCEPTUAL}
     */
    public EChunkType classifyChunk(final String text) {
        if (text == null || text.isEmpty()) {
            return EChunkType.CONCEPTUAL;
        }
        final String lower = text.toLowerCase(Locale.ROOT);
        for (final Map.Entry<EChunkType, List<String>> entry : CHUNK_TYPE_TRIGGERS.entrySet()) {
            if (entry.getValue().stream().anyMatch(lower::contains)) {
                return entry.getKey();
            }
        }
        return EChunkType.CONCEPTUAL;
    }
}
