package eu.virtualparadox.incidentkb.knowledge.context;

import eu.virtualparadox.incidentkb.rag.retriever.model.SearchResult;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders search results as a delimited block to be embedded in a language-model prompt.
 */
@Component
public class ContextFormatter {

    static final String BEGIN = "=== BEGIN KNOWLEDGE ===";
    static final String END = "=== END KNOWLEDGE ===";
    private static final int PROMPT_KEYWORDS = 5;

    /**
     * Formats results as
     * <pre>
     * === BEGIN KNOWLEDGE ===
     *
     * --- Source 1: Risk Methodology (magerit_v3) ---
     * Keywords: riesgo, amenaza
     * chunk text
     *
     * === END KNOWLEDGE ===
     * </pre>
     *
     * @return the block, or an empty string when there are no results
     */
    public String formatForPrompt(final List<SearchResult> results) {
        if (results == null || results.isEmpty()) {
            return "";
        }

        final List<String> lines = new ArrayList<>();
        lines.add(BEGIN);
        int n = 1;
        for (final SearchResult r : results) {
            lines.add("\n--- Source " + n++ + ": " + r.metadata().documentType().label()
                    + " (" + displayName(r.filename()) + ") ---");
            if (!r.keywords().isEmpty()) {
                lines.add("Keywords: " + String.join(", ", r.keywords().subList(0, Math.min(PROMPT_KEYWORDS, r.keywords().size()))));
            }
            lines.add(StringUtils.strip(r.content()));
        }
        lines.add("\n" + END + "\n");
        return String.join("\n", lines);
    }

    /**
     * Formats results with {@code [ref_n]} labels followed by a reference list.
     */
    public CitedContext formatWithCitations(final List<SearchResult> results) {
        if (results == null || results.isEmpty()) {
            return CitedContext.EMPTY;
        }

        final List<String> lines = new ArrayList<>();
        final List<Citation> citations = new ArrayList<>();
        lines.add(BEGIN);

        int n = 1;
        for (final SearchResult r : results) {
            final Citation c = new Citation("ref_" + n, r.filename(), r.metadata().documentType().id(),
                    r.chunkId(), r.relevanceRank() > 0 ? r.relevanceRank() : n);
            citations.add(c);
            n++;

            lines.add("\n--- [" + c.id() + "] " + r.metadata().documentType().label()
                    + " (" + displayName(c.source()) + ") ---");
            lines.add(StringUtils.strip(r.content()));
        }

        lines.add("\n" + END);
        lines.add("\nReferences:");
        for (final Citation c : citations) {
            lines.add("[" + c.id() + "] " + c.source() + " - " + c.documentType());
        }
        return new CitedContext(String.join("\n", lines), citations);
    }

    private static String displayName(final String filename) {
        return StringUtils.removeEnd(StringUtils.defaultString(filename), ".txt");
    }
}
