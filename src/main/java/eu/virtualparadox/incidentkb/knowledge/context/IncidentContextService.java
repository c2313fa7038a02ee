package eu.virtualparadox.incidentkb.knowledge.context;

import eu.virtualparadox.incidentkb.exception.KnowledgeBaseException;
import eu.virtualparadox.incidentkb.knowledge.KnowledgeOrchestrator;
import eu.virtualparadox.incidentkb.rag.retriever.model.SearchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Supplies knowledge context for incident analysis. Never fails: when the knowledge base is
 * unavailable the analysis proceeds without context.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IncidentContextService {

    static final int MAX_CONTEXT_CHUNKS = 5;

    private final KnowledgeOrchestrator orchestrator;
    private final ContextFormatter formatter;

    /**
     * @return the formatted knowledge block, or an empty string when no context is available
     */
    public String contextFor(final IncidentQuery incident) {
        final String query = buildQuery(incident);
        log.info("Looking up knowledge for: {}", StringUtils.abbreviate(query, 100));

        try {
            final List<SearchResult> results = orchestrator.searchRelevantContext(query, MAX_CONTEXT_CHUNKS, null);
            if (results.isEmpty()) {
                log.warn("No relevant knowledge found");
                return "";
            }
            log.info("Knowledge context: {} relevant chunks", results.size());
            return formatter.formatForPrompt(results);

        } catch (KnowledgeBaseException | IllegalArgumentException e) {
            log.error("Unable to obtain knowledge context: {}", e.getMessage());
            return "";
        }
    }

    /**
     * {@code "<title>. <description>[. Categoría: <category>]"}.
     */
    static String buildQuery(final IncidentQuery incident) {
        final StringBuilder sb = new StringBuilder()
                .append(StringUtils.defaultString(incident.title()))
                .append(". ")
                .append(StringUtils.defaultString(incident.description()));
        if (StringUtils.isNotBlank(incident.initialCategory())) {
            sb.append(". Categoría: ").append(incident.initialCategory());
        }
        return sb.toString();
    }
}
