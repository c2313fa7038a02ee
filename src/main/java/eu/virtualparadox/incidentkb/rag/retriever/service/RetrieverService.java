package eu.virtualparadox.incidentkb.rag.retriever.service;

import eu.virtualparadox.incidentkb.ingest.model.EDocumentType;
import eu.virtualparadox.incidentkb.rag.retriever.filter.MetadataFilter;
import eu.virtualparadox.incidentkb.rag.retriever.model.RetrievalOutcome;
import eu.virtualparadox.incidentkb.rag.retriever.model.RetrievalStats;
import eu.virtualparadox.incidentkb.rag.retriever.model.RetrieverSettings;

import java.util.Collection;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Semantic search over the vector index.
 * <p>
 * All searches run asynchronously. Provider failures and timeouts never surface as exceptions:
 * the returned future completes with a degraded {@link RetrievalOutcome} instead.
 */
public interface RetrieverService {

    /**
     * Applies search settings.
     *
     * @throws IllegalArgumentException if the settings are invalid
     */
    void configure(RetrieverSettings settings);

    RetrieverSettings settings();

    boolean isConfigured();

    CompletableFuture<RetrievalOutcome> search(String query, int maxResults, MetadataFilter filter);

    default CompletableFuture<RetrievalOutcome> search(final String query, final int maxResults) {
        return search(query, maxResults, MetadataFilter.none());
    }

    /**
     * Similarity search keeping only chunks whose keywords or text contain one of {@code requiredKeywords}.
     */
    CompletableFuture<RetrievalOutcome> searchByKeywords(String query, List<String> requiredKeywords, int maxResults);

    CompletableFuture<RetrievalOutcome> searchByDocumentTypes(String query, Collection<EDocumentType> types, int maxResults);

    RetrievalStats stats();

    void resetStats();
}
