package eu.virtualparadox.incidentkb.rag.retriever.model;

import java.util.Map;

/**
 * Snapshot of the retriever's usage statistics.
 *
 * @param totalSearches        number of search calls
 * @param avgResultsPerSearch  running average result count, rounded to 2 decimals
 * @param topSearchTerms       up to 10 most frequent query terms, most frequent first
 * @param configured           whether search settings have been applied
 * @param settings             current settings
 */
public record RetrievalStats(long totalSearches,
                             double avgResultsPerSearch,
                             Map<String, Integer> topSearchTerms,
                             boolean configured,
                             RetrieverSettings settings) {
}
