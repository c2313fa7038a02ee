package eu.virtualparadox.incidentkb.knowledge.stats;

import java.util.List;

/**
 * Outcome of running a set of sample queries against the knowledge base.
 */
public record SelfTestReport(int queriesTested,
                             int successfulSearches,
                             int failedSearches,
                             int totalResultsFound,
                             List<Detail> details) {

    public SelfTestReport {
        details = List.copyOf(details);
    }

    /**
     * @param query        sample query
     * @param success      whether retrieval was available
     * @param resultsCount results returned
     * @param topResult    filename of the best result, {@code null} if none
     * @param error        failure message, {@code null} on success
     */
    public record Detail(String query, boolean success, int resultsCount, String topResult, String error) {
    }
}
