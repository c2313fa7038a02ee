package eu.virtualparadox.incidentkb.knowledge.stats;

import java.time.Instant;

/**
 * @param query        first 50 characters of the query
 * @param resultsCount number of results returned
 * @param timestamp    time of the search
 */
public record LastSearch(String query, int resultsCount, Instant timestamp) {
}
