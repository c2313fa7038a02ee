package eu.virtualparadox.incidentkb.rag.retriever.model;

import eu.virtualparadox.incidentkb.exception.RetrievalUnavailableException;

import java.util.List;
import java.util.Optional;

/**
 * Result of a retrieval call.
 * <p>
 * A {@link ERetrievalStatus#DEGRADED} outcome always carries an empty result list and the cause,
 * so callers can tell "no relevant knowledge" apart from "retrieval unavailable".
 */
public record RetrievalOutcome(ERetrievalStatus status,
                               List<SearchResult> results,
                               RetrievalUnavailableException error) {

    public RetrievalOutcome {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static RetrievalOutcome ok(final List<SearchResult> results) {
        return new RetrievalOutcome(ERetrievalStatus.OK, results, null);
    }

    public static RetrievalOutcome degraded(final RetrievalUnavailableException error) {
        return new RetrievalOutcome(ERetrievalStatus.DEGRADED, List.of(), error);
    }

    public boolean isDegraded() {
        return status == ERetrievalStatus.DEGRADED;
    }

    public Optional<RetrievalUnavailableException> failure() {
        return Optional.ofNullable(error);
    }
}
