package eu.virtualparadox.incidentkb.rag.retriever.service;

import eu.virtualparadox.incidentkb.rag.retriever.model.RetrievalStats;
import eu.virtualparadox.incidentkb.rag.retriever.model.RetrieverSettings;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Thread-safe usage counters of the retriever.
 */
final class RetrievalStatistics {

    private static final int MIN_TERM_LENGTH = 4;
    private static final int TOP_TERMS = 10;

    private long totalSearches;
    private double avgResults;
    private final Map<String, Integer> termFrequency = new HashMap<>();

    synchronized void record(final String query, final int resultCount) {
        totalSearches++;
        final double avg = (avgResults * (totalSearches - 1) + resultCount) / totalSearches;
        avgResults = BigDecimal.valueOf(avg).setScale(2, RoundingMode.HALF_UP).doubleValue();

        if (query == null) {
            return;
        }
        for (final String word : query.toLowerCase(Locale.ROOT).split("\\s+")) {
            if (word.length() >= MIN_TERM_LENGTH) {
                termFrequency.merge(word, 1, Integer::sum);
            }
        }
    }

    synchronized RetrievalStats snapshot(final boolean configured, final RetrieverSettings settings) {
        final Map<String, Integer> top = new LinkedHashMap<>();
        termFrequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_TERMS)
                .forEach(e -> top.put(e.getKey(), e.getValue()));
        return new RetrievalStats(totalSearches, avgResults, Collections.unmodifiableMap(top), configured, settings);
    }

    synchronized void reset() {
        totalSearches = 0;
        avgResults = 0.0;
        termFrequency.clear();
    }
}
