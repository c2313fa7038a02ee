package eu.virtualparadox.incidentkb.rag.retriever.service;

import eu.virtualparadox.incidentkb.application.config.KnowledgeProperties;
import eu.virtualparadox.incidentkb.application.executor.RetrievalExecutor;
import eu.virtualparadox.incidentkb.exception.RetrievalUnavailableException;
import eu.virtualparadox.incidentkb.ingest.model.EDocumentType;
import eu.virtualparadox.incidentkb.rag.index.VectorIndexService;
import eu.virtualparadox.incidentkb.rag.index.model.IndexedCandidate;
import eu.virtualparadox.incidentkb.rag.retriever.filter.MetadataFilter;
import eu.virtualparadox.incidentkb.rag.retriever.model.RetrievalOutcome;
import eu.virtualparadox.incidentkb.rag.retriever.model.RetrievalStats;
import eu.virtualparadox.incidentkb.rag.retriever.model.RetrieverSettings;
import eu.virtualparadox.incidentkb.rag.retriever.model.SearchResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Provides semantic query capabilities over the Lucene HNSW index.
 * <p>
 * Steps:
 * <ol>
 *   <li>Embed the query through the {@link VectorIndexService}</li>
 *   <li>Fetch nearest neighbours and re-rank them according to the configured {@link RetrieverSettings}
 *       (plain similarity, similarity with threshold, or maximal marginal relevance)</li>
 *   <li>Apply the metadata filter, truncate, and assign 1-based ranks</li>
 * </ol>
 * Searches run on the retrieval executor and are bounded by {@code incidentkb.embedding.timeout};
 * a rejected submission or a timeout completes as a degraded outcome, like a provider failure.
 */
@Service
@Slf4j
public class MmrRetrieverService implements RetrieverService {

    private final VectorIndexService vectorIndexService;
    private final AsyncTaskExecutor executor;
    private final Duration timeout;
    private final RetrievalStatistics statistics = new RetrievalStatistics();

    private volatile RetrieverSettings settings;
    private volatile boolean configured;

    @Autowired
    public MmrRetrieverService(final VectorIndexService vectorIndexService,
                               final RetrievalExecutor retrievalExecutor,
                               final KnowledgeProperties properties) {
        this(vectorIndexService, retrievalExecutor, properties.getEmbedding().getTimeout(), RetrieverSettings.DEFAULTS);
    }

    MmrRetrieverService(final VectorIndexService vectorIndexService,
                        final AsyncTaskExecutor executor,
                        final Duration timeout,
                        final RetrieverSettings initialSettings) {
        this.vectorIndexService = vectorIndexService;
        this.executor = executor;
        this.timeout = timeout;
        this.settings = initialSettings;
    }

    @Override
    public void configure(final RetrieverSettings newSettings) {
        if (newSettings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        this.settings = newSettings;
        this.configured = true;
        log.info("Retriever configured: {}, k={}, fetchK={}, lambda={}",
                newSettings.searchType(), newSettings.k(), newSettings.fetchK(), newSettings.lambda());
    }

    @Override
    public RetrieverSettings settings() {
        return settings;
    }

    @Override
    public boolean isConfigured() {
        return configured;
    }

    @Override
    public CompletableFuture<RetrievalOutcome> search(final String query,
                                                      final int maxResults,
                                                      final MetadataFilter filter) {
        validate(query, maxResults);
        final RetrieverSettings current = settings;
        final MetadataFilter effective = filter == null ? MetadataFilter.none() : filter;

        return run(query, () -> {
            final List<SearchResult> ranked = new ArrayList<>();
            for (final IndexedCandidate c : candidates(query, current)) {
                if (ranked.size() >= maxResults) {
                    break;
                }
                if (effective.matches(c.metadata())) {
                    ranked.add(toResult(c, ranked.size() + 1, List.of()));
                }
            }
            log.debug("Search '{}' with {} -> {} results", StringUtils.abbreviate(query, 50), effective, ranked.size());
            return ranked;
        });
    }

    @Override
    public CompletableFuture<RetrievalOutcome> searchByKeywords(final String query,
                                                                final List<String> requiredKeywords,
                                                                final int maxResults) {
        validate(query, maxResults);
        final List<String> required = requiredKeywords == null ? List.of() : List.copyOf(requiredKeywords);

        return run(query, () -> {
            final float[] vector = vectorIndexService.embedQuery(query);
            final List<SearchResult> ranked = new ArrayList<>();
            for (final IndexedCandidate c : vectorIndexService.nearest(vector, maxResults * 2)) {
                final List<String> matched = matchedKeywords(c, required);
                if (!matched.isEmpty()) {
                    ranked.add(toResult(c, ranked.size() + 1, matched));
                }
                if (ranked.size() >= maxResults) {
                    break;
                }
            }
            log.info("Keyword search: {} results with {}", ranked.size(), required);
            return ranked;
        });
    }

    @Override
    public CompletableFuture<RetrievalOutcome> searchByDocumentTypes(final String query,
                                                                     final Collection<EDocumentType> types,
                                                                     final int maxResults) {
        if (types == null || types.isEmpty()) {
            return search(query, maxResults, MetadataFilter.none());
        }
        return search(query, maxResults, MetadataFilter.documentTypes(types));
    }

    @Override
    public RetrievalStats stats() {
        return statistics.snapshot(configured, settings);
    }

    @Override
    public void resetStats() {
        statistics.reset();
    }

    /**
     * Runs a search task on the executor, bounded by the timeout; every failure becomes a degraded outcome.
     * <p>
     * A rejected submission degrades immediately. On timeout, or when the caller cancels the returned
     * future, the running task is cancelled with interruption. Statistics are recorded once per call,
     * by whichever path settles the outcome first.
     */
    private CompletableFuture<RetrievalOutcome> run(final String query, final Supplier<List<SearchResult>> task) {
        final CompletableFuture<RetrievalOutcome> outcome = new CompletableFuture<>();
        final AtomicBoolean settled = new AtomicBoolean();

        final Future<?> running;
        try {
            running = executor.submit(() -> {
                RetrievalOutcome result;
                try {
                    result = RetrievalOutcome.ok(task.get());
                } catch (RuntimeException e) {
                    result = RetrievalOutcome.degraded(toUnavailable(e));
                }
                settle(outcome, settled, query, result);
            });
        } catch (RejectedExecutionException e) {
            settle(outcome, settled, query, RetrievalOutcome.degraded(
                    new RetrievalUnavailableException("Retrieval capacity exhausted, search rejected", e)));
            return outcome;
        }

        CompletableFuture.delayedExecutor(timeout.toMillis(), TimeUnit.MILLISECONDS).execute(() -> {
            final RetrievalUnavailableException error = new RetrievalUnavailableException(
                    "Retrieval timed out after " + timeout.toMillis() + " ms", new TimeoutException());
            if (settle(outcome, settled, query, RetrievalOutcome.degraded(error))) {
                running.cancel(true);
            }
        });
        outcome.whenComplete((result, ex) -> {
            if (outcome.isCancelled()) {
                running.cancel(true);
            }
        });
        return outcome;
    }

    private boolean settle(final CompletableFuture<RetrievalOutcome> outcome,
                           final AtomicBoolean settled,
                           final String query,
                           final RetrievalOutcome result) {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        if (result.isDegraded()) {
            log.warn("Retrieval degraded for '{}': {}", StringUtils.abbreviate(query, 50), result.error().getMessage());
        }
        statistics.record(query, result.results().size());
        return outcome.complete(result);
    }

    private List<IndexedCandidate> candidates(final String query, final RetrieverSettings s) {
        final float[] vector = vectorIndexService.embedQuery(query);

        switch (s.searchType()) {
            case SIMILARITY:
                return vectorIndexService.nearest(vector, s.k());

            case SIMILARITY_SCORE_THRESHOLD:
                return vectorIndexService.nearest(vector, s.k()).stream()
                        .filter(c -> c.similarity() >= s.scoreThreshold())
                        .toList();

            case MMR:
            default:
                final List<IndexedCandidate> fetched = vectorIndexService.nearest(vector, s.fetchK());
                final double[] sims = new double[fetched.size()];
                final List<float[]> vectors = new ArrayList<>(fetched.size());
                for (int i = 0; i < fetched.size(); i++) {
                    sims[i] = fetched.get(i).similarity();
                    vectors.add(fetched.get(i).vector());
                }
                final List<IndexedCandidate> selected = new ArrayList<>();
                for (final int idx : MaximalMarginalRelevance.select(sims, vectors, s.lambda(), s.k())) {
                    selected.add(fetched.get(idx));
                }
                return selected;
        }
    }

    private static List<String> matchedKeywords(final IndexedCandidate c, final List<String> required) {
        final String content = c.text() == null ? "" : c.text().toLowerCase(Locale.ROOT);
        final List<String> keywords = c.metadata().keywords();

        final List<String> matched = new ArrayList<>();
        for (final String kw : required) {
            final String needle = kw.toLowerCase(Locale.ROOT);
            final boolean inKeywords = keywords.stream().anyMatch(k -> k.equalsIgnoreCase(needle));
            if (inKeywords || content.contains(needle)) {
                matched.add(kw);
            }
        }
        return matched;
    }

    private static SearchResult toResult(final IndexedCandidate c, final int rank, final List<String> matched) {
        return new SearchResult(c.chunkId(), c.text(), c.metadata(), rank, c.similarity(), matched);
    }

    private static RetrievalUnavailableException toUnavailable(final RuntimeException ex) {
        final Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        if (cause instanceof RetrievalUnavailableException rue) {
            return rue;
        }
        return new RetrievalUnavailableException("Retrieval failed: " + cause.getMessage(), cause);
    }

    private static void validate(final String query, final int maxResults) {
        if (StringUtils.isBlank(query)) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (maxResults < 1) {
            throw new IllegalArgumentException("maxResults must be >= 1, got " + maxResults);
        }
    }
}
