package eu.virtualparadox.incidentkb.knowledge;

import eu.virtualparadox.incidentkb.application.config.KnowledgeProperties;
import eu.virtualparadox.incidentkb.exception.EmptyInputException;
import eu.virtualparadox.incidentkb.exception.KnowledgeNotReadyException;
import eu.virtualparadox.incidentkb.ingest.DocumentIngestor;
import eu.virtualparadox.incidentkb.ingest.model.Chunk;
import eu.virtualparadox.incidentkb.ingest.model.EDocumentType;
import eu.virtualparadox.incidentkb.ingest.model.SourceDocument;
import eu.virtualparadox.incidentkb.knowledge.health.EHealthStatus;
import eu.virtualparadox.incidentkb.knowledge.health.HealthComponents;
import eu.virtualparadox.incidentkb.knowledge.health.HealthReport;
import eu.virtualparadox.incidentkb.knowledge.stats.KnowledgeStats;
import eu.virtualparadox.incidentkb.knowledge.stats.LastSearch;
import eu.virtualparadox.incidentkb.knowledge.stats.SelfTestReport;
import eu.virtualparadox.incidentkb.rag.index.IndexSnapshot;
import eu.virtualparadox.incidentkb.rag.index.VectorIndexService;
import eu.virtualparadox.incidentkb.rag.retriever.model.RetrievalOutcome;
import eu.virtualparadox.incidentkb.rag.retriever.model.RetrieverSettings;
import eu.virtualparadox.incidentkb.rag.retriever.model.SearchResult;
import eu.virtualparadox.incidentkb.rag.retriever.service.RetrieverService;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the knowledge base lifecycle and is the single entry point for queries.
 * <p>
 * Initialization runs in dependency order:
 * <ol>
 *     <li>Embedding client</li>
 *     <li>Vector index: reuse the persisted snapshot when the sources are unchanged, otherwise
 *         load, chunk, embed and persist the documents</li>
 *     <li>Retriever configuration</li>
 * </ol>
 * State moves {@code UNINITIALIZED -> INITIALIZING -> READY}; a failed health check moves a ready
 * knowledge base to {@code DEGRADED} and a healthy one moves it back. Queries are rejected with
 * {@link KnowledgeNotReadyException} until initialization succeeds.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class KnowledgeOrchestrator {

    static final String HEALTH_QUERY = "test";
    static final List<String> DEFAULT_SELF_TEST_QUERIES = List.of(
            "vulnerabilidad",
            "MAGERIT",
            "análisis de riesgo",
            "controles de seguridad",
            "principios de seguridad");

    private static final Map<String, List<String>> METHODOLOGY_KEYWORDS = Map.of(
            "MAGERIT", List.of("magerit", "activo", "amenaza", "vulnerabilidad", "impacto", "riesgo"),
            "OCTAVE", List.of("octave", "asset", "threat", "vulnerability"),
            "ISO27001", List.of("iso", "27001", "sgsi", "control", "anexo"),
            "NIST", List.of("nist", "framework", "cybersecurity", "function"));

    private final KnowledgeProperties properties;
    private final DocumentIngestor documentIngestor;
    private final VectorIndexService vectorIndexService;
    private final RetrieverService retrieverService;

    private final AtomicReference<EKnowledgeState> state = new AtomicReference<>(EKnowledgeState.UNINITIALIZED);
    private volatile Throwable lastError;

    private volatile int documentsLoaded;
    private volatile int chunksCreated;
    private volatile Duration initializationTime;
    private volatile boolean snapshotReused;
    private volatile LastSearch lastSearch;
    private final AtomicLong retrievalCalls = new AtomicLong();

    /**
     * Initializes the knowledge base. Does nothing when already serving.
     *
     * @throws eu.virtualparadox.incidentkb.exception.KnowledgeConfigException if the embedding credential is missing
     * @throws eu.virtualparadox.incidentkb.exception.DocumentSourceNotFoundException if a build is needed and the
     *                                                                                 document directory is absent
     * @throws EmptyInputException if a build is needed and there is nothing to index
     */
    public synchronized void initialize() {
        if (state.get().isServing()) {
            log.debug("Knowledge base already initialized ({})", state.get());
            return;
        }
        doInitialize(false);
    }

    /**
     * Re-runs initialization. With {@code forceReindex} the persisted snapshot is deleted first,
     * otherwise it is reused when still current.
     */
    public synchronized void reinitialize(final boolean forceReindex) {
        log.info("Reinitializing knowledge base (forceReindex={})", forceReindex);
        if (forceReindex) {
            cleanup();
        } else {
            shutdown();
        }
        doInitialize(forceReindex);
    }

    private void doInitialize(final boolean forceRebuild) {
        state.set(EKnowledgeState.INITIALIZING);
        final Instant start = Instant.now();
        log.info("Initializing knowledge base from {}", properties.getDocs());

        try {
            // 1) embeddings
            vectorIndexService.initializeEmbedder(properties.getEmbedding().getApiKey());

            // 2) vector index
            setupVectorIndex(forceRebuild);

            // 3) retriever
            final KnowledgeProperties.Retriever r = properties.getRetriever();
            retrieverService.configure(new RetrieverSettings(
                    r.getSearchType(), r.getK(), r.getFetchK(), r.getLambda(), r.getScoreThreshold()));

            initializationTime = Duration.between(start, Instant.now());
            lastError = null;
            state.set(EKnowledgeState.READY);
            log.info("Knowledge base ready in {} ms: {} documents, {} chunks (snapshot reused: {})",
                    initializationTime.toMillis(), documentsLoaded, chunksCreated, snapshotReused);

        } catch (RuntimeException e) {
            lastError = e;
            state.set(EKnowledgeState.UNINITIALIZED);
            log.error("Knowledge base initialization failed", e);
            throw e;
        }
    }

    private void setupVectorIndex(final boolean forceRebuild) {
        final String collection = properties.getCollection();
        final Optional<IndexSnapshot> existing = forceRebuild ? Optional.empty() : vectorIndexService.load(collection);

        if (existing.isPresent() && !vectorIndexService.shouldRebuild(properties.getDocs(), existing)) {
            try {
                chunksCreated = existing.get().recordCount();
            } catch (IOException e) {
                throw new IllegalStateException("Unable to read snapshot " + collection, e);
            }
            documentsLoaded = 0;
            snapshotReused = true;
            log.info("Reusing persisted snapshot {}", collection);
            return;
        }

        log.info("Building a new snapshot for {}", collection);
        final List<SourceDocument> documents = documentIngestor.loadAllDocuments(properties.getDocs());
        documentsLoaded = documents.size();
        if (documents.isEmpty()) {
            throw new EmptyInputException("No documents found in " + properties.getDocs());
        }

        final List<Chunk> chunks = documentIngestor.splitDocuments(documents);
        chunksCreated = chunks.size();

        vectorIndexService.build(collection, chunks);
        snapshotReused = false;
    }

    /**
     * Searches the knowledge base and waits for the outcome.
     *
     * @param documentTypes optional document-type restriction, {@code null} or empty for none
     * @throws KnowledgeNotReadyException before initialization completed
     */
    public RetrievalOutcome search(final String query,
                                   final int maxChunks,
                                   final Collection<EDocumentType> documentTypes) {
        requireServing();
        return searchAsync(query, maxChunks, documentTypes).join();
    }

    public RetrievalOutcome search(final String query, final int maxChunks) {
        return search(query, maxChunks, null);
    }

    /**
     * Asynchronous variant of {@link #search(String, int, Collection)}. The future completes
     * exceptionally with {@link KnowledgeNotReadyException} before initialization completed.
     */
    public CompletableFuture<RetrievalOutcome> searchAsync(final String query,
                                                           final int maxChunks,
                                                           final Collection<EDocumentType> documentTypes) {
        if (!state.get().isServing()) {
            return CompletableFuture.failedFuture(notReady());
        }

        final CompletableFuture<RetrievalOutcome> future = documentTypes == null || documentTypes.isEmpty()
                ? retrieverService.search(query, maxChunks)
                : retrieverService.searchByDocumentTypes(query, documentTypes, maxChunks);

        return future.thenApply(outcome -> {
            retrievalCalls.incrementAndGet();
            lastSearch = new LastSearch(StringUtils.left(query, 50), outcome.results().size(), Instant.now());
            log.info("Search completed: {} chunks for '{}'", outcome.results().size(), StringUtils.abbreviate(query, 30));
            return outcome;
        });
    }

    /**
     * Returns the ranked context for a query; empty when retrieval is degraded.
     */
    public List<SearchResult> searchRelevantContext(final String query,
                                                    final int maxChunks,
                                                    final Collection<EDocumentType> documentTypes) {
        return search(query, maxChunks, documentTypes).results();
    }

    /**
     * Keyword-constrained search for one methodology (MAGERIT, OCTAVE, ISO27001, NIST).
     * Unknown methodologies use their lower-cased name as the only keyword.
     */
    public List<SearchResult> searchByMethodology(final String query, final String methodology, final int maxResults) {
        requireServing();
        if (StringUtils.isBlank(methodology)) {
            throw new IllegalArgumentException("methodology must not be blank");
        }
        final List<String> keywords = METHODOLOGY_KEYWORDS.getOrDefault(
                methodology.toUpperCase(Locale.ROOT), List.of(methodology.toLowerCase(Locale.ROOT)));

        final RetrievalOutcome outcome = retrieverService
                .searchByKeywords(query + " " + methodology, keywords, maxResults)
                .join();
        retrievalCalls.incrementAndGet();
        return outcome.results();
    }

    /**
     * Document type ids present in the index; empty before initialization.
     */
    public List<String> availableDocumentTypes() {
        if (!state.get().isServing()) {
            return List.of();
        }
        return new ArrayList<>(vectorIndexService.stats().documentTypeHistogram().keySet());
    }

    /**
     * Checks every component and runs a live one-result query.
     * <p>A ready knowledge base becomes {@link EKnowledgeState#DEGRADED} on a failed check and
     * returns to {@link EKnowledgeState#READY} on a healthy one.</p>
     */
    public HealthReport healthCheck() {
        try {
            final EKnowledgeState observed = state.get();
            final HealthComponents components = new HealthComponents(
                    observed.isServing(),
                    Files.isDirectory(properties.getDocs()),
                    vectorIndexService.currentSnapshot().map(IndexSnapshot::existsOnDisk).orElse(false),
                    retrieverService.isConfigured(),
                    vectorIndexService.isEmbedderReady());

            boolean testSearchSuccessful = false;
            if (components.initialized() && components.retriever()) {
                try {
                    final RetrievalOutcome outcome = search(HEALTH_QUERY, 1);
                    testSearchSuccessful = !outcome.isDegraded() && !outcome.results().isEmpty();
                } catch (KnowledgeNotReadyException | CancellationException e) {
                    log.warn("Health test search failed: {}", e.getMessage());
                }
            }

            final EHealthStatus status = components.allUp() && testSearchSuccessful
                    ? EHealthStatus.HEALTHY
                    : EHealthStatus.DEGRADED;
            updateStateFromHealth(observed, status);

            return new HealthReport(status, components, testSearchSuccessful, Instant.now(), null);

        } catch (RuntimeException e) {
            log.error("Health check failed", e);
            return HealthReport.unhealthy(e.getMessage());
        }
    }

    /**
     * Applies a health transition only if the state is still the one the check observed, so a check
     * overlapping initialization or shutdown never overrides the newer state.
     */
    private void updateStateFromHealth(final EKnowledgeState observed, final EHealthStatus status) {
        if (status == EHealthStatus.HEALTHY && observed == EKnowledgeState.DEGRADED) {
            if (state.compareAndSet(EKnowledgeState.DEGRADED, EKnowledgeState.READY)) {
                log.info("Knowledge base recovered");
            }
        } else if (status != EHealthStatus.HEALTHY && observed == EKnowledgeState.READY) {
            if (state.compareAndSet(EKnowledgeState.READY, EKnowledgeState.DEGRADED)) {
                log.warn("Knowledge base degraded");
            }
        }
    }


    /**
     * Runs sample queries (three results each) and reports which ones retrieval could serve.
     */
    public SelfTestReport selfTest(final List<String> queries) {
        requireServing();
        final List<String> samples = queries == null || queries.isEmpty() ? DEFAULT_SELF_TEST_QUERIES : queries;

        int ok = 0;
        int failed = 0;
        int total = 0;
        final List<SelfTestReport.Detail> details = new ArrayList<>();
        for (final String q : samples) {
            final RetrievalOutcome outcome = search(q, 3);
            if (outcome.isDegraded()) {
                failed++;
                details.add(new SelfTestReport.Detail(q, false, 0, null, outcome.error().getMessage()));
            } else {
                ok++;
                total += outcome.results().size();
                final String top = outcome.results().isEmpty() ? null : outcome.results().get(0).filename();
                details.add(new SelfTestReport.Detail(q, true, outcome.results().size(), top, null));
            }
        }
        return new SelfTestReport(samples.size(), ok, failed, total, details);
    }

    public KnowledgeStats stats() {
        final Throwable error = lastError;
        return new KnowledgeStats(
                state.get(),
                documentsLoaded,
                chunksCreated,
                initializationTime,
                retrievalCalls.get(),
                lastSearch,
                snapshotReused,
                properties.getDocs(),
                properties.getIndex(),
                vectorIndexService.stats(),
                retrieverService.stats(),
                error == null ? null : error.getMessage());
    }

    public EKnowledgeState state() {
        return state.get();
    }

    public Optional<Throwable> lastError() {
        return Optional.ofNullable(lastError);
    }

    /**
     * Releases resources and deletes the persisted snapshot; statistics are reset.
     */
    public synchronized void cleanup() {
        log.info("Cleaning up knowledge base resources");
        vectorIndexService.delete(properties.getCollection());
        retrieverService.resetStats();
        resetCounters();
        state.set(EKnowledgeState.UNINITIALIZED);
    }

    /**
     * Releases resources and keeps the persisted snapshot for the next start.
     */
    @PreDestroy
    public synchronized void shutdown() {
        vectorIndexService.close();
        state.set(EKnowledgeState.UNINITIALIZED);
        log.info("Knowledge base shut down");
    }

    private void resetCounters() {
        documentsLoaded = 0;
        chunksCreated = 0;
        initializationTime = null;
        snapshotReused = false;
        lastSearch = null;
        retrievalCalls.set(0);
    }

    private void requireServing() {
        if (!state.get().isServing()) {
            throw notReady();
        }
    }

    private KnowledgeNotReadyException notReady() {
        return new KnowledgeNotReadyException("Knowledge base is not ready (state: " + state.get() + ")");
    }
}
