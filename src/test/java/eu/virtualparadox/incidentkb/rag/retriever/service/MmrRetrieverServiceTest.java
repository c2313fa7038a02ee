package eu.virtualparadox.incidentkb.rag.retriever.service;

import eu.virtualparadox.incidentkb.application.config.KnowledgeProperties;
import eu.virtualparadox.incidentkb.application.executor.RetrievalExecutor;
import eu.virtualparadox.incidentkb.exception.RetrievalUnavailableException;
import eu.virtualparadox.incidentkb.ingest.model.Chunk;
import eu.virtualparadox.incidentkb.ingest.model.EDocumentType;
import eu.virtualparadox.incidentkb.rag.index.LuceneVectorIndexService;
import eu.virtualparadox.incidentkb.rag.retriever.filter.MetadataFilter;
import eu.virtualparadox.incidentkb.rag.retriever.filter.MetadataKey;
import eu.virtualparadox.incidentkb.rag.retriever.model.ESearchType;
import eu.virtualparadox.incidentkb.rag.retriever.model.RetrievalOutcome;
import eu.virtualparadox.incidentkb.rag.retriever.model.RetrievalStats;
import eu.virtualparadox.incidentkb.rag.retriever.model.RetrieverSettings;
import eu.virtualparadox.incidentkb.rag.retriever.model.SearchResult;
import eu.virtualparadox.incidentkb.support.HashingEmbeddingService;
import eu.virtualparadox.incidentkb.support.KnowledgeFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.IntStream;

import static eu.virtualparadox.incidentkb.support.KnowledgeFixtures.COLLECTION;
import static eu.virtualparadox.incidentkb.support.KnowledgeFixtures.chunk;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MmrRetrieverServiceTest {

    @TempDir
    Path root;

    private HashingEmbeddingService embedder;
    private LuceneVectorIndexService index;
    private RetrievalExecutor executor;
    private MmrRetrieverService retriever;

    @BeforeEach
    void setUp() {
        KnowledgeProperties properties = KnowledgeFixtures.properties(root.resolve("docs"), root.resolve("vectorstore"));
        embedder = new HashingEmbeddingService();
        index = new LuceneVectorIndexService(properties, apiKey -> embedder);
        index.initializeEmbedder("test-key");
        index.build(COLLECTION, chunks());

        executor = KnowledgeFixtures.retrievalExecutor();
        retriever = new MmrRetrieverService(index, executor, Duration.ofSeconds(5), RetrieverSettings.DEFAULTS);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
        index.close();
    }

    private static List<Chunk> chunks() {
        return List.of(
                chunk("magerit.txt", 0, EDocumentType.RISK_METHODOLOGY,
                        "magerit analiza activos amenazas y vulnerabilidades", List.of("magerit", "activo")),
                chunk("magerit.txt", 1, EDocumentType.RISK_METHODOLOGY,
                        "el impacto de una amenaza sobre un activo", List.of("impacto")),
                chunk("principios.txt", 0, EDocumentType.SECURITY_PRINCIPLES,
                        "confidencialidad integridad disponibilidad", List.of("confidencialidad")),
                chunk("compliance.txt", 0, EDocumentType.COMPLIANCE,
                        "cumplimiento normativo y auditoria de amenazas", List.of("compliance")));
    }

    @Test
    @DisplayName("Results are ranked from 1 and truncated to maxResults")
    void ranksAreConsecutive() {
        RetrievalOutcome outcome = retriever.search("activos amenazas", 3).join();

        assertThat(outcome.isDegraded()).isFalse();
        assertThat(outcome.results()).hasSize(3);
        assertThat(outcome.results()).extracting(SearchResult::relevanceRank).containsExactly(1, 2, 3);
        assertThat(outcome.results().get(0).chunkId()).isEqualTo(Chunk.chunkId("magerit.txt", 0));
    }

    @Test
    @DisplayName("Metadata filter keeps only matching chunks")
    void filterByDocumentType() {
        RetrievalOutcome outcome = retriever.search("amenazas", 5,
                MetadataFilter.equalTo(MetadataKey.DOCUMENT_TYPE, "compliance")).join();

        assertThat(outcome.results()).hasSize(1);
        assertThat(outcome.results().get(0).filename()).isEqualTo("compliance.txt");
        assertThat(outcome.results().get(0).relevanceRank()).isEqualTo(1);

        RetrievalOutcome byTypes = retriever.searchByDocumentTypes("amenazas",
                List.of(EDocumentType.RISK_METHODOLOGY), 5).join();
        assertThat(byTypes.results()).isNotEmpty()
                .allSatisfy(r -> assertThat(r.metadata().documentType()).isEqualTo(EDocumentType.RISK_METHODOLOGY));
    }

    @Test
    @DisplayName("Keyword search reports the matched keywords")
    void keywordSearch() {
        RetrievalOutcome outcome = retriever.searchByKeywords("análisis de riesgos", List.of("magerit"), 3).join();

        assertThat(outcome.results()).hasSize(1);
        SearchResult result = outcome.results().get(0);
        assertThat(result.chunkId()).isEqualTo(Chunk.chunkId("magerit.txt", 0));
        assertThat(result.matchedKeywords()).containsExactly("magerit");
    }

    @Test
    @DisplayName("Threshold search drops candidates under the score threshold")
    void scoreThreshold() {
        retriever.configure(new RetrieverSettings(ESearchType.SIMILARITY_SCORE_THRESHOLD, 4, 4, 0.7, 0.5));

        RetrievalOutcome outcome = retriever.search("confidencialidad integridad disponibilidad", 4).join();

        assertThat(outcome.results()).isNotEmpty()
                .allSatisfy(r -> assertThat(r.score()).isGreaterThanOrEqualTo(0.5));
        assertThat(outcome.results().get(0).filename()).isEqualTo("principios.txt");
    }

    @Test
    @DisplayName("Provider failure completes with a degraded outcome")
    void degradedOnProviderFailure() {
        embedder.setFailing(true);

        RetrievalOutcome outcome = retriever.search("amenazas", 3).join();

        assertThat(outcome.isDegraded()).isTrue();
        assertThat(outcome.results()).isEmpty();
        assertThat(outcome.failure()).get().isInstanceOf(RetrievalUnavailableException.class);
        assertThat(retriever.stats().totalSearches()).isEqualTo(1);
        assertThat(retriever.stats().avgResultsPerSearch()).isZero();
    }

    private static RetrievalExecutor singleThreadExecutor(final int queueCapacity) {
        RetrievalExecutor single = new RetrievalExecutor();
        single.setCorePoolSize(1);
        single.setMaxPoolSize(1);
        single.setQueueCapacity(queueCapacity);
        single.setThreadNamePrefix("retrieve-single-");
        single.initialize();
        return single;
    }

    @Test
    @DisplayName("Slow provider times out into a degraded outcome and frees the worker")
    void degradedOnTimeout() throws Exception {
        RetrievalExecutor single = singleThreadExecutor(10);
        try {
            MmrRetrieverService slow = new MmrRetrieverService(index, single, Duration.ofMillis(50),
                    RetrieverSettings.DEFAULTS);
            embedder.setDelay(Duration.ofSeconds(5));

            RetrievalOutcome outcome = slow.search("amenazas", 3).get(2, TimeUnit.SECONDS);

            assertThat(outcome.isDegraded()).isTrue();
            assertThat(outcome.failure()).get()
                    .satisfies(e -> assertThat(e.getCause()).isInstanceOf(TimeoutException.class));
            assertThat(slow.stats().totalSearches()).isEqualTo(1);

            // the timed-out task was interrupted, so the only worker serves the next search at once
            embedder.setDelay(Duration.ZERO);
            MmrRetrieverService fast = new MmrRetrieverService(index, single, Duration.ofSeconds(5),
                    RetrieverSettings.DEFAULTS);
            assertThat(fast.search("amenazas", 3).get(2, TimeUnit.SECONDS).isDegraded()).isFalse();
        } finally {
            single.shutdown();
        }
    }

    @Test
    @DisplayName("Cancelling a search interrupts the running task")
    void cancellationStopsTheTask() throws Exception {
        RetrievalExecutor single = singleThreadExecutor(10);
        try {
            MmrRetrieverService service = new MmrRetrieverService(index, single, Duration.ofSeconds(30),
                    RetrieverSettings.DEFAULTS);
            embedder.setDelay(Duration.ofSeconds(5));

            CompletableFuture<RetrievalOutcome> pending = service.search("amenazas", 3);
            Thread.sleep(100);
            assertThat(pending.cancel(true)).isTrue();

            embedder.setDelay(Duration.ZERO);
            RetrievalOutcome next = service.search("activos", 3).get(2, TimeUnit.SECONDS);
            assertThat(next.isDegraded()).isFalse();
            assertThat(next.results()).isNotEmpty();
        } finally {
            single.shutdown();
        }
    }

    @Test
    @DisplayName("A saturated executor degrades instead of throwing")
    void degradedWhenExecutorRejects() throws Exception {
        RetrievalExecutor single = singleThreadExecutor(0);
        try {
            MmrRetrieverService service = new MmrRetrieverService(index, single, Duration.ofSeconds(5),
                    RetrieverSettings.DEFAULTS);
            embedder.setDelay(Duration.ofMillis(500));

            CompletableFuture<RetrievalOutcome> busy = service.search("amenazas", 3);
            RetrievalOutcome rejected = service.search("activos", 3).getNow(null);

            assertThat(rejected).isNotNull();
            assertThat(rejected.isDegraded()).isTrue();
            assertThat(rejected.results()).isEmpty();
            assertThat(rejected.failure()).get()
                    .satisfies(e -> assertThat(e.getCause()).isInstanceOf(RejectedExecutionException.class));
            assertThat(service.searchByKeywords("activos", List.of("magerit"), 3).getNow(null).isDegraded()).isTrue();

            assertThat(busy.get(2, TimeUnit.SECONDS).isDegraded()).isFalse();
            assertThat(service.stats().totalSearches()).isEqualTo(3);
        } finally {
            single.shutdown();
        }
    }

    @Test
    @DisplayName("MMR with lambda 1 returns the same ranking as plain similarity")
    void mmrWithFullRelevanceEqualsSimilarity() {
        retriever.configure(new RetrieverSettings(ESearchType.MMR, 4, 4, 1.0, 0.5));
        List<String> mmr = retriever.search("activos amenazas impacto", 4).join().results().stream()
                .map(SearchResult::chunkId).toList();

        retriever.configure(new RetrieverSettings(ESearchType.SIMILARITY, 4, 4, 0.7, 0.5));
        List<String> similarity = retriever.search("activos amenazas impacto", 4).join().results().stream()
                .map(SearchResult::chunkId).toList();

        assertThat(mmr).hasSize(4).isEqualTo(similarity);
    }

    @Test
    @DisplayName("Keyword search stops at maxResults when more chunks match")
    void keywordSearchIsCapped() {
        List<Chunk> many = IntStream.range(0, 6)
                .mapToObj(i -> chunk("magerit.txt", i, EDocumentType.RISK_METHODOLOGY,
                        "magerit fase " + i + " del análisis", List.of("magerit")))
                .toList();
        index.build(COLLECTION, many);

        RetrievalOutcome outcome = retriever.searchByKeywords("magerit", List.of("magerit"), 3).join();

        assertThat(outcome.results()).hasSize(3)
                .allSatisfy(r -> assertThat(r.content()).contains("magerit"))
                .allSatisfy(r -> assertThat(r.matchedKeywords()).containsExactly("magerit"));
        assertThat(outcome.results()).extracting(SearchResult::relevanceRank).containsExactly(1, 2, 3);
    }

    @Test
    @DisplayName("Invalid arguments are rejected before any search runs")
    void invalidArguments() {
        assertThatThrownBy(() -> retriever.search(" ", 3)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> retriever.search("amenazas", 0)).isInstanceOf(IllegalArgumentException.class);
        assertThat(retriever.stats().totalSearches()).isZero();
    }

    @Test
    void statisticsTrackTerms() {
        retriever.search("amenazas activos", 2).join();
        retriever.search("amenazas de red", 2).join();

        RetrievalStats stats = retriever.stats();
        assertThat(stats.totalSearches()).isEqualTo(2);
        assertThat(stats.avgResultsPerSearch()).isEqualTo(2.0);
        assertThat(stats.topSearchTerms()).containsEntry("amenazas", 2).containsEntry("activos", 1)
                .doesNotContainKeys("de", "red");
        assertThat(stats.configured()).isFalse();

        retriever.resetStats();
        assertThat(retriever.stats().totalSearches()).isZero();
        assertThat(retriever.stats().topSearchTerms()).isEmpty();
    }
}
