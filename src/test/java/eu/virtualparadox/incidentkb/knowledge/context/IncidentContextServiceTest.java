package eu.virtualparadox.incidentkb.knowledge.context;

import eu.virtualparadox.incidentkb.application.config.KnowledgeProperties;
import eu.virtualparadox.incidentkb.application.executor.RetrievalExecutor;
import eu.virtualparadox.incidentkb.knowledge.KnowledgeOrchestrator;
import eu.virtualparadox.incidentkb.rag.retriever.model.RetrievalOutcome;
import eu.virtualparadox.incidentkb.support.HashingEmbeddingService;
import eu.virtualparadox.incidentkb.support.KnowledgeFixtures;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class IncidentContextServiceTest {

    @TempDir
    Path root;

    private KnowledgeProperties properties;
    private HashingEmbeddingService embedder;
    private RetrievalExecutor executor;
    private KnowledgeOrchestrator orchestrator;
    private IncidentContextService service;

    @BeforeEach
    void setUp() throws IOException {
        Path docs = root.resolve("docs");
        KnowledgeFixtures.writeCorpus(docs);
        properties = KnowledgeFixtures.properties(docs, root.resolve("vectorstore"));
        embedder = new HashingEmbeddingService();
        executor = KnowledgeFixtures.retrievalExecutor();
        orchestrator = KnowledgeFixtures.orchestrator(properties, embedder, executor);
        service = new IncidentContextService(orchestrator, new ContextFormatter());
    }

    @AfterEach
    void tearDown() {
        orchestrator.shutdown();
        executor.shutdown();
    }

    @Test
    void testBuildQuery() {
        assertThat(IncidentContextService.buildQuery(new IncidentQuery("Phishing", "Correo sospechoso", "malware")))
                .isEqualTo("Phishing. Correo sospechoso. Categoría: malware");
        assertThat(IncidentContextService.buildQuery(new IncidentQuery("Phishing", "Correo sospechoso", " ")))
                .isEqualTo("Phishing. Correo sospechoso");
        assertThat(IncidentContextService.buildQuery(new IncidentQuery("Phishing", null, null)))
                .isEqualTo("Phishing. ");
    }

    @Test
    @DisplayName("An unavailable knowledge base yields no context instead of an error")
    void testEmptyContextWhenNotReady() {
        assertThat(service.contextFor(new IncidentQuery("Fuga", "vulnerability en servidor", null))).isEmpty();
    }

    @Test
    void testEmptyContextWhenRetrievalDegrades() {
        orchestrator.initialize();
        embedder.setFailing(true);

        assertThat(service.contextFor(new IncidentQuery("Fuga", "vulnerability en servidor", null))).isEmpty();
    }

    @Test
    void testContextBlockWhenReady() {
        orchestrator.initialize();

        String context = service.contextFor(new IncidentQuery("Fuga", "vulnerability exploit en servidor", "intrusion"));

        assertThat(context).startsWith("=== BEGIN KNOWLEDGE ===\n")
                .endsWith("=== END KNOWLEDGE ===\n")
                .contains("--- Source 1: Risk Methodology (magerit_metodologia) ---")
                .contains("--- Source 5:")
                .doesNotContain("--- Source 6:");
    }

    @Test
    @DisplayName("A saturated retrieval pool yields no context instead of an error")
    void testEmptyContextWhenRetrievalPoolIsSaturated() throws Exception {
        orchestrator.shutdown();
        executor.shutdown();

        executor = new RetrievalExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(0);
        executor.initialize();
        orchestrator = KnowledgeFixtures.orchestrator(properties, embedder, executor);
        service = new IncidentContextService(orchestrator, new ContextFormatter());
        orchestrator.initialize();

        embedder.setDelay(Duration.ofMillis(500));
        CompletableFuture<RetrievalOutcome> busy = orchestrator.searchAsync("vulnerability", 2, null);

        assertThat(orchestrator.search("vulnerability", 2).isDegraded()).isTrue();
        assertThat(service.contextFor(new IncidentQuery("Fuga", "vulnerability en servidor", null))).isEmpty();
        assertThat(busy.get(2, TimeUnit.SECONDS).isDegraded()).isFalse();
    }
}
