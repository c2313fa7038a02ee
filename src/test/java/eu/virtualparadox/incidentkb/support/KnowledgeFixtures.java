package eu.virtualparadox.incidentkb.support;

import eu.virtualparadox.incidentkb.application.config.KnowledgeProperties;
import eu.virtualparadox.incidentkb.application.executor.RetrievalExecutor;
import eu.virtualparadox.incidentkb.ingest.DocumentIngestor;
import eu.virtualparadox.incidentkb.ingest.chunker.RecursiveChunker;
import eu.virtualparadox.incidentkb.ingest.keyword.KeywordExtractor;
import eu.virtualparadox.incidentkb.ingest.loader.DocumentClassifier;
import eu.virtualparadox.incidentkb.ingest.loader.DocumentLoader;
import eu.virtualparadox.incidentkb.ingest.model.Chunk;
import eu.virtualparadox.incidentkb.ingest.model.ChunkMetadata;
import eu.virtualparadox.incidentkb.ingest.model.EChunkType;
import eu.virtualparadox.incidentkb.ingest.model.EDocumentType;
import eu.virtualparadox.incidentkb.knowledge.KnowledgeOrchestrator;
import eu.virtualparadox.incidentkb.rag.embed.EmbeddingService;
import eu.virtualparadox.incidentkb.rag.index.LuceneVectorIndexService;
import eu.virtualparadox.incidentkb.rag.retriever.service.MmrRetrieverService;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.stream.Stream;

/**
 * Shared test data: configuration, a small methodology corpus and hand-made chunks.
 */
public final class KnowledgeFixtures {

    public static final String COLLECTION = "security_knowledge";

    /** Corpus files: three documents of three paragraphs each. */
    public static final List<String> CORPUS_FILES = List.of(
            "magerit_metodologia.txt",
            "principios_seguridad.txt",
            "marco_normativo.txt");

    private KnowledgeFixtures() {
    }

    public static KnowledgeProperties properties(final Path docs, final Path index) {
        final KnowledgeProperties p = new KnowledgeProperties();
        p.setDocs(docs);
        p.setIndex(index);
        p.setCollection(COLLECTION);
        p.getEmbedding().setApiKey("test-key");
        return p;
    }

    public static RetrievalExecutor retrievalExecutor() {
        final RetrievalExecutor executor = new RetrievalExecutor();
        executor.setCorePoolSize(2);
        executor.setThreadNamePrefix("retrieve-test-");
        executor.initialize();
        return executor;
    }

    /**
     * Wires the full knowledge stack by hand, with {@code embedder} in place of the remote provider.
     */
    public static KnowledgeOrchestrator orchestrator(final KnowledgeProperties properties,
                                                     final EmbeddingService embedder,
                                                     final RetrievalExecutor executor) {
        final KeywordExtractor keywords = new KeywordExtractor();
        final DocumentClassifier classifier = new DocumentClassifier();
        final DocumentIngestor ingestor = new DocumentIngestor(
                new DocumentLoader(classifier, keywords, properties),
                classifier,
                new RecursiveChunker(1000, 200, keywords));
        final LuceneVectorIndexService index = new LuceneVectorIndexService(properties, apiKey -> embedder);
        final MmrRetrieverService retriever = new MmrRetrieverService(index, executor, properties);
        return new KnowledgeOrchestrator(properties, ingestor, index, retriever);
    }

    /**
     * Builds a single-line paragraph of roughly {@code length} characters from the given words.
     */
    public static String paragraph(final int length, final String... words) {
        final StringBuilder sb = new StringBuilder(length + 16);
        int i = 0;
        while (sb.length() < length - 12) {
            sb.append(words[i % words.length]).append(' ');
            i++;
        }
        sb.append("fin.");
        return sb.toString();
    }

    /**
     * Writes the three-document corpus; every document splits into exactly three chunks with the
     * default 1000/200 chunker settings. Modification times are set one hour in the past.
     */
    public static void writeCorpus(final Path docs) throws IOException {
        Files.createDirectories(docs);
        write(docs.resolve(CORPUS_FILES.get(0)),
                paragraph(500, "magerit", "activo", "amenaza", "riesgo"),
                paragraph(500, "vulnerability", "threat", "exploit", "vulnerabilidad"),
                paragraph(500, "impacto", "daño", "consecuencia", "valoración"));
        write(docs.resolve(CORPUS_FILES.get(1)),
                paragraph(500, "confidencialidad", "integridad", "disponibilidad", "principio"),
                paragraph(500, "control", "salvaguarda", "mitigación", "medida"),
                paragraph(500, "test", "prueba", "verificación", "auditoria"));
        write(docs.resolve(CORPUS_FILES.get(2)),
                paragraph(500, "iso", "27001", "sgsi", "anexo"),
                paragraph(500, "nist", "framework", "cybersecurity", "function"),
                paragraph(500, "compliance", "cumplimiento", "regulación", "norma"));
        touchAll(docs, Instant.now().minus(1, ChronoUnit.HOURS));
    }

    public static void touchAll(final Path dir, final Instant time) throws IOException {
        try (Stream<Path> files = Files.walk(dir)) {
            for (final Path p : files.filter(Files::isRegularFile).toList()) {
                Files.setLastModifiedTime(p, FileTime.from(time));
            }
        }
    }

    public static Chunk chunk(final String filename,
                              final int index,
                              final EDocumentType type,
                              final String text,
                              final List<String> keywords) {
        final ChunkMetadata metadata = new ChunkMetadata(filename, type, index, 3, EChunkType.CONCEPTUAL,
                keywords, index * 100, "es", "cybersecurity");
        return new Chunk(Chunk.chunkId(filename, index), text, metadata);
    }

    private static void write(final Path file, final String... paragraphs) throws IOException {
        Files.writeString(file, String.join("\n\n", paragraphs), StandardCharsets.UTF_8);
    }
}
