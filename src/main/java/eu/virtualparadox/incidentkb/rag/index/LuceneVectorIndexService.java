package eu.virtualparadox.incidentkb.rag.index;

import eu.virtualparadox.incidentkb.application.config.KnowledgeProperties;
import eu.virtualparadox.incidentkb.exception.EmptyInputException;
import eu.virtualparadox.incidentkb.exception.KnowledgeConfigException;
import eu.virtualparadox.incidentkb.exception.SnapshotParseException;
import eu.virtualparadox.incidentkb.ingest.model.Chunk;
import eu.virtualparadox.incidentkb.ingest.model.EDocumentType;
import eu.virtualparadox.incidentkb.rag.embed.EmbeddingService;
import eu.virtualparadox.incidentkb.rag.embed.EmbeddingServiceFactory;
import eu.virtualparadox.incidentkb.rag.index.model.IndexStats;
import eu.virtualparadox.incidentkb.rag.index.model.IndexedCandidate;
import eu.virtualparadox.incidentkb.rag.index.model.SnapshotMetadata;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.SegmentInfos;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

import static eu.virtualparadox.incidentkb.util.LuceneConstants.*;

/**
 * Lucene-backed implementation of {@link VectorIndexService} using the HNSW k-NN graph.
 * <p>
 * Each collection lives in its own directory {@code <index-root>/<collection>}:
 * <ul>
 *   <li>Each chunk is stored as one Lucene document (see {@link ChunkDocumentMapper})</li>
 *   <li>Collection metadata is written as commit user data on every commit</li>
 *   <li>Searches go through a {@link SearcherManager} refreshed after each commit</li>
 * </ul>
 *
 * <p><b>Vector dimensions:</b> Lucene requires a constant dimension per vector field across an index.
 * The dimension is recorded with the snapshot and every write is validated against it. If the
 * embedding model changes, rebuild the collection.</p>
 *
 * <p>Mutations of one collection are serialized by a per-collection lock; reads are lock-free.</p>
 */
@Service
@Slf4j
public class LuceneVectorIndexService implements VectorIndexService {

    private final KnowledgeProperties properties;
    private final EmbeddingServiceFactory embeddingServiceFactory;
    private final CollectionLocks locks = new CollectionLocks();

    private volatile EmbeddingService embeddingService;
    private volatile IndexSnapshot current;

    public LuceneVectorIndexService(final KnowledgeProperties properties,
                                    final EmbeddingServiceFactory embeddingServiceFactory) {
        this.properties = properties;
        this.embeddingServiceFactory = embeddingServiceFactory;
    }

    @Override
    public void initializeEmbedder(final String apiKey) {
        if (StringUtils.isBlank(apiKey)) {
            throw new KnowledgeConfigException("Embedding provider API key is not configured (incidentkb.embedding.api-key)");
        }
        this.embeddingService = embeddingServiceFactory.create(apiKey);
    }

    @Override
    public boolean isEmbedderReady() {
        return embeddingService != null;
    }

    @Override
    public IndexSnapshot build(final String collection, final List<Chunk> chunks) {
        requireNonNullOrEmpty(collection, "collection");
        if (chunks == null || chunks.isEmpty()) {
            throw new EmptyInputException("No chunks to index for collection " + collection);
        }
        final EmbeddingService embedder = requireEmbedder();

        final ReentrantLock lock = locks.forCollection(collection);
        lock.lock();
        try {
            // embed first: a provider failure must leave the previous snapshot untouched
            final List<float[]> vectors = embedder.embed(chunks.stream().map(Chunk::text).toList());
            final int dim = validateVectors(chunks, vectors, null);

            final Path path = collectionPath(collection);
            closeCurrentIf(collection);
            if (Files.exists(path)) {
                FileSystemUtils.deleteRecursively(path);
            }
            Files.createDirectories(path);

            final SnapshotMetadata metadata = new SnapshotMetadata(
                    SnapshotMetadata.DEFAULT_DESCRIPTION,
                    SCHEMA_VERSION,
                    SnapshotMetadata.DEFAULT_FRAMEWORKS,
                    Arrays.stream(EDocumentType.values()).map(EDocumentType::id).toList(),
                    properties.getLanguage(),
                    properties.getDomain(),
                    embedder.modelName(),
                    dim,
                    Instant.now());

            final IndexSnapshot snapshot = open(collection, path, IndexWriterConfig.OpenMode.CREATE, metadata);
            try {
                snapshot.addRecords(chunks, vectors);
                snapshot.commit(metadata);
            } catch (IOException | RuntimeException e) {
                snapshot.close();
                throw e;
            }

            this.current = snapshot;
            log.info("Built snapshot {} with {} records at {}", collection, chunks.size(), path);
            return snapshot;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to build index for collection: " + collection, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<IndexSnapshot> load(final String collection) {
        requireNonNullOrEmpty(collection, "collection");
        final Path path = collectionPath(collection);

        final ReentrantLock lock = locks.forCollection(collection);
        lock.lock();
        try {
            if (!Files.isDirectory(path)) {
                log.info("No persisted snapshot for {} at {}", collection, path);
                return Optional.empty();
            }
            closeCurrentIf(collection);

            final SnapshotMetadata metadata;
            try (Directory existing = FSDirectory.open(path)) {
                if (!DirectoryReader.indexExists(existing)) {
                    log.info("Snapshot directory {} has no commit", path);
                    return Optional.empty();
                }
                metadata = SnapshotMetadata.fromUserData(SegmentInfos.readLatestCommit(existing).getUserData());
            }

            final IndexSnapshot snapshot = open(collection, path, IndexWriterConfig.OpenMode.APPEND, metadata);
            final int count;
            try {
                count = snapshot.recordCount();
            } catch (IOException e) {
                snapshot.close();
                throw e;
            }
            if (count == 0) {
                log.info("Snapshot {} holds no records, ignoring it", collection);
                snapshot.close();
                return Optional.empty();
            }

            this.current = snapshot;
            log.info("Loaded snapshot {} with {} records (built {})", collection, count, metadata.builtAt());
            return Optional.of(snapshot);

        } catch (IOException | SnapshotParseException | IllegalArgumentException e) {
            log.warn("Unable to read snapshot {} at {}, treating it as absent", collection, path, e);
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean shouldRebuild(final Path sourceDir, final Optional<IndexSnapshot> snapshot) {
        if (snapshot.isEmpty()) {
            return true;
        }
        final Instant builtAt = snapshot.get().metadata().builtAt();

        try (Stream<Path> files = Files.walk(sourceDir)) {
            final Optional<Path> newer = files
                    .filter(Files::isRegularFile)
                    .filter(p -> isModifiedAfter(p, builtAt))
                    .findFirst();
            newer.ifPresent(p -> log.info("Modified source detected: {}", p.getFileName()));
            return newer.isPresent();
        } catch (IOException | RuntimeException e) {
            // in doubt, keep the cached snapshot
            log.warn("Unable to check source timestamps under {}", sourceDir, e);
            return false;
        }
    }

    @Override
    public void add(final List<Chunk> chunks) {
        requireNonNullOrEmpty(chunks, "chunks");
        final EmbeddingService embedder = requireEmbedder();
        final IndexSnapshot snapshot = requireSnapshot();

        final ReentrantLock lock = locks.forCollection(snapshot.getCollection());
        lock.lock();
        try {
            final List<float[]> vectors = embedder.embed(chunks.stream().map(Chunk::text).toList());
            validateVectors(chunks, vectors, snapshot.metadata().vectorDimension());

            snapshot.addRecords(chunks, vectors);
            snapshot.commit(snapshot.metadata().withBuiltAt(Instant.now()));
            log.info("Added {} records to {}", chunks.size(), snapshot.getCollection());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to add chunks to " + snapshot.getCollection(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void update(final String chunkId, final Chunk chunk) {
        requireNonNullOrEmpty(chunkId, "chunkId");
        if (chunk == null) {
            throw new IllegalArgumentException("chunk must not be null");
        }
        final EmbeddingService embedder = requireEmbedder();
        final IndexSnapshot snapshot = requireSnapshot();

        final ReentrantLock lock = locks.forCollection(snapshot.getCollection());
        lock.lock();
        try {
            final List<float[]> vectors = embedder.embed(List.of(chunk.text()));
            validateVectors(List.of(chunk), vectors, snapshot.metadata().vectorDimension());

            // 1) delete previous record, 2) add the new one, 3) commit and refresh
            snapshot.deleteRecord(chunkId);
            snapshot.addRecords(List.of(chunk), vectors);
            snapshot.commit(snapshot.metadata().withBuiltAt(Instant.now()));
            log.info("Updated record {} in {}", chunkId, snapshot.getCollection());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to update record " + chunkId, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(final String collection) {
        requireNonNullOrEmpty(collection, "collection");
        final Path path = collectionPath(collection);

        final ReentrantLock lock = locks.forCollection(collection);
        lock.lock();
        try {
            closeCurrentIf(collection);
            final boolean removed = FileSystemUtils.deleteRecursively(path);
            if (removed) {
                log.info("Deleted snapshot {} at {}", collection, path);
            }
            return removed;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to delete snapshot " + collection, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<IndexSnapshot> currentSnapshot() {
        return Optional.ofNullable(current);
    }

    @Override
    public float[] embedQuery(final String query) {
        return requireEmbedder().embedQuery(query);
    }

    @Override
    public List<IndexedCandidate> nearest(final float[] queryVector, final int k) {
        if (k <= 0) {
            return List.of();
        }
        try {
            return requireSnapshot().nearest(queryVector, k);
        } catch (IOException e) {
            throw new IllegalStateException("Nearest-neighbour search failed", e);
        }
    }

    @Override
    public IndexStats stats() {
        final String collection = properties.getCollection();
        final IndexSnapshot snapshot = current;
        if (snapshot == null) {
            final Path path = collectionPath(collection);
            return IndexStats.notInitialized(collection, path, Files.isDirectory(path));
        }

        final Map<String, Integer> types = new TreeMap<>();
        final TreeSet<String> languages = new TreeSet<>();
        final int[] count = {0};
        try {
            snapshot.forEachRecord(d -> {
                count[0]++;
                types.merge(StringUtils.defaultIfEmpty(d.get(FIELD_DOCUMENT_TYPE), "unknown"), 1, Integer::sum);
                languages.add(StringUtils.defaultIfEmpty(d.get(FIELD_LANGUAGE), "unknown"));
            });
        } catch (IOException e) {
            log.error("Unable to compute index statistics for {}", snapshot.getCollection(), e);
        }

        return new IndexStats(
                true,
                count[0],
                Collections.unmodifiableMap(types),
                Collections.unmodifiableSet(languages),
                snapshot.metadata().embeddingModel(),
                snapshot.getCollection(),
                snapshot.getPath(),
                snapshot.existsOnDisk());
    }

    @Override
    public void close() {
        final IndexSnapshot snapshot = current;
        if (snapshot != null) {
            final ReentrantLock lock = locks.forCollection(snapshot.getCollection());
            lock.lock();
            try {
                closeCurrentIf(snapshot.getCollection());
            } finally {
                lock.unlock();
            }
        }
    }

    private IndexSnapshot open(final String collection,
                               final Path path,
                               final IndexWriterConfig.OpenMode mode,
                               final SnapshotMetadata metadata) throws IOException {
        final Directory directory = FSDirectory.open(path);
        IndexWriter writer = null;
        try {
            final IndexWriterConfig cfg = new IndexWriterConfig(new StandardAnalyzer()).setOpenMode(mode);
            writer = new IndexWriter(directory, cfg);
            final SearcherManager searcherManager = new SearcherManager(writer, null);
            return new IndexSnapshot(collection, path, directory, writer, searcherManager, metadata);
        } catch (IOException | RuntimeException e) {
            if (writer != null) {
                writer.rollback();
            }
            directory.close();
            throw e;
        }
    }

    private void closeCurrentIf(final String collection) {
        final IndexSnapshot snapshot = current;
        if (snapshot != null && snapshot.getCollection().equals(collection)) {
            snapshot.close();
            current = null;
        }
    }

    private Path collectionPath(final String collection) {
        return properties.getIndex().resolve(collection);
    }

    private EmbeddingService requireEmbedder() {
        final EmbeddingService embedder = embeddingService;
        if (embedder == null) {
            throw new IllegalStateException("Embedder is not initialized");
        }
        return embedder;
    }

    private IndexSnapshot requireSnapshot() {
        final IndexSnapshot snapshot = current;
        if (snapshot == null) {
            throw new IllegalStateException("No index snapshot is loaded");
        }
        return snapshot;
    }

    private static boolean isModifiedAfter(final Path file, final Instant builtAt) {
        try {
            return Files.getLastModifiedTime(file).toInstant().isAfter(builtAt);
        } catch (IOException e) {
            log.warn("Unable to read modification time of {}", file, e);
            return false;
        }
    }

    /**
     * Checks sizes and dimensions of freshly computed vectors.
     *
     * @param expectedDim dimension already established by the snapshot, or {@code null} for a new one
     * @return the common dimension
     */
    private static int validateVectors(final List<Chunk> chunks, final List<float[]> vectors, final Integer expectedDim) {
        if (chunks.size() != vectors.size()) {
            throw new IllegalArgumentException("chunks.size() != vectors.size()");
        }
        final int dim = expectedDim != null ? expectedDim : vectors.get(0).length;
        if (dim <= 0 || dim > MAX_VECTOR_DIMENSIONS) {
            throw new IllegalArgumentException("Vector dimension must be in 1.." + MAX_VECTOR_DIMENSIONS + ", got " + dim);
        }
        for (final float[] v : vectors) {
            if (v == null || v.length != dim) {
                throw new IllegalArgumentException("All vectors must be non-null and of length " + dim
                        + " (rebuild the collection if the embedder changed)");
            }
        }
        return dim;
    }

    /**
     * Utility to assert a required string or collection is non-null/non-empty.
     */
    private static void requireNonNullOrEmpty(final Object value, final String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " must not be null");
        }

        if (value instanceof String s && s.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }

        if (value instanceof List<?> list && list.isEmpty()) {
            throw new IllegalArgumentException(name + " must not be empty");
        }
    }
}
