package eu.virtualparadox.incidentkb.rag.index;

import eu.virtualparadox.incidentkb.ingest.model.Chunk;
import eu.virtualparadox.incidentkb.rag.index.model.IndexStats;
import eu.virtualparadox.incidentkb.rag.index.model.IndexedCandidate;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Abstraction for vector index persistence: embedding chunks, persisting them and serving
 * nearest-neighbour lookups.
 */
public interface VectorIndexService extends AutoCloseable {

    /**
     * Creates the embedding client.
     *
     * @param apiKey provider credential
     * @throws eu.virtualparadox.incidentkb.exception.KnowledgeConfigException if the credential is null or blank
     */
    void initializeEmbedder(String apiKey);

    boolean isEmbedderReady();

    /**
     * Embeds every chunk and writes a fresh snapshot of {@code collection}, replacing any previous one.
     * <p>If embedding fails, nothing is written and the previous snapshot stays on disk.</p>
     *
     * @throws eu.virtualparadox.incidentkb.exception.EmptyInputException if {@code chunks} is empty
     */
    IndexSnapshot build(String collection, List<Chunk> chunks);

    /**
     * Opens the persisted snapshot of {@code collection}.
     *
     * @return empty when no usable snapshot exists (missing, unreadable or holding zero records)
     */
    Optional<IndexSnapshot> load(String collection);

    /**
     * Decides whether the snapshot is stale with respect to the source directory.
     *
     * @return {@code true} if there is no snapshot or any source file is newer than its build time
     */
    boolean shouldRebuild(Path sourceDir, Optional<IndexSnapshot> snapshot);

    /**
     * Appends chunks to the current snapshot.
     */
    void add(List<Chunk> chunks);

    /**
     * Replaces the record {@code chunkId} with {@code chunk} (delete-then-insert).
     */
    void update(String chunkId, Chunk chunk);

    /**
     * Closes and removes the persisted snapshot of {@code collection}.
     *
     * @return {@code true} if a directory was removed
     */
    boolean delete(String collection);

    Optional<IndexSnapshot> currentSnapshot();

    /**
     * Embeds a query string with the initialized embedder.
     */
    float[] embedQuery(String query);

    /**
     * Returns the {@code k} nearest records of the current snapshot, ordered by decreasing similarity.
     */
    List<IndexedCandidate> nearest(float[] queryVector, int k);

    IndexStats stats();

    /**
     * Releases the current snapshot's resources, keeping its files.
     */
    @Override
    void close();
}
