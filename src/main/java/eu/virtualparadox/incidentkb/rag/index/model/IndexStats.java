package eu.virtualparadox.incidentkb.rag.index.model;

import java.nio.file.Path;
import java.util.Map;
import java.util.Set;

/**
 * Point-in-time description of the current index.
 */
public record IndexStats(boolean initialized,
                         int recordCount,
                         Map<String, Integer> documentTypeHistogram,
                         Set<String> languages,
                         String embeddingModel,
                         String collection,
                         Path directory,
                         boolean snapshotExists) {

    public static IndexStats notInitialized(final String collection, final Path directory, final boolean exists) {
        return new IndexStats(false, 0, Map.of(), Set.of(), null, collection, directory, exists);
    }
}
