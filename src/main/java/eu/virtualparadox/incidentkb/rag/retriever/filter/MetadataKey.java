package eu.virtualparadox.incidentkb.rag.retriever.filter;

import eu.virtualparadox.incidentkb.ingest.model.ChunkMetadata;

import java.util.function.Function;

/**
 * Filterable chunk metadata fields. Values are compared in their persisted string form.
 */
public enum MetadataKey {
    FILENAME(ChunkMetadata::filename),
    DOCUMENT_TYPE(m -> m.documentType().id()),
    CHUNK_TYPE(m -> m.chunkType().id()),
    CHUNK_INDEX(m -> Integer.toString(m.chunkIndex())),
    TOTAL_CHUNKS(m -> Integer.toString(m.totalChunks())),
    LANGUAGE(ChunkMetadata::language),
    DOMAIN(ChunkMetadata::domain);

    private final Function<ChunkMetadata, String> extractor;

    MetadataKey(final Function<ChunkMetadata, String> extractor) {
        this.extractor = extractor;
    }

    String valueOf(final ChunkMetadata metadata) {
        return extractor.apply(metadata);
    }
}
