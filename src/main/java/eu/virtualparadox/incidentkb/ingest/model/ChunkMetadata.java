package eu.virtualparadox.incidentkb.ingest.model;

import java.util.List;

/**
 * Typed metadata stored next to every chunk.
 *
 * @param filename     parent file name
 * @param documentType parent document type
 * @param chunkIndex   zero-based position of the chunk inside its parent
 * @param totalChunks  number of chunks produced for the parent
 * @param chunkType    semantic type of the chunk text
 * @param keywords     up to 10 vocabulary terms found in the chunk, in vocabulary order
 * @param startOffset  character offset of the chunk text inside the parent
 * @param language     language tag
 * @param domain       domain tag
 */
public record ChunkMetadata(String filename,
                            EDocumentType documentType,
                            int chunkIndex,
                            int totalChunks,
                            EChunkType chunkType,
                            List<String> keywords,
                            int startOffset,
                            String language,
                            String domain) {

    public ChunkMetadata {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
