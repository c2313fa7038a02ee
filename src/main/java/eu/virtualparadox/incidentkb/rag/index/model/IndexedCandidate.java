package eu.virtualparadox.incidentkb.rag.index.model;

import eu.virtualparadox.incidentkb.ingest.model.ChunkMetadata;

/**
 * A record returned by a nearest-neighbour lookup.
 *
 * @param chunkId    chunk identifier
 * @param text       chunk text
 * @param metadata   chunk metadata
 * @param vector     stored embedding, used for diversity computation
 * @param similarity cosine similarity to the query vector
 */
public record IndexedCandidate(String chunkId,
                               String text,
                               ChunkMetadata metadata,
                               float[] vector,
                               double similarity) {
}
