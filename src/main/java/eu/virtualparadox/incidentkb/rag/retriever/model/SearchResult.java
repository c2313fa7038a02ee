package eu.virtualparadox.incidentkb.rag.retriever.model;

import eu.virtualparadox.incidentkb.ingest.model.ChunkMetadata;

import java.util.List;

/**
 * @param chunkId         Identifier of the chunk.
 * @param content         The chunk text (retrieved from Lucene).
 * @param metadata        Chunk metadata (filename, document type, keywords, position).
 * @param relevanceRank   1-based rank within the result list.
 * @param score           Raw cosine similarity to the query, {@code null} when not computed.
 * @param matchedKeywords Required keywords found in the chunk (keyword search only, otherwise empty).
 */
public record SearchResult(String chunkId,
                           String content,
                           ChunkMetadata metadata,
                           int relevanceRank,
                           Double score,
                           List<String> matchedKeywords) {

    public SearchResult {
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
    }

    public List<String> keywords() {
        return metadata.keywords();
    }

    public String filename() {
        return metadata.filename();
    }

    /**
     * Copy with a new rank and the given matched keywords.
     */
    public SearchResult ranked(final int rank, final List<String> matched) {
        return new SearchResult(chunkId, content, metadata, rank, score, matched);
    }

    public SearchResult ranked(final int rank) {
        return ranked(rank, matchedKeywords);
    }
}
