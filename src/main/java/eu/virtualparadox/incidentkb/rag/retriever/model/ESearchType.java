package eu.virtualparadox.incidentkb.rag.retriever.model;

public enum ESearchType {
    /** Plain top-k by cosine similarity. */
    SIMILARITY,
    /** Top-k by cosine similarity, dropping hits below the score threshold. */
    SIMILARITY_SCORE_THRESHOLD,
    /** Maximal marginal relevance over the fetch-k nearest neighbours. */
    MMR
}
