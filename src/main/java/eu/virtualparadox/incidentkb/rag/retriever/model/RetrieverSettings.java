package eu.virtualparadox.incidentkb.rag.retriever.model;

/**
 * Search configuration of the retriever.
 *
 * @param searchType     search strategy
 * @param k              number of results the strategy produces
 * @param fetchK         candidates fetched before diversity re-ranking (MMR only)
 * @param lambda         relevance/diversity balance, {@code 1} = pure relevance, {@code 0} = pure diversity
 * @param scoreThreshold minimal cosine similarity ({@link ESearchType#SIMILARITY_SCORE_THRESHOLD} only)
 */
public record RetrieverSettings(ESearchType searchType,
                                int k,
                                int fetchK,
                                double lambda,
                                double scoreThreshold) {

    public static final RetrieverSettings DEFAULTS = new RetrieverSettings(ESearchType.MMR, 8, 16, 0.7, 0.5);

    public RetrieverSettings {
        if (searchType == null) {
            throw new IllegalArgumentException("searchType must not be null");
        }
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1, got " + k);
        }
        if (fetchK < k) {
            throw new IllegalArgumentException("fetchK must be >= k, got fetchK=" + fetchK + ", k=" + k);
        }
        if (Double.isNaN(lambda) || lambda < 0.0 || lambda > 1.0) {
            throw new IllegalArgumentException("lambda must be within [0, 1], got " + lambda);
        }
    }
}
