package eu.virtualparadox.incidentkb.rag.retriever.service;

import eu.virtualparadox.incidentkb.util.VectorCodec;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Maximal marginal relevance selection.
 * <p>
 * Candidates must be given in decreasing query-similarity order. The first pick is the most similar
 * candidate; each following pick maximizes
 * <pre>lambda * sim(query, c) - (1 - lambda) * max(sim(c, s) for s in selected)</pre>
 * Ties go to the candidate with the better similarity rank, so {@code lambda = 1} reproduces plain top-k.
 */
final class MaximalMarginalRelevance {

    private MaximalMarginalRelevance() {
        // prevent instantiation
    }

    /**
     * @param querySimilarities similarity of each candidate to the query
     * @param vectors           candidate vectors, same order
     * @param lambda            relevance weight in {@code [0, 1]}
     * @param k                 number of candidates to select
     * @return selected candidate indices, in selection order
     */
    static List<Integer> select(final double[] querySimilarities,
                                final List<float[]> vectors,
                                final double lambda,
                                final int k) {
        final int n = querySimilarities.length;
        if (n != vectors.size()) {
            throw new IllegalArgumentException("similarities and vectors differ in size");
        }
        final int limit = Math.min(k, n);
        final List<Integer> selected = new ArrayList<>(limit);
        if (limit <= 0) {
            return selected;
        }

        final boolean[] taken = new boolean[n];
        // highest similarity to any selected candidate, per candidate
        final double[] redundancy = new double[n];
        Arrays.fill(redundancy, Double.NEGATIVE_INFINITY);

        while (selected.size() < limit) {
            int best = -1;
            double bestScore = Double.NEGATIVE_INFINITY;
            for (int i = 0; i < n; i++) {
                if (taken[i]) {
                    continue;
                }
                final double penalty = selected.isEmpty() ? 0.0 : redundancy[i];
                final double score = lambda * querySimilarities[i] - (1.0 - lambda) * penalty;
                if (best < 0 || score > bestScore) {
                    best = i;
                    bestScore = score;
                }
            }

            taken[best] = true;
            selected.add(best);
            final float[] chosen = vectors.get(best);
            for (int i = 0; i < n; i++) {
                if (!taken[i]) {
                    redundancy[i] = Math.max(redundancy[i], VectorCodec.cosine(vectors.get(i), chosen));
                }
            }
        }
        return selected;
    }
}
