package eu.virtualparadox.incidentkb.rag.retriever.service;

import eu.virtualparadox.incidentkb.util.VectorCodec;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;

class MaximalMarginalRelevanceTest {

    private static final float[] QUERY = {1f, 0f, 0f};

    // two near-duplicates of the query and one orthogonal-ish alternative
    private static final List<float[]> VECTORS = List.of(
            new float[]{1f, 0.05f, 0f},
            new float[]{1f, 0.06f, 0f},
            new float[]{0.6f, 0f, 0.8f});

    private static double[] similarities() {
        double[] sims = new double[VECTORS.size()];
        for (int i = 0; i < sims.length; i++) {
            sims[i] = VectorCodec.cosine(QUERY, VECTORS.get(i));
        }
        return sims;
    }

    @Test
    void testLambdaOneIsPlainTopK() {
        assertThat(MaximalMarginalRelevance.select(similarities(), VECTORS, 1.0, 3)).containsExactly(0, 1, 2);
    }

    @Test
    void testLowerLambdaPrefersDiversity() {
        assertThat(MaximalMarginalRelevance.select(similarities(), VECTORS, 0.3, 2)).containsExactly(0, 2);
    }

    @Test
    void testLambdaZeroPicksTheLeastRedundantCandidate() {
        List<float[]> vectors = List.of(
                new float[]{1f, 0f, 0f},
                new float[]{0.95f, 0.3f, 0f},
                new float[]{0f, 0f, 1f},
                new float[]{0.7f, 0.7f, 0f});
        double[] sims = {0.9, 0.8, 0.6, 0.5};

        List<Integer> selected = MaximalMarginalRelevance.select(sims, vectors, 0.0, 3);

        assertThat(selected).containsExactly(0, 2, 3);
        double leastSimilarToFirst = Double.MAX_VALUE;
        for (int i = 1; i < vectors.size(); i++) {
            leastSimilarToFirst = Math.min(leastSimilarToFirst, VectorCodec.cosine(vectors.get(0), vectors.get(i)));
        }
        assertThat(VectorCodec.cosine(vectors.get(0), vectors.get(selected.get(1)))).isEqualTo(leastSimilarToFirst);
    }

    @Test
    void testLambdaZeroMinimizesRedundancyAtEveryStep() {
        Random random = new Random(42);
        List<float[]> vectors = new ArrayList<>();
        for (int i = 0; i < 16; i++) {
            vectors.add(new float[]{random.nextFloat(), random.nextFloat(), random.nextFloat(), random.nextFloat()});
        }
        double[] sims = new double[vectors.size()];
        for (int i = 0; i < sims.length; i++) {
            sims[i] = 1.0 - i * 0.01;
        }

        List<Integer> selected = MaximalMarginalRelevance.select(sims, vectors, 0.0, 8);

        assertThat(selected).hasSize(8).doesNotHaveDuplicates().startsWith(0);
        for (int step = 1; step < selected.size(); step++) {
            List<Integer> before = selected.subList(0, step);
            double chosen = maxSimilarity(vectors, selected.get(step), before);
            for (int candidate = 0; candidate < vectors.size(); candidate++) {
                if (!selected.subList(0, step + 1).contains(candidate)) {
                    assertThat(chosen).isLessThanOrEqualTo(maxSimilarity(vectors, candidate, before));
                }
            }
        }
    }

    private static double maxSimilarity(final List<float[]> vectors, final int candidate, final List<Integer> selected) {
        double max = Double.NEGATIVE_INFINITY;
        for (int s : selected) {
            max = Math.max(max, VectorCodec.cosine(vectors.get(candidate), vectors.get(s)));
        }
        return max;
    }

    @Test
    void testFirstPickIsAlwaysTheMostSimilar() {
        assertThat(MaximalMarginalRelevance.select(similarities(), VECTORS, 0.0, 1)).containsExactly(0);
    }

    @Test
    void testTiesGoToTheBetterRank() {
        List<float[]> same = List.of(new float[]{1f, 0f}, new float[]{1f, 0f}, new float[]{1f, 0f});
        double[] sims = {0.9, 0.9, 0.9};

        assertThat(MaximalMarginalRelevance.select(sims, same, 0.7, 3)).containsExactly(0, 1, 2);
    }

    @Test
    void testKLargerThanCandidates() {
        assertThat(MaximalMarginalRelevance.select(similarities(), VECTORS, 0.7, 10)).hasSize(3);
        assertThat(MaximalMarginalRelevance.select(new double[0], List.of(), 0.7, 5)).isEmpty();
    }
}
