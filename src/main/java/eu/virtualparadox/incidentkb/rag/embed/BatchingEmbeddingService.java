package eu.virtualparadox.incidentkb.rag.embed;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Splits large embedding requests into provider-sized batches and runs the batches concurrently.
 * <p>
 * Results are reassembled in input order. A failing batch fails the whole call, so callers never
 * see a partial vector list.
 */
@Slf4j
public abstract class BatchingEmbeddingService implements EmbeddingService {

    private final int batchSize;
    private final Executor executor;

    /**
     * @param batchSize maximum texts per provider call (must be {@code > 0})
     * @param executor  executor running the batches
     */
    protected BatchingEmbeddingService(final int batchSize, final Executor executor) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive");
        }
        this.batchSize = batchSize;
        this.executor = executor;
    }

    /**
     * Embeds one provider-sized batch.
     *
     * @param batch at most {@code batchSize} texts
     * @return one vector per text, same order
     */
    protected abstract List<float[]> embedBatch(List<String> batch);

    @Override
    public List<float[]> embed(final List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            return List.of();
        }

        final List<CompletableFuture<List<float[]>>> futures = new ArrayList<>();
        for (int from = 0; from < texts.size(); from += batchSize) {
            final List<String> batch = List.copyOf(texts.subList(from, Math.min(from + batchSize, texts.size())));
            futures.add(CompletableFuture.supplyAsync(() -> embedBatch(batch), executor));
        }
        log.debug("Embedding {} texts in {} batches", texts.size(), futures.size());

        final List<float[]> out = new ArrayList<>(texts.size());
        try {
            for (final CompletableFuture<List<float[]>> f : futures) {
                out.addAll(f.join());
            }
        } catch (CompletionException e) {
            futures.forEach(f -> f.cancel(true));
            final Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Failed to embed batch", cause);
        }

        if (out.size() != texts.size()) {
            throw new IllegalStateException("Embedding provider returned " + out.size()
                    + " vectors for " + texts.size() + " texts");
        }
        return out;
    }

    @Override
    public float[] embedQuery(final String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("query text must not be blank");
        }
        return embedBatch(List.of(text)).get(0);
    }
}
