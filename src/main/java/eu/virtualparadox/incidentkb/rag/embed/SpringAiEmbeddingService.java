package eu.virtualparadox.incidentkb.rag.embed;

import org.springframework.ai.embedding.EmbeddingModel;

import java.util.List;
import java.util.concurrent.Executor;

/**
 * {@link EmbeddingService} backed by a Spring AI {@link EmbeddingModel}.
 * <p>Retries and transport concerns belong to the model; this class only batches.</p>
 */
public final class SpringAiEmbeddingService extends BatchingEmbeddingService {

    private final EmbeddingModel embeddingModel;
    private final String modelName;

    public SpringAiEmbeddingService(final EmbeddingModel embeddingModel,
                                    final String modelName,
                                    final int batchSize,
                                    final Executor executor) {
        super(batchSize, executor);
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
    }

    @Override
    protected List<float[]> embedBatch(final List<String> batch) {
        return embeddingModel.embed(batch);
    }

    @Override
    public String modelName() {
        return modelName;
    }
}
