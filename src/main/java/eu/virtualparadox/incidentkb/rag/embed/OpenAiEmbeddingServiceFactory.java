package eu.virtualparadox.incidentkb.rag.embed;

import eu.virtualparadox.incidentkb.application.config.KnowledgeProperties;
import eu.virtualparadox.incidentkb.application.executor.EmbeddingExecutor;
import eu.virtualparadox.incidentkb.util.LuceneConstants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.document.MetadataMode;
import org.springframework.ai.openai.OpenAiEmbeddingModel;
import org.springframework.ai.openai.OpenAiEmbeddingOptions;
import org.springframework.ai.openai.api.OpenAiApi;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;

/**
 * Builds OpenAI-backed embedding services through Spring AI.
 * <p>
 * Each provider call is attempted up to {@code incidentkb.embedding.max-attempts} times with
 * exponential backoff when the failure is transient (5xx, rate limiting, connection errors).
 * The requested dimension is capped by what the Lucene vector field accepts.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class OpenAiEmbeddingServiceFactory implements EmbeddingServiceFactory {

    private static final long INITIAL_BACKOFF_MILLIS = 1_000L;
    private static final double BACKOFF_MULTIPLIER = 2.0;
    private static final long MAX_BACKOFF_MILLIS = 10_000L;

    private final KnowledgeProperties properties;
    private final EmbeddingExecutor embeddingExecutor;

    @Override
    public EmbeddingService create(final String apiKey) {
        final KnowledgeProperties.Embedding cfg = properties.getEmbedding();
        if (cfg.getDimensions() > LuceneConstants.MAX_VECTOR_DIMENSIONS) {
            throw new IllegalArgumentException("Embedding dimensions " + cfg.getDimensions()
                    + " exceed the index limit of " + LuceneConstants.MAX_VECTOR_DIMENSIONS);
        }

        final OpenAiApi api = OpenAiApi.builder()
                .baseUrl(cfg.getBaseUrl())
                .apiKey(apiKey)
                .build();

        final OpenAiEmbeddingOptions options = OpenAiEmbeddingOptions.builder()
                .model(cfg.getModel())
                .dimensions(cfg.getDimensions())
                .build();

        final RetryTemplate retryTemplate = RetryTemplate.builder()
                .maxAttempts(cfg.getMaxAttempts())
                .exponentialBackoff(INITIAL_BACKOFF_MILLIS, BACKOFF_MULTIPLIER, MAX_BACKOFF_MILLIS)
                .retryOn(TransientAiException.class)
                .retryOn(ResourceAccessException.class)
                .build();

        final OpenAiEmbeddingModel model = new OpenAiEmbeddingModel(api, MetadataMode.EMBED, options, retryTemplate);
        log.info("Embeddings initialized: {} ({} dimensions)", cfg.getModel(), cfg.getDimensions());

        return new SpringAiEmbeddingService(model, cfg.getModel(), cfg.getBatchSize(), embeddingExecutor);
    }
}
