package eu.virtualparadox.incidentkb.rag.embed;

/**
 * Creates an {@link EmbeddingService} bound to a provider credential.
 */
@FunctionalInterface
public interface EmbeddingServiceFactory {

    /**
     * @param apiKey non-blank provider credential
     * @return a ready embedding service
     */
    EmbeddingService create(String apiKey);
}
