package eu.virtualparadox.incidentkb.knowledge.health;

/**
 * Per-component health flags.
 *
 * @param initialized    the orchestrator finished initialization
 * @param docsAccessible the source-document directory exists
 * @param vectorStore    a snapshot is open and its directory still exists on disk
 * @param retriever      the retriever is configured
 * @param embeddings     the embedding client is initialized
 */
public record HealthComponents(boolean initialized,
                               boolean docsAccessible,
                               boolean vectorStore,
                               boolean retriever,
                               boolean embeddings) {

    public static final HealthComponents NONE = new HealthComponents(false, false, false, false, false);

    public boolean allUp() {
        return initialized && docsAccessible && vectorStore && retriever && embeddings;
    }
}
