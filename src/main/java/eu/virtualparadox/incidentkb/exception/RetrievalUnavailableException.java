package eu.virtualparadox.incidentkb.exception;

/**
 * The embedding provider failed or timed out while serving a query.
 * <p>Recoverable: callers continue without knowledge context.</p>
 */
public class RetrievalUnavailableException extends KnowledgeBaseException {

    private static final long serialVersionUID = 1L;

    public RetrievalUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
