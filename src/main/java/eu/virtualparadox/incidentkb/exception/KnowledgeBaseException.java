package eu.virtualparadox.incidentkb.exception;

/**
 * Root of the knowledge-base failure taxonomy.
 */
public abstract class KnowledgeBaseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    protected KnowledgeBaseException(final String message) {
        super(message);
    }

    protected KnowledgeBaseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
