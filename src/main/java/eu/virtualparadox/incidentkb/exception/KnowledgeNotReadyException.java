package eu.virtualparadox.incidentkb.exception;

/**
 * The knowledge base was queried before it reached the ready state.
 * <p>Distinct from an empty result so callers can tell "no context" from "system unavailable".</p>
 */
public class KnowledgeNotReadyException extends KnowledgeBaseException {

    private static final long serialVersionUID = 1L;

    public KnowledgeNotReadyException(final String message) {
        super(message);
    }
}
