package eu.virtualparadox.incidentkb.exception;

/**
 * Nothing to index: no documents were found or they produced no chunks.
 */
public class EmptyInputException extends KnowledgeBaseException {

    private static final long serialVersionUID = 1L;

    public EmptyInputException(final String message) {
        super(message);
    }
}
