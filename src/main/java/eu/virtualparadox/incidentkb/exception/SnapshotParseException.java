package eu.virtualparadox.incidentkb.exception;

/**
 * A persisted index snapshot could not be decoded. Loading treats it as absent.
 */
public class SnapshotParseException extends KnowledgeBaseException {

    private static final long serialVersionUID = 1L;

    public SnapshotParseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
