package eu.virtualparadox.incidentkb.exception;

/**
 * Missing or invalid configuration, e.g. no embedding-provider credential. Fatal at startup.
 */
public class KnowledgeConfigException extends KnowledgeBaseException {

    private static final long serialVersionUID = 1L;

    public KnowledgeConfigException(final String message) {
        super(message);
    }
}
