package eu.virtualparadox.incidentkb.exception;

import java.nio.file.Path;

/**
 * The configured source-document directory does not exist.
 */
public class DocumentSourceNotFoundException extends KnowledgeBaseException {

    private static final long serialVersionUID = 1L;

    public DocumentSourceNotFoundException(final Path directory) {
        super("Document directory not found: " + directory);
    }
}
