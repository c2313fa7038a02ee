package eu.virtualparadox.incidentkb.ingest.model;

import java.nio.file.Path;

/**
 * A loaded knowledge-base source file.
 *
 * @param content       raw UTF-8 text
 * @param source        path the text was read from
 * @param filename      file name without directories
 * @param documentType  type inferred from the file name
 * @param contentLength number of characters in {@code content}
 * @param language      language tag of the corpus
 * @param domain        domain tag of the corpus
 * @param keywordCount  number of vocabulary terms found in the whole document
 */
public record SourceDocument(String content,
                             Path source,
                             String filename,
                             EDocumentType documentType,
                             int contentLength,
                             String language,
                             String domain,
                             int keywordCount) {
}
