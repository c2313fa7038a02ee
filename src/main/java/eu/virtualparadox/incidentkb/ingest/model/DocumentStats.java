package eu.virtualparadox.incidentkb.ingest.model;

import java.util.Map;
import java.util.Set;

/**
 * Aggregate figures over a set of loaded documents.
 *
 * @param totalDocuments    number of documents
 * @param totalCharacters   sum of content lengths
 * @param avgDocumentLength integer average length, 0 for an empty set
 * @param documentTypes     histogram by document type id
 * @param languages         distinct language tags
 */
public record DocumentStats(int totalDocuments,
                            long totalCharacters,
                            long avgDocumentLength,
                            Map<String, Integer> documentTypes,
                            Set<String> languages) {

    public static DocumentStats empty() {
        return new DocumentStats(0, 0, 0, Map.of(), Set.of());
    }
}
