package eu.virtualparadox.incidentkb.knowledge.context;

/**
 * Reference to one source used in a cited context block.
 *
 * @param id            reference label, {@code ref_<n>}
 * @param source        source filename
 * @param documentType  document type id
 * @param chunkId       chunk identifier
 * @param relevanceRank rank of the result the citation was built from
 */
public record Citation(String id, String source, String documentType, String chunkId, int relevanceRank) {
}
