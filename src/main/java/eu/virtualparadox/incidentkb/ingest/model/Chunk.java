package eu.virtualparadox.incidentkb.ingest.model;

/**
 * Immutable representation of a text chunk produced by splitting a {@link SourceDocument}.
 * <p>Contains the chunk id, the text to be embedded and its metadata.</p>
 */
public record Chunk(String chunkId, String text, ChunkMetadata metadata) {

    /**
     * Builds the stable identifier {@code {filename}_{index(5 digits)}}.
     */
    public static String chunkId(final String filename, final int index) {
        return filename + "_" + String.format("%05d", index);
    }
}
