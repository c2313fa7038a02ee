package eu.virtualparadox.incidentkb.ingest.chunker;

/**
 * Split boundaries in priority order, from document structure down to single spaces.
 * <p>
 * Structural separators (headers, emphasis, blank lines, newlines) open the following piece, so
 * a header stays with its section. Sentence and space separators close the preceding piece, so a
 * sentence keeps its final period.
 */
enum ESeparator {
    SECTION_HEADER("\n\n# ", true),
    SUBSECTION_HEADER("\n\n## ", true),
    MINOR_HEADER("\n\n### ", true),
    EMPHASIS("\n\n**", true),
    PARAGRAPH("\n\n", true),
    LINE("\n", true),
    SENTENCE(". ", false),
    SPACE(" ", false);

    final String literal;
    final boolean leading;

    ESeparator(final String literal, final boolean leading) {
        this.literal = literal;
        this.leading = leading;
    }
}
