package eu.virtualparadox.incidentkb.ingest.chunker;

/**
 * Half-open range {@code [start, end)} of the document text: a separator-delimited piece,
 * a packed body, or a final chunk including its overlap prefix.
 */
record TextSpan(int start, int end) {

    TextSpan {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid span [" + start + ", " + end + ")");
        }
    }

    int length() {
        return end - start;
    }

    String slice(final String text) {
        return text.substring(start, end);
    }
}
