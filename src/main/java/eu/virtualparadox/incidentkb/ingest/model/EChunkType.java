package eu.virtualparadox.incidentkb.ingest.model;

import java.util.Arrays;
import java.util.Locale;

/**
 * Semantic type of a chunk, inferred from the terms it contains.
 */
public enum EChunkType {
    VULNERABILITIES("vulnerabilities"),
    CONTROLS("controls"),
    IMPACTS("impacts"),
    METHODOLOGY("methodology"),
    FRAMEWORK_REFERENCE("framework_reference"),
    CONCEPTUAL("conceptual");

    private final String id;

    EChunkType(final String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static EChunkType fromId(final String value) {
        if (value == null) {
            return CONCEPTUAL;
        }
        final String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(t -> t.id.equals(normalized))
                .findFirst()
                .orElse(CONCEPTUAL);
    }
}
