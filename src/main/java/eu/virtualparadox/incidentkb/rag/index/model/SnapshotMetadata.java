package eu.virtualparadox.incidentkb.rag.index.model;

import eu.virtualparadox.incidentkb.exception.SnapshotParseException;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static eu.virtualparadox.incidentkb.util.LuceneConstants.*;

/**
 * Collection-level metadata stored as Lucene commit user data.
 *
 * @param description     free-text description of the collection
 * @param version         schema version of the record layout
 * @param frameworks      methodologies covered by the documents
 * @param contentTypes    document type ids the collection was designed for
 * @param language        language tag
 * @param domain          domain tag
 * @param embeddingModel  model that produced the stored vectors
 * @param vectorDimension dimension of every stored vector
 * @param builtAt         time the snapshot was written
 */
public record SnapshotMetadata(String description,
                               String version,
                               List<String> frameworks,
                               List<String> contentTypes,
                               String language,
                               String domain,
                               String embeddingModel,
                               int vectorDimension,
                               Instant builtAt) {

    public static final String DEFAULT_DESCRIPTION = "Security Knowledge Base";
    public static final List<String> DEFAULT_FRAMEWORKS = List.of("MAGERIT", "OCTAVE", "ISO27001", "NIST");

    public SnapshotMetadata {
        frameworks = frameworks == null ? List.of() : List.copyOf(frameworks);
        contentTypes = contentTypes == null ? List.of() : List.copyOf(contentTypes);
    }

    /**
     * Returns a copy with a new build time. Used when the snapshot is mutated in place.
     */
    public SnapshotMetadata withBuiltAt(final Instant time) {
        return new SnapshotMetadata(description, version, frameworks, contentTypes,
                language, domain, embeddingModel, vectorDimension, time);
    }

    public Map<String, String> toUserData() {
        final Map<String, String> data = new LinkedHashMap<>();
        data.put(COMMIT_DESCRIPTION, description);
        data.put(COMMIT_VERSION, version);
        data.put(COMMIT_FRAMEWORKS, String.join(LIST_SEPARATOR, frameworks));
        data.put(COMMIT_CONTENT_TYPES, String.join(LIST_SEPARATOR, contentTypes));
        data.put(COMMIT_LANGUAGE, language);
        data.put(COMMIT_DOMAIN, domain);
        data.put(COMMIT_EMBEDDING_MODEL, embeddingModel);
        data.put(COMMIT_VECTOR_DIMENSION, Integer.toString(vectorDimension));
        data.put(COMMIT_BUILT_AT, builtAt.toString());
        return data;
    }

    /**
     * Decodes commit user data.
     *
     * @throws SnapshotParseException when a required entry is missing or malformed
     */
    public static SnapshotMetadata fromUserData(final Map<String, String> data) {
        if (data == null || data.isEmpty()) {
            throw new SnapshotParseException("Snapshot has no collection metadata", null);
        }
        try {
            return new SnapshotMetadata(
                    data.getOrDefault(COMMIT_DESCRIPTION, ""),
                    require(data, COMMIT_VERSION),
                    splitList(data.get(COMMIT_FRAMEWORKS)),
                    splitList(data.get(COMMIT_CONTENT_TYPES)),
                    data.getOrDefault(COMMIT_LANGUAGE, ""),
                    data.getOrDefault(COMMIT_DOMAIN, ""),
                    require(data, COMMIT_EMBEDDING_MODEL),
                    Integer.parseInt(require(data, COMMIT_VECTOR_DIMENSION)),
                    Instant.parse(require(data, COMMIT_BUILT_AT)));
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new SnapshotParseException("Malformed snapshot metadata: " + e.getMessage(), e);
        }
    }

    private static String require(final Map<String, String> data, final String key) {
        final String value = data.get(key);
        if (StringUtils.isBlank(value)) {
            throw new SnapshotParseException("Snapshot metadata is missing '" + key + "'", null);
        }
        return value;
    }

    private static List<String> splitList(final String value) {
        if (StringUtils.isBlank(value)) {
            return List.of();
        }
        return Arrays.stream(value.split(LIST_SEPARATOR))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
