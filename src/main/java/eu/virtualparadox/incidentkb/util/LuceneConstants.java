package eu.virtualparadox.incidentkb.util;

public class LuceneConstants {
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_VECTOR_BYTES = "vector_bytes";
    public static final String FIELD_CHUNK_ID = "chunk_id";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_FILENAME = "filename";
    public static final String FIELD_DOCUMENT_TYPE = "document_type";
    public static final String FIELD_CHUNK_INDEX = "chunk_index";
    public static final String FIELD_TOTAL_CHUNKS = "total_chunks";
    public static final String FIELD_CHUNK_TYPE = "chunk_type";
    public static final String FIELD_KEYWORDS = "keywords";
    public static final String FIELD_START_OFFSET = "start_offset";
    public static final String FIELD_LANGUAGE = "language";
    public static final String FIELD_DOMAIN = "domain";

    // commit user data
    public static final String COMMIT_DESCRIPTION = "description";
    public static final String COMMIT_VERSION = "version";
    public static final String COMMIT_FRAMEWORKS = "frameworks";
    public static final String COMMIT_CONTENT_TYPES = "content_types";
    public static final String COMMIT_LANGUAGE = "language";
    public static final String COMMIT_DOMAIN = "domain";
    public static final String COMMIT_EMBEDDING_MODEL = "embedding_model";
    public static final String COMMIT_VECTOR_DIMENSION = "vector_dimension";
    public static final String COMMIT_BUILT_AT = "built_at";

    public static final String SCHEMA_VERSION = "1.0";
    public static final String LIST_SEPARATOR = ",";

    /** Upper bound Lucene accepts for a {@code KnnFloatVectorField}. */
    public static final int MAX_VECTOR_DIMENSIONS = 1024;

    private LuceneConstants() {
        // prevent instantiation
    }
}
