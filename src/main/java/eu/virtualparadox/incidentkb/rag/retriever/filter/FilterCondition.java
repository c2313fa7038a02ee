package eu.virtualparadox.incidentkb.rag.retriever.filter;

import eu.virtualparadox.incidentkb.ingest.model.ChunkMetadata;

import java.util.Objects;
import java.util.Set;

/**
 * A single predicate on one metadata key.
 */
public interface FilterCondition {

    MetadataKey key();

    boolean test(ChunkMetadata metadata);

    /**
     * The field equals {@code value}.
     */
    record Equals(MetadataKey key, String value) implements FilterCondition {
        public Equals {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public boolean test(final ChunkMetadata metadata) {
            return value.equals(key.valueOf(metadata));
        }
    }

    /**
     * The field equals one of {@code values}.
     */
    record AnyOf(MetadataKey key, Set<String> values) implements FilterCondition {
        public AnyOf {
            Objects.requireNonNull(key, "key");
            values = Set.copyOf(values);
        }

        @Override
        public boolean test(final ChunkMetadata metadata) {
            final String actual = key.valueOf(metadata);
            return actual != null && values.contains(actual);
        }
    }
}
