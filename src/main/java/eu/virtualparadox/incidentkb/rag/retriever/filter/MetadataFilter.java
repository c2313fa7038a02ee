package eu.virtualparadox.incidentkb.rag.retriever.filter;

import eu.virtualparadox.incidentkb.ingest.model.ChunkMetadata;
import eu.virtualparadox.incidentkb.ingest.model.EDocumentType;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Conjunction of {@link FilterCondition}s applied to search results after retrieval.
 * <p>An empty filter matches everything.</p>
 */
public final class MetadataFilter {

    private static final MetadataFilter NONE = new MetadataFilter(List.of());

    private final List<FilterCondition> conditions;

    private MetadataFilter(final List<FilterCondition> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    public static MetadataFilter none() {
        return NONE;
    }

    public static MetadataFilter of(final FilterCondition... conditions) {
        return new MetadataFilter(List.of(conditions));
    }

    public static MetadataFilter equalTo(final MetadataKey key, final String value) {
        return of(new FilterCondition.Equals(key, value));
    }

    public static MetadataFilter anyOf(final MetadataKey key, final Collection<String> values) {
        return of(new FilterCondition.AnyOf(key, Set.copyOf(values)));
    }

    public static MetadataFilter documentTypes(final Collection<EDocumentType> types) {
        return anyOf(MetadataKey.DOCUMENT_TYPE, types.stream().map(EDocumentType::id).collect(Collectors.toSet()));
    }

    /**
     * Returns a new filter that additionally requires {@code condition}.
     */
    public MetadataFilter and(final FilterCondition condition) {
        final List<FilterCondition> next = new ArrayList<>(conditions);
        next.add(condition);
        return new MetadataFilter(next);
    }

    public boolean matches(final ChunkMetadata metadata) {
        for (final FilterCondition c : conditions) {
            if (!c.test(metadata)) {
                return false;
            }
        }
        return true;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    public List<FilterCondition> conditions() {
        return conditions;
    }

    @Override
    public String toString() {
        return "MetadataFilter" + conditions;
    }
}
