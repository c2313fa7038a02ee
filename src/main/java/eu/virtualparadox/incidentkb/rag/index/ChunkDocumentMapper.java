package eu.virtualparadox.incidentkb.rag.index;

import eu.virtualparadox.incidentkb.ingest.model.Chunk;
import eu.virtualparadox.incidentkb.ingest.model.ChunkMetadata;
import eu.virtualparadox.incidentkb.ingest.model.EChunkType;
import eu.virtualparadox.incidentkb.ingest.model.EDocumentType;
import eu.virtualparadox.incidentkb.util.VectorCodec;
import org.apache.commons.lang3.StringUtils;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.util.BytesRef;

import java.util.Arrays;
import java.util.List;

import static eu.virtualparadox.incidentkb.util.LuceneConstants.*;

/**
 * Converts between {@link Chunk} + vector pairs and Lucene {@link Document}s.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code chunk_id} – {@link StringField#TYPE_STORED}: unique chunk identifier, used for delete-then-insert</li>
 *   <li>{@code text} – {@link TextField}: chunk text, stored to rebuild results</li>
 *   <li>{@code vector} – {@link KnnFloatVectorField}: dense vector, HNSW indexed with cosine similarity</li>
 *   <li>{@code vector_bytes} – {@link StoredField}: copy of the vector for diversity re-ranking</li>
 *   <li>{@code filename}, {@code document_type}, {@code chunk_type}, {@code language}, {@code domain} –
 *       {@link StringField}s, stored</li>
 *   <li>{@code chunk_index}, {@code total_chunks}, {@code start_offset}, {@code keywords} – stored only</li>
 * </ul>
 */
final class ChunkDocumentMapper {

    private ChunkDocumentMapper() {
        // prevent instantiation
    }

    static Document toDocument(final Chunk chunk, final float[] vector) {
        final ChunkMetadata m = chunk.metadata();
        final Document d = new Document();

        // Identifier
        d.add(new StringField(FIELD_CHUNK_ID, chunk.chunkId(), Field.Store.YES));

        // Text content
        d.add(new TextField(FIELD_TEXT, chunk.text(), Field.Store.YES));

        // Vector for HNSW ANN search, plus a stored copy
        d.add(new KnnFloatVectorField(FIELD_VECTOR, vector, VectorSimilarityFunction.COSINE));
        d.add(new StoredField(FIELD_VECTOR_BYTES, VectorCodec.toBytes(vector)));

        // Filterable metadata
        d.add(new StringField(FIELD_FILENAME, m.filename(), Field.Store.YES));
        d.add(new StringField(FIELD_DOCUMENT_TYPE, m.documentType().id(), Field.Store.YES));
        d.add(new StringField(FIELD_CHUNK_TYPE, m.chunkType().id(), Field.Store.YES));
        d.add(new StringField(FIELD_LANGUAGE, StringUtils.defaultString(m.language()), Field.Store.YES));
        d.add(new StringField(FIELD_DOMAIN, StringUtils.defaultString(m.domain()), Field.Store.YES));

        // Positional metadata (stored only)
        d.add(new StoredField(FIELD_CHUNK_INDEX, m.chunkIndex()));
        d.add(new StoredField(FIELD_TOTAL_CHUNKS, m.totalChunks()));
        d.add(new StoredField(FIELD_START_OFFSET, m.startOffset()));
        d.add(new StoredField(FIELD_KEYWORDS, String.join(LIST_SEPARATOR, m.keywords())));

        return d;
    }

    static ChunkMetadata toMetadata(final Document d) {
        final String keywords = d.get(FIELD_KEYWORDS);
        final List<String> keywordList = StringUtils.isEmpty(keywords)
                ? List.of()
                : Arrays.asList(keywords.split(LIST_SEPARATOR));

        return new ChunkMetadata(
                d.get(FIELD_FILENAME),
                EDocumentType.fromId(d.get(FIELD_DOCUMENT_TYPE)),
                intValue(d, FIELD_CHUNK_INDEX),
                intValue(d, FIELD_TOTAL_CHUNKS),
                EChunkType.fromId(d.get(FIELD_CHUNK_TYPE)),
                keywordList,
                intValue(d, FIELD_START_OFFSET),
                d.get(FIELD_LANGUAGE),
                d.get(FIELD_DOMAIN));
    }

    static float[] toVector(final Document d) {
        final BytesRef bytes = d.getBinaryValue(FIELD_VECTOR_BYTES);
        if (bytes == null) {
            throw new IllegalStateException("Record " + d.get(FIELD_CHUNK_ID) + " has no stored vector");
        }
        return VectorCodec.fromBytes(bytes.bytes, bytes.offset, bytes.length);
    }

    private static int intValue(final Document d, final String field) {
        final IndexableField f = d.getField(field);
        return f == null ? 0 : f.numericValue().intValue();
    }
}
