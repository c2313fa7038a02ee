package eu.virtualparadox.incidentkb.rag.index;

import eu.virtualparadox.incidentkb.ingest.model.Chunk;
import eu.virtualparadox.incidentkb.rag.index.model.IndexedCandidate;
import eu.virtualparadox.incidentkb.rag.index.model.SnapshotMetadata;
import eu.virtualparadox.incidentkb.util.VectorCodec;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.IndexReader;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.MultiBits;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.Term;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.Directory;
import org.apache.lucene.util.Bits;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

import static eu.virtualparadox.incidentkb.util.LuceneConstants.FIELD_CHUNK_ID;
import static eu.virtualparadox.incidentkb.util.LuceneConstants.FIELD_TEXT;
import static eu.virtualparadox.incidentkb.util.LuceneConstants.FIELD_VECTOR;

/**
 * The on-disk Lucene index of one collection together with its open resources.
 * <p>
 * Owns the {@link Directory}, {@link IndexWriter} and {@link SearcherManager}; all of them are
 * closed by {@link #close()}. Writes go through {@link LuceneVectorIndexService}, which serializes
 * them per collection; reads acquire a searcher and never block behind writers.
 */
@Slf4j
public final class IndexSnapshot implements Closeable {

    @Getter
    private final String collection;
    @Getter
    private final Path path;

    private final Directory directory;
    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    private volatile SnapshotMetadata metadata;

    IndexSnapshot(final String collection,
                  final Path path,
                  final Directory directory,
                  final IndexWriter writer,
                  final SearcherManager searcherManager,
                  final SnapshotMetadata metadata) {
        this.collection = collection;
        this.path = path;
        this.directory = directory;
        this.writer = writer;
        this.searcherManager = searcherManager;
        this.metadata = metadata;
    }

    public SnapshotMetadata metadata() {
        return metadata;
    }

    /**
     * Whether the snapshot directory is still present on disk.
     */
    public boolean existsOnDisk() {
        return Files.isDirectory(path);
    }

    public int recordCount() throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            return searcher.getIndexReader().numDocs();
        } finally {
            searcherManager.release(searcher);
        }
    }

    /**
     * Visits every live record of the snapshot.
     */
    public void forEachRecord(final Consumer<Document> visitor) throws IOException {
        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final IndexReader reader = searcher.getIndexReader();
            final StoredFields storedFields = reader.storedFields();
            final Bits liveDocs = MultiBits.getLiveDocs(reader);
            for (int i = 0; i < reader.maxDoc(); i++) {
                if (liveDocs == null || liveDocs.get(i)) {
                    visitor.accept(storedFields.document(i));
                }
            }
        } finally {
            searcherManager.release(searcher);
        }
    }

    public List<String> chunkIds() throws IOException {
        final List<String> ids = new ArrayList<>();
        forEachRecord(d -> ids.add(d.get(FIELD_CHUNK_ID)));
        return ids;
    }

    /**
     * Runs an HNSW k-NN query and returns the hits with their stored vectors.
     * <p>Similarity is recomputed from the stored vector, so it is the raw cosine in {@code [-1, 1]}.</p>
     *
     * @param query query vector, same dimension as the indexed vectors
     * @param k     number of neighbours to return
     * @return hits ordered by decreasing similarity
     */
    public List<IndexedCandidate> nearest(final float[] query, final int k) throws IOException {
        if (query.length != metadata.vectorDimension()) {
            throw new IllegalArgumentException("Query dimension " + query.length
                    + " does not match index dimension " + metadata.vectorDimension());
        }

        final IndexSearcher searcher = searcherManager.acquire();
        try {
            final KnnFloatVectorQuery knn = new KnnFloatVectorQuery(FIELD_VECTOR, query, k);
            final TopDocs topDocs = searcher.search(knn, k);
            final StoredFields storedFields = searcher.storedFields();

            final List<IndexedCandidate> hits = new ArrayList<>(topDocs.scoreDocs.length);
            for (final ScoreDoc sd : topDocs.scoreDocs) {
                final Document doc = storedFields.document(sd.doc);
                final float[] vector = ChunkDocumentMapper.toVector(doc);
                hits.add(new IndexedCandidate(
                        doc.get(FIELD_CHUNK_ID),
                        doc.get(FIELD_TEXT),
                        ChunkDocumentMapper.toMetadata(doc),
                        vector,
                        VectorCodec.cosine(query, vector)));
            }
            hits.sort((a, b) -> Double.compare(b.similarity(), a.similarity()));
            return hits;
        } finally {
            searcherManager.release(searcher);
        }
    }

    void addRecords(final List<Chunk> chunks, final List<float[]> vectors) throws IOException {
        for (int i = 0; i < chunks.size(); i++) {
            writer.addDocument(ChunkDocumentMapper.toDocument(chunks.get(i), vectors.get(i)));
        }
    }

    void deleteRecord(final String chunkId) throws IOException {
        writer.deleteDocuments(new Term(FIELD_CHUNK_ID, chunkId));
    }

    /**
     * Commits pending writes with the given collection metadata and refreshes the searcher.
     */
    void commit(final SnapshotMetadata newMetadata) throws IOException {
        writer.setLiveCommitData(newMetadata.toUserData().entrySet());
        writer.commit();
        searcherManager.maybeRefreshBlocking();
        this.metadata = newMetadata;
    }

    /**
     * Closes the Lucene resources; the files on disk are kept. Close failures are logged.
     */
    @Override
    public void close() {
        try { searcherManager.close(); } catch (Exception e) {
            log.error("Unable to close SearcherManager for {}", collection, e);
        }

        try { writer.close(); } catch (Exception e) {
            log.error("Unable to close IndexWriter for {}", collection, e);
        }

        try { directory.close(); } catch (Exception e) {
            log.error("Unable to close Directory for {}", collection, e);
        }
    }
}
