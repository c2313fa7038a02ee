package eu.virtualparadox.incidentkb.ingest;

import eu.virtualparadox.incidentkb.ingest.chunker.RecursiveChunker;
import eu.virtualparadox.incidentkb.ingest.loader.DocumentClassifier;
import eu.virtualparadox.incidentkb.ingest.loader.DocumentLoader;
import eu.virtualparadox.incidentkb.ingest.model.Chunk;
import eu.virtualparadox.incidentkb.ingest.model.DocumentStats;
import eu.virtualparadox.incidentkb.ingest.model.EDocumentType;
import eu.virtualparadox.incidentkb.ingest.model.SourceDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Entry point of the ingestion side:
 * <ol>
 *     <li>Load and classify the source documents</li>
 *     <li>Split them into overlapping, keyword-annotated chunks</li>
 * </ol>
 * Reads files only; the documents themselves are never modified.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentIngestor {

    private final DocumentLoader documentLoader;
    private final DocumentClassifier documentClassifier;
    private final RecursiveChunker chunker;

    public List<SourceDocument> loadAllDocuments(final Path sourceDir) {
        return documentLoader.loadAllDocuments(sourceDir);
    }

    public EDocumentType classify(final String filename) {
        return documentClassifier.classify(filename);
    }

    /**
     * Splits documents with the configured chunk size and overlap.
     */
    public List<Chunk> splitDocuments(final List<SourceDocument> documents) {
        return split(documents, chunker);
    }

    /**
     * Splits documents with explicit sizes.
     *
     * @param chunkSize target characters per chunk
     * @param overlap   characters shared by adjacent chunks
     */
    public List<Chunk> splitDocuments(final List<SourceDocument> documents,
                                      final int chunkSize,
                                      final int overlap) {
        return split(documents, chunker.withSizes(chunkSize, overlap));
    }

    private List<Chunk> split(final List<SourceDocument> documents, final RecursiveChunker splitter) {
        final List<Chunk> all = new ArrayList<>();
        for (final SourceDocument document : documents) {
            all.addAll(splitter.chunk(document));
        }
        log.info("Created {} chunks from {} documents", all.size(), documents.size());
        return all;
    }

    public DocumentStats documentStats(final List<SourceDocument> documents) {
        if (documents == null || documents.isEmpty()) {
            return DocumentStats.empty();
        }
        long totalChars = 0;
        final Map<String, Integer> types = new TreeMap<>();
        final TreeSet<String> languages = new TreeSet<>();

        for (final SourceDocument d : documents) {
            totalChars += d.contentLength();
            types.merge(d.documentType().id(), 1, Integer::sum);
            languages.add(d.language());
        }
        return new DocumentStats(
                documents.size(),
                totalChars,
                totalChars / documents.size(),
                Collections.unmodifiableMap(types),
                Collections.unmodifiableSet(languages));
    }
}
