package eu.virtualparadox.incidentkb.ingest.loader;

import eu.virtualparadox.incidentkb.application.config.KnowledgeProperties;
import eu.virtualparadox.incidentkb.exception.DocumentSourceNotFoundException;
import eu.virtualparadox.incidentkb.ingest.keyword.KeywordExtractor;
import eu.virtualparadox.incidentkb.ingest.model.SourceDocument;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Reads the plain-text methodology documents ({@code **}{@code /*.txt}, UTF-8) from a source
 * directory and enriches each with its inferred type and corpus tags.
 */
@Service
@Slf4j
public class DocumentLoader {

    private static final String TEXT_EXTENSION = ".txt";

    private final DocumentClassifier classifier;
    private final KeywordExtractor keywordExtractor;
    private final String language;
    private final String domain;

    public DocumentLoader(final DocumentClassifier classifier,
                          final KeywordExtractor keywordExtractor,
                          final KnowledgeProperties properties) {
        this.classifier = classifier;
        this.keywordExtractor = keywordExtractor;
        this.language = properties.getLanguage();
        this.domain = properties.getDomain();
    }

    /**
     * Loads every text document below {@code sourceDir}, in path order.
     *
     * @param sourceDir directory to scan recursively
     * @return loaded documents (possibly empty)
     * @throws DocumentSourceNotFoundException if {@code sourceDir} is not a directory
     * @throws IllegalStateException           if a file cannot be read
     */
    public List<SourceDocument> loadAllDocuments(final Path sourceDir) {
        if (sourceDir == null || !Files.isDirectory(sourceDir)) {
            throw new DocumentSourceNotFoundException(sourceDir);
        }

        final List<Path> files;
        try (Stream<Path> walk = Files.walk(sourceDir)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(TEXT_EXTENSION))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to scan document directory: " + sourceDir, e);
        }

        final List<SourceDocument> documents = new ArrayList<>(files.size());
        for (final Path file : files) {
            documents.add(load(file));
        }

        log.info("Loaded {} documents from {}", documents.size(), sourceDir);
        return documents;
    }

    private SourceDocument load(final Path file) {
        try {
            final String content = Files.readString(file, StandardCharsets.UTF_8);
            final String filename = file.getFileName().toString();
            return new SourceDocument(
                    content,
                    file,
                    filename,
                    classifier.classify(filename),
                    content.length(),
                    language,
                    domain,
                    keywordExtractor.allKeywords(content).size());
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read document: " + file, e);
        }
    }
}
