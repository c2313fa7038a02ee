package eu.virtualparadox.incidentkb.ingest.chunker;

import eu.virtualparadox.incidentkb.ingest.keyword.KeywordExtractor;
import eu.virtualparadox.incidentkb.ingest.model.Chunk;
import eu.virtualparadox.incidentkb.ingest.model.ChunkMetadata;
import eu.virtualparadox.incidentkb.ingest.model.SourceDocument;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Separator-aware text {@code RecursiveChunker} that produces overlapping chunks for the
 * knowledge-base vector index.
 *
 * <h2>Overview</h2>
 * <ul>
 *   <li><strong>Recursive splitting:</strong> the text is cut on the highest-priority
 *       {@link ESeparator} it contains (section header, subsection header, emphasis, blank line,
 *       newline, sentence end, space). Pieces that still exceed the body budget are cut again
 *       with the next separators.</li>
 *   <li><strong>Packing:</strong> adjacent pieces that fit are greedily packed into a chunk body
 *       of at most {@code chunkSize - overlapChars} characters.</li>
 *   <li><strong>Exact overlap prefix:</strong> every chunk except the first is prefixed with the
 *       {@code overlapChars} characters of source text that precede its body, so adjacent chunks
 *       share exactly that context.</li>
 *   <li><strong>Indivisible tokens:</strong> a piece without any separator left (a very long
 *       token) is kept whole rather than cut mid-token; it is the only way a chunk may exceed
 *       {@code chunkSize}.</li>
 * </ul>
 *
 * <h2>Chunk Size Accounting</h2>
 * A chunk's text is always a contiguous substring of the parent:
 * <pre>
 *     text[startOffset, bodyEnd)   where startOffset = max(0, bodyStart - overlapChars)
 * </pre>
 * so its length is {@code ≤ chunkSize} unless its body holds an indivisible token.
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * Stateless after construction and thus thread-safe. Output is a pure function of the input text.
 */
@Component
public class RecursiveChunker {

    private final int chunkSize;
    private final int overlapChars;
    private final KeywordExtractor keywordExtractor;

    /**
     * Constructs a {@code RecursiveChunker}.
     *
     * @param chunkSize        target number of characters per chunk, overlap included (must be {@code > 0})
     * @param overlapChars     characters shared with the previous chunk
     *                         (must be {@code >= 0} and {@code < chunkSize})
     * @param keywordExtractor vocabulary matcher used for chunk keywords and chunk type
     * @throws IllegalArgumentException if constraints are violated
     */
    @Autowired
    public RecursiveChunker(@Value("${incidentkb.chunker.chunk-size:1000}") final int chunkSize,
                            @Value("${incidentkb.chunker.overlap:200}") final int overlapChars,
                            final KeywordExtractor keywordExtractor) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive");
        }
        if (overlapChars < 0 || overlapChars >= chunkSize) {
            throw new IllegalArgumentException("overlapChars must be non-negative and less than chunkSize");
        }
        this.chunkSize = chunkSize;
        this.overlapChars = overlapChars;
        this.keywordExtractor = keywordExtractor;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getOverlapChars() {
        return overlapChars;
    }

    /**
     * Returns a chunker sharing the keyword extractor but using other size settings.
     */
    public RecursiveChunker withSizes(final int newChunkSize, final int newOverlapChars) {
        return new RecursiveChunker(newChunkSize, newOverlapChars, keywordExtractor);
    }

    /**
     * Splits a loaded document into chunks enriched with keywords, chunk type and position.
     *
     * @param document the document to split (non-null)
     * @return ordered chunks; empty if the document text is blank
     */
    public List<Chunk> chunk(final SourceDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        final String text = document.content();
        final List<TextSpan> spans = chunkSpans(text);

        final List<Chunk> result = new ArrayList<>(spans.size());
        for (int i = 0; i < spans.size(); i++) {
            final TextSpan span = spans.get(i);
            final String chunkText = span.slice(text);
            final ChunkMetadata metadata = new ChunkMetadata(
                    document.filename(),
                    document.documentType(),
                    i,
                    spans.size(),
                    keywordExtractor.classifyChunk(chunkText),
                    keywordExtractor.extractKeywords(chunkText),
                    span.start(),
                    document.language(),
                    document.domain());
            result.add(new Chunk(Chunk.chunkId(document.filename(), i), chunkText, metadata));
        }
        return result;
    }

    /**
     * Splits raw text and returns the chunk strings only.
     *
     * @param text input text (non-null)
     * @return ordered chunk texts
     */
    public List<String> splitText(final String text) {
        final List<TextSpan> spans = chunkSpans(text);
        final List<String> out = new ArrayList<>(spans.size());
        for (final TextSpan s : spans) {
            out.add(s.slice(text));
        }
        return out;
    }

    /**
     * Computes the chunk spans (overlap prefix included) for {@code text}.
     */
    private List<TextSpan> chunkSpans(final String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        final List<TextSpan> chunks = new ArrayList<>();
        if (text.isBlank()) {
            return chunks;
        }

        final List<TextSpan> bodies = new ArrayList<>();
        splitRecursive(text, new TextSpan(0, text.length()), 0, bodies);

        for (final TextSpan body : bodies) {
            if (body.slice(text).isBlank()) {
                continue;
            }
            final int start = chunks.isEmpty() ? body.start() : Math.max(0, body.start() - overlapChars);
            chunks.add(new TextSpan(start, body.end()));
        }
        return chunks;
    }

    /**
     * Cuts {@code range} on the first separator (from {@code fromSeparator} on) that occurs in it,
     * packs the pieces that fit and recurses into the ones that do not.
     *
     * @param text          source text
     * @param range         region of {@code text} to split
     * @param fromSeparator ordinal of the first separator still allowed
     * @param out           receives packed body spans in document order
     */
    private void splitRecursive(final String text,
                                final TextSpan range,
                                final int fromSeparator,
                                final List<TextSpan> out) {
        final int budget = chunkSize - overlapChars;
        final ESeparator[] separators = ESeparator.values();

        int sepIndex = -1;
        for (int i = fromSeparator; i < separators.length; i++) {
            if (occursIn(text, range, separators[i].literal)) {
                sepIndex = i;
                break;
            }
        }
        if (sepIndex < 0) {
            // nothing left to split on: indivisible
            out.add(range);
            return;
        }

        final List<TextSpan> good = new ArrayList<>();
        for (final TextSpan piece : cut(text, range, separators[sepIndex])) {
            if (piece.length() <= budget) {
                good.add(piece);
                continue;
            }
            if (!good.isEmpty()) {
                pack(good, budget, out);
                good.clear();
            }
            splitRecursive(text, piece, sepIndex + 1, out);
        }
        if (!good.isEmpty()) {
            pack(good, budget, out);
        }
    }

    /**
     * Greedily merges contiguous pieces into bodies of at most {@code budget} characters.
     */
    private static void pack(final List<TextSpan> pieces, final int budget, final List<TextSpan> out) {
        int currentStart = pieces.get(0).start();
        int currentEnd = pieces.get(0).end();

        for (int i = 1; i < pieces.size(); i++) {
            final TextSpan p = pieces.get(i);
            if (p.end() - currentStart > budget) {
                out.add(new TextSpan(currentStart, currentEnd));
                currentStart = p.start();
            }
            currentEnd = p.end();
        }
        out.add(new TextSpan(currentStart, currentEnd));
    }

    /**
     * Cuts {@code range} at every occurrence of {@code separator}, keeping the separator with the
     * following piece (leading) or the preceding piece (trailing). Empty pieces are dropped.
     */
    private static List<TextSpan> cut(final String text, final TextSpan range, final ESeparator separator) {
        final List<TextSpan> pieces = new ArrayList<>();
        final String literal = separator.literal;

        int pieceStart = range.start();
        int idx = text.indexOf(literal, range.start());
        while (idx >= 0 && idx + literal.length() <= range.end()) {
            final int boundary = separator.leading ? idx : idx + literal.length();
            if (boundary > pieceStart) {
                pieces.add(new TextSpan(pieceStart, boundary));
                pieceStart = boundary;
            }
            idx = text.indexOf(literal, idx + literal.length());
        }
        if (pieceStart < range.end()) {
            pieces.add(new TextSpan(pieceStart, range.end()));
        }
        return pieces;
    }

    private static boolean occursIn(final String text, final TextSpan range, final String literal) {
        final int idx = text.indexOf(literal, range.start());
        return idx >= 0 && idx + literal.length() <= range.end();
    }
}
