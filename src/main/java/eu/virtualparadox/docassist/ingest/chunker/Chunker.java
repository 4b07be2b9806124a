package eu.virtualparadox.docassist.ingest.chunker;

import eu.virtualparadox.docassist.application.config.ApplicationConfig;
import eu.virtualparadox.docassist.exception.ConfigException;
import eu.virtualparadox.docassist.ingest.model.Chunk;
import eu.virtualparadox.docassist.ingest.model.Document;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fixed-window text {@code Chunker} producing overlapping chunks for the RAG index.
 *
 * <h2>Windows</h2>
 * Window {@code i} starts at {@code i * (chunkSize - overlap)} and spans at most {@code chunkSize}
 * characters. Consecutive windows share exactly {@code overlap} characters; the last window ends
 * at the end of the text, so the windows cover the input with no gap. For a text of length
 * {@code n > chunkSize} this yields {@code ceil((n - overlap) / (chunkSize - overlap))} chunks,
 * otherwise exactly one.
 *
 * <h2>Page mapping</h2>
 * If a per-character {@code pageMap} is supplied, each chunk records the page span of its first
 * and last character, and the span is appended to the chunk id.
 *
 * <h2>Determinism &amp; Thread-safety</h2>
 * Stateless after construction. The same input always yields the same chunk sequence, which
 * downstream citation ordering relies on.
 */
@Component
public class Chunker {

    private final int chunkSize;
    private final int overlap;

    @Autowired
    public Chunker(final ApplicationConfig config) {
        this(config.getChunkSize(), config.getChunkOverlap());
    }

    /**
     * @param chunkSize maximum characters per chunk (must be {@code > 0})
     * @param overlap   characters shared by consecutive chunks ({@code 0 <= overlap < chunkSize})
     * @throws ConfigException if the constraints are violated
     */
    public Chunker(final int chunkSize, final int overlap) {
        if (chunkSize <= 0) {
            throw new ConfigException("chunkSize must be positive, was " + chunkSize);
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new ConfigException("overlap must be non-negative and less than chunkSize ("
                    + overlap + " vs " + chunkSize + ")");
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public List<Chunk> split(final Document document) {
        return split(document.id(), document.text(), document.pageMap(), document.metadata());
    }

    public List<Chunk> split(final String docId, final String text) {
        return split(docId, text, null, Map.of());
    }

    /**
     * Splits {@code text} into overlapping windows.
     *
     * @param docId    document identifier (non-blank)
     * @param text     normalized text (non-null)
     * @param pageMap  optional per-character page index, same length as {@code text}
     * @param metadata metadata copied onto every chunk
     * @return ordered chunks; empty for blank text
     */
    public List<Chunk> split(final String docId,
                             final String text,
                             final int[] pageMap,
                             final Map<String, String> metadata) {
        if (docId == null || docId.isBlank()) {
            throw new IllegalArgumentException("docId cannot be null or blank");
        }
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (pageMap != null && pageMap.length != text.length()) {
            throw new IllegalArgumentException("pageMap length must match text length");
        }

        final List<Chunk> result = new ArrayList<>();
        if (text.isBlank()) {
            return result;
        }

        final int length = text.length();
        final int stride = chunkSize - overlap;

        int seq = 0;
        for (int start = 0; ; start += stride) {
            final int end = Math.min(start + chunkSize, length);
            result.add(createChunk(docId, text, start, end, seq++, pageMap, metadata));
            if (end >= length) {
                break;
            }
        }
        return result;
    }

    private Chunk createChunk(final String docId,
                              final String text,
                              final int start,
                              final int end,
                              final int sequence,
                              final int[] pageMap,
                              final Map<String, String> metadata) {
        final int pageStart = pageOf(pageMap, start);
        final int pageEnd = pageOf(pageMap, end - 1);
        final String chunkId = buildChunkId(docId, sequence, pageStart, pageEnd);

        final Map<String, String> meta = new LinkedHashMap<>();
        if (metadata != null) {
            meta.putAll(metadata);
        }
        meta.put(Chunk.META_CHUNK_ID, chunkId);
        meta.put(Chunk.META_OFFSET, String.valueOf(start));
        if (pageStart >= 1) {
            meta.put(Chunk.META_PAGE, pageStart == pageEnd ? String.valueOf(pageStart) : pageStart + "-" + pageEnd);
        }

        return new Chunk(docId, chunkId, sequence, start, text.substring(start, end), pageStart, pageEnd, meta);
    }

    private static int pageOf(final int[] pageMap, final int charIndex) {
        if (pageMap == null || pageMap.length == 0) {
            return -1;
        }
        final int idx = Math.max(0, Math.min(charIndex, pageMap.length - 1));
        return pageMap[idx];
    }

    /**
     * {@code {docId}_{seq(5 digits)}[_p{pageStart}-{pageEnd}]}
     */
    private static String buildChunkId(final String docId,
                                       final int seq,
                                       final int pageStart,
                                       final int pageEnd) {
        final String seqStr = String.format("%05d", seq);
        if (pageStart >= 1 && pageEnd >= 1) {
            return docId + "_" + seqStr + "_p" + pageStart + "-" + pageEnd;
        }
        return docId + "_" + seqStr;
    }
}
