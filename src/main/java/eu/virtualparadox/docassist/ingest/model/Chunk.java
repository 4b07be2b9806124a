package eu.virtualparadox.docassist.ingest.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Contiguous text window cut from one {@link Document}.
 *
 * @param docId     parent document id
 * @param chunkId   stable id, {@code {docId}_{seq}[_p{from}-{to}]}
 * @param sequence  zero-based position of the chunk in the document
 * @param offset    start offset of the window in the document text
 * @param text      window text
 * @param pageStart first page covered, or {@code -1} when unknown
 * @param pageEnd   last page covered, or {@code -1} when unknown
 * @param metadata  inherited document metadata
 */
public record Chunk(String docId,
                    String chunkId,
                    int sequence,
                    int offset,
                    String text,
                    int pageStart,
                    int pageEnd,
                    Map<String, String> metadata) {

    public static final String META_CHUNK_ID = "chunk_id";
    public static final String META_OFFSET = "offset";
    public static final String META_PAGE = "page";

    public Chunk {
        metadata = metadata == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public boolean hasPages() {
        return pageStart >= 1 && pageEnd >= 1;
    }
}
