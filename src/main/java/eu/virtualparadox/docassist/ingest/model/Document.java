package eu.virtualparadox.docassist.ingest.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable uploaded document: normalized text plus its origin.
 * <p>A document is never edited. Uploading a new one replaces it in the session.</p>
 *
 * @param id         generated document identifier, used as prefix for chunk ids
 * @param name       original file name
 * @param sourceType declared type (lowercase extension, e.g. {@code pdf})
 * @param text       extracted, normalized text
 * @param pageMap    optional per-character 1-based page index aligned with {@code text}, or {@code null}
 */
public record Document(String id, String name, String sourceType, String text, int[] pageMap) {

    public static final String META_SOURCE = "source";
    public static final String META_FILE_TYPE = "file_type";

    public Document {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (pageMap != null && pageMap.length != text.length()) {
            throw new IllegalArgumentException("pageMap length must match text length");
        }
        pageMap = pageMap == null ? null : pageMap.clone();
    }

    public static Document ofText(final String id, final String name, final String sourceType, final String text) {
        return new Document(id, name, sourceType, text, null);
    }

    @Override
    public int[] pageMap() {
        return pageMap == null ? null : pageMap.clone();
    }

    /**
     * Origin metadata inherited by every chunk derived from this document.
     */
    public Map<String, String> metadata() {
        final Map<String, String> meta = new LinkedHashMap<>();
        if (name != null) {
            meta.put(META_SOURCE, name);
        }
        if (sourceType != null) {
            meta.put(META_FILE_TYPE, sourceType);
        }
        return meta;
    }
}
