package eu.virtualparadox.docassist.util;

public class LuceneConstants {
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_ORDINAL = "ordinal";
    public static final String FIELD_DOC_ID = "docId";
    public static final String FIELD_CHUNK_ID = "chunkId";
    public static final String FIELD_TEXT = "text";

    private LuceneConstants() {
        // prevent instantiation
    }
}
