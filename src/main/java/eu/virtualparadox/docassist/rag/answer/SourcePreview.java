package eu.virtualparadox.docassist.rag.answer;

import java.util.Map;

/**
 * Truncated view of a chunk used to support an answer.
 *
 * @param content  the first characters of the chunk, suffixed with {@code ...} when truncated
 * @param metadata chunk metadata (source, file type, chunk id, offset, pages)
 * @param score    similarity of the chunk to the question
 */
public record SourcePreview(String content, Map<String, String> metadata, double score) {

    public static String truncate(final String text, final int maxChars) {
        if (text == null) {
            return "";
        }
        return text.length() > maxChars ? text.substring(0, maxChars) + "..." : text;
    }
}
