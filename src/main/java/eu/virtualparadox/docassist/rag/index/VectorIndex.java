package eu.virtualparadox.docassist.rag.index;

import eu.virtualparadox.docassist.exception.ConfigException;
import eu.virtualparadox.docassist.rag.retriever.model.RetrievalResult;

import java.util.List;

/**
 * Nearest-neighbour store over chunk embeddings.
 * <p>
 * One instance belongs to exactly one document session and is never shared across sessions.
 * Implementations are not thread-safe; callers serialize access per session.
 * <ul>
 *   <li><b>Add</b> is additive; the chat service always clears before adding a new document</li>
 *   <li><b>Search</b> ranks by cosine similarity, highest first, ties in insertion order</li>
 *   <li><b>Clear</b> drops every entry at once; there is no partial delete</li>
 * </ul>
 * All vectors, stored and queried, must share one dimension. A mismatch is a configuration
 * error ({@link ConfigException}), not something to retry.
 */
public interface VectorIndex extends AutoCloseable {

    /**
     * Appends entries to the index.
     *
     * @param entries entries to add (non-null; may be empty)
     * @throws ConfigException if a vector's dimension differs from the established one
     */
    void add(final List<IndexEntry> entries);

    /**
     * Returns the {@code k} most similar entries. {@code k} is clamped to the index size;
     * an empty index yields an empty result.
     *
     * @param queryVector query embedding
     * @param k           maximum number of hits ({@code > 0})
     * @throws ConfigException if the query dimension differs from the stored vectors
     */
    RetrievalResult search(final float[] queryVector, final int k);

    void clear();

    int size();

    @Override
    default void close() {
        clear();
    }
}
