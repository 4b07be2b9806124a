package eu.virtualparadox.docassist.rag.embed;

import eu.virtualparadox.docassist.exception.EmbeddingException;

/**
 * Computes dense vector embeddings through an external embedding model.
 * <p>
 * The output dimension is fixed per deployment; every vector compared in one index
 * must come from the same gateway configuration.
 */
public interface EmbeddingGateway {

    /**
     * Embeds a single text (a chunk at ingest time or a query at retrieval time).
     *
     * @param text the text to embed (non-null)
     * @return a dense vector representation of {@code text}
     * @throws EmbeddingException if the model call fails or returns an empty vector
     */
    float[] embed(final String text);
}
