package eu.virtualparadox.docassist.rag.index;

import eu.virtualparadox.docassist.ingest.model.Chunk;

import java.util.Objects;

/**
 * A chunk together with its embedding, as stored in a {@link VectorIndex}.
 */
public record IndexEntry(float[] vector, Chunk chunk) {

    public IndexEntry {
        Objects.requireNonNull(vector, "vector must not be null");
        Objects.requireNonNull(chunk, "chunk must not be null");
    }
}
