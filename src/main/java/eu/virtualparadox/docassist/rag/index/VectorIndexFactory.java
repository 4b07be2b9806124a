package eu.virtualparadox.docassist.rag.index;

/**
 * Creates a fresh, exclusively owned index for each new document session.
 */
@FunctionalInterface
public interface VectorIndexFactory {

    VectorIndex create();
}
