package eu.virtualparadox.docassist.rag.index;

import eu.virtualparadox.docassist.exception.ConfigException;

/**
 * Tracks the vector dimension of an index.
 * <p>The first vector seen fixes the dimension; it is forgotten again on {@link #reset()}.</p>
 */
final class DimensionGuard {

    private Integer dimension;

    void accept(final float[] vector) {
        final int dim = vector.length;
        if (dim <= 0) {
            throw new ConfigException("Vector dimension must be > 0");
        }
        if (dimension == null) {
            dimension = dim;
        } else if (dimension != dim) {
            throw new ConfigException("Vector dimension mismatch. Existing=" + dimension + ", new=" + dim
                    + " (embedding model changed without re-ingesting?)");
        }
    }

    void checkQuery(final float[] query) {
        if (dimension != null && dimension != query.length) {
            throw new ConfigException("Query dimension " + query.length + " does not match index dimension " + dimension);
        }
    }

    void reset() {
        dimension = null;
    }
}
