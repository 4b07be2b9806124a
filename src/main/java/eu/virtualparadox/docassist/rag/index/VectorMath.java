package eu.virtualparadox.docassist.rag.index;

final class VectorMath {

    private VectorMath() {
        // prevent instantiation
    }

    /**
     * Cosine similarity in {@code [-1, 1]}; {@code 0} if either vector has zero norm.
     */
    static double cosine(final float[] a, final float[] b) {
        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            normA += (double) a[i] * a[i];
            normB += (double) b[i] * b[i];
        }
        if (normA == 0.0 || normB == 0.0) {
            return 0.0;
        }
        return dot / (Math.sqrt(normA) * Math.sqrt(normB));
    }
}
