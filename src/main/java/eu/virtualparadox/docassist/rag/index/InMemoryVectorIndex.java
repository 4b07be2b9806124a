package eu.virtualparadox.docassist.rag.index;

import eu.virtualparadox.docassist.rag.retriever.model.RetrievalResult;
import eu.virtualparadox.docassist.rag.retriever.model.ScoredChunk;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Exact, brute-force cosine index held in memory.
 * <p>
 * Search scores every entry and sorts with a stable comparator, so equal scores keep their
 * insertion order. Linear in the number of entries, which is fine for the size of a single
 * uploaded document.
 */
public final class InMemoryVectorIndex implements VectorIndex {

    private final List<IndexEntry> entries = new ArrayList<>();
    private final DimensionGuard dimensionGuard = new DimensionGuard();

    @Override
    public void add(final List<IndexEntry> newEntries) {
        Objects.requireNonNull(newEntries, "entries must not be null");
        // validate everything first so a bad batch leaves the index untouched
        for (final IndexEntry entry : newEntries) {
            Objects.requireNonNull(entry, "entries must not contain null elements");
            dimensionGuard.accept(entry.vector());
        }
        entries.addAll(newEntries);
    }

    @Override
    public RetrievalResult search(final float[] queryVector, final int k) {
        Objects.requireNonNull(queryVector, "queryVector must not be null");
        if (k <= 0) {
            throw new IllegalArgumentException("k must be positive, was " + k);
        }
        if (entries.isEmpty()) {
            return RetrievalResult.empty();
        }
        dimensionGuard.checkQuery(queryVector);

        final List<ScoredChunk> scored = new ArrayList<>(entries.size());
        for (final IndexEntry entry : entries) {
            scored.add(new ScoredChunk(entry.chunk(), VectorMath.cosine(queryVector, entry.vector())));
        }
        // List.sort is stable: ties stay in insertion order
        scored.sort(Comparator.comparingDouble(ScoredChunk::score).reversed());

        return new RetrievalResult(scored.subList(0, Math.min(k, scored.size())));
    }

    @Override
    public void clear() {
        entries.clear();
        dimensionGuard.reset();
    }

    @Override
    public int size() {
        return entries.size();
    }
}
