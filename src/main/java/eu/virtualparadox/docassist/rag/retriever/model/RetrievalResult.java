package eu.virtualparadox.docassist.rag.retriever.model;

import eu.virtualparadox.docassist.ingest.model.Chunk;

import java.util.List;

/**
 * Ordered search hits: descending similarity, ties in insertion order.
 */
public record RetrievalResult(List<ScoredChunk> hits) {

    public RetrievalResult {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }

    public static RetrievalResult empty() {
        return new RetrievalResult(List.of());
    }

    public int size() {
        return hits.size();
    }

    public boolean isEmpty() {
        return hits.isEmpty();
    }

    public List<Chunk> chunks() {
        return hits.stream().map(ScoredChunk::chunk).toList();
    }
}
