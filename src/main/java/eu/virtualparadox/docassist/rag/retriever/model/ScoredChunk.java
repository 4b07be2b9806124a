package eu.virtualparadox.docassist.rag.retriever.model;

import eu.virtualparadox.docassist.ingest.model.Chunk;

/**
 * @param chunk the matched chunk
 * @param score cosine similarity between query and chunk vector (higher = better)
 */
public record ScoredChunk(Chunk chunk, double score) {

}
