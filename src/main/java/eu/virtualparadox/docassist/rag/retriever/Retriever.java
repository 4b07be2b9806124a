package eu.virtualparadox.docassist.rag.retriever;

import eu.virtualparadox.docassist.exception.EmbeddingException;
import eu.virtualparadox.docassist.rag.embed.EmbeddingGateway;
import eu.virtualparadox.docassist.rag.index.VectorIndex;
import eu.virtualparadox.docassist.rag.retriever.model.RetrievalResult;
import eu.virtualparadox.docassist.rag.retriever.model.ScoredChunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Semantic retrieval over a session's {@link VectorIndex}.
 * <p>
 * Steps:
 * <ol>
 *   <li>Embed the query using {@link EmbeddingGateway}</li>
 *   <li>Run a nearest-neighbour search on the index</li>
 * </ol>
 * Embedding failures propagate: an empty result here would silently degrade the answer.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class Retriever {

    public static final int DEFAULT_TOP_K = 4;

    private final EmbeddingGateway embeddingGateway;

    public RetrievalResult retrieve(final VectorIndex index, final String query) {
        return retrieve(index, query, DEFAULT_TOP_K);
    }

    /**
     * @param index the session index to search
     * @param query user input string
     * @param k     maximum number of results to return
     * @return hits ordered by descending similarity (never null)
     * @throws EmbeddingException if the query cannot be embedded
     */
    public RetrievalResult retrieve(final VectorIndex index, final String query, final int k) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("query must not be blank");
        }
        final float[] vector = embeddingGateway.embed(query);
        final RetrievalResult result = index.search(vector, k);
        printDebugRetrieved(query, result);
        return result;
    }

    private void printDebugRetrieved(final String query, final RetrievalResult result) {
        if (!log.isDebugEnabled()) {
            return;
        }
        final StringBuilder sb = new StringBuilder();
        for (final ScoredChunk hit : result.hits()) {
            sb.append(" - [").append(String.format("%.4f", hit.score())).append("] ")
                    .append(hit.chunk().chunkId()).append("\n");
        }
        log.debug("Retrieved {} chunks for '{}':\n{}", result.size(), query, sb);
    }
}
