package eu.virtualparadox.docassist.rag.embed;

import eu.virtualparadox.docassist.exception.EmbeddingException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

/**
 * {@link EmbeddingGateway} backed by a Spring AI {@link EmbeddingModel}
 * (Bedrock Titan text embeddings in the default configuration).
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class SpringAiEmbeddingGateway implements EmbeddingGateway {

    private final EmbeddingModel embeddingModel;

    @Override
    public float[] embed(final String text) {
        if (text == null) {
            throw new IllegalArgumentException("text must not be null");
        }

        final float[] vector;
        try {
            vector = embeddingModel.embed(text);
        } catch (final RuntimeException e) {
            log.error("Embedding call failed for text of {} chars", text.length(), e);
            throw new EmbeddingException("Embedding model call failed: " + e.getMessage(), e);
        }

        if (vector == null || vector.length == 0) {
            throw new EmbeddingException("Embedding model returned an empty vector");
        }
        return vector;
    }
}
