package eu.virtualparadox.docassist.exception;

/**
 * The embedding model could not be reached or returned an unusable vector.
 */
public class EmbeddingException extends DocAssistException {

    public EmbeddingException(final String message) {
        super("EMBEDDING_ERROR", message);
    }

    public EmbeddingException(final String message, final Throwable cause) {
        super("EMBEDDING_ERROR", message, cause);
    }
}
