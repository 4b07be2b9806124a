package eu.virtualparadox.docassist.exception;

/**
 * Root of the application's unchecked exception hierarchy.
 * <p>Every subtype carries a stable machine-readable {@code code} that the REST layer
 * reports back to callers next to the human-readable message.</p>
 */
public class DocAssistException extends RuntimeException {

    private final String code;

    public DocAssistException(final String code, final String message) {
        super(message);
        this.code = code;
    }

    public DocAssistException(final String code, final String message, final Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
