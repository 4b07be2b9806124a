package eu.virtualparadox.docassist.exception;

/**
 * No session is registered under the requested id.
 */
public class SessionNotFoundException extends DocAssistException {

    public SessionNotFoundException(final String message) {
        super("SESSION_NOT_FOUND", message);
    }

    public SessionNotFoundException(final String message, final Throwable cause) {
        super("SESSION_NOT_FOUND", message, cause);
    }
}
