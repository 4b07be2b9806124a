package eu.virtualparadox.docassist.exception;

/**
 * An operation was invoked before its prerequisite state, e.g. asking before a document is indexed.
 */
public class NotReadyException extends DocAssistException {

    public NotReadyException(final String message) {
        super("NOT_READY", message);
    }

    public NotReadyException(final String message, final Throwable cause) {
        super("NOT_READY", message, cause);
    }
}
