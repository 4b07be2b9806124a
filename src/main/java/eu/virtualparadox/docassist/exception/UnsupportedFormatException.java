package eu.virtualparadox.docassist.exception;

/**
 * Raised by the document loaders when the declared type is not one of the supported formats.
 */
public class UnsupportedFormatException extends DocAssistException {

    public UnsupportedFormatException(final String message) {
        super("UNSUPPORTED_FORMAT", message);
    }

    public UnsupportedFormatException(final String message, final Throwable cause) {
        super("UNSUPPORTED_FORMAT", message, cause);
    }
}
