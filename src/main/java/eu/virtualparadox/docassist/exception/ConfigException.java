package eu.virtualparadox.docassist.exception;

/**
 * Invalid configuration, such as chunk/overlap parameters or mismatched vector dimensions. Fatal, never retried.
 */
public class ConfigException extends DocAssistException {

    public ConfigException(final String message) {
        super("CONFIG_ERROR", message);
    }

    public ConfigException(final String message, final Throwable cause) {
        super("CONFIG_ERROR", message, cause);
    }
}
