package eu.virtualparadox.docassist.exception;

/**
 * The reasoning loop could not complete because the model is unreachable.
 */
public class AgentException extends DocAssistException {

    public AgentException(final String message) {
        super("AGENT_ERROR", message);
    }

    public AgentException(final String message, final Throwable cause) {
        super("AGENT_ERROR", message, cause);
    }
}
