package eu.virtualparadox.docassist.exception;

/**
 * The generation model failed (transport, auth, rate limit or an empty response).
 */
public class GatewayException extends DocAssistException {

    public GatewayException(final String message) {
        super("GATEWAY_ERROR", message);
    }

    public GatewayException(final String message, final Throwable cause) {
        super("GATEWAY_ERROR", message, cause);
    }
}
