package eu.virtualparadox.docassist.agent.tool.calc;

/**
 * Raised when an arithmetic expression cannot be parsed or evaluated.
 */
public class CalculationException extends RuntimeException {

    public CalculationException(final String message) {
        super(message);
    }
}
