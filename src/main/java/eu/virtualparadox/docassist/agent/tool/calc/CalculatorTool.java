package eu.virtualparadox.docassist.agent.tool.calc;

import eu.virtualparadox.docassist.agent.tool.AbstractTool;
import org.springframework.stereotype.Component;

/**
 * Evaluates arithmetic expressions with {@link ExpressionParser}.
 */
@Component
public class CalculatorTool extends AbstractTool {

    public static final String NAME = "calculator";

    private static final String DESCRIPTION = "Useful for performing mathematical calculations. "
            + "Input should be a mathematical expression like '2+2' or 'sqrt(16)' or '10*5/2'";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public String description() {
        return DESCRIPTION;
    }

    @Override
    protected String execute(final String input) {
        final String expression = input.trim();
        final double result = ExpressionParser.evaluate(expression);
        return "The result of " + expression + " is: " + format(result);
    }

    @Override
    protected String describeFailure(final Exception e) {
        return "Error in calculation: " + messageOf(e) + ". Please check your mathematical expression.";
    }

    /**
     * Integral values print without a fractional part, e.g. {@code 4} rather than {@code 4.0}.
     */
    static String format(final double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }
}
