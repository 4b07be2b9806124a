package eu.virtualparadox.docassist.agent.tool.calc;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Recursive-descent evaluator for a small arithmetic language.
 * <p>
 * Grammar:
 * <pre>
 * expression := term (('+' | '-') term)*
 * term       := unary (('*' | '/' | '%') unary)*
 * unary      := ('+' | '-') unary | power
 * power      := primary (('^' | '**') unary)?
 * primary    := number | constant | function '(' args ')' | '(' expression ')'
 * </pre>
 * Only whitelisted functions and constants are recognised; any other identifier or character
 * is rejected, so no input can reach anything outside arithmetic. Nesting of parentheses, signs,
 * exponents and function arguments is limited to {@value #MAX_DEPTH} levels.
 * <p>
 * Instances are single use and not thread-safe; use {@link #evaluate(String)}.
 */
public final class ExpressionParser {

    static final int MAX_DEPTH = 256;

    private record MathFunction(int minArgs, int maxArgs, Function<double[], Double> body) {
    }

    private static final Map<String, Double> CONSTANTS = Map.of(
            "pi", Math.PI,
            "e", Math.E);

    private static final Map<String, MathFunction> FUNCTIONS = Map.ofEntries(
            Map.entry("sqrt", unary(Math::sqrt)),
            Map.entry("sin", unary(Math::sin)),
            Map.entry("cos", unary(Math::cos)),
            Map.entry("tan", unary(Math::tan)),
            Map.entry("asin", unary(Math::asin)),
            Map.entry("acos", unary(Math::acos)),
            Map.entry("atan", unary(Math::atan)),
            Map.entry("log", new MathFunction(1, 2,
                    a -> a.length == 1 ? Math.log(a[0]) : Math.log(a[0]) / Math.log(a[1]))),
            Map.entry("log10", unary(Math::log10)),
            Map.entry("exp", unary(Math::exp)),
            Map.entry("abs", unary(Math::abs)),
            Map.entry("floor", unary(Math::floor)),
            Map.entry("ceil", unary(Math::ceil)),
            Map.entry("round", unary(Math::rint)),
            Map.entry("pow", new MathFunction(2, 2, a -> Math.pow(a[0], a[1]))),
            Map.entry("min", new MathFunction(1, Integer.MAX_VALUE, ExpressionParser::min)),
            Map.entry("max", new MathFunction(1, Integer.MAX_VALUE, ExpressionParser::max)));

    private final String source;
    private int pos;
    private int depth;

    private ExpressionParser(final String source) {
        this.source = source;
    }

    /**
     * Evaluates the expression.
     *
     * @param expression arithmetic expression, e.g. {@code sqrt(16) + 2^3}
     * @return the finite result
     * @throws CalculationException on syntax errors, unknown identifiers, division by zero or
     *                              a non-finite result
     */
    public static double evaluate(final String expression) {
        if (expression == null || expression.isBlank()) {
            throw new CalculationException("empty expression");
        }
        final ExpressionParser parser = new ExpressionParser(expression);
        final double value = parser.parseExpression();
        parser.skipWhitespace();
        if (!parser.atEnd()) {
            throw new CalculationException("unexpected '" + parser.peek() + "' at position " + parser.pos);
        }
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new CalculationException("math domain error");
        }
        return value;
    }

    private double parseExpression() {
        double value = parseTerm();
        while (true) {
            if (consume('+')) {
                value += parseTerm();
            } else if (consume('-')) {
                value -= parseTerm();
            } else {
                return value;
            }
        }
    }

    private double parseTerm() {
        double value = parseUnary();
        while (true) {
            if (consume('*')) {
                value *= parseUnary();
            } else if (consume('/')) {
                final double divisor = parseUnary();
                if (divisor == 0.0) {
                    throw new CalculationException("division by zero");
                }
                value /= divisor;
            } else if (consume('%')) {
                final double divisor = parseUnary();
                if (divisor == 0.0) {
                    throw new CalculationException("modulo by zero");
                }
                value %= divisor;
            } else {
                return value;
            }
        }
    }

    // every nested level (parenthesis, sign, exponent, argument) passes through here
    private double parseUnary() {
        if (++depth > MAX_DEPTH) {
            throw new CalculationException("expression nested too deeply");
        }
        try {
            if (consume('-')) {
                return -parseUnary();
            }
            if (consume('+')) {
                return parseUnary();
            }
            return parsePower();
        } finally {
            depth--;
        }
    }

    private double parsePower() {
        final double base = parsePrimary();
        skipWhitespace();
        if (lookingAt("**")) {
            pos += 2;
            return Math.pow(base, parseUnary());
        }
        if (consume('^')) {
            return Math.pow(base, parseUnary());
        }
        return base;
    }

    private double parsePrimary() {
        skipWhitespace();
        if (atEnd()) {
            throw new CalculationException("unexpected end of expression");
        }
        final char c = peek();
        if (c == '(') {
            pos++;
            final double value = parseExpression();
            expect(')');
            return value;
        }
        if (Character.isDigit(c) || c == '.') {
            return parseNumber();
        }
        if (Character.isLetter(c) || c == '_') {
            return parseIdentifier();
        }
        throw new CalculationException("unexpected '" + c + "' at position " + pos);
    }

    private double parseNumber() {
        final int start = pos;
        while (!atEnd() && (Character.isDigit(peek()) || peek() == '.')) {
            pos++;
        }
        // scientific notation only when an exponent digit follows, so "2e" stays 2 * e
        if (!atEnd() && (peek() == 'e' || peek() == 'E')) {
            int look = pos + 1;
            if (look < source.length() && (source.charAt(look) == '+' || source.charAt(look) == '-')) {
                look++;
            }
            if (look < source.length() && Character.isDigit(source.charAt(look))) {
                pos = look;
                while (!atEnd() && Character.isDigit(peek())) {
                    pos++;
                }
            }
        }
        final String literal = source.substring(start, pos);
        try {
            return Double.parseDouble(literal);
        } catch (final NumberFormatException e) {
            throw new CalculationException("invalid number '" + literal + "'");
        }
    }

    private double parseIdentifier() {
        final int start = pos;
        while (!atEnd() && (Character.isLetterOrDigit(peek()) || peek() == '_')) {
            pos++;
        }
        final String name = source.substring(start, pos).toLowerCase(Locale.ROOT);
        skipWhitespace();

        if (!atEnd() && peek() == '(') {
            final MathFunction function = FUNCTIONS.get(name);
            if (function == null) {
                throw new CalculationException("unknown function '" + name + "'");
            }
            pos++;
            final double[] args = parseArguments();
            if (args.length < function.minArgs() || args.length > function.maxArgs()) {
                throw new CalculationException("wrong number of arguments for '" + name + "'");
            }
            return function.body().apply(args);
        }

        final Double constant = CONSTANTS.get(name);
        if (constant == null) {
            throw new CalculationException("unknown name '" + name + "'");
        }
        return constant;
    }

    private double[] parseArguments() {
        final List<Double> args = new ArrayList<>();
        skipWhitespace();
        if (consume(')')) {
            return new double[0];
        }
        do {
            args.add(parseExpression());
        } while (consume(','));
        expect(')');

        final double[] result = new double[args.size()];
        for (int i = 0; i < result.length; i++) {
            result[i] = args.get(i);
        }
        return result;
    }

    private boolean consume(final char expected) {
        skipWhitespace();
        if (!atEnd() && peek() == expected) {
            if (expected == '*' && lookingAt("**")) {
                return false;
            }
            pos++;
            return true;
        }
        return false;
    }

    private void expect(final char expected) {
        if (!consume(expected)) {
            throw new CalculationException("expected '" + expected + "' at position " + pos);
        }
    }

    private boolean lookingAt(final String token) {
        skipWhitespace();
        return source.startsWith(token, pos);
    }

    private void skipWhitespace() {
        while (!atEnd() && Character.isWhitespace(peek())) {
            pos++;
        }
    }

    private boolean atEnd() {
        return pos >= source.length();
    }

    private char peek() {
        return source.charAt(pos);
    }

    private static MathFunction unary(final Function<Double, Double> body) {
        return new MathFunction(1, 1, a -> body.apply(a[0]));
    }

    private static double min(final double[] values) {
        double result = values[0];
        for (final double v : values) {
            result = Math.min(result, v);
        }
        return result;
    }

    private static double max(final double[] values) {
        double result = values[0];
        for (final double v : values) {
            result = Math.max(result, v);
        }
        return result;
    }
}
