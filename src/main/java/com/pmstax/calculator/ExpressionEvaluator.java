package com.pmstax.calculator;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Evaluates the calculator mini-language typed after '=' in amount fields.
 *
 * <p>Grammar (whitespace ignored anywhere between tokens):
 * <pre>
 * expr   := term (('+' | '-') term)*
 * term   := factor (('*' | '/') factor)*
 * factor := ('+' | '-') factor | number | '(' expr ')'
 * number := digits with optional ',' grouping and at most one '.'
 * </pre>
 *
 * <p>Arithmetic is done in {@link BigDecimal} with {@link MathContext#DECIMAL64}; the result
 * is rounded half-up to two places with trailing zeros removed. Nothing other than the
 * grammar above is ever evaluated.
 */
public final class ExpressionEvaluator {

    static final String INVALID_CHARACTERS =
            "Invalid characters in expression. Only numbers and +, -, *, /, () are allowed.";

    private final String text;
    private int pos;

    private ExpressionEvaluator(String text) {
        this.text = text;
    }

    /**
     * Evaluates an expression. A leading '=' is tolerated so callers can pass the raw
     * field buffer.
     */
    public static BigDecimal evaluate(String expression) throws ExpressionException {
        String body = expression == null ? "" : expression;
        if (body.startsWith("=")) {
            body = body.substring(1);
        }
        precheck(body);
        ExpressionEvaluator parser = new ExpressionEvaluator(body);
        BigDecimal result = parser.parseExpression();
        parser.skipWhitespace();
        if (parser.pos < body.length()) {
            if (body.charAt(parser.pos) == ')') {
                throw new ExpressionException("Unmatched closing parenthesis", parser.pos);
            }
            throw new ExpressionException("Invalid mathematical expression.", parser.pos);
        }
        BigDecimal rounded = result.setScale(2, RoundingMode.HALF_UP).stripTrailingZeros();
        return rounded.scale() < 0 ? rounded.setScale(0) : rounded;
    }

    /** Whether a character may appear inside an expression at all. */
    public static boolean isAllowedCharacter(char c) {
        return Character.isDigit(c)
                || c == '.'
                || c == ','
                || c == '+'
                || c == '-'
                || c == '*'
                || c == '/'
                || c == '('
                || c == ')'
                || Character.isWhitespace(c);
    }

    private static void precheck(String body) throws ExpressionException {
        if (body.isBlank()) {
            throw new ExpressionException("Empty expression after =", 0);
        }
        for (int i = 0; i < body.length(); i++) {
            if (!isAllowedCharacter(body.charAt(i))) {
                throw new ExpressionException(INVALID_CHARACTERS, i);
            }
        }
        if (body.contains("**")) {
            throw new ExpressionException("Use * for multiplication, not **", body.indexOf("**"));
        }
        if (body.contains("//")) {
            throw new ExpressionException("Use / for division, not //", body.indexOf("//"));
        }
        int depth = 0;
        for (int i = 0; i < body.length(); i++) {
            char c = body.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
                if (depth < 0) {
                    throw new ExpressionException("Unmatched closing parenthesis", i);
                }
            }
        }
        if (depth > 0) {
            throw new ExpressionException("Unmatched opening parenthesis", body.lastIndexOf('('));
        }
    }

    private BigDecimal parseExpression() throws ExpressionException {
        BigDecimal value = parseTerm();
        while (true) {
            skipWhitespace();
            if (consume('+')) {
                value = value.add(parseTerm(), MathContext.DECIMAL64);
            } else if (consume('-')) {
                value = value.subtract(parseTerm(), MathContext.DECIMAL64);
            } else {
                return value;
            }
        }
    }

    private BigDecimal parseTerm() throws ExpressionException {
        BigDecimal value = parseFactor();
        while (true) {
            skipWhitespace();
            if (consume('*')) {
                value = value.multiply(parseFactor(), MathContext.DECIMAL64);
            } else if (consume('/')) {
                int divisorAt = pos;
                BigDecimal divisor = parseFactor();
                if (divisor.signum() == 0) {
                    throw new ExpressionException("Division by zero is not allowed.", divisorAt);
                }
                value = value.divide(divisor, MathContext.DECIMAL64);
            } else {
                return value;
            }
        }
    }

    private BigDecimal parseFactor() throws ExpressionException {
        skipWhitespace();
        if (consume('+')) {
            return parseFactor();
        }
        if (consume('-')) {
            return parseFactor().negate();
        }
        if (consume('(')) {
            BigDecimal inner = parseExpression();
            skipWhitespace();
            if (!consume(')')) {
                throw new ExpressionException("Unmatched opening parenthesis", pos);
            }
            return inner;
        }
        return parseNumber();
    }

    private BigDecimal parseNumber() throws ExpressionException {
        int start = pos;
        if (pos >= text.length() || !(Character.isDigit(text.charAt(pos)) || text.charAt(pos) == '.')) {
            throw new ExpressionException("Invalid mathematical expression.", pos);
        }
        StringBuilder digits = new StringBuilder();
        int dots = 0;
        while (pos < text.length()) {
            char c = text.charAt(pos);
            if (Character.isDigit(c)) {
                digits.append(c);
            } else if (c == '.') {
                dots++;
                digits.append(c);
            } else if (c != ',') {
                break;
            }
            pos++;
        }
        if (dots > 1 || digits.toString().equals(".")) {
            throw new ExpressionException("Invalid number: " + text.substring(start, pos).trim(), start);
        }
        return new BigDecimal(digits.toString());
    }

    private boolean consume(char expected) {
        if (pos < text.length() && text.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void skipWhitespace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }
}
