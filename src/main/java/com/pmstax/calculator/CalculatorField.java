package com.pmstax.calculator;

import com.pmstax.domain.enums.FieldType;
import java.math.BigDecimal;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.Getter;

/**
 * Input buffer and calculator state for one editable field.
 *
 * <p>Typing '=' anywhere switches the field into {@link CalculatorState#COMPOSING}; the
 * buffer then holds the expression until blur evaluates it. A failed evaluation keeps
 * the expression and its error until the user changes the expression. Outside calculator
 * mode numeric fields accept only digits, grouping commas, dots and whitespace, and a
 * buffer that still does not read as a number on blur is flagged instead of committed.
 *
 * <p>Not thread-safe; one instance belongs to one edit session.
 */
public class CalculatorField {

    static final String INVALID_ARITHMETIC =
            "Invalid arithmetic without '=' prefix. Use = to start calculations (e.g., =10000*10)";
    static final String INVALID_NUMBER = "Please enter a valid number";

    private static final Pattern ARITHMETIC = Pattern.compile(".*[+\\-*/].*");
    private static final Pattern NUMERIC_INPUT = Pattern.compile("^[0-9,.\\s₹]*$");
    private static final Set<String> ZERO_DISPLAYS = Set.of("0", "₹0", "0.00", "₹0.00");

    @Getter
    private final String name;

    @Getter
    private final FieldType fieldType;

    @Getter
    private CalculatorState state = CalculatorState.IDLE;

    @Getter
    private String buffer;

    @Getter
    private String error;

    private int errorPosition;

    @Getter
    private String notice;

    public CalculatorField(String name, FieldType fieldType, String initialBuffer) {
        this.name = name;
        this.fieldType = fieldType;
        this.buffer = initialBuffer != null ? initialBuffer : "";
    }

    public InputOutcome onInput(String text) {
        String input = text != null ? text : "";
        int equalsAt = input.indexOf('=');
        if (equalsAt >= 0) {
            String expression = equalsAt == 0 ? input : "=" + input.substring(equalsAt + 1);
            for (int i = 1; i < expression.length(); i++) {
                if (!ExpressionEvaluator.isAllowedCharacter(expression.charAt(i))) {
                    setError(ExpressionEvaluator.INVALID_CHARACTERS, i - 1);
                    return snapshot(false);
                }
            }
            // an evaluation error stays until the expression changes
            if (state != CalculatorState.COMPOSING || !expression.equals(buffer)) {
                clearError();
            }
            buffer = expression;
            state = CalculatorState.COMPOSING;
            notice = null;
            return snapshot(true);
        }

        if (state == CalculatorState.COMPOSING) {
            state = CalculatorState.IDLE;
            clearError();
        }
        if (!fieldType.isFreeText()) {
            if (ARITHMETIC.matcher(input).matches()) {
                setError(INVALID_ARITHMETIC, 0);
                return snapshot(false);
            }
            if (!NUMERIC_INPUT.matcher(input).matches()) {
                return snapshot(false);
            }
        }
        buffer = input;
        clearError();
        return snapshot(true);
    }

    public InputOutcome onBlur() {
        if (state == CalculatorState.COMPOSING) {
            return evaluateNow();
        }
        if (!fieldType.isFreeText() && !buffer.isBlank()) {
            Optional<BigDecimal> value = IndianNumberFormat.parse(buffer);
            if (value.isEmpty()) {
                setError(INVALID_NUMBER, 0);
                return snapshot(false);
            }
            buffer = IndianNumberFormat.format(value.get());
        }
        return snapshot(true);
    }

    /** Evaluates a pending expression; a no-op outside calculator mode. */
    public InputOutcome evaluateNow() {
        if (state != CalculatorState.COMPOSING) {
            return snapshot(true);
        }
        String expression = buffer;
        try {
            BigDecimal result = ExpressionEvaluator.evaluate(expression);
            buffer = IndianNumberFormat.format(result);
            state = CalculatorState.IDLE;
            clearError();
            notice = "Calculated from: " + expression;
            return snapshot(true);
        } catch (ExpressionException e) {
            setError(e.getMessage(), e.getPosition());
            return snapshot(false);
        }
    }

    /** Clears a zero placeholder so an expression can be typed straight away. */
    public InputOutcome onFocus() {
        if (ZERO_DISPLAYS.contains(buffer.trim())) {
            buffer = "";
        }
        return snapshot(true);
    }

    /**
     * Numeric value to persist. Evaluates a pending expression first and fails if it
     * does not evaluate; an empty buffer is zero.
     */
    public BigDecimal resolveForSave() throws ExpressionException {
        if (state == CalculatorState.COMPOSING) {
            evaluateNow();
        }
        if (error != null && state == CalculatorState.COMPOSING) {
            throw new ExpressionException(error, errorPosition);
        }
        return IndianNumberFormat.parse(buffer).orElse(BigDecimal.ZERO);
    }

    public boolean isComposing() {
        return state == CalculatorState.COMPOSING;
    }

    private void setError(String message, int position) {
        this.error = message;
        this.errorPosition = position;
    }

    private void clearError() {
        this.error = null;
        this.errorPosition = 0;
    }

    private InputOutcome snapshot(boolean accepted) {
        return InputOutcome.builder()
                .accepted(accepted)
                .state(state)
                .buffer(buffer)
                .error(error)
                .notice(notice)
                .build();
    }
}
