package com.pmstax.session;

import com.pmstax.calculator.CalculatorState;
import com.pmstax.domain.enums.Severity;
import lombok.Builder;
import lombok.Getter;

/** What the host renders for one field after an edit event. */
@Getter
@Builder
public class FieldState {

    private final String field;

    /** Committed form value: a BigDecimal, String or Boolean. */
    private final Object value;

    /** Raw input text, possibly a pending expression. */
    private final String buffer;

    private final CalculatorState state;
    private final boolean accepted;

    @Builder.Default
    private final Severity severity = Severity.NONE;

    private final String message;

    /** Calculator error; blocks saving this field's pending expression. */
    private final String error;

    private final String notice;
}
