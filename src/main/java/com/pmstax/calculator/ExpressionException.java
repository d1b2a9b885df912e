package com.pmstax.calculator;

import lombok.Getter;

/**
 * A calculator expression could not be evaluated. The message is user-facing and
 * is shown under the field until the user edits the expression.
 */
@Getter
public class ExpressionException extends Exception {

    /** Zero-based offset into the expression text (after the '=') where parsing stopped. */
    private final int position;

    public ExpressionException(String message, int position) {
        super(message);
        this.position = position;
    }
}
