package com.pmstax.calculator;

import lombok.Builder;
import lombok.Getter;

/**
 * Snapshot of a {@link CalculatorField} after handling one event.
 *
 * <p>{@code accepted} is false when the keystroke was refused and the buffer left
 * as it was; {@code error} then says why, unless the rejection is silent.
 */
@Getter
@Builder
public class InputOutcome {

    private final boolean accepted;
    private final CalculatorState state;
    private final String buffer;
    private final String error;
    private final String notice;

    public boolean hasError() {
        return error != null;
    }
}
