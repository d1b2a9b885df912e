package com.pmstax.calculator;

/** Lifecycle of an amount field's input buffer. */
public enum CalculatorState {

    /** Plain numeric entry. */
    IDLE,

    /** The buffer starts with '=' and holds an unevaluated expression. */
    COMPOSING
}
