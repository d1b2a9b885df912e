package com.pmstax.domain.enums;

/** Type of a flat-form value. */
public enum ValueKind {
    NUMBER,
    STRING,
    BOOLEAN
}
