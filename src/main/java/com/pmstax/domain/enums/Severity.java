package com.pmstax.domain.enums;

/**
 * Outcome class of a field check. There is deliberately no error level: field
 * messages are advisory and never block a save.
 */
public enum Severity {

    /** The value looks wrong or breaches a statutory ceiling. */
    WARNING,

    /** Helpful context, e.g. remaining headroom under a section limit. */
    INFO,

    /** Nothing to report. */
    NONE
}
