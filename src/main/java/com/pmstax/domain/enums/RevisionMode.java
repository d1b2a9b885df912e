package com.pmstax.domain.enums;

/**
 * How a save is applied to the component's revision history.
 */
public enum RevisionMode {

    /** Patch the currently active revision in place. */
    UPDATE,

    /** Close the active revision and open a new one at a chosen effective date. */
    NEW_REVISION;

    /** Maps the screen's {@code mode} flag; only {@code "new"} selects a new revision. */
    public static RevisionMode fromFlag(String flag) {
        return "new".equalsIgnoreCase(flag == null ? null : flag.trim()) ? NEW_REVISION : UPDATE;
    }
}
