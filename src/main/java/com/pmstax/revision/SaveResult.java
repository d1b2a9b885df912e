package com.pmstax.revision;

import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * Outcome of a save. A failed save carries the user-facing banner text and, when the
 * persistence API rejected the data, its detail messages.
 */
@Getter
public class SaveResult {

    private final boolean saved;
    private final Map<String, Object> revision;
    private final String message;
    private final List<String> errors;

    private SaveResult(boolean saved, Map<String, Object> revision, String message, List<String> errors) {
        this.saved = saved;
        this.revision = revision;
        this.message = message;
        this.errors = errors;
    }

    public static SaveResult success(Map<String, Object> revision, String message) {
        return new SaveResult(true, revision != null ? revision : Map.of(), message, List.of());
    }

    public static SaveResult failed(String message, List<String> errors) {
        return new SaveResult(false, Map.of(), message, List.copyOf(errors));
    }

    public boolean isFailed() {
        return !saved;
    }
}
