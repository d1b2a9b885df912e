package com.pmstax.exception;

import java.util.Map;

/**
 * Raised before any persistence call when a save cannot be attempted, e.g. a new
 * revision without an effective-from date.
 */
public class RevisionValidationException extends BaseException {

    public RevisionValidationException(String message, String field) {
        super(ErrorCode.VALIDATION_ERROR, message, Map.of("field", field));
    }
}
