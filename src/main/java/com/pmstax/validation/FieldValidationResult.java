package com.pmstax.validation;

import com.pmstax.domain.enums.Severity;
import com.pmstax.domain.model.FieldMessage;
import lombok.Getter;

/**
 * Advisory outcome of validating one field value. Never an error: saves proceed
 * whatever the severity.
 */
@Getter
public class FieldValidationResult {

    private static final FieldValidationResult NONE = new FieldValidationResult(Severity.NONE, null, "");

    private final Severity severity;
    private final String code;
    private final String message;

    private FieldValidationResult(Severity severity, String code, String message) {
        this.severity = severity;
        this.code = code;
        this.message = message;
    }

    public static FieldValidationResult none() {
        return NONE;
    }

    public static FieldValidationResult warning(String code, String message) {
        return new FieldValidationResult(Severity.WARNING, code, message);
    }

    public static FieldValidationResult info(String code, String message) {
        return new FieldValidationResult(Severity.INFO, code, message);
    }

    public static FieldValidationResult from(FieldMessage message) {
        return new FieldValidationResult(message.getSeverity(), message.getCode(), message.getMessage());
    }

    public boolean isWarning() {
        return severity == Severity.WARNING;
    }

    public boolean isInfo() {
        return severity == Severity.INFO;
    }
}
