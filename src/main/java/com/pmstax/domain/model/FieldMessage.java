package com.pmstax.domain.model;

import com.pmstax.domain.enums.Severity;
import lombok.Builder;
import lombok.Getter;

/**
 * A single advisory message produced for a field.
 *
 * <p>The code is machine-readable (e.g. "SECTION_80C_EXCEEDED"), the message is what
 * the user sees next to the input.
 */
@Getter
@Builder
public class FieldMessage {

    private final String code;
    private final Severity severity;
    private final String message;

    public static FieldMessage warning(String code, String message) {
        return FieldMessage.builder().code(code).severity(Severity.WARNING).message(message).build();
    }

    public static FieldMessage info(String code, String message) {
        return FieldMessage.builder().code(code).severity(Severity.INFO).message(message).build();
    }

    public boolean isWarning() {
        return severity == Severity.WARNING;
    }

    @Override
    public String toString() {
        return severity + " " + code + ": " + message;
    }
}
