package com.pmstax.domain.model;

import com.pmstax.domain.enums.ComponentKind;
import java.util.Objects;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Identifies one component record: employee, tax year and component kind. */
@Getter
@EqualsAndHashCode
public final class ComponentKey {

    private final String employeeId;
    private final TaxYear taxYear;
    private final ComponentKind kind;

    private ComponentKey(String employeeId, TaxYear taxYear, ComponentKind kind) {
        this.employeeId = employeeId;
        this.taxYear = taxYear;
        this.kind = kind;
    }

    public static ComponentKey of(String employeeId, TaxYear taxYear, ComponentKind kind) {
        if (employeeId == null || employeeId.isBlank()) {
            throw new IllegalArgumentException("employeeId is required");
        }
        return new ComponentKey(employeeId.trim(), Objects.requireNonNull(taxYear), Objects.requireNonNull(kind));
    }

    @Override
    public String toString() {
        return employeeId + "/" + taxYear + "/" + kind.getPathSegment();
    }
}
