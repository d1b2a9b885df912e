package com.pmstax.domain.enums;

import com.pmstax.exception.BusinessException;
import com.pmstax.exception.ErrorCode;
import java.util.Locale;
import lombok.Getter;

/**
 * The seven taxation sub-forms an employee's tax record is split into.
 *
 * <p>Each kind knows the path segment the persistence API uses for it and the key
 * under which its nested record travels in an update request. The two differ only
 * for salary ({@code salary} vs {@code salary_income}).
 */
@Getter
public enum ComponentKind {

    /** Basic pay, DA, HRA and the long tail of allowances. */
    SALARY("salary", "salary_income", "salary"),

    /** Accommodation, car, LTA, ESOP and the other Section 17(2) benefits. */
    PERQUISITES("perquisites", "perquisites", "perquisites"),

    /** Chapter VI-A deductions plus the HRA rent inputs. */
    DEDUCTIONS("deductions", "deductions", "deductions"),

    /** Interest, dividends, gifts and miscellaneous income. */
    OTHER_INCOME("other_income", "other_income", "other income"),

    /** Short and long term gains under Sections 111A and 112A. */
    CAPITAL_GAINS("capital_gains_income", "capital_gains_income", "capital gains"),

    /** Gratuity, leave encashment, pension, VRS. */
    RETIREMENT_BENEFITS("retirement_benefits", "retirement_benefits", "retirement benefits"),

    /** Self-occupied or let-out house property. */
    HOUSE_PROPERTY("house_property_income", "house_property_income", "house property");

    private final String pathSegment;
    private final String payloadKey;
    private final String label;

    ComponentKind(String pathSegment, String payloadKey, String label) {
        this.pathSegment = pathSegment;
        this.payloadKey = payloadKey;
        this.label = label;
    }

    /**
     * Resolves a kind from its path segment ("capital_gains_income"), its enum name
     * ("CAPITAL_GAINS") or the kebab form used in URLs ("capital-gains").
     */
    public static ComponentKind fromPathSegment(String value) {
        if (value == null || value.isBlank()) {
            throw new BusinessException(ErrorCode.BAD_REQUEST, "Component kind is required");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (ComponentKind kind : values()) {
            if (kind.pathSegment.equals(normalized) || kind.name().equalsIgnoreCase(normalized)) {
                return kind;
            }
        }
        throw new BusinessException(ErrorCode.BAD_REQUEST, "Unknown component kind: " + value);
    }
}
