package com.pmstax.domain.model;

import com.pmstax.domain.enums.AggregateGroup;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/**
 * Everything a field check may need beyond the value itself. All members are
 * optional; missing amounts count as zero and a missing age as "not senior".
 */
@Getter
@Builder(toBuilder = true)
public class ValidationContext {

    /** Sum of the field's aggregate group as currently held in the form, this field included. */
    @Builder.Default
    private final BigDecimal currentTotal = BigDecimal.ZERO;

    /** This field's value as currently held in the form. */
    @Builder.Default
    private final BigDecimal currentValue = BigDecimal.ZERO;

    private final AggregateGroup aggregateGroup;
    private final Integer employeeAge;
    private final Integer parentsAge;
    private final BigDecimal basic;
    private final BigDecimal da;
    private final BigDecimal rentPaid;
    private final String city;
    private final boolean severeDisability;

    /** Upper bound for the plain amount check; null means the tax year's salary-component cap. */
    private final BigDecimal maxLimit;

    public static ValidationContext empty() {
        return ValidationContext.builder().build();
    }
}
