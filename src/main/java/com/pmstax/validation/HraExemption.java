package com.pmstax.validation;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/** Breakdown of a Section 10(13A) HRA exemption calculation. */
@Getter
@Builder
public class HraExemption {

    private final BigDecimal hraReceived;
    private final BigDecimal salary;
    private final boolean metro;
    private final BigDecimal cityLimit;
    private final BigDecimal rentLimit;
    private final BigDecimal exemption;
    private final BigDecimal taxable;

    public boolean isFullyExempt() {
        return taxable.signum() == 0;
    }
}
