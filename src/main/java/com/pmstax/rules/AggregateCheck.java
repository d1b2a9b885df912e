package com.pmstax.rules;

import com.pmstax.domain.enums.AggregateGroup;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Getter;

/** Sum of an aggregate group measured against its ceiling. */
@Getter
@Builder
public class AggregateCheck {

    private final AggregateGroup group;
    private final BigDecimal total;
    private final BigDecimal ceiling;

    /** {@code max(0, total - ceiling)}. */
    private final BigDecimal exceededBy;

    /** {@code max(0, ceiling - total)}. */
    private final BigDecimal remaining;

    public boolean isExceeded() {
        return exceededBy.signum() > 0;
    }
}
