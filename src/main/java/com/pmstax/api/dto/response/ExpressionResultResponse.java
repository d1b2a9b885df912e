package com.pmstax.api.dto.response;

import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExpressionResultResponse {

    private String expression;
    private BigDecimal value;

    /** Value in Indian grouping, e.g. "1,05,000". */
    private String formatted;
}
