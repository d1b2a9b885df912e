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
public class AggregateCheckResponse {

    private String group;
    private String label;
    private BigDecimal total;
    private BigDecimal ceiling;
    private BigDecimal exceededBy;
    private BigDecimal remaining;
    private boolean exceeded;
}
