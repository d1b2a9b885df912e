package com.pmstax.api.dto.request;

import com.pmstax.domain.enums.AggregateGroup;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Values of a group's member fields, checked against the group's ceiling. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AggregateCheckRequest {

    @NotNull
    private AggregateGroup group;

    @NotNull
    private Map<String, BigDecimal> values;

    private Integer employeeAge;

    private Integer parentsAge;

    private boolean severeDisability;
}
