package com.pmstax.api.dto.response;

import java.math.BigDecimal;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** The flat form of one component, with the load notice or error banner. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentFormResponse {

    private String employeeId;
    private String taxYear;
    private String kind;
    private String mode;
    private Map<String, Object> values;

    /** Running totals, e.g. total_salary or total_deductions, in display order. */
    private Map<String, BigDecimal> summary;

    private String notice;
    private String banner;
}
