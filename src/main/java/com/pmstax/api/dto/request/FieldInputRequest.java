package com.pmstax.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import java.math.BigDecimal;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One field edit: the raw text as typed (a number, a formatted amount or an
 * {@code =} expression) plus the rest of the form as the client holds it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldInputRequest {

    @NotBlank
    private String field;

    private String value;

    /** Current values of the other fields; aggregate totals are computed from these. */
    private Map<String, Object> values;

    private Integer employeeAge;

    private Integer parentsAge;

    /** Rent paid, for the HRA exemption breakdown on salary forms. */
    private BigDecimal rentPaid;
}
