package com.pmstax.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EvaluateExpressionRequest {

    /** Arithmetic expression, with or without the leading '='. */
    @NotBlank
    private String expression;
}
