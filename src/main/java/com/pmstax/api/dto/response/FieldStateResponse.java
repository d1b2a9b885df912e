package com.pmstax.api.dto.response;

import com.pmstax.calculator.CalculatorState;
import com.pmstax.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldStateResponse {

    private String field;
    private Object value;
    private String buffer;
    private CalculatorState state;
    private boolean accepted;
    private Severity severity;
    private String message;
    private String error;
    private String notice;
}
