package com.pmstax.api.controller;

import com.pmstax.api.dto.request.EvaluateExpressionRequest;
import com.pmstax.api.dto.response.ExpressionResultResponse;
import com.pmstax.calculator.ExpressionEvaluator;
import com.pmstax.calculator.ExpressionException;
import com.pmstax.calculator.IndianNumberFormat;
import com.pmstax.observability.TaxEngineMetrics;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** Stateless arithmetic evaluation for amount fields. */
@RestController
@RequestMapping("/api/calculator")
public class CalculatorController {

    private final TaxEngineMetrics metrics;

    public CalculatorController(TaxEngineMetrics metrics) {
        this.metrics = metrics;
    }

    @PostMapping("/evaluate")
    public ExpressionResultResponse evaluate(@Valid @RequestBody EvaluateExpressionRequest request)
            throws ExpressionException {
        BigDecimal value;
        try {
            value = ExpressionEvaluator.evaluate(request.getExpression());
        } catch (ExpressionException e) {
            metrics.recordExpressionError();
            throw e;
        }
        return ExpressionResultResponse.builder()
                .expression(request.getExpression())
                .value(value)
                .formatted(IndianNumberFormat.format(value))
                .build();
    }
}
