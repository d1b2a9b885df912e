package com.pmstax.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.stereotype.Service;

/**
 * Micrometer counters for the tax component engine:
 * <ul>
 *   <li><b>tax.component.saves</b>: successful saves, tagged by component kind and mode</li>
 *   <li><b>tax.component.save.failures</b>: saves rejected by or failing at the persistence API</li>
 *   <li><b>tax.component.load.fallbacks</b>: loads that fell back to the default form</li>
 *   <li><b>calculator.expression.errors</b>: expressions that failed to evaluate</li>
 * </ul>
 */
@Service
public class TaxEngineMetrics {

    private final MeterRegistry meterRegistry;
    private final Counter expressionErrorCounter;

    public TaxEngineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.expressionErrorCounter = Counter.builder("calculator.expression.errors")
                .description("Calculator expressions that failed to evaluate")
                .register(meterRegistry);
    }

    public void recordSave(String kind, String mode) {
        Counter.builder("tax.component.saves")
                .description("Tax component saves accepted by the persistence API")
                .tags(Tags.of("kind", kind, "mode", mode))
                .register(meterRegistry)
                .increment();
    }

    public void recordSaveFailure(String kind) {
        Counter.builder("tax.component.save.failures")
                .description("Tax component saves that failed")
                .tag("kind", kind)
                .register(meterRegistry)
                .increment();
    }

    public void recordLoadFallback(String kind, String reason) {
        Counter.builder("tax.component.load.fallbacks")
                .description("Component loads that fell back to default values")
                .tags(Tags.of("kind", kind, "reason", reason))
                .register(meterRegistry)
                .increment();
    }

    public void recordExpressionError() {
        expressionErrorCounter.increment();
    }
}
