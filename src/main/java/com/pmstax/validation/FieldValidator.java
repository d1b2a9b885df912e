package com.pmstax.validation;

import com.pmstax.calculator.IndianNumberFormat;
import com.pmstax.domain.enums.FieldType;
import com.pmstax.domain.model.FieldMessage;
import com.pmstax.domain.model.TaxYear;
import com.pmstax.domain.model.ValidationContext;
import com.pmstax.rules.StatutoryLimits;
import com.pmstax.rules.StatutoryRuleTable;
import java.math.BigDecimal;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Classifies a field value as WARNING, INFO or NONE.
 *
 * <p>Checks run in order: plain amount bounds (negative, above the recommended
 * maximum), the HRA exemption breakdown for HRA fields, then the rule table's
 * field-specific limits. A warning from any step wins over an info.
 *
 * <p>Raw values starting with '=' are calculator expressions and are left to the
 * calculator; they validate as NONE until evaluated.
 */
@Component
public class FieldValidator {

    private final StatutoryRuleTable ruleTable;

    public FieldValidator(StatutoryRuleTable ruleTable) {
        this.ruleTable = ruleTable;
    }

    public FieldValidationResult validate(
            FieldType fieldType, String rawValue, ValidationContext context, TaxYear taxYear) {
        if (fieldType == null || fieldType.isFreeText() || rawValue == null) {
            return FieldValidationResult.none();
        }
        if (rawValue.trim().startsWith("=")) {
            return FieldValidationResult.none();
        }
        Optional<BigDecimal> parsed = IndianNumberFormat.parse(rawValue);
        return parsed.map(value -> validate(fieldType, value, context, taxYear))
                .orElse(FieldValidationResult.none());
    }

    public FieldValidationResult validate(
            FieldType fieldType, BigDecimal value, ValidationContext context, TaxYear taxYear) {
        if (fieldType == null || fieldType.isFreeText() || value == null) {
            return FieldValidationResult.none();
        }
        ValidationContext ctx = context != null ? context : ValidationContext.empty();
        StatutoryLimits limits = ruleTable.limitsFor(taxYear);

        if (value.signum() < 0) {
            return FieldValidationResult.warning("NEGATIVE_AMOUNT", "Amount cannot be negative");
        }
        BigDecimal maxLimit = ctx.getMaxLimit() != null ? ctx.getMaxLimit() : limits.getMaxSalaryComponent();
        if (value.compareTo(maxLimit) > 0) {
            return FieldValidationResult.warning(
                    "ABOVE_RECOMMENDED_LIMIT",
                    "Amount exceeds recommended limit of " + IndianNumberFormat.formatRupees(maxLimit));
        }

        FieldValidationResult info = FieldValidationResult.none();
        if (fieldType == FieldType.HRA) {
            info = hraInfo(value, ctx, limits);
        }

        Optional<FieldMessage> limitMessage = ruleTable.checkFieldLimit(fieldType, value, ctx, taxYear);
        if (limitMessage.isPresent()) {
            FieldMessage message = limitMessage.get();
            if (message.isWarning() || !info.isInfo()) {
                return FieldValidationResult.from(message);
            }
        }
        return info;
    }

    private FieldValidationResult hraInfo(BigDecimal hra, ValidationContext ctx, StatutoryLimits limits) {
        if (!isPositive(ctx.getBasic()) || !isPositive(ctx.getRentPaid()) || hra.signum() <= 0) {
            return FieldValidationResult.none();
        }
        HraExemption result =
                HraCalculator.calculate(hra, ctx.getBasic(), ctx.getDa(), ctx.getRentPaid(), ctx.getCity(), limits);
        if (result.isFullyExempt()) {
            return FieldValidationResult.info(
                    "HRA_FULLY_EXEMPT", "Fully exempt HRA: " + IndianNumberFormat.formatRupees(result.getExemption()));
        }
        return FieldValidationResult.info(
                "HRA_PARTIALLY_TAXABLE",
                "HRA exemption: " + IndianNumberFormat.formatRupees(result.getExemption()) + ", Taxable: "
                        + IndianNumberFormat.formatRupees(result.getTaxable()));
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
