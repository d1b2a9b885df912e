package com.pmstax.unit.validation;

import static org.assertj.core.api.Assertions.assertThat;

import com.pmstax.domain.enums.AggregateGroup;
import com.pmstax.domain.enums.FieldType;
import com.pmstax.domain.enums.Severity;
import com.pmstax.domain.model.TaxYear;
import com.pmstax.domain.model.ValidationContext;
import com.pmstax.rules.StatutoryRuleTable;
import com.pmstax.validation.FieldValidationResult;
import com.pmstax.validation.FieldValidator;
import java.math.BigDecimal;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for FieldValidator.
 *
 * <p>Verifies: amount bounds, HRA exemption info, rule table delegation and that
 * free text or pending expressions are never validated.
 */
class FieldValidatorTest {

    private static final TaxYear YEAR = TaxYear.of(2024);

    private final FieldValidator validator = new FieldValidator(StatutoryRuleTable.withDefaults());

    @Test
    void negativeAmount_warns() {
        FieldValidationResult result =
                validator.validate(FieldType.AMOUNT, new BigDecimal("-1"), ValidationContext.empty(), YEAR);

        assertThat(result.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(result.getMessage()).isEqualTo("Amount cannot be negative");
    }

    @Test
    void aboveRecommendedLimit_warns() {
        ValidationContext context = ValidationContext.builder().maxLimit(new BigDecimal("500000")).build();

        FieldValidationResult result = validator.validate(FieldType.AMOUNT, new BigDecimal("500001"), context, YEAR);

        assertThat(result.getMessage()).isEqualTo("Amount exceeds recommended limit of ₹5,00,000");
    }

    @Test
    void plainAmount_hasNoMessage() {
        FieldValidationResult result =
                validator.validate(FieldType.AMOUNT, new BigDecimal("50000"), ValidationContext.empty(), YEAR);

        assertThat(result.getSeverity()).isEqualTo(Severity.NONE);
    }

    @Test
    void hra_fullyExemptInMetro() {
        ValidationContext context = ValidationContext.builder()
                .basic(new BigDecimal("40000"))
                .da(BigDecimal.ZERO)
                .rentPaid(new BigDecimal("25000"))
                .city("metro")
                .build();

        FieldValidationResult result = validator.validate(FieldType.HRA, new BigDecimal("20000"), context, YEAR);

        assertThat(result.getSeverity()).isEqualTo(Severity.INFO);
        assertThat(result.getMessage()).isEqualTo("Fully exempt HRA: ₹20,000");
    }

    @Test
    void hra_partlyTaxableOutsideMetro() {
        ValidationContext context = ValidationContext.builder()
                .basic(new BigDecimal("40000"))
                .rentPaid(new BigDecimal("25000"))
                .city("non_metro")
                .build();

        FieldValidationResult result = validator.validate(FieldType.HRA, new BigDecimal("20000"), context, YEAR);

        assertThat(result.getMessage()).isEqualTo("HRA exemption: ₹16,000, Taxable: ₹4,000");
    }

    @Test
    void hra_withoutRent_hasNoMessage() {
        ValidationContext context = ValidationContext.builder().basic(new BigDecimal("40000")).build();

        assertThat(validator.validate(FieldType.HRA, new BigDecimal("20000"), context, YEAR).getSeverity())
                .isEqualTo(Severity.NONE);
    }

    @Test
    void rawExpression_isNotValidated() {
        FieldValidationResult result =
                validator.validate(FieldType.AMOUNT, "=-500", ValidationContext.empty(), YEAR);

        assertThat(result.getSeverity()).isEqualTo(Severity.NONE);
    }

    @Test
    void rawFormattedAmount_isParsed() {
        ValidationContext context = ValidationContext.builder()
                .aggregateGroup(AggregateGroup.SECTION_80C)
                .build();

        FieldValidationResult result =
                validator.validate(FieldType.SECTION_80C_COMPONENT, "₹1,50,001", context, YEAR);

        assertThat(result.isWarning()).isTrue();
        assertThat(result.getMessage()).startsWith("This exceeds Section 80C limit by ₹1.");
    }

    @Test
    void textField_isNeverValidated() {
        assertThat(validator.validate(FieldType.TEXT, "-100", ValidationContext.empty(), YEAR).getSeverity())
                .isEqualTo(Severity.NONE);
    }

    @Test
    void ruleTableWarning_winsOverHraInfo() {
        ValidationContext context = ValidationContext.builder()
                .aggregateGroup(AggregateGroup.SECTION_80TTA)
                .basic(new BigDecimal("40000"))
                .rentPaid(new BigDecimal("25000"))
                .city("metro")
                .build();

        FieldValidationResult result = validator.validate(FieldType.HRA, new BigDecimal("20000"), context, YEAR);

        assertThat(result.isWarning()).isTrue();
        assertThat(result.getMessage()).startsWith("This exceeds Section 80TTA limit by ₹10,000.");
    }
}
