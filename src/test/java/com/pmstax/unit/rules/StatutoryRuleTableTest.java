package com.pmstax.unit.rules;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.pmstax.domain.enums.AggregateGroup;
import com.pmstax.domain.enums.FieldType;
import com.pmstax.domain.enums.Severity;
import com.pmstax.domain.model.FieldMessage;
import com.pmstax.domain.model.TaxYear;
import com.pmstax.domain.model.ValidationContext;
import com.pmstax.rules.AggregateCheck;
import com.pmstax.rules.RuleTableProperties;
import com.pmstax.rules.StatutoryRuleTable;
import java.math.BigDecimal;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for StatutoryRuleTable.
 *
 * <p>Verifies: exact 80C ceiling behaviour, age and disability dependent ceilings,
 * field-type specific limits and per-year overrides.
 */
class StatutoryRuleTableTest {

    private static final TaxYear YEAR = TaxYear.of(2024);

    private final StatutoryRuleTable ruleTable = StatutoryRuleTable.withDefaults();

    private static ValidationContext section80c(String total, String current) {
        return ValidationContext.builder()
                .aggregateGroup(AggregateGroup.SECTION_80C)
                .currentTotal(new BigDecimal(total))
                .currentValue(new BigDecimal(current))
                .build();
    }

    @Nested
    @DisplayName("Section 80C")
    class Section80c {

        @Test
        void exactlyAtCeiling_noMessage() {
            Optional<FieldMessage> message = ruleTable.checkFieldLimit(
                    FieldType.SECTION_80C_COMPONENT, new BigDecimal("150000"), section80c("0", "0"), YEAR);

            assertThat(message).isEmpty();
        }

        @Test
        void oneRupeeOver_warnsWithExcess() {
            Optional<FieldMessage> message = ruleTable.checkFieldLimit(
                    FieldType.SECTION_80C_COMPONENT, new BigDecimal("150001"), section80c("0", "0"), YEAR);

            assertThat(message).hasValueSatisfying(m -> {
                assertThat(m.getSeverity()).isEqualTo(Severity.WARNING);
                assertThat(m.getMessage())
                        .isEqualTo("This exceeds Section 80C limit by ₹1. Excess amount will not be considered for deduction.");
            });
        }

        @Test
        void belowCeiling_reportsRemaining() {
            Optional<FieldMessage> message = ruleTable.checkFieldLimit(
                    FieldType.SECTION_80C_COMPONENT, new BigDecimal("100000"), section80c("0", "0"), YEAR);

            assertThat(message).hasValueSatisfying(m -> {
                assertThat(m.getSeverity()).isEqualTo(Severity.INFO);
                assertThat(m.getMessage()).isEqualTo("Remaining Section 80C limit: ₹50,000");
            });
        }

        @Test
        void projectsTotalReplacingCurrentValue() {
            // other fields hold 1,00,000; this field moves from 20,000 to 50,000
            Optional<FieldMessage> message = ruleTable.checkFieldLimit(
                    FieldType.SECTION_80C_COMPONENT, new BigDecimal("50000"), section80c("120000", "20000"), YEAR);

            assertThat(message).isEmpty();
        }

        @Test
        void zeroValue_isNotChecked() {
            assertThat(ruleTable.checkFieldLimit(
                            FieldType.SECTION_80C_COMPONENT, BigDecimal.ZERO, section80c("200000", "0"), YEAR))
                    .isEmpty();
        }
    }

    @Nested
    @DisplayName("Ceilings")
    class Ceilings {

        @Test
        void section80dParents_dependsOnParentsAge() {
            ValidationContext young = ValidationContext.builder().parentsAge(55).build();
            ValidationContext senior = ValidationContext.builder().parentsAge(60).build();

            assertThat(ruleTable.ceilingFor(AggregateGroup.SECTION_80D_PARENTS, young, YEAR))
                    .isEqualByComparingTo("25000");
            assertThat(ruleTable.ceilingFor(AggregateGroup.SECTION_80D_PARENTS, senior, YEAR))
                    .isEqualByComparingTo("50000");
        }

        @Test
        void section80dd_severeDisabilityRaisesCeiling() {
            ValidationContext severe = ValidationContext.builder().severeDisability(true).build();

            assertThat(ruleTable.ceilingFor(AggregateGroup.SECTION_80DD, ValidationContext.empty(), YEAR))
                    .isEqualByComparingTo("75000");
            assertThat(ruleTable.ceilingFor(AggregateGroup.SECTION_80DD, severe, YEAR))
                    .isEqualByComparingTo("125000");
        }

        @Test
        void ltcgExemption_usesCapitalGainsNote() {
            ValidationContext context = ValidationContext.builder()
                    .aggregateGroup(AggregateGroup.LTCG_112A_EXEMPTION)
                    .build();

            Optional<FieldMessage> message =
                    ruleTable.checkFieldLimit(FieldType.AMOUNT, new BigDecimal("130000"), context, YEAR);

            assertThat(message).hasValueSatisfying(m -> assertThat(m.getMessage())
                    .isEqualTo("This exceeds Section 112A exemption limit by ₹5,000. The excess is taxable as long term capital gain."));
        }

        @Test
        void checkAggregateLimit_sumsMembers() {
            AggregateCheck check = ruleTable.checkAggregateLimit(
                    AggregateGroup.SECTION_80D,
                    Map.of(
                            "self_family_premium", new BigDecimal("30000"),
                            "parent_premium", new BigDecimal("60000"),
                            "preventive_health_checkup", new BigDecimal("15000"),
                            "bonus", new BigDecimal("999999")),
                    ValidationContext.empty(),
                    YEAR);

            assertThat(check.getTotal()).isEqualByComparingTo("105000");
            assertThat(check.getCeiling()).isEqualByComparingTo("100000");
            assertThat(check.getExceededBy()).isEqualByComparingTo("5000");
            assertThat(check.getRemaining()).isEqualByComparingTo("0");
            assertThat(check.isExceeded()).isTrue();
        }
    }

    @Nested
    @DisplayName("Field type limits")
    class FieldTypeLimits {

        @Test
        void age_outOfRangeWarns() {
            assertThat(ruleTable.checkFieldLimit(FieldType.AGE, new BigDecimal("12"), null, YEAR))
                    .hasValueSatisfying(m -> assertThat(m.getMessage())
                            .isEqualTo("Age is outside typical range (18-100). Please verify if correct."));
        }

        @Test
        void age_seniorIsInfo() {
            assertThat(ruleTable.checkFieldLimit(FieldType.AGE, new BigDecimal("65"), null, YEAR))
                    .hasValueSatisfying(m -> {
                        assertThat(m.getSeverity()).isEqualTo(Severity.INFO);
                        assertThat(m.getMessage()).isEqualTo("Senior citizen benefits applicable (Age 65)");
                    });
        }

        @Test
        void age_superSeniorFromEighty() {
            assertThat(ruleTable.checkFieldLimit(FieldType.AGE, new BigDecimal("80"), null, YEAR))
                    .hasValueSatisfying(m -> {
                        assertThat(m.getSeverity()).isEqualTo(Severity.INFO);
                        assertThat(m.getMessage()).isEqualTo("Super senior citizen benefits applicable (Age 80)");
                    });
            assertThat(ruleTable.checkFieldLimit(FieldType.AGE, new BigDecimal("79"), null, YEAR))
                    .hasValueSatisfying(m -> assertThat(m.getMessage())
                            .isEqualTo("Senior citizen benefits applicable (Age 79)"));
        }

        @Test
        void ltaClaimedCount_aboveTwoWarns() {
            assertThat(ruleTable.checkFieldLimit(FieldType.LTA_CLAIMED_COUNT, new BigDecimal("3"), null, YEAR))
                    .hasValueSatisfying(m -> assertThat(m.getMessage())
                            .isEqualTo("LTA claimed 3 times exceeds limit of 2 times in 4 years. Excess claims may not be exempt."));
            assertThat(ruleTable.checkFieldLimit(FieldType.LTA_CLAIMED_COUNT, new BigDecimal("2"), null, YEAR))
                    .isEmpty();
        }

        @Test
        void months_aboveTwelveWarns() {
            assertThat(ruleTable.checkFieldLimit(FieldType.MONTHS, new BigDecimal("13"), null, YEAR))
                    .hasValueSatisfying(m -> assertThat(m.isWarning()).isTrue());
        }

        @Test
        void loanAmount_exemptUpToTwentyThousand() {
            assertThat(ruleTable.checkFieldLimit(FieldType.LOAN_AMOUNT, new BigDecimal("20000"), null, YEAR))
                    .hasValueSatisfying(m -> assertThat(m.getMessage()).isEqualTo("Loan amount is exempt from perquisite tax"));
            assertThat(ruleTable.checkFieldLimit(FieldType.LOAN_AMOUNT, new BigDecimal("20001"), null, YEAR))
                    .hasValueSatisfying(m -> assertThat(m.getCode()).isEqualTo("LOAN_TAXABLE"));
        }

        @Test
        void textFields_neverChecked() {
            assertThat(ruleTable.checkFieldLimit(FieldType.TEXT, new BigDecimal("1"), null, YEAR)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        void overriddenYearUsesConfiguredLimit() {
            RuleTableProperties properties = new RuleTableProperties();
            properties.getOverrides().put("2025-26", Map.of("section-80c-limit", new BigDecimal("200000")));
            StatutoryRuleTable table = new StatutoryRuleTable(properties);

            assertThat(table.limitsFor(TaxYear.of(2025)).getSection80cLimit()).isEqualByComparingTo("200000");
            assertThat(table.limitsFor(TaxYear.of(2024)).getSection80cLimit()).isEqualByComparingTo("150000");
        }

        @Test
        void integerLimitsCanBeOverridden() {
            RuleTableProperties properties = new RuleTableProperties();
            properties.getOverrides().put("2025-26", Map.of("lta-max-journeys", new BigDecimal("3")));

            StatutoryRuleTable table = new StatutoryRuleTable(properties);

            assertThat(table.limitsFor(TaxYear.of(2025)).getLtaMaxJourneys()).isEqualTo(3);
        }

        @Test
        void unknownKeyFailsAtStartup() {
            RuleTableProperties properties = new RuleTableProperties();
            properties.getOverrides().put("2025-26", Map.of("section-99z-limit", BigDecimal.ONE));

            assertThatThrownBy(() -> new StatutoryRuleTable(properties)).isInstanceOf(IllegalStateException.class);
        }

        @Test
        void limitsForReturnsPrivateCopy() {
            ruleTable.limitsFor(YEAR).setSection80cLimit(BigDecimal.ONE);

            assertThat(ruleTable.limitsFor(YEAR).getSection80cLimit()).isEqualByComparingTo("150000");
        }
    }
}
