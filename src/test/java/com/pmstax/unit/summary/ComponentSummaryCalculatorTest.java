package com.pmstax.unit.summary;

import static org.assertj.core.api.Assertions.assertThat;

import com.pmstax.domain.enums.ComponentKind;
import com.pmstax.domain.model.FlatForm;
import com.pmstax.rules.StatutoryLimits;
import com.pmstax.summary.ComponentSummaryCalculator;
import com.pmstax.transform.ComponentSchemas;
import java.math.BigDecimal;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ComponentSummaryCalculator.
 *
 * <p>Verifies: the totals of each component kind, the statutory caps applied to them
 * and the age dependent ceilings of the deductions summary.
 */
class ComponentSummaryCalculatorTest {

    private final StatutoryLimits limits = StatutoryLimits.defaults();

    /** Schema defaults with the given name/value pairs on top; numbers given as strings. */
    private static FlatForm form(ComponentKind kind, Object... pairs) {
        FlatForm form = ComponentSchemas.forKind(kind).defaults();
        for (int i = 0; i < pairs.length; i += 2) {
            Object value = pairs[i + 1];
            form.put((String) pairs[i], value instanceof String text && !text.isEmpty() && Character.isDigit(text.charAt(0))
                    ? new BigDecimal(text)
                    : value);
        }
        return form;
    }

    private Map<String, BigDecimal> summarize(ComponentKind kind, FlatForm form) {
        return ComponentSummaryCalculator.summarize(kind, form, limits, null, null);
    }

    @Nested
    @DisplayName("Salary")
    class Salary {

        @Test
        void totalsAllowancesAndAppliesStandardDeduction() {
            FlatForm salary = form(ComponentKind.SALARY,
                    "basic_salary", "50000",
                    "hra_provided", "20000",
                    "special_allowance", "10000",
                    "bonus", "5000");

            Map<String, BigDecimal> summary = summarize(ComponentKind.SALARY, salary);

            assertThat(summary).containsOnlyKeys("total_allowances", "total_salary", "standard_deduction", "net_salary");
            assertThat(summary.get("total_allowances")).isEqualByComparingTo("35000");
            assertThat(summary.get("total_salary")).isEqualByComparingTo("85000");
            assertThat(summary.get("standard_deduction")).isEqualByComparingTo("75000");
            assertThat(summary.get("net_salary")).isEqualByComparingTo("10000");
        }

        @Test
        void standardDeductionNeverExceedsSalary() {
            Map<String, BigDecimal> summary =
                    summarize(ComponentKind.SALARY, form(ComponentKind.SALARY, "basic_salary", "60000"));

            assertThat(summary.get("standard_deduction")).isEqualByComparingTo("60000");
            assertThat(summary.get("net_salary")).isEqualByComparingTo("0");
        }

        @Test
        void standardDeductionFollowsYearLimits() {
            StatutoryLimits older = limits.toBuilder().standardDeductionNewRegime(new BigDecimal("50000")).build();

            Map<String, BigDecimal> summary = ComponentSummaryCalculator.summarize(
                    ComponentKind.SALARY, form(ComponentKind.SALARY, "basic_salary", "90000"), older, null, null);

            assertThat(summary.get("net_salary")).isEqualByComparingTo("40000");
        }
    }

    @Nested
    @DisplayName("Capital gains")
    class CapitalGains {

        @Test
        void splitsShortAndLongTermWithTaxEstimates() {
            FlatForm gains = form(ComponentKind.CAPITAL_GAINS,
                    "stcg_111a_equity_stt", "100000",
                    "stcg_other_assets", "20000",
                    "ltcg_112a_equity_stt", "200000",
                    "ltcg_other_assets", "50000",
                    "ltcg_debt_mf", "10000");

            Map<String, BigDecimal> summary = summarize(ComponentKind.CAPITAL_GAINS, gains);

            assertThat(summary.get("total_stcg")).isEqualByComparingTo("120000");
            assertThat(summary.get("total_ltcg")).isEqualByComparingTo("260000");
            assertThat(summary.get("total_capital_gains")).isEqualByComparingTo("380000");
            assertThat(summary.get("ltcg_112a_exempt")).isEqualByComparingTo("125000");
            assertThat(summary.get("tax_on_stcg_111a")).isEqualByComparingTo("20000");
            assertThat(summary.get("tax_on_ltcg_112a")).isEqualByComparingTo("9375");
        }

        @Test
        void equityGainsWithinExemptionAreNotTaxed() {
            Map<String, BigDecimal> summary = summarize(ComponentKind.CAPITAL_GAINS,
                    form(ComponentKind.CAPITAL_GAINS, "ltcg_112a_equity_stt", "100000"));

            assertThat(summary.get("ltcg_112a_exempt")).isEqualByComparingTo("100000");
            assertThat(summary.get("tax_on_ltcg_112a")).isEqualByComparingTo("0");
        }
    }

    @Nested
    @DisplayName("House property")
    class HouseProperty {

        @Test
        void letOut_deductsThirtyPercentOfAnnualValue() {
            FlatForm property = form(ComponentKind.HOUSE_PROPERTY,
                    "property_type", "Let-Out",
                    "annual_rent_received", "300000",
                    "municipal_taxes_paid", "20000",
                    "home_loan_interest", "100000",
                    "pre_construction_interest", "10000");

            Map<String, BigDecimal> summary = summarize(ComponentKind.HOUSE_PROPERTY, property);

            assertThat(summary.get("net_annual_value")).isEqualByComparingTo("280000");
            assertThat(summary.get("standard_deduction")).isEqualByComparingTo("84000");
            assertThat(summary.get("total_deductions")).isEqualByComparingTo("194000");
            assertThat(summary.get("net_income")).isEqualByComparingTo("86000");
        }

        @Test
        void selfOccupied_interestIsALoss() {
            FlatForm property = form(ComponentKind.HOUSE_PROPERTY,
                    "annual_rent_received", "100000",
                    "home_loan_interest", "200000");

            Map<String, BigDecimal> summary = summarize(ComponentKind.HOUSE_PROPERTY, property);

            assertThat(summary.get("net_annual_value")).isEqualByComparingTo("0");
            assertThat(summary.get("standard_deduction")).isEqualByComparingTo("0");
            assertThat(summary.get("total_deductions")).isEqualByComparingTo("200000");
            assertThat(summary.get("net_income")).isEqualByComparingTo("-200000");
        }
    }

    @Nested
    @DisplayName("Deductions")
    class Deductions {

        private FlatForm deductions() {
            return form(ComponentKind.DEDUCTIONS,
                    "life_insurance_premium", "100000",
                    "elss_investment", "80000",
                    "self_family_premium", "30000",
                    "preventive_health_checkup", "5000",
                    "parent_premium", "40000",
                    "additional_nps_50k", "60000",
                    "education_loan_interest", "12000",
                    "political_party_contribution", "5000",
                    "savings_account_interest", "15000",
                    "deposit_interest_senior", "30000");
        }

        @Test
        void capsEachSectionAtItsCeiling() {
            Map<String, BigDecimal> summary = summarize(ComponentKind.DEDUCTIONS, deductions());

            assertThat(summary.get("section_80c_total")).isEqualByComparingTo("180000");
            assertThat(summary.get("section_80c_allowed")).isEqualByComparingTo("150000");
            assertThat(summary.get("section_80d_total")).isEqualByComparingTo("75000");
            assertThat(summary.get("section_80d_allowed")).isEqualByComparingTo("50000");
            assertThat(summary.get("section_80ccd_1b_allowed")).isEqualByComparingTo("50000");
            assertThat(summary.get("interest_deduction_allowed")).isEqualByComparingTo("10000");
            assertThat(summary.get("total_deductions")).isEqualByComparingTo("277000");
        }

        @Test
        void seniorParentsRaiseTheirCeiling() {
            Map<String, BigDecimal> summary = ComponentSummaryCalculator.summarize(
                    ComponentKind.DEDUCTIONS, deductions(), limits, 40, 65);

            assertThat(summary.get("section_80d_allowed")).isEqualByComparingTo("65000");
        }

        @Test
        void seniorEmployeeClaimsDepositInterest() {
            Map<String, BigDecimal> summary = ComponentSummaryCalculator.summarize(
                    ComponentKind.DEDUCTIONS, deductions(), limits, 62, 70);

            assertThat(summary.get("section_80d_allowed")).isEqualByComparingTo("75000");
            assertThat(summary.get("interest_deduction_allowed")).isEqualByComparingTo("45000");
            assertThat(summary.get("total_deductions")).isEqualByComparingTo("337000");
        }
    }

    @Nested
    @DisplayName("Retirement benefits")
    class RetirementBenefits {

        @Test
        void exemptionsAreCappedPerBenefit() {
            FlatForm benefits = form(ComponentKind.RETIREMENT_BENEFITS,
                    "gratuity_amount", "2500000",
                    "leave_encashment_amount", "400000",
                    "vrs_amount", "600000",
                    "pension_regular_pension", "100000");

            Map<String, BigDecimal> summary = summarize(ComponentKind.RETIREMENT_BENEFITS, benefits);

            assertThat(summary.get("total_retirement_benefits")).isEqualByComparingTo("3600000");
            assertThat(summary.get("gratuity_exempt")).isEqualByComparingTo("2000000");
            assertThat(summary.get("leave_encashment_exempt")).isEqualByComparingTo("300000");
            assertThat(summary.get("vrs_exempt")).isEqualByComparingTo("500000");
            assertThat(summary.get("taxable_retirement_benefits")).isEqualByComparingTo("800000");
        }

        @Test
        void encashmentDuringEmploymentIsTaxable() {
            FlatForm benefits = form(ComponentKind.RETIREMENT_BENEFITS,
                    "leave_encashment_amount", "400000",
                    "during_employment", true);

            Map<String, BigDecimal> summary = summarize(ComponentKind.RETIREMENT_BENEFITS, benefits);

            assertThat(summary.get("leave_encashment_exempt")).isEqualByComparingTo("0");
            assertThat(summary.get("taxable_retirement_benefits")).isEqualByComparingTo("400000");
        }
    }

    @Nested
    @DisplayName("Perquisites")
    class Perquisites {

        @Test
        void mixedUseCar_flatMonthlyRateWithDriver() {
            FlatForm perks = form(ComponentKind.PERQUISITES,
                    "car_use_type", "Mixed",
                    "engine_capacity_cc", "1800",
                    "has_expense_reimbursement", true,
                    "driver_provided", true,
                    "months_used", "12");

            assertThat(summarize(ComponentKind.PERQUISITES, perks).get("car_perquisite"))
                    .isEqualByComparingTo("39600");
        }

        @Test
        void mixedUseSmallCar_employeeBearsExpenses() {
            FlatForm perks = form(ComponentKind.PERQUISITES,
                    "car_use_type", "Mixed",
                    "engine_capacity_cc", "1600",
                    "months_used", "6");

            assertThat(summarize(ComponentKind.PERQUISITES, perks).get("car_perquisite"))
                    .isEqualByComparingTo("3600");
        }

        @Test
        void officialCarIsNotAPerquisite() {
            FlatForm perks = form(ComponentKind.PERQUISITES,
                    "car_use_type", "Official",
                    "car_cost_to_employer", "150000");

            assertThat(summarize(ComponentKind.PERQUISITES, perks).get("car_perquisite"))
                    .isEqualByComparingTo("0");
        }

        @Test
        void totalAddsEachBenefitNetOfExemptions() {
            FlatForm perks = form(ComponentKind.PERQUISITES,
                    "employer_maintained_1st_child", true,
                    "monthly_expenses_child1", "800",
                    "employer_maintained_2nd_child", true,
                    "monthly_expenses_child2", "3000",
                    "months_child2", "10",
                    "lunch_employer_cost", "20000",
                    "gas_paid_by_employer", "10000",
                    "gas_paid_by_employee", "4000",
                    "lta_amount_claimed", "20000",
                    "car_use_type", "Mixed",
                    "engine_capacity_cc", "1800",
                    "has_expense_reimbursement", true,
                    "driver_provided", true);

            Map<String, BigDecimal> summary = summarize(ComponentKind.PERQUISITES, perks);

            assertThat(summary.get("free_education")).isEqualByComparingTo("30000");
            assertThat(summary.get("lunch_refreshment")).isEqualByComparingTo("7500");
            assertThat(summary.get("utilities")).isEqualByComparingTo("6000");
            assertThat(summary.get("total_perquisites")).isEqualByComparingTo("103100");
        }

        @Test
        void transferredAssetIsDepreciatedByType() {
            FlatForm laptop = form(ComponentKind.PERQUISITES,
                    "movable_asset_transfer_type", "Electronics",
                    "movable_asset_transfer_cost", "100000",
                    "movable_asset_years_of_use", "1",
                    "movable_asset_transfer_employee_payment", "10000");
            FlatForm car = form(ComponentKind.PERQUISITES,
                    "movable_asset_transfer_type", "Motor Vehicle",
                    "movable_asset_transfer_cost", "500000",
                    "movable_asset_years_of_use", "2");
            FlatForm oldLaptop = form(ComponentKind.PERQUISITES,
                    "movable_asset_transfer_type", "Electronics",
                    "movable_asset_transfer_cost", "100000",
                    "movable_asset_years_of_use", "3");

            assertThat(summarize(ComponentKind.PERQUISITES, laptop).get("movable_asset_transfer"))
                    .isEqualByComparingTo("40000");
            assertThat(summarize(ComponentKind.PERQUISITES, car).get("movable_asset_transfer"))
                    .isEqualByComparingTo("300000");
            assertThat(summarize(ComponentKind.PERQUISITES, oldLaptop).get("movable_asset_transfer"))
                    .isEqualByComparingTo("0");
        }
    }

    @Test
    void otherIncome_interestAndTotal() {
        FlatForm income = form(ComponentKind.OTHER_INCOME,
                "savings_interest", "5000",
                "fd_interest", "20000",
                "dividend_income", "10000");

        Map<String, BigDecimal> summary = summarize(ComponentKind.OTHER_INCOME, income);

        assertThat(summary.get("total_interest_income")).isEqualByComparingTo("25000");
        assertThat(summary.get("total_other_income")).isEqualByComparingTo("35000");
    }
}
