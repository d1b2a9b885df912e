package com.pmstax.summary;

import com.pmstax.domain.enums.AggregateGroup;
import com.pmstax.domain.enums.ComponentKind;
import com.pmstax.domain.enums.ValueKind;
import com.pmstax.domain.model.FlatForm;
import com.pmstax.rules.StatutoryLimits;
import com.pmstax.transform.ComponentSchemas;
import com.pmstax.transform.FieldSpec;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Running totals shown under each component form, recomputed from the flat form.
 *
 * <p>Totals are informational: they apply the year's ceilings and exemption caps but
 * never change the stored values. Amounts derived from a rate are rounded to whole
 * rupees. Keys come back in display order.
 */
public final class ComponentSummaryCalculator {

    private static final String LET_OUT = "Let-Out";

    private static final List<String> SALARY_BASE = List.of("basic_salary");
    private static final List<String> INTEREST_INCOME =
            List.of("savings_interest", "fd_interest", "rd_interest", "post_office_interest");
    private static final List<String> STCG = List.of("stcg_111a_equity_stt", "stcg_other_assets", "stcg_debt_mf");
    private static final List<String> LTCG = List.of("ltcg_112a_equity_stt", "ltcg_other_assets", "ltcg_debt_mf");
    private static final List<String> RETIREMENT = List.of(
            "gratuity_amount",
            "leave_encashment_amount",
            "vrs_amount",
            "pension_regular_pension",
            "pension_commuted_pension",
            "other_retirement_benefits");

    private ComponentSummaryCalculator() {}

    /**
     * Totals for one component. Ages may be null; a missing age never raises a ceiling.
     */
    public static Map<String, BigDecimal> summarize(
            ComponentKind kind, FlatForm form, StatutoryLimits limits, Integer employeeAge, Integer parentsAge) {
        Map<String, BigDecimal> summary = new LinkedHashMap<>();
        switch (kind) {
            case SALARY -> salary(form, limits, summary);
            case PERQUISITES -> perquisites(form, limits, summary);
            case DEDUCTIONS -> deductions(form, limits, isSenior(employeeAge, limits), isSenior(parentsAge, limits),
                    summary);
            case OTHER_INCOME -> otherIncome(form, summary);
            case CAPITAL_GAINS -> capitalGains(form, limits, summary);
            case RETIREMENT_BENEFITS -> retirementBenefits(form, limits, summary);
            case HOUSE_PROPERTY -> houseProperty(form, limits, summary);
        }
        return Collections.unmodifiableMap(summary);
    }

    private static void salary(FlatForm form, StatutoryLimits limits, Map<String, BigDecimal> summary) {
        BigDecimal allowances = BigDecimal.ZERO;
        for (FieldSpec field : ComponentSchemas.forKind(ComponentKind.SALARY).getFields()) {
            if (field.getValueKind() == ValueKind.NUMBER && !SALARY_BASE.contains(field.getName())) {
                allowances = allowances.add(form.getNumber(field.getName()));
            }
        }
        BigDecimal total = form.getNumber("basic_salary").add(allowances);
        BigDecimal standardDeduction = total.max(BigDecimal.ZERO).min(limits.getStandardDeductionNewRegime());
        summary.put("total_allowances", allowances);
        summary.put("total_salary", total);
        summary.put("standard_deduction", standardDeduction);
        summary.put("net_salary", total.subtract(standardDeduction));
    }

    private static void perquisites(FlatForm form, StatutoryLimits limits, Map<String, BigDecimal> summary) {
        BigDecimal car = carPerquisite(form, limits);
        BigDecimal freeEducation = freeEducation(form, "monthly_expenses_child1", "months_child1",
                        "employer_maintained_1st_child", limits)
                .add(freeEducation(form, "monthly_expenses_child2", "months_child2",
                        "employer_maintained_2nd_child", limits));
        BigDecimal utilities = net(
                sum(form, "gas_paid_by_employer", "electricity_paid_by_employer", "water_paid_by_employer"),
                sum(form, "gas_paid_by_employee", "electricity_paid_by_employee", "water_paid_by_employee"));
        BigDecimal assetUsage = form.getBoolean("movable_asset_is_employer_owned")
                ? net(rupees(form.getNumber("movable_asset_usage_value").multiply(new BigDecimal("0.10"))),
                        form.getNumber("movable_asset_employee_payment"))
                : net(form.getNumber("movable_asset_hire_cost"), form.getNumber("movable_asset_employee_payment"));
        BigDecimal assetTransfer = assetTransfer(form);
        BigDecimal mealExemption =
                limits.getLunchExemptionPerMeal().multiply(form.getNumber("lunch_meal_days_per_year"));
        BigDecimal lunch = net(form.getNumber("lunch_employer_cost"),
                form.getNumber("lunch_employee_payment").add(mealExemption));
        BigDecimal domesticHelp = net(
                form.getNumber("domestic_help_paid_by_employer"), form.getNumber("domestic_help_paid_by_employee"));
        BigDecimal monetaryBenefits = net(
                form.getNumber("monetary_amount_paid_by_employer"),
                sum(form, "expenditure_for_official_purpose", "amount_paid_by_employee"));
        BigDecimal clubExpenses = net(
                form.getNumber("club_expenses_paid_by_employer"),
                sum(form, "club_expenses_paid_by_employee", "club_expenses_for_official_purpose"));

        summary.put("car_perquisite", car);
        summary.put("free_education", freeEducation);
        summary.put("utilities", utilities);
        summary.put("movable_asset_usage", assetUsage);
        summary.put("movable_asset_transfer", assetTransfer);
        summary.put("lunch_refreshment", lunch);
        summary.put("domestic_help", domesticHelp);
        summary.put("monetary_benefits", monetaryBenefits);
        summary.put("club_expenses", clubExpenses);
        summary.put("total_perquisites", sum(form, "lta_amount_claimed", "esop_exercise_value", "other_perquisites_amount")
                .add(car)
                .add(freeEducation)
                .add(utilities)
                .add(assetUsage)
                .add(assetTransfer)
                .add(lunch)
                .add(domesticHelp)
                .add(monetaryBenefits)
                .add(clubExpenses));
    }

    /**
     * Official use is not a perquisite and personal use is valued at the employer's cost.
     * Mixed use is a flat monthly amount by engine size and by who bears the running
     * expenses, plus the driver amount when a driver is provided.
     */
    private static BigDecimal carPerquisite(FlatForm form, StatutoryLimits limits) {
        String use = form.getString("car_use_type");
        if ("Official".equals(use)) {
            return BigDecimal.ZERO;
        }
        if (!"Mixed".equals(use)) {
            return form.getNumber("car_cost_to_employer");
        }
        boolean higher = form.getNumber("engine_capacity_cc")
                .compareTo(BigDecimal.valueOf(limits.getCarEngineCapacityThresholdCc())) > 0;
        BigDecimal monthly;
        if (form.getBoolean("has_expense_reimbursement")) {
            monthly = higher ? limits.getCarPerqHigherWithExpense() : limits.getCarPerqLowerWithExpense();
        } else {
            monthly = higher ? limits.getCarPerqHigherWithoutExpense() : limits.getCarPerqLowerWithoutExpense();
        }
        if (form.getBoolean("driver_provided")) {
            monthly = monthly.add(limits.getDriverPerq());
        }
        return monthly.multiply(form.getNumber("months_used"));
    }

    /** Schooling at or below the monthly exemption per child is not a perquisite. */
    private static BigDecimal freeEducation(
            FlatForm form, String monthlyField, String monthsField, String maintainedField, StatutoryLimits limits) {
        BigDecimal monthly = form.getNumber(monthlyField);
        if (!form.getBoolean(maintainedField) || monthly.compareTo(limits.getFreeEducationExemption()) <= 0) {
            return BigDecimal.ZERO;
        }
        return monthly.multiply(form.getNumber(monthsField));
    }

    /** Written-down value at transfer, less what the employee paid. */
    private static BigDecimal assetTransfer(FlatForm form) {
        BigDecimal cost = form.getNumber("movable_asset_transfer_cost");
        BigDecimal rate = switch (form.getString("movable_asset_transfer_type")) {
            case "Electronics" -> new BigDecimal("0.50");
            case "Motor Vehicle" -> new BigDecimal("0.20");
            default -> new BigDecimal("0.10");
        };
        BigDecimal depreciation = rupees(cost.multiply(rate).multiply(form.getNumber("movable_asset_years_of_use")));
        BigDecimal writtenDown = net(cost, depreciation);
        return net(writtenDown, form.getNumber("movable_asset_transfer_employee_payment"));
    }

    private static void deductions(
            FlatForm form,
            StatutoryLimits limits,
            boolean seniorEmployee,
            boolean seniorParents,
            Map<String, BigDecimal> summary) {
        BigDecimal section80c = sum(form, AggregateGroup.SECTION_80C.getMembers());
        BigDecimal section80cAllowed = section80c.min(limits.getSection80cLimit());

        BigDecimal selfFamily = sum(form, AggregateGroup.SECTION_80D_SELF_FAMILY.getMembers());
        BigDecimal parents = sum(form, AggregateGroup.SECTION_80D_PARENTS.getMembers());
        BigDecimal section80dAllowed = selfFamily
                .min(seniorEmployee ? limits.getSection80dSelfFamilySenior() : limits.getSection80dSelfFamily())
                .add(parents.min(seniorParents ? limits.getSection80dParentsSenior() : limits.getSection80dParents()))
                .min(limits.getSection80dTotal());

        BigDecimal nps = form.getNumber("additional_nps_50k").min(limits.getSection80ccd1bLimit());
        BigDecimal evLoan = form.getNumber("ev_loan_interest").min(limits.getSection80eebLimit());
        // seniors claim deposit interest under 80TTB instead of savings interest under 80TTA
        BigDecimal depositInterest = seniorEmployee
                ? sum(form, "savings_account_interest", "deposit_interest_senior").min(limits.getSection80ttbLimit())
                : form.getNumber("savings_account_interest").min(limits.getSection80ttaLimit());

        summary.put("section_80c_total", section80c);
        summary.put("section_80c_allowed", section80cAllowed);
        summary.put("section_80d_total", selfFamily.add(parents));
        summary.put("section_80d_allowed", section80dAllowed);
        summary.put("section_80ccd_1b_allowed", nps);
        summary.put("section_80eeb_allowed", evLoan);
        summary.put("interest_deduction_allowed", depositInterest);
        summary.put("total_deductions", section80cAllowed
                .add(section80dAllowed)
                .add(nps)
                .add(form.getNumber("education_loan_interest"))
                .add(evLoan)
                .add(form.getNumber("political_party_contribution"))
                .add(depositInterest));
    }

    private static void otherIncome(FlatForm form, Map<String, BigDecimal> summary) {
        BigDecimal interest = sum(form, INTEREST_INCOME);
        summary.put("total_interest_income", interest);
        summary.put("total_other_income", interest.add(sum(form,
                "dividend_income", "gifts_received", "business_professional_income", "other_miscellaneous_income")));
    }

    private static void capitalGains(FlatForm form, StatutoryLimits limits, Map<String, BigDecimal> summary) {
        BigDecimal stcg = sum(form, STCG);
        BigDecimal ltcg = sum(form, LTCG);
        BigDecimal equityLtcg = form.getNumber("ltcg_112a_equity_stt");
        BigDecimal exempt = equityLtcg.max(BigDecimal.ZERO).min(limits.getLtcgExemptionLimit());
        summary.put("total_stcg", stcg);
        summary.put("total_ltcg", ltcg);
        summary.put("total_capital_gains", stcg.add(ltcg));
        summary.put("ltcg_112a_exempt", exempt);
        summary.put("tax_on_stcg_111a",
                rupees(form.getNumber("stcg_111a_equity_stt").max(BigDecimal.ZERO).multiply(limits.getStcg111aRate())));
        summary.put("tax_on_ltcg_112a", rupees(net(equityLtcg, exempt).multiply(limits.getLtcg112aRate())));
    }

    private static void retirementBenefits(FlatForm form, StatutoryLimits limits, Map<String, BigDecimal> summary) {
        BigDecimal total = sum(form, RETIREMENT);
        BigDecimal gratuity = form.getNumber("gratuity_amount").min(limits.getGratuityExemptionLimit());
        // encashment while still employed is fully taxable
        BigDecimal leave = form.getBoolean("during_employment")
                ? BigDecimal.ZERO
                : form.getNumber("leave_encashment_amount").min(limits.getLeaveEncashmentExemptionLimit());
        BigDecimal vrs = form.getNumber("vrs_amount").min(limits.getVrsExemptionLimit());
        BigDecimal exempt = gratuity.add(leave).add(vrs).max(BigDecimal.ZERO);
        summary.put("total_retirement_benefits", total);
        summary.put("gratuity_exempt", gratuity);
        summary.put("leave_encashment_exempt", leave);
        summary.put("vrs_exempt", vrs);
        summary.put("taxable_retirement_benefits", net(total, exempt));
    }

    private static void houseProperty(FlatForm form, StatutoryLimits limits, Map<String, BigDecimal> summary) {
        BigDecimal interest = sum(form, "home_loan_interest", "pre_construction_interest");
        BigDecimal annualValue = BigDecimal.ZERO;
        BigDecimal standardDeduction = BigDecimal.ZERO;
        if (LET_OUT.equals(form.getString("property_type"))) {
            annualValue = form.getNumber("annual_rent_received").subtract(form.getNumber("municipal_taxes_paid"));
            standardDeduction =
                    rupees(annualValue.max(BigDecimal.ZERO).multiply(limits.getHousePropertyStandardDeductionRate()));
        }
        BigDecimal totalDeductions = standardDeduction.add(interest);
        summary.put("net_annual_value", annualValue);
        summary.put("standard_deduction", standardDeduction);
        summary.put("total_deductions", totalDeductions);
        summary.put("net_income", annualValue.subtract(totalDeductions));
    }

    private static boolean isSenior(Integer age, StatutoryLimits limits) {
        return age != null && age >= limits.getSeniorCitizenAge();
    }

    private static BigDecimal sum(FlatForm form, String... fields) {
        return sum(form, List.of(fields));
    }

    private static BigDecimal sum(FlatForm form, List<String> fields) {
        BigDecimal total = BigDecimal.ZERO;
        for (String field : fields) {
            total = total.add(form.getNumber(field));
        }
        return total;
    }

    /** {@code amount - offset}, floored at zero. */
    private static BigDecimal net(BigDecimal amount, BigDecimal offset) {
        return amount.subtract(offset).max(BigDecimal.ZERO);
    }

    private static BigDecimal rupees(BigDecimal amount) {
        return amount.setScale(0, RoundingMode.HALF_UP);
    }
}
