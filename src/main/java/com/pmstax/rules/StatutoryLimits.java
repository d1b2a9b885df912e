package com.pmstax.rules;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Data;

/**
 * Every ceiling, rate and threshold the validators need for one tax year.
 *
 * <p>Rates are fractions (0.5 = 50%). Monthly allowances are per month, per child
 * where that applies. Built from {@link #defaults()} and patched per year from
 * {@code pmstax.rules.overrides}.
 */
@Data
@Builder(toBuilder = true)
public class StatutoryLimits {

    private BigDecimal maxSalaryComponent;
    private int minAge;
    private int maxAge;
    private int seniorCitizenAge;
    private int superSeniorCitizenAge;

    // Chapter VI-A
    private BigDecimal section80cLimit;
    private BigDecimal section80dSelfFamily;
    private BigDecimal section80dSelfFamilySenior;
    private BigDecimal section80dParents;
    private BigDecimal section80dParentsSenior;
    private BigDecimal section80dTotal;
    private BigDecimal section80ddNormal;
    private BigDecimal section80ddSevere;
    private BigDecimal section80ddbNormal;
    private BigDecimal section80ddbSenior;
    private BigDecimal section80eebLimit;
    private BigDecimal section80uNormal;
    private BigDecimal section80uSevere;
    private BigDecimal section80ccd1bLimit;
    private BigDecimal section80ttaLimit;
    private BigDecimal section80ttbLimit;

    // Salary exemptions
    private BigDecimal hraMetroRate;
    private BigDecimal hraNonMetroRate;
    private BigDecimal hraRentExcessRate;
    private int ltaBlockYears;
    private int ltaMaxJourneys;
    private int maxChildrenForEducation;

    // Capital gains
    private BigDecimal ltcgExemptionLimit;
    private BigDecimal stcg111aRate;
    private BigDecimal ltcg112aRate;

    // House property
    private BigDecimal housePropertyStandardDeductionRate;

    // Perquisites
    private BigDecimal loanExemptionLimit;
    private int carEngineCapacityThresholdCc;
    private BigDecimal carPerqHigherWithExpense;
    private BigDecimal carPerqLowerWithExpense;
    private BigDecimal carPerqHigherWithoutExpense;
    private BigDecimal carPerqLowerWithoutExpense;
    private BigDecimal driverPerq;
    private BigDecimal lunchExemptionPerMeal;
    private BigDecimal freeEducationExemption;

    // Retirement
    private BigDecimal gratuityExemptionLimit;
    private BigDecimal leaveEncashmentExemptionLimit;
    private BigDecimal vrsExemptionLimit;

    private BigDecimal standardDeductionNewRegime;

    // Sanity bounds
    private int maxMonths;
    private BigDecimal maxInterestRate;
    private BigDecimal maxPercentage;

    public static StatutoryLimits defaults() {
        return StatutoryLimits.builder()
                .maxSalaryComponent(new BigDecimal("99999999"))
                .minAge(18)
                .maxAge(100)
                .seniorCitizenAge(60)
                .superSeniorCitizenAge(80)
                .section80cLimit(new BigDecimal("150000"))
                .section80dSelfFamily(new BigDecimal("25000"))
                .section80dSelfFamilySenior(new BigDecimal("50000"))
                .section80dParents(new BigDecimal("25000"))
                .section80dParentsSenior(new BigDecimal("50000"))
                .section80dTotal(new BigDecimal("100000"))
                .section80ddNormal(new BigDecimal("75000"))
                .section80ddSevere(new BigDecimal("125000"))
                .section80ddbNormal(new BigDecimal("40000"))
                .section80ddbSenior(new BigDecimal("100000"))
                .section80eebLimit(new BigDecimal("150000"))
                .section80uNormal(new BigDecimal("75000"))
                .section80uSevere(new BigDecimal("125000"))
                .section80ccd1bLimit(new BigDecimal("50000"))
                .section80ttaLimit(new BigDecimal("10000"))
                .section80ttbLimit(new BigDecimal("50000"))
                .hraMetroRate(new BigDecimal("0.50"))
                .hraNonMetroRate(new BigDecimal("0.40"))
                .hraRentExcessRate(new BigDecimal("0.10"))
                .ltaBlockYears(4)
                .ltaMaxJourneys(2)
                .maxChildrenForEducation(2)
                .ltcgExemptionLimit(new BigDecimal("125000"))
                .stcg111aRate(new BigDecimal("0.20"))
                .ltcg112aRate(new BigDecimal("0.125"))
                .housePropertyStandardDeductionRate(new BigDecimal("0.30"))
                .loanExemptionLimit(new BigDecimal("20000"))
                .carEngineCapacityThresholdCc(1600)
                .carPerqHigherWithExpense(new BigDecimal("2400"))
                .carPerqLowerWithExpense(new BigDecimal("1800"))
                .carPerqHigherWithoutExpense(new BigDecimal("900"))
                .carPerqLowerWithoutExpense(new BigDecimal("600"))
                .driverPerq(new BigDecimal("900"))
                .lunchExemptionPerMeal(new BigDecimal("50"))
                .freeEducationExemption(new BigDecimal("1000"))
                .gratuityExemptionLimit(new BigDecimal("2000000"))
                .leaveEncashmentExemptionLimit(new BigDecimal("300000"))
                .vrsExemptionLimit(new BigDecimal("500000"))
                .standardDeductionNewRegime(new BigDecimal("75000"))
                .maxMonths(12)
                .maxInterestRate(new BigDecimal("50"))
                .maxPercentage(new BigDecimal("100"))
                .build();
    }
}
