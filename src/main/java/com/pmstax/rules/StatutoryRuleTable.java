package com.pmstax.rules;

import com.pmstax.calculator.IndianNumberFormat;
import com.pmstax.domain.enums.AggregateGroup;
import com.pmstax.domain.enums.FieldType;
import com.pmstax.domain.model.FieldMessage;
import com.pmstax.domain.model.TaxYear;
import com.pmstax.domain.model.ValidationContext;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.BeanWrapper;
import org.springframework.beans.BeanWrapperImpl;
import org.springframework.beans.BeansException;
import org.springframework.stereotype.Component;

/**
 * Statutory limits per tax year and the pure limit checks built on them.
 *
 * <p>Every year starts from {@link StatutoryLimits#defaults()}; years listed under
 * {@code pmstax.rules.overrides} get their configured values patched in once at
 * startup. After construction the table is read-only, so it is safe to share.
 *
 * <p>Checks never throw for odd input and never block: they return an advisory
 * {@link FieldMessage} or nothing.
 */
@Component
public class StatutoryRuleTable {

    private static final Logger log = LoggerFactory.getLogger(StatutoryRuleTable.class);

    private final StatutoryLimits defaults = StatutoryLimits.defaults();
    private final Map<TaxYear, StatutoryLimits> overriddenYears;

    public StatutoryRuleTable(RuleTableProperties properties) {
        Map<TaxYear, StatutoryLimits> years = new HashMap<>();
        properties.getOverrides().forEach((year, values) -> {
            TaxYear taxYear = TaxYear.parse(year);
            years.put(taxYear, applyOverrides(taxYear, values));
        });
        this.overriddenYears = Collections.unmodifiableMap(years);
    }

    /** A table with no per-year overrides. */
    public static StatutoryRuleTable withDefaults() {
        return new StatutoryRuleTable(new RuleTableProperties());
    }

    /** Returns a private copy; callers may not alter the table through it. */
    public StatutoryLimits limitsFor(TaxYear taxYear) {
        StatutoryLimits limits = taxYear == null ? null : overriddenYears.get(taxYear);
        return (limits != null ? limits : defaults).toBuilder().build();
    }

    /** The ceiling for a group, resolving age and disability dependent caps from the context. */
    public BigDecimal ceilingFor(AggregateGroup group, ValidationContext context, TaxYear taxYear) {
        StatutoryLimits limits = limitsFor(taxYear);
        ValidationContext ctx = context != null ? context : ValidationContext.empty();
        return switch (group) {
            case SECTION_80C -> limits.getSection80cLimit();
            case SECTION_80D -> limits.getSection80dTotal();
            case SECTION_80D_SELF_FAMILY -> isSenior(ctx.getEmployeeAge(), limits)
                    ? limits.getSection80dSelfFamilySenior()
                    : limits.getSection80dSelfFamily();
            case SECTION_80D_PARENTS -> isSenior(ctx.getParentsAge(), limits)
                    ? limits.getSection80dParentsSenior()
                    : limits.getSection80dParents();
            case SECTION_80CCD_1B -> limits.getSection80ccd1bLimit();
            case SECTION_80DD -> ctx.isSevereDisability() ? limits.getSection80ddSevere() : limits.getSection80ddNormal();
            case SECTION_80DDB -> isSenior(ctx.getEmployeeAge(), limits)
                    ? limits.getSection80ddbSenior()
                    : limits.getSection80ddbNormal();
            case SECTION_80EEB -> limits.getSection80eebLimit();
            case SECTION_80U -> ctx.isSevereDisability() ? limits.getSection80uSevere() : limits.getSection80uNormal();
            case SECTION_80TTA -> limits.getSection80ttaLimit();
            case SECTION_80TTB -> limits.getSection80ttbLimit();
            case LTCG_112A_EXEMPTION -> limits.getLtcgExemptionLimit();
        };
    }

    /**
     * Sums the group's members present in {@code values} (absent members count as zero)
     * and compares the total with the group's ceiling.
     */
    public AggregateCheck checkAggregateLimit(
            AggregateGroup group, Map<String, BigDecimal> values, ValidationContext context, TaxYear taxYear) {
        BigDecimal total = BigDecimal.ZERO;
        for (String member : group.getMembers()) {
            BigDecimal value = values.get(member);
            if (value != null) {
                total = total.add(value);
            }
        }
        BigDecimal ceiling = ceilingFor(group, context, taxYear);
        return AggregateCheck.builder()
                .group(group)
                .total(total)
                .ceiling(ceiling)
                .exceededBy(total.subtract(ceiling).max(BigDecimal.ZERO))
                .remaining(ceiling.subtract(total).max(BigDecimal.ZERO))
                .build();
    }

    /**
     * Field-level limit check for an already parsed value.
     *
     * <p>Aggregate messages use the projected total, i.e. the group total with this
     * field's current value replaced by {@code value}.
     */
    public Optional<FieldMessage> checkFieldLimit(
            FieldType fieldType, BigDecimal value, ValidationContext context, TaxYear taxYear) {
        if (fieldType == null || value == null) {
            return Optional.empty();
        }
        ValidationContext ctx = context != null ? context : ValidationContext.empty();
        StatutoryLimits limits = limitsFor(taxYear);

        switch (fieldType) {
            case AGE:
                return checkAge(value, limits);
            case SECTION_80C_COMPONENT:
                return checkAggregateField(
                        ctx.getAggregateGroup() != null ? ctx.getAggregateGroup() : AggregateGroup.SECTION_80C,
                        value,
                        ctx,
                        taxYear);
            case LTA_CLAIMED_COUNT:
                if (value.compareTo(BigDecimal.valueOf(limits.getLtaMaxJourneys())) > 0) {
                    return Optional.of(FieldMessage.warning(
                            "LTA_JOURNEYS_EXCEEDED",
                            String.format(
                                    "LTA claimed %s times exceeds limit of %d times in %d years. Excess claims may not be exempt.",
                                    IndianNumberFormat.format(value),
                                    limits.getLtaMaxJourneys(),
                                    limits.getLtaBlockYears())));
                }
                return Optional.empty();
            case CHILDREN_COUNT:
                if (value.compareTo(BigDecimal.valueOf(limits.getMaxChildrenForEducation())) > 0) {
                    return Optional.of(FieldMessage.warning(
                            "CHILDREN_LIMIT_EXCEEDED",
                            String.format(
                                    "Children count exceeds limit of %d for education allowance. Excess may not be exempt.",
                                    limits.getMaxChildrenForEducation())));
                }
                return Optional.empty();
            case MONTHS:
                if (value.compareTo(BigDecimal.valueOf(limits.getMaxMonths())) > 0) {
                    return Optional.of(FieldMessage.warning(
                            "MONTHS_EXCEEDED",
                            String.format("Months exceeds %d. Please verify the period.", limits.getMaxMonths())));
                }
                return Optional.empty();
            case PERCENTAGE:
                if (value.compareTo(limits.getMaxPercentage()) > 0) {
                    return Optional.of(FieldMessage.warning(
                            "PERCENTAGE_EXCEEDED", "Percentage exceeds 100%. Please verify if correct."));
                }
                return Optional.empty();
            case INTEREST_RATE:
                if (value.compareTo(limits.getMaxInterestRate()) > 0) {
                    return Optional.of(FieldMessage.warning(
                            "INTEREST_RATE_UNUSUAL", "Interest rate seems unusually high. Please verify."));
                }
                return Optional.empty();
            case LOAN_AMOUNT:
                if (value.compareTo(limits.getLoanExemptionLimit()) <= 0) {
                    return Optional.of(
                            FieldMessage.info("LOAN_EXEMPT", "Loan amount is exempt from perquisite tax"));
                }
                return Optional.of(FieldMessage.info(
                        "LOAN_TAXABLE", "Loan amount exceeds exemption limit, perquisite value will be calculated"));
            case TEXT:
            case SELECT:
                return Optional.empty();
            default:
                if (ctx.getAggregateGroup() != null) {
                    return checkAggregateField(ctx.getAggregateGroup(), value, ctx, taxYear);
                }
                return Optional.empty();
        }
    }

    private Optional<FieldMessage> checkAge(BigDecimal age, StatutoryLimits limits) {
        if (age.compareTo(BigDecimal.valueOf(limits.getMinAge())) < 0
                || age.compareTo(BigDecimal.valueOf(limits.getMaxAge())) > 0) {
            return Optional.of(FieldMessage.warning(
                    "AGE_OUT_OF_RANGE",
                    String.format(
                            "Age is outside typical range (%d-%d). Please verify if correct.",
                            limits.getMinAge(),
                            limits.getMaxAge())));
        }
        if (age.compareTo(BigDecimal.valueOf(limits.getSuperSeniorCitizenAge())) >= 0) {
            return Optional.of(FieldMessage.info(
                    "SUPER_SENIOR_CITIZEN",
                    "Super senior citizen benefits applicable (Age " + IndianNumberFormat.format(age) + ")"));
        }
        if (age.compareTo(BigDecimal.valueOf(limits.getSeniorCitizenAge())) >= 0) {
            return Optional.of(FieldMessage.info(
                    "SENIOR_CITIZEN",
                    "Senior citizen benefits applicable (Age " + IndianNumberFormat.format(age) + ")"));
        }
        return Optional.empty();
    }

    private Optional<FieldMessage> checkAggregateField(
            AggregateGroup group, BigDecimal value, ValidationContext ctx, TaxYear taxYear) {
        if (value.signum() <= 0) {
            return Optional.empty();
        }
        BigDecimal projected = ctx.getCurrentTotal().subtract(ctx.getCurrentValue()).add(value);
        BigDecimal ceiling = ceilingFor(group, ctx, taxYear);
        if (projected.compareTo(ceiling) > 0) {
            return Optional.of(FieldMessage.warning(
                    group.name() + "_EXCEEDED",
                    String.format(
                            "This exceeds %s limit by %s. %s",
                            group.getLabel(),
                            IndianNumberFormat.formatRupees(projected.subtract(ceiling)),
                            group.getExcessNote())));
        }
        BigDecimal remaining = ceiling.subtract(projected);
        if (remaining.signum() > 0) {
            return Optional.of(FieldMessage.info(
                    group.name() + "_REMAINING",
                    String.format(
                            "Remaining %s limit: %s", group.getLabel(), IndianNumberFormat.formatRupees(remaining))));
        }
        return Optional.empty();
    }

    private static boolean isSenior(Integer age, StatutoryLimits limits) {
        return age != null && age >= limits.getSeniorCitizenAge();
    }

    private StatutoryLimits applyOverrides(TaxYear taxYear, Map<String, BigDecimal> values) {
        StatutoryLimits limits = StatutoryLimits.defaults();
        BeanWrapper wrapper = new BeanWrapperImpl(limits);
        values.forEach((key, value) -> {
            String property = toPropertyName(key);
            try {
                wrapper.setPropertyValue(property, value.toPlainString());
            } catch (BeansException e) {
                throw new IllegalStateException(
                        "Invalid statutory limit override '" + key + "' for tax year " + taxYear, e);
            }
        });
        log.info("Statutory limits for {} overridden: {}", taxYear, values.keySet());
        return limits;
    }

    /** "section-80c-limit" -> "section80cLimit". Already camel-cased keys pass through. */
    static String toPropertyName(String key) {
        String[] parts = key.trim().split("[-_]");
        StringBuilder name = new StringBuilder(parts[0]);
        for (int i = 1; i < parts.length; i++) {
            if (!parts[i].isEmpty()) {
                name.append(Character.toUpperCase(parts[i].charAt(0))).append(parts[i].substring(1));
            }
        }
        return name.toString();
    }
}
