package com.pmstax.domain.enums;

import java.util.ArrayList;
import java.util.List;
import lombok.Getter;

/**
 * Sets of fields whose sum is capped by a single statutory ceiling.
 *
 * <p>Members are flat-form field names. A field may belong to more than one group
 * (the 80D self/family premium counts both towards its own age-dependent cap and
 * the overall 80D total); the narrower group is declared first.
 */
@Getter
public enum AggregateGroup {
    SECTION_80C(
            "Section 80C",
            List.of(
                    "life_insurance_premium",
                    "nsc_investment",
                    "tax_saving_fd",
                    "elss_investment",
                    "home_loan_principal",
                    "tuition_fees",
                    "ulip_premium",
                    "sukanya_samriddhi",
                    "stamp_duty_property",
                    "senior_citizen_savings",
                    "other_80c_investments")),
    SECTION_80D_SELF_FAMILY("Section 80D (self and family)", List.of("self_family_premium", "preventive_health_checkup")),
    SECTION_80D_PARENTS("Section 80D (parents)", List.of("parent_premium")),
    SECTION_80D("Section 80D", List.of("self_family_premium", "parent_premium", "preventive_health_checkup")),
    SECTION_80CCD_1B("Section 80CCD(1B)", List.of("additional_nps_50k")),
    SECTION_80DD("Section 80DD", List.of("disability_amount")),
    SECTION_80DDB("Section 80DDB", List.of("medical_expenses")),
    SECTION_80EEB("Section 80EEB", List.of("ev_loan_interest")),
    SECTION_80U("Section 80U", List.of("self_disability_amount")),
    SECTION_80TTA("Section 80TTA", List.of("savings_account_interest")),
    SECTION_80TTB("Section 80TTB", List.of("deposit_interest_senior")),
    LTCG_112A_EXEMPTION(
            "Section 112A exemption",
            List.of("ltcg_112a_equity_stt"),
            "The excess is taxable as long term capital gain.");

    private static final String DEFAULT_EXCESS_NOTE = "Excess amount will not be considered for deduction.";

    private final String label;
    private final List<String> members;
    private final String excessNote;

    AggregateGroup(String label, List<String> members) {
        this(label, members, DEFAULT_EXCESS_NOTE);
    }

    AggregateGroup(String label, List<String> members, String excessNote) {
        this.label = label;
        this.members = members;
        this.excessNote = excessNote;
    }

    public boolean contains(String field) {
        return members.contains(field);
    }

    /** Groups the field belongs to, narrowest first. */
    public static List<AggregateGroup> forField(String field) {
        List<AggregateGroup> groups = new ArrayList<>();
        for (AggregateGroup group : values()) {
            if (group.contains(field)) {
                groups.add(group);
            }
        }
        return groups;
    }
}
