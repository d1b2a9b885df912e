package com.pmstax.transform;

import com.pmstax.domain.enums.ComponentKind;
import com.pmstax.domain.enums.FieldType;
import java.math.BigDecimal;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Field layout of every component kind: flat name, nested location, default.
 *
 * <p>Defaults are the values a blank form starts with; a field absent from (or null in)
 * a stored record takes the same default.
 */
public final class ComponentSchemas {

    static final List<String> CITY_TYPES = List.of("metro", "non_metro");
    static final List<String> RELATIONS = List.of("Self", "Parents", "Spouse", "Children");
    static final List<String> DISABILITY_LEVELS = List.of("40-79%", "80%+");
    static final List<String> ASSET_TYPES = List.of("Electronics", "Motor Vehicle", "Others");

    /** Severe disability (80% or more) raises the 80DD and 80U ceilings. */
    public static final String SEVERE_DISABILITY = "80%+";

    private static final Map<ComponentKind, ComponentSchema> SCHEMAS;

    static {
        Map<ComponentKind, ComponentSchema> schemas = new EnumMap<>(ComponentKind.class);
        schemas.put(ComponentKind.SALARY, salary());
        schemas.put(ComponentKind.PERQUISITES, perquisites());
        schemas.put(ComponentKind.DEDUCTIONS, deductions());
        schemas.put(ComponentKind.OTHER_INCOME, otherIncome());
        schemas.put(ComponentKind.CAPITAL_GAINS, capitalGains());
        schemas.put(ComponentKind.RETIREMENT_BENEFITS, retirementBenefits());
        schemas.put(ComponentKind.HOUSE_PROPERTY, houseProperty());
        SCHEMAS = Collections.unmodifiableMap(schemas);
    }

    private ComponentSchemas() {}

    public static ComponentSchema forKind(ComponentKind kind) {
        return SCHEMAS.get(kind);
    }

    private static ComponentSchema salary() {
        return ComponentSchema.builder(ComponentKind.SALARY)
                .amount("basic_salary")
                .amount("dearness_allowance")
                .number("hra_provided", "hra_provided", FieldType.HRA, BigDecimal.ZERO)
                .select("hra_city_type", "hra_city_type", "non_metro", CITY_TYPES)
                .amount("special_allowance")
                .amount("bonus")
                .amount("commission")
                .amount("city_compensatory_allowance")
                .amount("rural_allowance")
                .amount("proctorship_allowance")
                .amount("wardenship_allowance")
                .amount("project_allowance")
                .amount("deputation_allowance")
                .amount("interim_relief")
                .amount("tiffin_allowance")
                .amount("overtime_allowance")
                .amount("servant_allowance")
                .amount("hills_high_altd_allowance")
                .amount("border_remote_allowance")
                .amount("transport_employee_allowance")
                .amount("children_education_allowance")
                .amount("hostel_allowance")
                .amount("underground_mines_allowance")
                .amount("govt_employee_entertainment_allowance")
                .amount("supreme_high_court_judges_allowance")
                .amount("judge_compensatory_allowance")
                .amount("section_10_14_special_allowances")
                .amount("travel_on_tour_allowance")
                .amount("tour_daily_charge_allowance")
                .amount("conveyance_in_performace_of_duties")
                .amount("helper_in_performace_of_duties")
                .amount("academic_research")
                .amount("uniform_allowance")
                .amount("any_other_allowance_exemption")
                .build();
    }

    private static ComponentSchema perquisites() {
        return ComponentSchema.builder(ComponentKind.PERQUISITES)
                // accommodation
                .select(
                        "accommodation_type",
                        "accommodation.accommodation_type",
                        "Employer-Owned",
                        List.of("Employer-Owned", "Government", "Employer-Leased", "Hotel"))
                .select(
                        "city_population",
                        "accommodation.city_population",
                        "Below 15 lakhs",
                        List.of("Above 40 lakhs", "Between 15-40 lakhs", "Below 15 lakhs"))
                .amount("license_fees", "accommodation.license_fees")
                .amount("employee_rent_payment", "accommodation.employee_rent_payment")
                .amount("rent_paid_by_employer", "accommodation.rent_paid_by_employer")
                .amount("hotel_charges", "accommodation.hotel_charges")
                .number("stay_days", "accommodation.stay_days", FieldType.AMOUNT, BigDecimal.ZERO)
                .amount("furniture_cost", "accommodation.furniture_cost")
                .amount("furniture_employee_payment", "accommodation.furniture_employee_payment")
                .flag("is_furniture_owned_by_employer", "accommodation.is_furniture_owned_by_employer", false)
                // car
                .select("car_use_type", "car.car_use_type", "Personal", List.of("Personal", "Official", "Mixed"))
                .number("engine_capacity_cc", "car.engine_capacity_cc", FieldType.AMOUNT, new BigDecimal("1600"))
                .number("months_used", "car.months_used", FieldType.MONTHS, new BigDecimal("12"))
                .number(
                        "months_used_other_vehicle",
                        "car.months_used_other_vehicle",
                        FieldType.MONTHS,
                        new BigDecimal("12"))
                .amount("car_cost_to_employer", "car.car_cost_to_employer")
                .amount("other_vehicle_cost", "car.other_vehicle_cost")
                .flag("has_expense_reimbursement", "car.has_expense_reimbursement", false)
                .flag("driver_provided", "car.driver_provided", false)
                // leave travel
                .amount("lta_amount_claimed", "lta.lta_amount_claimed")
                .number("lta_claimed_count", "lta.lta_claimed_count", FieldType.LTA_CLAIMED_COUNT, BigDecimal.ZERO)
                .amount("public_transport_cost", "lta.public_transport_cost")
                .select("travel_mode", "lta.travel_mode", "Air", List.of("Air", "Railways", "Bus", "Other"))
                // esop
                .amount("esop_exercise_value", "esop.exercise_price")
                .amount("esop_fair_market_value", "esop.allotment_price")
                .number("esop_shares_exercised", "esop.shares_exercised", FieldType.AMOUNT, BigDecimal.ZERO)
                // free education
                .amount("monthly_expenses_child1", "free_education.monthly_expenses_child1")
                .amount("monthly_expenses_child2", "free_education.monthly_expenses_child2")
                .number("months_child1", "free_education.months_child1", FieldType.MONTHS, new BigDecimal("12"))
                .number("months_child2", "free_education.months_child2", FieldType.MONTHS, new BigDecimal("12"))
                .flag("employer_maintained_1st_child", "free_education.employer_maintained_1st_child", false)
                .flag("employer_maintained_2nd_child", "free_education.employer_maintained_2nd_child", false)
                .derived("free_education_amount", "monthly_expenses_child1", "monthly_expenses_child2")
                .flag("is_children_education", "is_children_education", true)
                // utilities
                .amount("gas_paid_by_employer", "utilities.gas_paid_by_employer")
                .amount("electricity_paid_by_employer", "utilities.electricity_paid_by_employer")
                .amount("water_paid_by_employer", "utilities.water_paid_by_employer")
                .amount("gas_paid_by_employee", "utilities.gas_paid_by_employee")
                .amount("electricity_paid_by_employee", "utilities.electricity_paid_by_employee")
                .amount("water_paid_by_employee", "utilities.water_paid_by_employee")
                .flag("is_gas_manufactured_by_employer", "utilities.is_gas_manufactured_by_employer", false)
                .flag(
                        "is_electricity_manufactured_by_employer",
                        "utilities.is_electricity_manufactured_by_employer",
                        false)
                .flag("is_water_manufactured_by_employer", "utilities.is_water_manufactured_by_employer", false)
                .derived(
                        "gas_electricity_water_amount",
                        "gas_paid_by_employer",
                        "electricity_paid_by_employer",
                        "water_paid_by_employer")
                // interest free loan
                .number("loan_amount", "interest_free_loan.loan_amount", FieldType.LOAN_AMOUNT, BigDecimal.ZERO)
                .amount("emi_amount", "interest_free_loan.emi_amount")
                .number(
                        "company_interest_rate",
                        "interest_free_loan.company_interest_rate",
                        FieldType.INTEREST_RATE,
                        BigDecimal.ZERO)
                .number(
                        "sbi_interest_rate",
                        "interest_free_loan.sbi_interest_rate",
                        FieldType.INTEREST_RATE,
                        new BigDecimal("6.5"))
                .select(
                        "loan_type",
                        "interest_free_loan.loan_type",
                        "Personal",
                        List.of("Personal", "Medical", "Education", "Housing", "Vehicle", "Other"))
                .text("loan_start_date", "interest_free_loan.loan_start_date", "")
                // movable assets
                .select("movable_asset_type", "movable_asset_usage.asset_type", "", ASSET_TYPES)
                .amount("movable_asset_usage_value", "movable_asset_usage.asset_value")
                .amount("movable_asset_hire_cost", "movable_asset_usage.hire_cost")
                .amount("movable_asset_employee_payment", "movable_asset_usage.employee_payment")
                .flag("movable_asset_is_employer_owned", "movable_asset_usage.is_employer_owned", false)
                .derived("movable_asset_value", "movable_asset_usage_value")
                .select("movable_asset_transfer_type", "movable_asset_transfer.asset_type", "", ASSET_TYPES)
                .amount("movable_asset_transfer_cost", "movable_asset_transfer.asset_cost")
                .number(
                        "movable_asset_years_of_use",
                        "movable_asset_transfer.years_of_use",
                        FieldType.AMOUNT,
                        BigDecimal.ZERO)
                .amount("movable_asset_transfer_employee_payment", "movable_asset_transfer.employee_payment")
                .number("asset_usage_months", "asset_usage_months", FieldType.MONTHS, new BigDecimal("12"))
                // lunch
                .amount("lunch_employer_cost", "lunch_refreshment.employer_cost")
                .amount("lunch_employee_payment", "lunch_refreshment.employee_payment")
                .number(
                        "lunch_meal_days_per_year",
                        "lunch_refreshment.meal_days_per_year",
                        FieldType.AMOUNT,
                        new BigDecimal("250"))
                .derived("lunch_refreshment_amount", "lunch_employer_cost")
                // domestic help
                .amount("domestic_help_paid_by_employer", "domestic_help.domestic_help_paid_by_employer")
                .amount("domestic_help_paid_by_employee", "domestic_help.domestic_help_paid_by_employee")
                .amount("other_perquisites_amount", "other_perquisites")
                // monetary benefits
                .amount("monetary_amount_paid_by_employer", "monetary_benefits.monetary_amount_paid_by_employer")
                .amount("expenditure_for_official_purpose", "monetary_benefits.expenditure_for_official_purpose")
                .amount("amount_paid_by_employee", "monetary_benefits.amount_paid_by_employee")
                // club
                .amount("club_expenses_paid_by_employer", "club_expenses.club_expenses_paid_by_employer")
                .amount("club_expenses_paid_by_employee", "club_expenses.club_expenses_paid_by_employee")
                .amount("club_expenses_for_official_purpose", "club_expenses.club_expenses_for_official_purpose")
                .build();
    }

    private static ComponentSchema deductions() {
        return ComponentSchema.builder(ComponentKind.DEDUCTIONS)
                .amount("actual_rent_paid", "hra_exemption.actual_rent_paid")
                .select("hra_city_type", "hra_exemption.hra_city_type", "non_metro", CITY_TYPES)
                // 80C
                .number("life_insurance_premium", "section_80c.life_insurance_premium",
                        FieldType.SECTION_80C_COMPONENT, BigDecimal.ZERO)
                .number("nsc_investment", "section_80c.nsc_investment",
                        FieldType.SECTION_80C_COMPONENT, BigDecimal.ZERO)
                .number("tax_saving_fd", "section_80c.tax_saving_fd",
                        FieldType.SECTION_80C_COMPONENT, BigDecimal.ZERO)
                .number("elss_investment", "section_80c.elss_investment",
                        FieldType.SECTION_80C_COMPONENT, BigDecimal.ZERO)
                .number("home_loan_principal", "section_80c.home_loan_principal",
                        FieldType.SECTION_80C_COMPONENT, BigDecimal.ZERO)
                .number("tuition_fees", "section_80c.tuition_fees",
                        FieldType.SECTION_80C_COMPONENT, BigDecimal.ZERO)
                .number("ulip_premium", "section_80c.ulip_premium",
                        FieldType.SECTION_80C_COMPONENT, BigDecimal.ZERO)
                .number("sukanya_samriddhi", "section_80c.sukanya_samriddhi",
                        FieldType.SECTION_80C_COMPONENT, BigDecimal.ZERO)
                .number("stamp_duty_property", "section_80c.stamp_duty_property",
                        FieldType.SECTION_80C_COMPONENT, BigDecimal.ZERO)
                .number("senior_citizen_savings", "section_80c.senior_citizen_savings",
                        FieldType.SECTION_80C_COMPONENT, BigDecimal.ZERO)
                .number("other_80c_investments", "section_80c.other_80c_investments",
                        FieldType.SECTION_80C_COMPONENT, BigDecimal.ZERO)
                // 80CCC, 80CCD
                .amount("pension_plan_insurance_company", "section_80ccc.pension_fund_contribution")
                .amount("nps_contribution_10_percent", "section_80ccd.employee_nps_contribution")
                .amount("additional_nps_50k", "section_80ccd.additional_nps_contribution")
                .amount("employer_nps_contribution", "section_80ccd.employer_nps_contribution")
                // 80D
                .amount("self_family_premium", "section_80d.self_family_premium")
                .amount("parent_premium", "section_80d.parent_premium")
                .amount("preventive_health_checkup", "section_80d.preventive_health_checkup")
                // 80DD, 80DDB
                .amount("disability_amount", "section_80dd.eligible_deduction")
                .select("disability_relation", "section_80dd.relation", "Parents", RELATIONS)
                .select("disability_percentage", "section_80dd.disability_percentage", "40-79%", DISABILITY_LEVELS)
                .amount("medical_expenses", "section_80ddb.medical_expenses")
                .select("medical_relation", "section_80ddb.relation", "Self", RELATIONS)
                // 80E, 80EEB
                .amount("education_loan_interest", "section_80e.education_loan_interest")
                .fallback("other_deductions.education_loan_interest")
                .amount("ev_loan_interest", "section_80eeb.ev_loan_interest")
                // 80G
                .aggregate(
                        "donation_100_percent_without_limit",
                        "section_80g",
                        List.of(
                                "pm_relief_fund",
                                "national_defence_fund",
                                "national_foundation_communal_harmony",
                                "zila_saksharta_samiti",
                                "national_illness_assistance_fund",
                                "national_blood_transfusion_council",
                                "national_trust_autism_fund",
                                "national_sports_fund",
                                "national_cultural_fund",
                                "technology_development_fund",
                                "national_children_fund",
                                "cm_relief_fund",
                                "army_naval_air_force_funds",
                                "swachh_bharat_kosh",
                                "clean_ganga_fund",
                                "drug_abuse_control_fund",
                                "other_100_percent_wo_limit",
                                "jn_memorial_fund",
                                "pm_drought_relief",
                                "indira_gandhi_memorial_trust",
                                "rajiv_gandhi_foundation"),
                        "other_100_percent_wo_limit")
                .aggregate(
                        "donation_50_percent_without_limit",
                        "section_80g",
                        List.of("other_50_percent_wo_limit", "family_planning_donation", "indian_olympic_association"),
                        "other_50_percent_wo_limit")
                .aggregate(
                        "donation_100_percent_with_limit",
                        "section_80g",
                        List.of(
                                "other_100_percent_w_limit",
                                "govt_charitable_donations",
                                "housing_authorities_donations",
                                "religious_renovation_donations",
                                "other_charitable_donations"),
                        "other_100_percent_w_limit")
                .aggregate(
                        "donation_50_percent_with_limit",
                        "section_80g",
                        List.of("other_50_percent_w_limit"),
                        "other_50_percent_w_limit")
                .amount("political_party_contribution", "section_80ggc.political_party_contribution")
                // 80U, 80TTA/TTB
                .amount("self_disability_amount", "section_80u.eligible_deduction")
                .select(
                        "self_disability_percentage",
                        "section_80u.disability_percentage",
                        "40-79%",
                        DISABILITY_LEVELS)
                .amount("savings_account_interest", "section_80tta_ttb.savings_interest")
                .amount("deposit_interest_senior", "section_80tta_ttb.fd_interest")
                .build();
    }

    private static ComponentSchema otherIncome() {
        return ComponentSchema.builder(ComponentKind.OTHER_INCOME)
                .amount("savings_interest", "interest_income.savings_interest")
                .amount("fd_interest", "interest_income.fd_interest")
                .amount("rd_interest", "interest_income.rd_interest")
                .amount("post_office_interest", "interest_income.post_office_interest")
                .amount("dividend_income")
                .amount("gifts_received")
                .amount("business_professional_income")
                .amount("other_miscellaneous_income")
                .build();
    }

    private static ComponentSchema capitalGains() {
        return ComponentSchema.builder(ComponentKind.CAPITAL_GAINS)
                .amount("stcg_111a_equity_stt")
                .amount("stcg_other_assets")
                .amount("stcg_debt_mf")
                .amount("ltcg_112a_equity_stt")
                .amount("ltcg_other_assets")
                .amount("ltcg_debt_mf")
                .build();
    }

    private static ComponentSchema retirementBenefits() {
        return ComponentSchema.builder(ComponentKind.RETIREMENT_BENEFITS)
                .amount("gratuity_amount", "gratuity.gratuity_amount")
                .fallback("gratuity_amount")
                .amount("gratuity_monthly_salary", "gratuity.monthly_salary")
                .number("gratuity_service_years", "gratuity.service_years", FieldType.AMOUNT, BigDecimal.ZERO)
                .flag("gratuity_is_govt_employee", "gratuity.is_govt_employee", false)
                .amount("leave_encashment_amount", "leave_encashment.leave_encashment_amount")
                .fallback("leave_encashment_amount")
                .amount("average_monthly_salary", "leave_encashment.average_monthly_salary")
                .number(
                        "leave_days_encashed",
                        "leave_encashment.leave_days_encashed",
                        FieldType.AMOUNT,
                        BigDecimal.ZERO)
                .flag("is_deceased", "leave_encashment.is_deceased", false)
                .flag("during_employment", "leave_encashment.during_employment", false)
                .amount("vrs_amount")
                .amount("pension_amount")
                .amount("commuted_pension_amount")
                .amount("other_retirement_benefits")
                .amount("pension_regular_pension", "pension.regular_pension")
                .amount("pension_commuted_pension", "pension.commuted_pension")
                .amount("pension_total_pension", "pension.total_pension")
                .flag("pension_is_govt_employee", "pension.is_govt_employee", false)
                .flag("pension_gratuity_received", "pension.gratuity_received", false)
                .build();
    }

    private static ComponentSchema houseProperty() {
        return ComponentSchema.builder(ComponentKind.HOUSE_PROPERTY)
                .select("property_type", "property_type", "Self-Occupied", List.of("Self-Occupied", "Let-Out"))
                .text("address", "address", "")
                .amount("annual_rent_received")
                .amount("municipal_taxes_paid")
                .amount("home_loan_interest")
                .amount("pre_construction_interest")
                .build();
    }
}
