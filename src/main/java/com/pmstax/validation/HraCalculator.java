package com.pmstax.validation;

import com.pmstax.rules.StatutoryLimits;
import java.math.BigDecimal;
import java.util.Locale;
import java.util.Set;

/**
 * HRA exemption: the least of the HRA received, 50% (metro) or 40% of basic + DA,
 * and rent paid in excess of 10% of basic + DA.
 */
public final class HraCalculator {

    private static final Set<String> METRO_CITIES = Set.of("delhi", "mumbai", "kolkata", "chennai");

    private HraCalculator() {}

    /** The four metros by name, or a city type value of "metro". */
    public static boolean isMetro(String city) {
        if (city == null) {
            return false;
        }
        String normalized = city.trim().toLowerCase(Locale.ROOT);
        return normalized.equals("metro") || METRO_CITIES.contains(normalized);
    }

    public static HraExemption calculate(
            BigDecimal hraReceived,
            BigDecimal basic,
            BigDecimal da,
            BigDecimal rentPaid,
            String city,
            StatutoryLimits limits) {
        BigDecimal hra = orZero(hraReceived);
        BigDecimal salary = orZero(basic).add(orZero(da));
        boolean metro = isMetro(city);
        BigDecimal cityLimit = salary.multiply(metro ? limits.getHraMetroRate() : limits.getHraNonMetroRate());
        BigDecimal rentLimit = orZero(rentPaid)
                .subtract(salary.multiply(limits.getHraRentExcessRate()))
                .max(BigDecimal.ZERO);
        BigDecimal exemption = hra.min(cityLimit).min(rentLimit).max(BigDecimal.ZERO);
        return HraExemption.builder()
                .hraReceived(hra)
                .salary(salary)
                .metro(metro)
                .cityLimit(cityLimit)
                .rentLimit(rentLimit)
                .exemption(exemption)
                .taxable(hra.subtract(exemption))
                .build();
    }

    private static BigDecimal orZero(BigDecimal value) {
        return value != null ? value : BigDecimal.ZERO;
    }
}
