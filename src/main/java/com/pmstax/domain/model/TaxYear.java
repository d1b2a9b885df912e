package com.pmstax.domain.model;

import com.pmstax.exception.BusinessException;
import com.pmstax.exception.ErrorCode;
import java.time.LocalDate;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Indian financial year, written "2024-25" and running April 1 to March 31.
 */
@Getter
@EqualsAndHashCode
public final class TaxYear implements Comparable<TaxYear> {

    private static final Pattern FORMAT = Pattern.compile("^(\\d{4})-(\\d{2})$");

    private final int startYear;

    private TaxYear(int startYear) {
        this.startYear = startYear;
    }

    public static TaxYear of(int startYear) {
        return new TaxYear(startYear);
    }

    /**
     * Parses "2024-25". The two-digit suffix must be the year after the start year,
     * so "2024-26" and "2024-2025" are rejected.
     */
    public static TaxYear parse(String value) {
        if (value == null) {
            throw invalid(null);
        }
        Matcher matcher = FORMAT.matcher(value.trim());
        if (!matcher.matches()) {
            throw invalid(value);
        }
        int start = Integer.parseInt(matcher.group(1));
        int suffix = Integer.parseInt(matcher.group(2));
        if ((start + 1) % 100 != suffix) {
            throw invalid(value);
        }
        return new TaxYear(start);
    }

    /** The financial year a calendar date falls in. */
    public static TaxYear containing(LocalDate date) {
        return new TaxYear(date.getMonthValue() >= 4 ? date.getYear() : date.getYear() - 1);
    }

    public LocalDate getStartDate() {
        return LocalDate.of(startYear, 4, 1);
    }

    public LocalDate getEndDate() {
        return LocalDate.of(startYear + 1, 3, 31);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(getStartDate()) && !date.isAfter(getEndDate());
    }

    @Override
    public int compareTo(TaxYear other) {
        return Integer.compare(startYear, other.startYear);
    }

    @Override
    public String toString() {
        return String.format("%d-%02d", startYear, (startYear + 1) % 100);
    }

    private static BusinessException invalid(String value) {
        return new BusinessException(
                ErrorCode.VALIDATION_ERROR,
                "Tax year must be written as YYYY-YY, e.g. 2024-25",
                Map.of("taxYear", String.valueOf(value)));
    }
}
