package com.pmstax.calculator;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Formats and parses amounts with Indian digit grouping: the last three digits, then
 * groups of two (lakh, crore). 105000 is written "1,05,000" and 12345678.5 is
 * "1,23,45,678.5".
 */
public final class IndianNumberFormat {

    public static final String RUPEE = "₹";

    private static final Pattern PLAIN_NUMBER = Pattern.compile("^[+-]?(\\d+\\.?\\d*|\\.\\d+)$");

    private IndianNumberFormat() {}

    /** At most two fraction digits, rounded half-up, trailing zeros dropped. */
    public static String format(BigDecimal value) {
        if (value == null) {
            return "";
        }
        BigDecimal rounded = value.setScale(2, RoundingMode.HALF_UP).stripTrailingZeros();
        if (rounded.scale() < 0) {
            rounded = rounded.setScale(0);
        }
        String plain = rounded.abs().toPlainString();
        int dot = plain.indexOf('.');
        String integerPart = dot < 0 ? plain : plain.substring(0, dot);
        String fraction = dot < 0 ? "" : plain.substring(dot);

        StringBuilder grouped = new StringBuilder();
        int length = integerPart.length();
        if (length <= 3) {
            grouped.append(integerPart);
        } else {
            String head = integerPart.substring(0, length - 3);
            String tail = integerPart.substring(length - 3);
            int firstGroup = head.length() % 2;
            if (firstGroup > 0) {
                grouped.append(head, 0, firstGroup).append(',');
            }
            for (int i = firstGroup; i < head.length(); i += 2) {
                grouped.append(head, i, i + 2).append(',');
            }
            grouped.append(tail);
        }
        String sign = rounded.signum() < 0 ? "-" : "";
        return sign + grouped + fraction;
    }

    public static String formatRupees(BigDecimal value) {
        return RUPEE + format(value);
    }

    /**
     * Lenient parse: rupee sign, commas and whitespace are ignored. Returns empty for
     * blank input or anything that is not a plain decimal number.
     */
    public static Optional<BigDecimal> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String cleaned = text.replace(RUPEE, "").replace(",", "").replaceAll("\\s+", "");
        if (cleaned.isEmpty() || !PLAIN_NUMBER.matcher(cleaned).matches()) {
            return Optional.empty();
        }
        return Optional.of(new BigDecimal(cleaned));
    }
}
