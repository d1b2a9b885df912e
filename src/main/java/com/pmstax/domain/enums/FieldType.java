package com.pmstax.domain.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import lombok.Getter;

/**
 * Validation vocabulary attached to every editable field.
 *
 * <p>Forms declare fields with a free-form tag. Known tags map to their constant;
 * anything else containing {@code amount} is treated as a plain amount, and the rest
 * as text, which is never validated. The tag is also the JSON form of a type.
 */
@Getter
public enum FieldType {
    AMOUNT("amount"),
    AGE("age"),
    SECTION_80C_COMPONENT("section_80c_component"),
    HRA("hra"),
    LTA_CLAIMED_COUNT("lta_claimed_count"),
    CHILDREN_COUNT("children_count"),
    MONTHS("months"),
    PERCENTAGE("percentage"),
    INTEREST_RATE("interest_rate"),
    LOAN_AMOUNT("loan_amount"),
    TEXT("text"),
    SELECT("select");

    @JsonValue
    private final String tag;

    FieldType(String tag) {
        this.tag = tag;
    }

    @JsonCreator
    public static FieldType fromTag(String tag) {
        if (tag == null) {
            return TEXT;
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (FieldType type : values()) {
            if (type.tag.equals(normalized)) {
                return type;
            }
        }
        return normalized.contains("amount") ? AMOUNT : TEXT;
    }

    /** Whether a tag denotes a currency value (rupee prefix, limit hints). */
    public static boolean isAmountLike(String tag) {
        return tag != null && tag.toLowerCase(Locale.ROOT).contains("amount");
    }

    /** Free-text and dropdown fields accept any character and skip numeric checks. */
    public boolean isFreeText() {
        return this == TEXT || this == SELECT;
    }
}
