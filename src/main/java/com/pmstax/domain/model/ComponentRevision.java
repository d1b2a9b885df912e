package com.pmstax.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * One time-bounded version of a component record.
 *
 * <p>{@code effectiveTill} is exclusive; null means the revision is the active one.
 */
@Getter
@Builder(toBuilder = true)
public class ComponentRevision {

    private final int revisionNumber;
    private final LocalDate effectiveFrom;
    private final LocalDate effectiveTill;
    private final Map<String, Object> data;
    private final String notes;
    private final Instant createdAt;

    public boolean isActive() {
        return effectiveTill == null;
    }

    /** Whether the revision's window covers the given date. */
    public boolean covers(LocalDate date) {
        return !date.isBefore(effectiveFrom) && (effectiveTill == null || date.isBefore(effectiveTill));
    }
}
