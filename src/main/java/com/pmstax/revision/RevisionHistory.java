package com.pmstax.revision;

import com.pmstax.domain.model.ComponentRevision;
import com.pmstax.exception.RevisionValidationException;
import com.pmstax.mapper.JsonHelper;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only revision list of one component.
 *
 * <p>Windows are half-open {@code [effectiveFrom, effectiveTill)} and never overlap; at most
 * one revision is active (open-ended). Opening a revision at X closes the active one at
 * X, so X must fall strictly after the active revision's start. Closed revisions are
 * never modified again.
 *
 * <p>Not thread-safe; callers sharing an instance synchronise on it.
 */
public class RevisionHistory {

    private final List<ComponentRevision> revisions = new ArrayList<>();
    private final Clock clock;

    public RevisionHistory() {
        this(Clock.systemUTC());
    }

    public RevisionHistory(Clock clock) {
        this.clock = clock;
    }

    public Optional<ComponentRevision> active() {
        return revisions.stream().filter(ComponentRevision::isActive).findFirst();
    }

    /** The revision whose window covers the date, if any. */
    public Optional<ComponentRevision> asOf(LocalDate date) {
        return revisions.stream().filter(r -> r.covers(date)).findFirst();
    }

    public List<ComponentRevision> all() {
        return Collections.unmodifiableList(revisions);
    }

    public boolean isEmpty() {
        return revisions.isEmpty();
    }

    /**
     * Merges {@code patch} into the active revision. With no revision yet, the first one
     * is created starting at {@code effectiveFromIfNew}.
     */
    public ComponentRevision updateActive(Map<String, Object> patch, String notes, LocalDate effectiveFromIfNew) {
        Optional<ComponentRevision> current = active();
        if (current.isEmpty()) {
            return append(effectiveFromIfNew, JsonHelper.deepCopy(patch), notes);
        }
        ComponentRevision updated = current.get().toBuilder()
                .data(Collections.unmodifiableMap(JsonHelper.deepMerge(current.get().getData(), patch)))
                .notes(notes)
                .build();
        revisions.set(revisions.indexOf(current.get()), updated);
        return updated;
    }

    /** Closes the active revision at {@code effectiveFrom} and opens a new one there. */
    public ComponentRevision openRevision(LocalDate effectiveFrom, Map<String, Object> data, String notes) {
        if (effectiveFrom == null) {
            throw new RevisionValidationException("Effective from date is required for a new revision", "effective_from");
        }
        Optional<ComponentRevision> current = active();
        if (current.isPresent()) {
            ComponentRevision open = current.get();
            if (!effectiveFrom.isAfter(open.getEffectiveFrom())) {
                throw new RevisionValidationException(
                        "Effective from date must be after " + open.getEffectiveFrom()
                                + ", the start of the current revision",
                        "effective_from");
            }
            revisions.set(revisions.indexOf(open), open.toBuilder().effectiveTill(effectiveFrom).build());
        }
        return append(effectiveFrom, JsonHelper.deepCopy(data), notes);
    }

    private ComponentRevision append(LocalDate effectiveFrom, Map<String, Object> data, String notes) {
        ComponentRevision revision = ComponentRevision.builder()
                .revisionNumber(revisions.size() + 1)
                .effectiveFrom(effectiveFrom)
                .data(Collections.unmodifiableMap(data))
                .notes(notes)
                .createdAt(Instant.now(clock))
                .build();
        revisions.add(revision);
        return revision;
    }
}
