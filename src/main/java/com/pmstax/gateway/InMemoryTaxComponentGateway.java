package com.pmstax.gateway;

import com.pmstax.domain.enums.ComponentKind;
import com.pmstax.domain.model.ComponentKey;
import com.pmstax.domain.model.ComponentRevision;
import com.pmstax.domain.model.TaxYear;
import com.pmstax.exception.ComponentValidationException;
import com.pmstax.exception.RevisionValidationException;
import com.pmstax.mapper.JsonHelper;
import com.pmstax.revision.ComponentUpdateRequest;
import com.pmstax.revision.RevisionHistory;
import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process gateway keeping one {@link RevisionHistory} per component key.
 *
 * <p>Histories are created on first save and synchronised individually, so concurrent
 * requests for different components do not contend. A revision window the history
 * refuses is reported as a {@link ComponentValidationException}, the way the taxation
 * API answers with a 4xx.
 */
public class InMemoryTaxComponentGateway implements TaxComponentGateway {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaxComponentGateway.class);

    private final Map<ComponentKey, RevisionHistory> histories = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryTaxComponentGateway() {
        this(Clock.systemUTC());
    }

    public InMemoryTaxComponentGateway(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<Map<String, Object>> getComponent(ComponentKey key) {
        RevisionHistory history = histories.get(key);
        if (history == null) {
            return Optional.empty();
        }
        synchronized (history) {
            return history.active().map(revision -> JsonHelper.deepCopy(revision.getData()));
        }
    }

    @Override
    public Map<String, Object> updateComponent(ComponentKind kind, ComponentUpdateRequest request) {
        TaxYear taxYear = TaxYear.parse(request.getTaxYear());
        ComponentKey key = ComponentKey.of(request.getEmployeeId(), taxYear, kind);
        Map<String, Object> payload = request.getPayload() != null ? request.getPayload() : Map.of();
        RevisionHistory history = histories.computeIfAbsent(key, k -> new RevisionHistory(clock));
        ComponentRevision revision;
        synchronized (history) {
            try {
                revision = request.isForceNewRevision()
                        ? history.openRevision(request.getEffectiveFrom(), payload, request.getNotes())
                        : history.updateActive(payload, request.getNotes(), taxYear.getStartDate());
            } catch (RevisionValidationException e) {
                log.warn("Rejected {} revision for {}: {}", kind, key, e.getMessage());
                throw new ComponentValidationException(List.of(e.getMessage()));
            }
        }
        log.info("Stored {} revision {} for {}", kind, revision.getRevisionNumber(), key);
        return toResponse(key, revision);
    }

    /** Snapshot of all revisions for a key, oldest first. */
    public List<ComponentRevision> getHistory(ComponentKey key) {
        RevisionHistory history = histories.get(key);
        if (history == null) {
            return List.of();
        }
        synchronized (history) {
            return List.copyOf(history.all());
        }
    }

    private Map<String, Object> toResponse(ComponentKey key, ComponentRevision revision) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("employee_id", key.getEmployeeId());
        response.put("tax_year", key.getTaxYear().toString());
        response.put("component_type", key.getKind().getPathSegment());
        response.put("revision_number", revision.getRevisionNumber());
        response.put("effective_from", revision.getEffectiveFrom().toString());
        response.put("effective_till", revision.getEffectiveTill() != null ? revision.getEffectiveTill().toString() : null);
        response.put("notes", revision.getNotes());
        response.put("component_data", JsonHelper.deepCopy(revision.getData()));
        return response;
    }
}
