package com.pmstax.revision;

import com.pmstax.domain.enums.ComponentKind;
import com.pmstax.domain.enums.RevisionMode;
import com.pmstax.domain.model.ComponentKey;
import com.pmstax.exception.ComponentValidationException;
import com.pmstax.exception.GatewayException;
import com.pmstax.exception.RevisionValidationException;
import com.pmstax.gateway.TaxComponentGateway;
import com.pmstax.observability.TaxEngineMetrics;
import com.pmstax.transform.ComponentFlattener;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns an edited flat form into a persistence request and submits it.
 *
 * <p>UPDATE patches the active revision in place. NEW_REVISION closes the active
 * revision and opens another one at {@code effectiveFrom}, which is therefore required
 * and checked before the gateway is called. Saves are not retried; a failed save is
 * reported through {@link SaveResult} and the caller keeps its form.
 */
@Service
@RequiredArgsConstructor
public class RevisionController {

    private static final Logger log = LoggerFactory.getLogger(RevisionController.class);

    static final String UPDATE_NOTES = "Updated via individual component management";

    private final ComponentFlattener flattener;
    private final TaxComponentGateway gateway;
    private final TaxEngineMetrics metrics;

    /**
     * Builds the request for a save.
     *
     * @throws RevisionValidationException if a new revision has no effective-from date
     */
    public ComponentUpdateRequest prepare(SaveCommand command) {
        ComponentKey key = command.getKey();
        ComponentKind kind = key.getKind();
        boolean newRevision = command.getMode() == RevisionMode.NEW_REVISION;
        if (newRevision && command.getEffectiveFrom() == null) {
            throw new RevisionValidationException("Effective from date is required for a new revision", "effective_from");
        }

        Map<String, Object> nested = flattener.unflatten(kind, command.getForm());
        return ComponentUpdateRequest.builder()
                .employeeId(key.getEmployeeId())
                .taxYear(key.getTaxYear().toString())
                .kind(kind)
                .payload(nested)
                .forceNewRevision(newRevision)
                .notes(notesFor(command))
                .effectiveFrom(newRevision ? command.getEffectiveFrom() : null)
                .build();
    }

    /**
     * Prepares and submits a save.
     *
     * @throws RevisionValidationException if a new revision has no effective-from date
     */
    public SaveResult submit(SaveCommand command) {
        ComponentUpdateRequest request = prepare(command);
        ComponentKind kind = request.getKind();
        try {
            Map<String, Object> revision = gateway.updateComponent(kind, request);
            metrics.recordSave(kind.name(), command.getMode().name());
            log.info("Saved {} for {} (mode {})", kind, command.getKey(), command.getMode());
            return SaveResult.success(revision, successMessage(kind, command.getMode()));
        } catch (ComponentValidationException e) {
            metrics.recordSaveFailure(kind.name());
            log.warn("{} rejected for {}: {}", kind, command.getKey(), e.getMessages());
            return SaveResult.failed(failureMessage(kind), e.getMessages());
        } catch (GatewayException e) {
            metrics.recordSaveFailure(kind.name());
            log.error("Saving {} for {} failed", kind, command.getKey(), e);
            return SaveResult.failed(failureMessage(kind), List.of(e.getMessage()));
        }
    }

    private static String notesFor(SaveCommand command) {
        if (command.getNotes() != null && !command.getNotes().isBlank()) {
            return command.getNotes();
        }
        if (command.getMode() == RevisionMode.NEW_REVISION) {
            return "New " + command.getKey().getKind().getLabel() + " revision created via individual component management";
        }
        return UPDATE_NOTES;
    }

    static String successMessage(ComponentKind kind, RevisionMode mode) {
        if (mode == RevisionMode.NEW_REVISION) {
            return "New " + kind.getLabel() + " revision created successfully";
        }
        return capitalize(kind.getLabel()) + " component updated successfully";
    }

    static String failureMessage(ComponentKind kind) {
        return "Failed to save " + kind.getLabel() + " data. Please try again.";
    }

    private static String capitalize(String text) {
        return text.substring(0, 1).toUpperCase(Locale.ROOT) + text.substring(1);
    }
}
