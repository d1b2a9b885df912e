package com.pmstax.revision;

import com.pmstax.domain.enums.ComponentKind;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;

/**
 * Update request in the shape the persistence API expects. The nested record travels
 * under the component's payload key, e.g. {@code salary_income} for salary.
 */
@Getter
@Builder
public class ComponentUpdateRequest {

    private final String employeeId;
    private final String taxYear;
    private final ComponentKind kind;
    private final Map<String, Object> payload;
    private final boolean forceNewRevision;
    private final String notes;
    private final LocalDate effectiveFrom;

    /** Snake-case request body; {@code effective_from} only when set. */
    public Map<String, Object> toBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("employee_id", employeeId);
        body.put("tax_year", taxYear);
        body.put(kind.getPayloadKey(), payload);
        body.put("force_new_revision", forceNewRevision);
        body.put("notes", notes);
        if (effectiveFrom != null) {
            body.put("effective_from", effectiveFrom.toString());
        }
        return body;
    }
}
