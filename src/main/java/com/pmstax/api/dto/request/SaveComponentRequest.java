package com.pmstax.api.dto.request;

import jakarta.validation.constraints.NotNull;
import java.time.LocalDate;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for saving a flat form as an update or as a new revision. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SaveComponentRequest {

    /** "new" opens a new revision; anything else updates the active one. */
    private String mode;

    /** Required when {@code mode} is "new". */
    private LocalDate effectiveFrom;

    private String notes;

    @NotNull
    private Map<String, Object> values;
}
