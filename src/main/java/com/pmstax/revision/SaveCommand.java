package com.pmstax.revision;

import com.pmstax.domain.enums.RevisionMode;
import com.pmstax.domain.model.ComponentKey;
import com.pmstax.domain.model.FlatForm;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Getter;

/** Everything needed to persist one edited component. */
@Getter
@Builder
public class SaveCommand {

    private final ComponentKey key;

    @Builder.Default
    private final RevisionMode mode = RevisionMode.UPDATE;

    private final FlatForm form;

    /** Required for {@link RevisionMode#NEW_REVISION}, ignored for updates. */
    private final LocalDate effectiveFrom;

    /** Optional; a default note is used when blank. */
    private final String notes;
}
