package com.pmstax.transform;

import com.pmstax.domain.model.FlatForm;
import lombok.Builder;
import lombok.Getter;

/** Flat form produced from a stored record, and whether anything usable was found. */
@Getter
@Builder
public class FlattenResult {

    public static final String NO_DATA_NOTICE = "No existing data found";

    private final FlatForm form;
    private final boolean dataFound;

    /** Info notice for the user when the defaults were used; null otherwise. */
    private final String notice;
}
