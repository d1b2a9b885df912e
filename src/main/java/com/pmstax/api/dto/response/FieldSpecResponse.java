package com.pmstax.api.dto.response;

import com.pmstax.domain.enums.FieldType;
import com.pmstax.domain.enums.ValueKind;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldSpecResponse {

    private String name;

    /** Dotted location in the nested record, e.g. "section_80c.ppf_contribution". */
    private String path;

    private ValueKind valueKind;
    private FieldType fieldType;

    /** Shown with a rupee prefix and limit hints. */
    private boolean amountLike;

    private Object defaultValue;
    private List<String> options;
    private boolean readOnly;
    private boolean aggregate;
}
