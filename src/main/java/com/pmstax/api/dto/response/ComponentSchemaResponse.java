package com.pmstax.api.dto.response;

import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ComponentSchemaResponse {

    private String kind;
    private String pathSegment;
    private String label;
    private List<FieldSpecResponse> fields;
}
