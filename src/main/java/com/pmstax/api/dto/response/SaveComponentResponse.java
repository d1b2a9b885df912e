package com.pmstax.api.dto.response;

import java.util.List;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Save outcome. {@code saved=false} is a soft failure: {@code message} is the banner
 * text and {@code errors} the persistence API's detail messages.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SaveComponentResponse {

    private boolean saved;
    private String message;
    private List<String> errors;
    private Map<String, Object> revision;

    /** Fields whose pending expression could not be evaluated and were not saved. */
    private List<String> unsavedFields;
}
