package com.pmstax.exception;

import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * The persistence API rejected a component with a 4xx response. Carries the
 * server's detail messages so they can be shown verbatim.
 */
@Getter
public class ComponentValidationException extends BaseException {

    private final List<String> messages;

    public ComponentValidationException(List<String> messages) {
        super(ErrorCode.VALIDATION_ERROR, String.join("; ", messages), Map.of("messages", List.copyOf(messages)));
        this.messages = List.copyOf(messages);
    }
}
