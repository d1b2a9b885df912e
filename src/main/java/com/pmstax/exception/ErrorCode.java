package com.pmstax.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    EXPRESSION_ERROR("EXPRESSION_ERROR", 422),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    GATEWAY_ERROR("GATEWAY_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
