package com.pmstax.exception;

/** Transport or server-side failure talking to the persistence API. */
public class GatewayException extends BaseException {

    public GatewayException(String message) {
        super(ErrorCode.GATEWAY_ERROR, message);
    }

    public GatewayException(String message, Throwable cause) {
        super(ErrorCode.GATEWAY_ERROR, message, cause);
    }
}
