package com.pmstax.transform;

/** A stored record does not have the shape its schema expects. */
class MalformedPayloadException extends RuntimeException {

    MalformedPayloadException(String message) {
        super(message);
    }
}
