package com.deepansh.assistant.exception;

/**
 * The request or response no longer matches the upstream API contract.
 * Never retried.
 */
public class ModelProtocolException extends ModelGatewayException {

    public ModelProtocolException(String message) {
        super(message);
    }

    public ModelProtocolException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
