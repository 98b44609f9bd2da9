package com.deepansh.assistant.exception;

/**
 * Failure of a single completion call. {@link #isTransient()} tells the
 * resilience layer whether another attempt can succeed.
 */
public abstract class ModelGatewayException extends AssistantException {

    protected ModelGatewayException(String message) {
        super(message);
    }

    protected ModelGatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract boolean isTransient();
}
