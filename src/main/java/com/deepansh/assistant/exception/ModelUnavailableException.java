package com.deepansh.assistant.exception;

/**
 * Network error, timeout or 5xx from the model endpoint, or an open circuit
 * breaker. Only the former are worth retrying.
 */
public class ModelUnavailableException extends ModelGatewayException {

    private final boolean retryable;

    public ModelUnavailableException(String message, Throwable cause) {
        this(message, cause, true);
    }

    public ModelUnavailableException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    @Override
    public boolean isTransient() {
        return retryable;
    }
}
