package com.deepansh.assistant.exception;

/** HTTP 429 from the model endpoint. */
public class ModelRateLimitedException extends ModelGatewayException {

    public ModelRateLimitedException(String message) {
        super(message);
    }

    @Override
    public boolean isTransient() {
        return true;
    }
}
