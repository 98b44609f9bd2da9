package com.deepansh.assistant.exception;

/** The model endpoint rejected the credentials (401/403). */
public class ModelAuthException extends ModelGatewayException {

    public ModelAuthException(String message) {
        super(message);
    }

    @Override
    public boolean isTransient() {
        return false;
    }
}
