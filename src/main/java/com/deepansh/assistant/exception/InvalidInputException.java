package com.deepansh.assistant.exception;

/** User input rejected before any state change. */
public class InvalidInputException extends AssistantException {

    public InvalidInputException(String message) {
        super(message);
    }
}
