package com.deepansh.assistant.exception;

/**
 * Root of the assistant's unchecked exceptions.
 */
public class AssistantException extends RuntimeException {

    public AssistantException(String message) {
        super(message);
    }

    public AssistantException(String message, Throwable cause) {
        super(message, cause);
    }
}
