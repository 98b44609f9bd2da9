package com.deepansh.assistant.exception;

public class ToolTimeoutException extends ToolException {

    public ToolTimeoutException(String message) {
        super(message);
    }
}
