package com.deepansh.assistant.exception;

public class ToolUnavailableException extends ToolException {

    public ToolUnavailableException(String message) {
        super(message);
    }

    public ToolUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
