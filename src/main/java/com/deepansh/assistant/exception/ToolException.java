package com.deepansh.assistant.exception;

/**
 * Tool call that could not complete at the connection level. The
 * orchestrator turns these into failed tool results; they never reach
 * the HTTP layer.
 */
public abstract class ToolException extends AssistantException {

    protected ToolException(String message) {
        super(message);
    }

    protected ToolException(String message, Throwable cause) {
        super(message, cause);
    }
}
