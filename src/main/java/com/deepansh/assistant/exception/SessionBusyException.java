package com.deepansh.assistant.exception;

/** Another turn holds the session lock. */
public class SessionBusyException extends AssistantException {

    public SessionBusyException(String message) {
        super(message);
    }
}
