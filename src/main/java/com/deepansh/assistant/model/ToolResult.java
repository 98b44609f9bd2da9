package com.deepansh.assistant.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Result of one tool invocation. Exactly one of {@code payload} and
 * {@code errorDetail} is set.
 */
@Value
@Builder
public class ToolResult {

    public enum ErrorType {
        /** The tool ran and reported a domain error, e.g. an unknown city */
        APPLICATION,
        INVALID_ARGUMENTS,
        UNKNOWN_TOOL,
        UNAVAILABLE,
        TIMEOUT,
        CANCELLED
    }

    @With
    String toolCallId;

    @With
    String toolName;

    boolean success;
    String payload;
    String errorDetail;
    ErrorType errorType;

    public static ToolResult success(String payload) {
        return ToolResult.builder().success(true).payload(payload).build();
    }

    public static ToolResult failure(ErrorType type, String detail) {
        return ToolResult.builder().success(false).errorType(type).errorDetail(detail).build();
    }
}
