package com.deepansh.assistant.model;

import lombok.Value;

/**
 * Outcome of one tool call. {@code content} is what the model reads: the
 * payload on success, an {@code ERROR:} line otherwise.
 */
@Value
public class ToolResultPart implements ContentPart {

    String toolCallId;
    String toolName;
    boolean success;
    ToolResult.ErrorType errorType;
    String content;

    public static ToolResultPart from(ToolResult result) {
        String content = result.isSuccess()
                ? result.getPayload()
                : "ERROR: " + result.getErrorDetail();
        return new ToolResultPart(result.getToolCallId(), result.getToolName(),
                result.isSuccess(), result.getErrorType(), content);
    }

    @Override
    public String getType() {
        return "tool_result";
    }
}
