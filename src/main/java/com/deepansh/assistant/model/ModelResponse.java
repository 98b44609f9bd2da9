package com.deepansh.assistant.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.util.List;

/**
 * What one completion call produced: a final answer or a list of tool calls.
 * The {@link Kind} is the only branch point for callers.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ModelResponse {

    public enum Kind {
        FINAL_TEXT, TOOL_CALLS
    }

    Kind kind;

    /** Set when kind = FINAL_TEXT */
    String content;

    /** Non-empty when kind = TOOL_CALLS, in the order the model listed them */
    List<ToolCallRequest> toolCalls;

    int promptTokens;
    int completionTokens;

    public static ModelResponse finalText(String content) {
        return finalText(content, 0, 0);
    }

    public static ModelResponse finalText(String content, int promptTokens, int completionTokens) {
        return new ModelResponse(Kind.FINAL_TEXT, content != null ? content : "", List.of(),
                promptTokens, completionTokens);
    }

    public static ModelResponse toolCalls(List<ToolCallRequest> toolCalls) {
        return toolCalls(toolCalls, 0, 0);
    }

    public static ModelResponse toolCalls(List<ToolCallRequest> toolCalls, int promptTokens, int completionTokens) {
        if (toolCalls == null || toolCalls.isEmpty()) {
            throw new IllegalArgumentException("a tool-call response needs at least one tool call");
        }
        return new ModelResponse(Kind.TOOL_CALLS, null, List.copyOf(toolCalls),
                promptTokens, completionTokens);
    }

    public boolean isFinalText() {
        return kind == Kind.FINAL_TEXT;
    }
}
