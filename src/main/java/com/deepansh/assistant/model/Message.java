package com.deepansh.assistant.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * One turn of the conversation. Immutable: the store stamps {@code sequence}
 * and {@code createdAt} by building a copy on append.
 */
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Message {

    public enum Role {
        system, user, assistant, tool
    }

    Role role;
    MessageContent content;

    /** Present when role = tool: the id of the tool call this message answers */
    String toolCallId;

    /** Present when role = tool: the name of the tool that produced the result */
    String name;

    /** Position in the store, assigned on append. Zero until then. */
    long sequence;

    Instant createdAt;

    public static Message system(String text) {
        return Message.builder().role(Role.system).content(MessageContent.text(text)).build();
    }

    public static Message user(String text) {
        return Message.builder()
                .role(Role.user)
                .content(MessageContent.parts(List.of(new TextPart(text))))
                .build();
    }

    public static Message assistant(String text) {
        return Message.builder().role(Role.assistant).content(MessageContent.text(text)).build();
    }

    /**
     * Assistant turn that records every tool call the model asked for, in the
     * order it listed them.
     */
    public static Message assistantToolCalls(List<ToolCallRequest> toolCalls) {
        List<ContentPart> parts = toolCalls.stream()
                .<ContentPart>map(ToolCallPart::from)
                .toList();
        return Message.builder().role(Role.assistant).content(MessageContent.parts(parts)).build();
    }

    public static Message tool(ToolResult result) {
        if (result.getToolCallId() == null || result.getToolCallId().isBlank()) {
            throw new IllegalArgumentException("tool message requires a toolCallId");
        }
        return Message.builder()
                .role(Role.tool)
                .toolCallId(result.getToolCallId())
                .name(result.getToolName())
                .content(MessageContent.parts(List.of(ToolResultPart.from(result))))
                .build();
    }

    /** Tool-call requests recorded on an assistant turn, empty for every other message. */
    public List<ToolCallRequest> toolCalls() {
        if (role != Role.assistant || content == null || content.isText()) {
            return List.of();
        }
        return content.getParts().stream()
                .filter(ToolCallPart.class::isInstance)
                .map(p -> ((ToolCallPart) p).toRequest())
                .toList();
    }
}
