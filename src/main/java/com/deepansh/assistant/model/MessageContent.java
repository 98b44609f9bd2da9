package com.deepansh.assistant.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Message body: either one string or an ordered list of parts.
 * Serializes to exactly one of those two JSON shapes.
 */
@EqualsAndHashCode
public final class MessageContent {

    private final String text;
    private final List<ContentPart> parts;

    private MessageContent(String text, List<ContentPart> parts) {
        this.text = text;
        this.parts = parts;
    }

    public static MessageContent text(String text) {
        return new MessageContent(text != null ? text : "", null);
    }

    public static MessageContent parts(List<ContentPart> parts) {
        if (parts == null || parts.isEmpty()) {
            throw new IllegalArgumentException("content parts must not be empty");
        }
        return new MessageContent(null, List.copyOf(parts));
    }

    public boolean isText() {
        return parts == null;
    }

    public String getText() {
        return text;
    }

    public List<ContentPart> getParts() {
        return parts != null ? parts : List.of();
    }

    /** Text of the string form, or the text parts joined with spaces. */
    public String asPlainText() {
        if (isText()) {
            return text;
        }
        return parts.stream()
                .filter(TextPart.class::isInstance)
                .map(p -> ((TextPart) p).getText())
                .collect(Collectors.joining(" "));
    }

    @JsonValue
    public Object toJson() {
        return isText() ? text : parts;
    }

    @Override
    public String toString() {
        return isText() ? text : parts.toString();
    }
}
