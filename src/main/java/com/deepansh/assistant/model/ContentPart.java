package com.deepansh.assistant.model;

/**
 * One element of a multi-part message body. Every part exposes either a
 * {@code text} or a {@code content} property in its JSON form so a display
 * layer can render it without knowing the part type.
 */
public interface ContentPart {

    /** Discriminator written to JSON: text, tool_call or tool_result */
    String getType();
}
