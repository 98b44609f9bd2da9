package com.deepansh.assistant.model;

import lombok.Value;

@Value
public class TextPart implements ContentPart {

    String text;

    @Override
    public String getType() {
        return "text";
    }
}
