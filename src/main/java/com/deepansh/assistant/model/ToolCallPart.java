package com.deepansh.assistant.model;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tool invocation requested by the model, recorded on the assistant turn.
 */
@Value
public class ToolCallPart implements ContentPart {

    String id;
    String name;
    Map<String, Object> arguments;

    public static ToolCallPart from(ToolCallRequest request) {
        Map<String, Object> arguments = request.getArguments() != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(request.getArguments()))
                : Map.of();
        return new ToolCallPart(request.getId(), request.getToolName(), arguments);
    }

    public ToolCallRequest toRequest() {
        return ToolCallRequest.builder().id(id).toolName(name).arguments(arguments).build();
    }

    @Override
    public String getType() {
        return "tool_call";
    }

    public String getText() {
        return "Calling " + name + " " + (arguments != null ? arguments : Map.of());
    }
}
