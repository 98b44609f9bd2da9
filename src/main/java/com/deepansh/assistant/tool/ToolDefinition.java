package com.deepansh.assistant.tool;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Schema of one tool as advertised to the model.
 */
@Value
@Builder
public class ToolDefinition {

    String name;
    String description;
    Map<String, Object> inputSchema;

    /**
     * OpenAI's tool format:
     * { "type": "function", "function": { "name", "description", "parameters" } }
     */
    public Map<String, Object> toOpenAiSchema() {
        return Map.of(
                "type", "function",
                "function", Map.of(
                        "name", name,
                        "description", description != null ? description : "",
                        "parameters", inputSchema != null
                                ? inputSchema
                                : Map.of("type", "object", "properties", Map.of())
                )
        );
    }
}
