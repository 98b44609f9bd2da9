package com.deepansh.assistant.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCallRequest {

    /** ID assigned by the model, echoed back on the matching tool message */
    private String id;

    private String toolName;

    private Map<String, Object> arguments;
}
