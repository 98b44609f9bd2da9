package com.deepansh.assistant.core;

import com.deepansh.assistant.model.ToolCallRequest;
import com.deepansh.assistant.observability.TurnMetrics;
import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one handleUserMessage call, passed through the tool-call
 * loop instead of living in fields on the orchestrator.
 */
@Data
public class TurnContext {

    private final String userInput;
    private final TurnMetrics metrics = new TurnMetrics();
    private final List<ToolCallRequest> executedToolCalls = new ArrayList<>();
    private int roundsUsed;
}
