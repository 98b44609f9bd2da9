package com.deepansh.assistant.observability;

import java.util.ArrayList;
import java.util.List;

/**
 * Timing and token usage of one turn, logged when the turn ends.
 * Tool calls may be recorded from several threads.
 */
public class TurnMetrics {

    private final long startTimeMs = System.currentTimeMillis();
    private final List<ToolCallRecord> toolCallRecords = new ArrayList<>();

    private int promptTokens;
    private int completionTokens;

    public synchronized void recordToolCall(String toolName, long latencyMs, boolean success) {
        toolCallRecords.add(new ToolCallRecord(toolName, latencyMs, success));
    }

    public synchronized void addTokens(int prompt, int completion) {
        this.promptTokens += prompt;
        this.completionTokens += completion;
    }

    public synchronized List<ToolCallRecord> toolCallRecords() {
        return List.copyOf(toolCallRecords);
    }

    public synchronized int totalTokens() {
        return promptTokens + completionTokens;
    }

    public long elapsedMs() {
        return System.currentTimeMillis() - startTimeMs;
    }

    public record ToolCallRecord(String toolName, long latencyMs, boolean success) {
    }
}
