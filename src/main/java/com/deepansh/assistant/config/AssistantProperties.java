package com.deepansh.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Orchestration settings, bound from application.yml under "assistant".
 */
@Component
@ConfigurationProperties(prefix = "assistant")
@Data
public class AssistantProperties {

    /** Upper bound on model calls per user message */
    private int maxRounds = 8;

    /**
     * How long a second request waits for the in-flight turn before it is
     * rejected as busy. Zero rejects immediately.
     */
    private Duration sessionBusyWait = Duration.ZERO;

    /** Run the tool calls of one round concurrently; results keep request order */
    private boolean parallelToolCalls = false;

    /** Seeded as the first message and re-seeded after every clear. Blank disables it. */
    private String systemPrompt = "";
}
