package com.deepansh.assistant.llm;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Connection settings for the OpenAI-compatible completion endpoint.
 * Bound from application.yml under "model".
 */
@Component
@ConfigurationProperties(prefix = "model")
@Data
public class ModelProperties {

    /** Label used in logs and error messages */
    private String provider = "github-models";

    private String baseUrl = "https://models.inference.ai.azure.com";
    private String apiKey = "";
    private String model = "gpt-4o";

    /** Sent as the api-version query parameter when set (Azure-style endpoints) */
    private String apiVersion = "";

    private double temperature = 1.0;
    private double topP = 1.0;

    /** Omitted from the request when null */
    private Integer maxTokens;

    private Duration connectTimeout = Duration.ofSeconds(10);
    private Duration readTimeout = Duration.ofSeconds(60);
}
