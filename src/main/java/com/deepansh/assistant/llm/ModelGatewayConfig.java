package com.deepansh.assistant.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

/**
 * Creates the raw completion gateway. The resilient decorator wraps it and is
 * what the orchestrator receives.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class ModelGatewayConfig {

    private final ModelProperties props;

    @PostConstruct
    public void logActiveModel() {
        log.info("================================================================");
        log.info("  Model provider : {}", props.getProvider());
        log.info("  Endpoint       : {}", props.getBaseUrl());
        log.info("  Model          : {}", props.getModel());
        logKey(props.getApiKey());
        log.info("================================================================");
    }

    @Bean("rawModelGateway")
    public ModelGateway rawModelGateway(ObjectMapper objectMapper, RestClient.Builder modelRestClientBuilder) {
        return new OpenAiModelGateway(props, objectMapper, modelRestClientBuilder.clone());
    }

    private void logKey(String key) {
        if (key == null || key.isBlank()) {
            log.error("  API key not set! Set env var GITHUB_TOKEN (or model.api-key)");
        } else {
            log.info("  Key            : {}...{}", key.substring(0, Math.min(4, key.length())),
                    key.length() > 8 ? key.substring(key.length() - 4) : "");
        }
    }
}
