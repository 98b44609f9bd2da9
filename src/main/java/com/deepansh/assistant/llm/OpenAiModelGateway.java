package com.deepansh.assistant.llm;

import com.deepansh.assistant.exception.ModelAuthException;
import com.deepansh.assistant.exception.ModelGatewayException;
import com.deepansh.assistant.exception.ModelProtocolException;
import com.deepansh.assistant.exception.ModelRateLimitedException;
import com.deepansh.assistant.exception.ModelUnavailableException;
import com.deepansh.assistant.model.ContentPart;
import com.deepansh.assistant.model.Message;
import com.deepansh.assistant.model.MessageContent;
import com.deepansh.assistant.model.ModelResponse;
import com.deepansh.assistant.model.TextPart;
import com.deepansh.assistant.model.ToolCallRequest;
import com.deepansh.assistant.model.ToolResultPart;
import com.deepansh.assistant.tool.ToolCatalog;
import com.deepansh.assistant.tool.ToolDefinition;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * OpenAI-compatible chat completions client (OpenAI, GitHub Models, Azure).
 *
 * Error handling strategy:
 *
 * | Error                    | Exception                                 |
 * |--------------------------|-------------------------------------------|
 * | 401 / 403                | ModelAuthException (fatal)                |
 * | 429                      | ModelRateLimitedException (retryable)     |
 * | 5xx, network, timeout    | ModelUnavailableException (retryable)     |
 * | other 4xx, bad response  | ModelProtocolException (fatal)            |
 */
@Slf4j
public class OpenAiModelGateway implements ModelGateway {

    private final ModelProperties props;
    private final ObjectMapper objectMapper;
    private final RestClient restClient;

    public OpenAiModelGateway(ModelProperties props,
                              ObjectMapper objectMapper,
                              RestClient.Builder restClientBuilder) {
        this.props = props;
        this.objectMapper = objectMapper;
        this.restClient = restClientBuilder
                .baseUrl(props.getBaseUrl())
                .defaultHeader("Authorization", "Bearer " + props.getApiKey())
                .build();
    }

    @Override
    public ModelResponse complete(List<Message> history, ToolCatalog tools) {
        Map<String, Object> requestBody = buildRequestBody(history, tools);

        log.debug("Sending {} messages and {} tools to {} [model={}]",
                history.size(), tools.size(), props.getProvider(), props.getModel());

        RestClient.RequestBodySpec request = hasApiVersion()
                ? restClient.post().uri("/chat/completions?api-version={version}", props.getApiVersion())
                : restClient.post().uri("/chat/completions");

        Map<String, Object> response;
        try {
            response = request
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (req, res) -> {
                        String body = new String(res.getBody().readAllBytes(), StandardCharsets.UTF_8);
                        log.error("{} {} : {}", props.getProvider(), res.getStatusCode(), body);
                        throw mapError(res.getStatusCode().value(), body);
                    })
                    .body(new ParameterizedTypeReference<>() {});
        } catch (ModelGatewayException e) {
            throw e;
        } catch (ResourceAccessException e) {
            throw new ModelUnavailableException(
                    props.getProvider() + " is unreachable: " + e.getMessage(), e);
        } catch (RestClientException e) {
            throw new ModelProtocolException(
                    props.getProvider() + " returned an unreadable response: " + e.getMessage(), e);
        }

        if (response == null) {
            throw new ModelProtocolException(props.getProvider() + " returned an empty body");
        }
        return parseResponse(response);
    }

    private boolean hasApiVersion() {
        return props.getApiVersion() != null && !props.getApiVersion().isBlank();
    }

    ModelGatewayException mapError(int statusCode, String body) {
        if (statusCode == 401 || statusCode == 403) {
            return new ModelAuthException(
                    props.getProvider() + " rejected the API key [" + statusCode + "]. Check the model.api-key setting.");
        }
        if (statusCode == 429) {
            return new ModelRateLimitedException(props.getProvider() + " rate limit exceeded: " + body);
        }
        if (statusCode >= 500) {
            return new ModelUnavailableException(
                    props.getProvider() + " server error [" + statusCode + "]: " + body, null);
        }
        return new ModelProtocolException(props.getProvider() + " client error [" + statusCode + "]: " + body);
    }

    Map<String, Object> buildRequestBody(List<Message> history, ToolCatalog tools) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", props.getModel());
        body.put("messages", history.stream().map(this::formatMessage).toList());
        body.put("temperature", props.getTemperature());
        body.put("top_p", props.getTopP());
        if (props.getMaxTokens() != null) {
            body.put("max_tokens", props.getMaxTokens());
        }

        if (!tools.isEmpty()) {
            body.put("tools", tools.definitions().stream().map(ToolDefinition::toOpenAiSchema).toList());
            body.put("tool_choice", "auto");
        }
        return body;
    }

    private Map<String, Object> formatMessage(Message msg) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("role", msg.getRole().name());
        MessageContent content = msg.getContent();

        switch (msg.getRole()) {
            case tool -> {
                m.put("tool_call_id", msg.getToolCallId());
                m.put("content", toolResultText(content));
            }
            case assistant -> {
                List<ToolCallRequest> toolCalls = msg.toolCalls();
                if (toolCalls.isEmpty()) {
                    m.put("content", content != null ? content.asPlainText() : "");
                } else {
                    // An assistant turn that made tool calls must carry tool_calls,
                    // otherwise the following tool messages cannot be correlated.
                    String text = content.asPlainText();
                    m.put("content", text.isEmpty() ? null : text);
                    m.put("tool_calls", toolCalls.stream().map(this::formatToolCall).toList());
                }
            }
            case user -> m.put("content", formatUserContent(content));
            default -> m.put("content", content != null ? content.asPlainText() : "");
        }
        return m;
    }

    private Object formatUserContent(MessageContent content) {
        if (content == null) {
            return "";
        }
        if (content.isText()) {
            return content.getText();
        }
        List<Map<String, Object>> parts = new ArrayList<>();
        for (ContentPart part : content.getParts()) {
            if (part instanceof TextPart text) {
                parts.add(Map.of("type", "text", "text", text.getText()));
            }
        }
        return parts;
    }

    private String toolResultText(MessageContent content) {
        if (content == null) {
            return "";
        }
        if (content.isText()) {
            return content.getText();
        }
        return content.getParts().stream()
                .map(p -> p instanceof ToolResultPart r ? r.getContent() : content.asPlainText())
                .collect(Collectors.joining("\n"));
    }

    private Map<String, Object> formatToolCall(ToolCallRequest call) {
        Map<String, Object> fn = new LinkedHashMap<>();
        fn.put("name", call.getToolName());
        try {
            fn.put("arguments", objectMapper.writeValueAsString(
                    call.getArguments() != null ? call.getArguments() : Map.of()));
        } catch (JsonProcessingException e) {
            fn.put("arguments", "{}");
        }

        Map<String, Object> tc = new LinkedHashMap<>();
        tc.put("id", call.getId());
        tc.put("type", "function");
        tc.put("function", fn);
        return tc;
    }

    @SuppressWarnings("unchecked")
    ModelResponse parseResponse(Map<String, Object> response) {
        if (!(response.get("choices") instanceof List<?> choices) || choices.isEmpty()) {
            throw new ModelProtocolException(props.getProvider() + " returned no choices in response");
        }

        int promptTokens = 0, completionTokens = 0;
        if (response.get("usage") instanceof Map<?, ?> usage) {
            promptTokens = intValue(usage.get("prompt_tokens"));
            completionTokens = intValue(usage.get("completion_tokens"));
            log.debug("Token usage: prompt={} completion={}", promptTokens, completionTokens);
        }

        if (!(choices.get(0) instanceof Map<?, ?> choice)
                || !(choice.get("message") instanceof Map<?, ?> message)) {
            throw new ModelProtocolException(props.getProvider() + " returned a choice without a message");
        }
        log.debug("{} finish_reason: {}", props.getProvider(), choice.get("finish_reason"));

        if (message.get("tool_calls") instanceof List<?> rawCalls && !rawCalls.isEmpty()) {
            List<ToolCallRequest> calls = new ArrayList<>();
            for (Object raw : rawCalls) {
                if (!(raw instanceof Map<?, ?> rawCall)) {
                    throw new ModelProtocolException(
                            props.getProvider() + " returned a tool call that is not an object: " + raw);
                }
                calls.add(parseToolCall((Map<String, Object>) rawCall));
            }
            return ModelResponse.toolCalls(calls, promptTokens, completionTokens);
        }

        if (!(message.get("content") instanceof String content)) {
            throw new ModelProtocolException(
                    props.getProvider() + " returned neither content nor tool calls");
        }
        return ModelResponse.finalText(content, promptTokens, completionTokens);
    }

    @SuppressWarnings("unchecked")
    private ToolCallRequest parseToolCall(Map<String, Object> raw) {
        if (raw == null || !(raw.get("function") instanceof Map<?, ?> fn)
                || !(fn.get("name") instanceof String name) || name.isBlank()) {
            throw new ModelProtocolException(props.getProvider() + " returned a tool call without a function name");
        }

        String id = raw.get("id") instanceof String s && !s.isBlank()
                ? s
                : "call-" + UUID.randomUUID().toString().substring(0, 8);

        return ToolCallRequest.builder()
                .id(id)
                .toolName(name)
                .arguments(parseArguments(name, fn.get("arguments")))
                .build();
    }

    /**
     * Arguments arrive as a JSON string. Anything that is not a JSON object
     * becomes an empty map so the call still reaches the tool, which can then
     * report what is missing.
     */
    @SuppressWarnings("unchecked")
    private Map<String, Object> parseArguments(String toolName, Object rawArguments) {
        if (rawArguments instanceof Map<?, ?> map) {
            return readOnly((Map<String, Object>) map);
        }
        if (!(rawArguments instanceof String json) || json.isBlank()) {
            return Map.of();
        }
        try {
            Object parsed = objectMapper.readValue(json, Object.class);
            if (parsed instanceof Map<?, ?> map) {
                return readOnly((Map<String, Object>) map);
            }
            log.warn("Arguments for tool [{}] are not a JSON object: {}", toolName, json);
        } catch (JsonProcessingException e) {
            log.warn("Unparseable arguments for tool [{}]: {}", toolName, json);
        }
        return Map.of();
    }

    /** Keeps JSON nulls, which Map.copyOf would reject. */
    private static Map<String, Object> readOnly(Map<String, Object> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    private static int intValue(Object value) {
        return value instanceof Number n ? n.intValue() : 0;
    }
}
