package com.deepansh.assistant.llm;

import com.deepansh.assistant.exception.ModelAuthException;
import com.deepansh.assistant.exception.ModelProtocolException;
import com.deepansh.assistant.exception.ModelRateLimitedException;
import com.deepansh.assistant.exception.ModelUnavailableException;
import com.deepansh.assistant.model.Message;
import com.deepansh.assistant.model.ModelResponse;
import com.deepansh.assistant.model.ToolCallRequest;
import com.deepansh.assistant.model.ToolResult;
import com.deepansh.assistant.tool.ToolCatalog;
import com.deepansh.assistant.tool.ToolDefinition;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.*;
import static org.springframework.test.web.client.response.MockRestResponseCreators.*;

class OpenAiModelGatewayTest {

    private static final String URL = "https://models.test/chat/completions?api-version=2024-08-01-preview";

    private static final ToolCatalog CATALOG = ToolCatalog.of(List.of(
            ToolDefinition.builder()
                    .name("get-weather")
                    .description("Current weather for a location")
                    .inputSchema(Map.of("type", "object",
                            "properties", Map.of("location", Map.of("type", "string"))))
                    .build()));

    private MockRestServiceServer server;
    private OpenAiModelGateway gateway;

    @BeforeEach
    void setUp() {
        ModelProperties props = new ModelProperties();
        props.setBaseUrl("https://models.test");
        props.setApiKey("test-token");
        props.setModel("gpt-4o");
        props.setApiVersion("2024-08-01-preview");

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        gateway = new OpenAiModelGateway(props, new ObjectMapper(), builder);
    }

    @Test
    void complete_finalText_sendsToolsAndAuthHeader() {
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Bearer test-token"))
                .andExpect(jsonPath("$.model").value("gpt-4o"))
                .andExpect(jsonPath("$.tool_choice").value("auto"))
                .andExpect(jsonPath("$.tools[0].function.name").value("get-weather"))
                .andExpect(jsonPath("$.messages[0].role").value("system"))
                .andExpect(jsonPath("$.messages[1].content[0].type").value("text"))
                .andExpect(jsonPath("$.messages[1].content[0].text").value("Seattle?"))
                .andRespond(withSuccess("""
                        {"choices":[{"message":{"role":"assistant","content":"Take an umbrella."},
                          "finish_reason":"stop"}],
                         "usage":{"prompt_tokens":120,"completion_tokens":8}}
                        """, MediaType.APPLICATION_JSON));

        ModelResponse response = gateway.complete(
                List.of(Message.system("Be brief."), Message.user("Seattle?")), CATALOG);

        assertThat(response.isFinalText()).isTrue();
        assertThat(response.getContent()).isEqualTo("Take an umbrella.");
        assertThat(response.getPromptTokens()).isEqualTo(120);
        assertThat(response.getCompletionTokens()).isEqualTo(8);
        server.verify();
    }

    @Test
    void complete_multipleToolCalls_keepsModelOrder() {
        server.expect(requestTo(URL))
                .andRespond(withSuccess("""
                        {"choices":[{"message":{"role":"assistant","content":null,"tool_calls":[
                          {"id":"call_1","type":"function",
                           "function":{"name":"get-weather","arguments":"{\\"location\\":\\"Seattle\\"}"}},
                          {"id":"call_2","type":"function",
                           "function":{"name":"get-air-quality","arguments":"{\\"location\\":\\"Seattle\\"}"}}
                        ]},"finish_reason":"tool_calls"}]}
                        """, MediaType.APPLICATION_JSON));

        ModelResponse response = gateway.complete(List.of(Message.user("Seattle?")), CATALOG);

        assertThat(response.getKind()).isEqualTo(ModelResponse.Kind.TOOL_CALLS);
        assertThat(response.getToolCalls()).extracting(ToolCallRequest::getId).containsExactly("call_1", "call_2");
        assertThat(response.getToolCalls().get(0).getArguments()).containsEntry("location", "Seattle");
    }

    @Test
    void complete_toolHistory_isSerializedWithToolCallIds() {
        ToolCallRequest call = ToolCallRequest.builder()
                .id("call_1").toolName("get-weather").arguments(Map.of("location", "Seattle")).build();
        List<Message> history = List.of(
                Message.user("Seattle?"),
                Message.assistantToolCalls(List.of(call)),
                Message.tool(ToolResult.success("Rain").withToolCallId("call_1").withToolName("get-weather")));

        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.messages[1].tool_calls[0].id").value("call_1"))
                .andExpect(jsonPath("$.messages[1].tool_calls[0].function.arguments").value("{\"location\":\"Seattle\"}"))
                .andExpect(jsonPath("$.messages[2].role").value("tool"))
                .andExpect(jsonPath("$.messages[2].tool_call_id").value("call_1"))
                .andExpect(jsonPath("$.messages[2].content").value("Rain"))
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\"Umbrella.\"}}]}",
                        MediaType.APPLICATION_JSON));

        assertThat(gateway.complete(history, CATALOG).getContent()).isEqualTo("Umbrella.");
        server.verify();
    }

    @Test
    void complete_emptyCatalog_omitsTools() {
        server.expect(requestTo(URL))
                .andExpect(jsonPath("$.tools").doesNotExist())
                .andExpect(jsonPath("$.tool_choice").doesNotExist())
                .andRespond(withSuccess("{\"choices\":[{\"message\":{\"content\":\"Hi\"}}]}",
                        MediaType.APPLICATION_JSON));

        assertThat(gateway.complete(List.of(Message.user("hi")), ToolCatalog.empty()).getContent()).isEqualTo("Hi");
    }

    @Test
    void complete_unauthorized_throwsAuthException() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.UNAUTHORIZED).body("bad credentials"));

        assertThatThrownBy(() -> gateway.complete(List.of(Message.user("hi")), CATALOG))
                .isInstanceOf(ModelAuthException.class)
                .satisfies(e -> assertThat(((ModelAuthException) e).isTransient()).isFalse());
    }

    @Test
    void complete_tooManyRequests_throwsRetryableRateLimit() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS).body("slow down"));

        assertThatThrownBy(() -> gateway.complete(List.of(Message.user("hi")), CATALOG))
                .isInstanceOf(ModelRateLimitedException.class)
                .satisfies(e -> assertThat(((ModelRateLimitedException) e).isTransient()).isTrue());
    }

    @Test
    void complete_serverError_throwsRetryableUnavailable() {
        server.expect(requestTo(URL)).andRespond(withServerError());

        assertThatThrownBy(() -> gateway.complete(List.of(Message.user("hi")), CATALOG))
                .isInstanceOf(ModelUnavailableException.class)
                .satisfies(e -> assertThat(((ModelUnavailableException) e).isTransient()).isTrue());
    }

    @Test
    void complete_badRequest_throwsProtocolException() {
        server.expect(requestTo(URL)).andRespond(withBadRequest().body("unknown model"));

        assertThatThrownBy(() -> gateway.complete(List.of(Message.user("hi")), CATALOG))
                .isInstanceOf(ModelProtocolException.class)
                .hasMessageContaining("400");
    }

    @Test
    void parseResponse_noChoices_throwsProtocolException() {
        assertThatThrownBy(() -> gateway.parseResponse(Map.of("choices", List.of())))
                .isInstanceOf(ModelProtocolException.class);
    }

    @Test
    void parseResponse_neitherContentNorToolCalls_throwsProtocolException() {
        Map<String, Object> response = Map.of("choices", List.of(Map.of("message", Map.of("role", "assistant"))));

        assertThatThrownBy(() -> gateway.parseResponse(response)).isInstanceOf(ModelProtocolException.class);
    }

    @Test
    void parseResponse_unparseableArguments_becomeEmptyMap() {
        Map<String, Object> response = Map.of("choices", List.of(Map.of("message", Map.of(
                "tool_calls", List.of(
                        Map.of("id", "a", "function", Map.of("name", "get-weather", "arguments", "not json")),
                        Map.of("id", "b", "function", Map.of("name", "get-weather", "arguments", "[1,2]")),
                        Map.of("function", Map.of("name", "get-weather", "arguments", "")))))));

        ModelResponse parsed = gateway.parseResponse(response);

        assertThat(parsed.getToolCalls()).hasSize(3);
        assertThat(parsed.getToolCalls()).allSatisfy(c -> assertThat(c.getArguments()).isEmpty());
        assertThat(parsed.getToolCalls().get(2).getId()).startsWith("call-");
    }

    @Test
    void parseResponse_toolCallNotAnObject_throwsProtocolException() {
        Map<String, Object> response = Map.of("choices", List.of(Map.of("message", Map.of(
                "tool_calls", List.of("get_weather")))));

        assertThatThrownBy(() -> gateway.parseResponse(response))
                .isInstanceOf(ModelProtocolException.class)
                .hasMessageContaining("not an object");
    }

    @Test
    void parseResponse_arguments_areReadOnly() {
        Map<String, Object> response = Map.of("choices", List.of(Map.of("message", Map.of(
                "tool_calls", List.of(Map.of("id", "a", "function",
                        Map.of("name", "get-weather", "arguments", "{\"city\":\"Seattle\"}")))))));

        Map<String, Object> arguments = gateway.parseResponse(response).getToolCalls().get(0).getArguments();

        assertThat(arguments).containsEntry("city", "Seattle");
        assertThatThrownBy(() -> arguments.put("city", "Oslo"))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void parseResponse_toolCallWithoutName_throwsProtocolException() {
        Map<String, Object> response = Map.of("choices", List.of(Map.of("message", Map.of(
                "tool_calls", List.of(Map.of("id", "a", "function", Map.of("arguments", "{}")))))));

        assertThatThrownBy(() -> gateway.parseResponse(response)).isInstanceOf(ModelProtocolException.class);
    }
}
