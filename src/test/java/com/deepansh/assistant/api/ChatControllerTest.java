package com.deepansh.assistant.api;

import com.deepansh.assistant.core.ChatOrchestrator;
import com.deepansh.assistant.exception.GlobalExceptionHandler;
import com.deepansh.assistant.exception.InvalidInputException;
import com.deepansh.assistant.exception.SessionBusyException;
import com.deepansh.assistant.model.FinalAnswer;
import com.deepansh.assistant.model.Message;
import com.deepansh.assistant.model.ToolCallRequest;
import com.deepansh.assistant.model.ToolResult;
import com.deepansh.assistant.tool.ToolCatalog;
import com.deepansh.assistant.tool.ToolDefinition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class ChatControllerTest {

    @Mock ChatOrchestrator orchestrator;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new ChatController(orchestrator))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void sendMessage_returnsAnswerAndEchoesMessage() throws Exception {
        when(orchestrator.handleUserMessage("Seattle")).thenReturn(FinalAnswer.builder()
                .text("Take an umbrella.")
                .status(FinalAnswer.Status.COMPLETE)
                .roundsUsed(2)
                .build());

        mockMvc.perform(post("/api/send_message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Seattle\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.response").value("Take an umbrella."))
                .andExpect(jsonPath("$.message").value("Seattle"))
                .andExpect(jsonPath("$.status").value("COMPLETE"));
    }

    @Test
    void sendMessage_blankMessage_returns400() throws Exception {
        mockMvc.perform(post("/api/send_message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Message is required"))
                .andExpect(jsonPath("$.timestamp").exists());

        verifyNoInteractions(orchestrator);
    }

    @Test
    void sendMessage_missingBody_returns400() throws Exception {
        mockMvc.perform(post("/api/send_message").contentType(MediaType.APPLICATION_JSON))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Message is required"));
    }

    @Test
    void sendMessage_invalidInputFromOrchestrator_returns400() throws Exception {
        when(orchestrator.handleUserMessage(anyString())).thenThrow(new InvalidInputException("Message is required"));

        mockMvc.perform(post("/api/send_message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"x\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void sendMessage_sessionBusy_returns409() throws Exception {
        when(orchestrator.handleUserMessage("Seattle"))
                .thenThrow(new SessionBusyException("Another message is still being processed"));

        mockMvc.perform(post("/api/send_message")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"message\":\"Seattle\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Another message is still being processed"));
    }

    @Test
    void weather_defaultsToSeattle() throws Exception {
        when(orchestrator.handleUserMessage("I'm in Seattle. What do I need to do before leaving the house?"))
                .thenReturn(FinalAnswer.builder().text("Bring a jacket.").status(FinalAnswer.Status.COMPLETE).build());

        mockMvc.perform(get("/api/weather"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.weatherInfo").value("Bring a jacket."))
                .andExpect(jsonPath("$.city").value("Seattle"));
    }

    @Test
    void messageHistory_exposesContentShapesTheFrontEndReads() throws Exception {
        ToolCallRequest call = ToolCallRequest.builder()
                .id("c1").toolName("get-weather").arguments(Map.of("location", "Seattle")).build();
        when(orchestrator.getHistory()).thenReturn(List.of(
                Message.user("Seattle"),
                Message.assistantToolCalls(List.of(call)),
                Message.tool(ToolResult.success("Rain").withToolCallId("c1").withToolName("get-weather")),
                Message.assistant("Take an umbrella.")));

        mockMvc.perform(get("/api/message_history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.messageHistory[0].role").value("user"))
                .andExpect(jsonPath("$.messageHistory[0].content[0].type").value("text"))
                .andExpect(jsonPath("$.messageHistory[0].content[0].text").value("Seattle"))
                .andExpect(jsonPath("$.messageHistory[1].content[0].type").value("tool_call"))
                .andExpect(jsonPath("$.messageHistory[1].content[0].text").exists())
                .andExpect(jsonPath("$.messageHistory[2].toolCallId").value("c1"))
                .andExpect(jsonPath("$.messageHistory[2].content[0].type").value("tool_result"))
                .andExpect(jsonPath("$.messageHistory[2].content[0].content").value("Rain"))
                .andExpect(jsonPath("$.messageHistory[3].content").value("Take an umbrella."));
    }

    @Test
    void clearHistory_returnsSuccess() throws Exception {
        mockMvc.perform(post("/api/clear_history"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.message").value("Message history cleared"));

        verify(orchestrator).clearHistory();
    }

    @Test
    void modelResponse_returnsLatestAnswer() throws Exception {
        when(orchestrator.getLatestResponse()).thenReturn("Take an umbrella.");

        mockMvc.perform(get("/api/model_response"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.modelResponse").value("Take an umbrella."));
    }

    @Test
    void health_reportsToolCount() throws Exception {
        when(orchestrator.getToolCatalog()).thenReturn(ToolCatalog.of(List.of(
                ToolDefinition.builder().name("get-weather").build())));

        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.tools").value(1));
    }
}
