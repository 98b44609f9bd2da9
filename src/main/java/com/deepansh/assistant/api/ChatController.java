package com.deepansh.assistant.api;

import com.deepansh.assistant.core.ChatOrchestrator;
import com.deepansh.assistant.model.ChatRequest;
import com.deepansh.assistant.model.FinalAnswer;
import com.deepansh.assistant.model.Message;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Routes used by the chat front end.
 *
 * POST /api/send_message     {message} → {response, message, status}
 * GET  /api/message_history  → {messageHistory}, system messages excluded
 * POST /api/clear_history
 * GET  /api/model_response   → latest answer text
 * GET  /api/weather?city=... legacy one-shot question
 * GET  /api/health
 */
@RestController
@RequestMapping("/api")
@CrossOrigin
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    static final String DEFAULT_CITY = "Seattle";

    private final ChatOrchestrator orchestrator;

    @PostMapping("/send_message")
    public ResponseEntity<Map<String, Object>> sendMessage(@Valid @RequestBody ChatRequest request) {
        log.info("send_message request [length={}]", request.getMessage().length());
        FinalAnswer answer = orchestrator.handleUserMessage(request.getMessage());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("response", answer.getText());
        body.put("message", request.getMessage());
        body.put("status", answer.getStatus());
        return ResponseEntity.ok(body);
    }

    @GetMapping("/weather")
    public ResponseEntity<Map<String, Object>> weather(
            @RequestParam(value = "city", defaultValue = DEFAULT_CITY) String city) {
        String question = "I'm in " + city + ". What do I need to do before leaving the house?";
        FinalAnswer answer = orchestrator.handleUserMessage(question);
        return ResponseEntity.ok(Map.of("weatherInfo", answer.getText(), "city", city));
    }

    @GetMapping("/model_response")
    public ResponseEntity<Map<String, String>> modelResponse() {
        return ResponseEntity.ok(Map.of("modelResponse", orchestrator.getLatestResponse()));
    }

    @GetMapping("/message_history")
    public ResponseEntity<Map<String, List<Message>>> messageHistory() {
        return ResponseEntity.ok(Map.of("messageHistory", orchestrator.getHistory()));
    }

    @PostMapping("/clear_history")
    public ResponseEntity<Map<String, String>> clearHistory() {
        orchestrator.clearHistory();
        return ResponseEntity.ok(Map.of("status", "success", "message", "Message history cleared"));
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of("status", "UP", "tools", orchestrator.getToolCatalog().size()));
    }
}
