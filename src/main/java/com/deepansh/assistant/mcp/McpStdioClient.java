package com.deepansh.assistant.mcp;

import com.deepansh.assistant.config.ToolServerProperties;
import com.deepansh.assistant.exception.ToolTimeoutException;
import com.deepansh.assistant.exception.ToolUnavailableException;
import com.deepansh.assistant.model.ToolResult;
import com.deepansh.assistant.tool.ToolCatalog;
import com.deepansh.assistant.tool.ToolDefinition;
import com.deepansh.assistant.tool.ToolServerConnection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * JSON-RPC 2.0 client for one MCP server running as a child process.
 *
 * <p>
 * Lifecycle:
 * <ol>
 * <li>{@link #connect()} launches the process, sends {@code initialize}, the
 * {@code notifications/initialized} notification and {@code tools/list}
 * <li>{@link #invoke} sends {@code tools/call}
 * <li>{@link #close()} fails pending calls and destroys the process
 * </ol>
 *
 * <p>
 * Requests are newline-delimited JSON on stdin. A reader thread parses stdout
 * and completes the pending future whose id matches each response, so any
 * number of threads may call {@link #invoke} at once over the one connection.
 * Writes are serialized. Stderr is drained to the DEBUG log.
 */
@Slf4j
public class McpStdioClient implements ToolServerConnection {

    static final String JSONRPC_VERSION = "2.0";
    static final String MCP_PROTOCOL_VERSION = "2024-11-05";
    static final int METHOD_NOT_FOUND = -32601;
    static final int INVALID_PARAMS = -32602;
    static final String PING = "ping";

    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final String serverId;
    private final ToolServerProperties.Server config;
    private final ObjectMapper objectMapper;

    private final AtomicInteger nextId = new AtomicInteger(1);
    private final Map<Integer, CompletableFuture<JsonNode>> pendingRequests = new ConcurrentHashMap<>();
    private final Object writeLock = new Object();

    private Process process;
    private BufferedWriter writer;

    private volatile boolean running;
    private volatile boolean closed;
    private volatile ToolCatalog catalog = ToolCatalog.empty();

    public McpStdioClient(String serverId, ToolServerProperties.Server config, ObjectMapper objectMapper) {
        this.serverId = serverId;
        this.config = config;
        this.objectMapper = objectMapper;
    }

    @Override
    public String getServerId() {
        return serverId;
    }

    @Override
    public void connect() {
        if (closed) {
            throw new ToolUnavailableException("Tool server '" + serverId + "' has been released");
        }
        if (config.getCommand() == null || config.getCommand().isBlank()) {
            throw new ToolUnavailableException("No command configured for tool server '" + serverId + "'");
        }

        List<String> command = new ArrayList<>();
        command.add(config.getCommand());
        command.addAll(config.getArgs());
        log.info("[MCP:{}] Starting server: {}", serverId, String.join(" ", command));

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(false);
        pb.environment().putAll(config.getEnv());

        try {
            process = pb.start();
        } catch (IOException e) {
            throw new ToolUnavailableException(
                    "Could not start tool server '" + serverId + "': " + e.getMessage(), e);
        }

        Thread stderrThread = new Thread(() -> drainStderr(process.getErrorStream()), "mcp-stderr-" + serverId);
        stderrThread.setDaemon(true);
        stderrThread.start();

        attach(process.getInputStream(), process.getOutputStream());
    }

    /**
     * Runs the handshake over already-open streams and caches the catalog.
     * On any failure the client is closed and the error rethrown.
     */
    void attach(InputStream stdout, OutputStream stdin) {
        writer = new BufferedWriter(new OutputStreamWriter(stdin, StandardCharsets.UTF_8));
        running = true;

        Thread readerThread = new Thread(() -> readLoop(stdout), "mcp-reader-" + serverId);
        readerThread.setDaemon(true);
        readerThread.start();

        try {
            Duration timeout = config.getStartupTimeout();

            JsonNode initResult = awaitHandshake("initialize", Map.of(
                    "protocolVersion", MCP_PROTOCOL_VERSION,
                    "capabilities", Map.of(),
                    "clientInfo", Map.of(
                            "name", "weather-assistant",
                            "version", "0.1.0")), timeout);
            log.info("[MCP:{}] Initialized: {}", serverId, initResult);

            sendNotification("notifications/initialized", Map.of());

            JsonNode toolsResult = awaitHandshake("tools/list", Map.of(), timeout);
            catalog = ToolCatalog.of(parseToolDefinitions(toolsResult));
            log.info("[MCP:{}] Available tools: {}", serverId, catalog.names());
        } catch (RuntimeException e) {
            log.error("[MCP:{}] Initialization failed, cleaning up: {}", serverId, e.getMessage());
            close();
            throw e;
        }
    }

    @Override
    public ToolCatalog listTools() {
        return catalog;
    }

    @Override
    public ToolResult invoke(String toolName, Map<String, Object> arguments) {
        ensureConnected();

        Map<String, Object> params = new LinkedHashMap<>();
        params.put("name", toolName);
        params.put("arguments", arguments != null ? arguments : Map.of());

        CompletableFuture<JsonNode> future = sendRequest("tools/call", params);
        Duration timeout = config.getCallTimeout();
        try {
            JsonNode result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return parseToolCallResult(toolName, result).withToolName(toolName);
        } catch (TimeoutException e) {
            future.completeExceptionally(e);
            throw new ToolTimeoutException(
                    "Tool '" + toolName + "' did not respond within " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof McpRpcException rpc) {
                return rpcFailure(rpc).withToolName(toolName);
            }
            throw new ToolUnavailableException(
                    "Tool server '" + serverId + "' unavailable: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.completeExceptionally(e);
            throw new ToolUnavailableException("Interrupted while waiting for tool '" + toolName + "'", e);
        }
    }

    @Override
    public boolean isConnected() {
        return running && !closed && (process == null || process.isAlive());
    }

    private void ensureConnected() {
        if (closed) {
            throw new ToolUnavailableException("Tool server '" + serverId + "' has been released");
        }
        if (!running) {
            throw new ToolUnavailableException("Tool server '" + serverId + "' is not connected");
        }
        if (process != null && !process.isAlive()) {
            throw new ToolUnavailableException("Tool server '" + serverId + "' process has exited");
        }
    }

    private JsonNode awaitHandshake(String method, Map<String, Object> params, Duration timeout) {
        CompletableFuture<JsonNode> future = sendRequest(method, params);
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.completeExceptionally(e);
            throw new ToolUnavailableException(
                    "Tool server '" + serverId + "' did not answer " + method + " within " + timeout.toMillis() + "ms");
        } catch (ExecutionException e) {
            throw new ToolUnavailableException(
                    "Tool server '" + serverId + "' rejected " + method + ": " + e.getCause().getMessage(), e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ToolUnavailableException("Interrupted during " + method + " with '" + serverId + "'", e);
        }
    }

    CompletableFuture<JsonNode> sendRequest(String method, Map<String, Object> params) {
        int id = nextId.getAndIncrement();
        CompletableFuture<JsonNode> future = new CompletableFuture<>();
        future.whenComplete((result, ex) -> pendingRequests.remove(id));
        pendingRequests.put(id, future);

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("jsonrpc", JSONRPC_VERSION);
        request.put("id", id);
        request.put("method", method);
        request.put("params", params);

        try {
            write(objectMapper.writeValueAsString(request));
        } catch (IOException e) {
            future.completeExceptionally(e);
        }
        return future;
    }

    void sendNotification(String method, Map<String, Object> params) {
        Map<String, Object> notification = new LinkedHashMap<>();
        notification.put("jsonrpc", JSONRPC_VERSION);
        notification.put("method", method);
        if (params != null && !params.isEmpty()) {
            notification.put("params", params);
        }

        try {
            write(objectMapper.writeValueAsString(notification));
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to send notification {}: {}", serverId, method, e.getMessage());
        }
    }

    private void write(String json) throws IOException {
        log.debug("[MCP:{}] → {}", serverId, json);
        synchronized (writeLock) {
            if (writer == null || !running) {
                throw new IOException("connection to '" + serverId + "' is not open");
            }
            writer.write(json);
            writer.newLine();
            writer.flush();
        }
    }

    private void readLoop(InputStream stdout) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stdout, StandardCharsets.UTF_8))) {
            String line;
            while (running && (line = reader.readLine()) != null) {
                line = line.trim();
                if (line.isEmpty()) {
                    continue;
                }
                log.debug("[MCP:{}] ← {}", serverId, line);
                dispatch(line);
            }
        } catch (IOException e) {
            if (running) {
                log.warn("[MCP:{}] Reader thread error: {}", serverId, e.getMessage());
            }
        } finally {
            running = false;
            failPending(new IOException("MCP server '" + serverId + "' closed the connection"));
        }
    }

    private void dispatch(String line) {
        JsonNode message;
        try {
            message = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            log.warn("[MCP:{}] Ignoring unparseable line: {}", serverId, e.getMessage());
            return;
        }

        JsonNode idNode = message.get("id");
        if (message.hasNonNull("method")) {
            String method = message.get("method").asText();
            if (idNode == null || idNode.isNull()) {
                log.debug("[MCP:{}] Server notification: {}", serverId, method);
            } else {
                answerServerRequest(idNode, method);
            }
            return;
        }
        if (idNode == null || !idNode.canConvertToInt()) {
            log.warn("[MCP:{}] Ignoring response without a usable id: {}", serverId, line);
            return;
        }

        CompletableFuture<JsonNode> pending = pendingRequests.remove(idNode.asInt());
        if (pending == null) {
            log.warn("[MCP:{}] Received response for unknown id: {}", serverId, idNode.asInt());
            return;
        }

        JsonNode error = message.get("error");
        if (error != null && !error.isNull()) {
            pending.completeExceptionally(new McpRpcException(
                    error.has("code") ? error.get("code").asInt() : -1,
                    error.has("message") ? error.get("message").asText() : "Unknown MCP error"));
        } else {
            pending.complete(message.get("result"));
        }
    }

    /**
     * Requests the server sends to us share the id space of our own requests,
     * so they are answered here and never matched against pending calls.
     * Only ping is supported.
     */
    private void answerServerRequest(JsonNode idNode, String method) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("jsonrpc", JSONRPC_VERSION);
        response.put("id", idNode);
        if (PING.equals(method)) {
            response.put("result", Map.of());
        } else {
            log.debug("[MCP:{}] Rejecting unsupported server request: {}", serverId, method);
            response.put("error", Map.of(
                    "code", METHOD_NOT_FOUND,
                    "message", "Method not found: " + method));
        }

        try {
            write(objectMapper.writeValueAsString(response));
        } catch (IOException e) {
            log.warn("[MCP:{}] Failed to answer server request {}: {}", serverId, method, e.getMessage());
        }
    }

    private void drainStderr(InputStream stderr) {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stderr, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[MCP:{}] stderr: {}", serverId, line);
            }
        } catch (IOException e) {
            log.debug("[MCP:{}] Stderr drain ended: {}", serverId, e.getMessage());
        }
    }

    List<ToolDefinition> parseToolDefinitions(JsonNode result) {
        if (result == null) {
            return List.of();
        }
        JsonNode toolsNode = result.get("tools");
        if (toolsNode == null || !toolsNode.isArray()) {
            return List.of();
        }

        List<ToolDefinition> tools = new ArrayList<>();
        for (JsonNode toolNode : toolsNode) {
            if (!toolNode.hasNonNull("name")) {
                continue;
            }
            String name = toolNode.get("name").asText();
            String description = toolNode.hasNonNull("description") ? toolNode.get("description").asText() : "";

            Map<String, Object> inputSchema = Map.of("type", "object", "properties", Map.of());
            if (toolNode.has("inputSchema")) {
                try {
                    inputSchema = objectMapper.convertValue(toolNode.get("inputSchema"), MAP_TYPE_REF);
                } catch (IllegalArgumentException e) {
                    log.warn("[MCP:{}] Bad inputSchema for tool '{}': {}", serverId, name, e.getMessage());
                }
            }

            tools.add(ToolDefinition.builder()
                    .name(name)
                    .description(description)
                    .inputSchema(inputSchema)
                    .build());
        }
        return tools;
    }

    /**
     * Text parts are joined with newlines; other part types are kept as JSON so
     * nothing the server returned is lost.
     */
    ToolResult parseToolCallResult(String toolName, JsonNode result) {
        if (result == null || result.isNull()) {
            return ToolResult.failure(ToolResult.ErrorType.APPLICATION, "No result from tool: " + toolName);
        }

        boolean isError = result.has("isError") && result.get("isError").asBoolean(false);

        StringBuilder output = new StringBuilder();
        JsonNode contentNode = result.get("content");
        if (contentNode != null && contentNode.isArray()) {
            for (JsonNode item : contentNode) {
                String type = item.has("type") ? item.get("type").asText() : "text";
                if (!output.isEmpty()) {
                    output.append("\n");
                }
                if ("text".equals(type) && item.has("text")) {
                    output.append(item.get("text").asText());
                } else {
                    output.append(item.toString());
                }
            }
        }

        if (isError) {
            return ToolResult.failure(ToolResult.ErrorType.APPLICATION,
                    output.isEmpty() ? "Tool '" + toolName + "' reported an error" : output.toString());
        }
        return ToolResult.success(output.isEmpty() ? "(no output)" : output.toString());
    }

    private ToolResult rpcFailure(McpRpcException e) {
        ToolResult.ErrorType type = switch (e.getCode()) {
            case INVALID_PARAMS -> ToolResult.ErrorType.INVALID_ARGUMENTS;
            case METHOD_NOT_FOUND -> ToolResult.ErrorType.UNKNOWN_TOOL;
            default -> ToolResult.ErrorType.APPLICATION;
        };
        return ToolResult.failure(type, "JSON-RPC error " + e.getCode() + ": " + e.getMessage());
    }

    private void failPending(Exception cause) {
        for (CompletableFuture<JsonNode> future : pendingRequests.values()) {
            future.completeExceptionally(cause);
        }
        pendingRequests.clear();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        log.info("[MCP:{}] Closing client", serverId);
        closed = true;
        running = false;

        failPending(new IOException("MCP client '" + serverId + "' closing"));

        synchronized (writeLock) {
            if (writer != null) {
                try {
                    writer.close();
                } catch (IOException e) {
                    log.debug("[MCP:{}] Error closing writer: {}", serverId, e.getMessage());
                }
            }
        }

        if (process != null && process.isAlive()) {
            process.destroy();
            try {
                if (!process.waitFor(5, TimeUnit.SECONDS)) {
                    process.destroyForcibly();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                process.destroyForcibly();
            }
        }
    }

    /**
     * JSON-RPC error object returned by the server.
     */
    static class McpRpcException extends Exception {
        private static final long serialVersionUID = 1L;
        private final int code;

        McpRpcException(int code, String message) {
            super(message);
            this.code = code;
        }

        int getCode() {
            return code;
        }
    }
}
