package com.deepansh.assistant.tool;

import com.deepansh.assistant.exception.ToolUnavailableException;
import com.deepansh.assistant.model.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single {@link ToolClient} over every configured tool server.
 *
 * Servers are connected once at startup and their catalogs merged; each tool
 * name is routed to the server that advertised it first. A server that fails
 * to start is logged and left out, so its tools are simply absent from the
 * catalog instead of failing the whole process.
 */
@Slf4j
public class ToolRegistry implements ToolClient, Closeable {

    private final List<ToolServerConnection> servers;
    private final Map<String, ToolServerConnection> toolToServer = new ConcurrentHashMap<>();

    private volatile ToolCatalog catalog = ToolCatalog.empty();
    private volatile boolean closed;

    public ToolRegistry(List<ToolServerConnection> servers) {
        this.servers = List.copyOf(servers);
    }

    public void connectAll() {
        List<ToolDefinition> merged = new ArrayList<>();

        for (ToolServerConnection server : servers) {
            try {
                server.connect();
            } catch (RuntimeException e) {
                log.error("Tool server [{}] failed to start, its tools will be unavailable: {}",
                        server.getServerId(), e.getMessage());
                continue;
            }

            for (ToolDefinition def : server.listTools().definitions()) {
                ToolServerConnection previous = toolToServer.putIfAbsent(def.getName(), server);
                if (previous != null) {
                    log.warn("Tool [{}] from server [{}] shadowed by server [{}]",
                            def.getName(), server.getServerId(), previous.getServerId());
                    continue;
                }
                merged.add(def);
            }
            log.info("Connected to tool server [{}] with tools: {}",
                    server.getServerId(), server.listTools().names());
        }

        catalog = ToolCatalog.of(merged);
        log.info("Total tools registered: {}", catalog.size());
    }

    @Override
    public ToolCatalog listTools() {
        return catalog;
    }

    /**
     * Routes the call to the owning server. Unknown tools come back as a failed
     * result so the model can correct itself; connection faults propagate.
     */
    @Override
    public ToolResult invoke(String toolName, Map<String, Object> arguments) {
        if (closed) {
            throw new ToolUnavailableException("Tool registry has been shut down");
        }

        ToolServerConnection server = toolToServer.get(toolName);
        if (server == null) {
            String msg = String.format("Unknown tool '%s'. Available tools: %s", toolName, catalog.names());
            log.warn(msg);
            return ToolResult.failure(ToolResult.ErrorType.UNKNOWN_TOOL, msg).withToolName(toolName);
        }

        log.info("Executing tool: [{}] on server [{}] with args: {}", toolName, server.getServerId(), arguments);
        return server.invoke(toolName, arguments);
    }

    public List<String> connectedServers() {
        return servers.stream()
                .filter(ToolServerConnection::isConnected)
                .map(ToolServerConnection::getServerId)
                .toList();
    }

    @Override
    public void close() {
        closed = true;
        for (ToolServerConnection server : servers) {
            try {
                server.close();
            } catch (RuntimeException e) {
                log.warn("Error closing tool server [{}]: {}", server.getServerId(), e.getMessage());
            }
        }
    }
}
