package com.deepansh.assistant.config;

import com.deepansh.assistant.mcp.McpStdioClient;
import com.deepansh.assistant.tool.ToolRegistry;
import com.deepansh.assistant.tool.ToolServerConnection;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds one MCP client per enabled entry under tools.servers and hands them
 * to the registry, which connects them at startup and closes them at shutdown.
 */
@Configuration
@Slf4j
public class ToolServerConfig {

    @Bean(initMethod = "connectAll", destroyMethod = "close")
    public ToolRegistry toolRegistry(ToolServerProperties props, ObjectMapper objectMapper) {
        List<ToolServerConnection> servers = new ArrayList<>();
        for (Map.Entry<String, ToolServerProperties.Server> entry : props.getServers().entrySet()) {
            if (!entry.getValue().isEnabled()) {
                log.info("Tool server [{}] is disabled", entry.getKey());
                continue;
            }
            servers.add(new McpStdioClient(entry.getKey(), entry.getValue(), objectMapper));
        }
        if (servers.isEmpty()) {
            log.warn("No tool servers configured, the model will answer without tools");
        }
        return new ToolRegistry(servers);
    }
}
