package com.deepansh.assistant.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tool servers to launch at startup, bound from application.yml under
 * "tools.servers.&lt;id&gt;".
 */
@Component
@ConfigurationProperties(prefix = "tools")
@Data
public class ToolServerProperties {

    private Map<String, Server> servers = new LinkedHashMap<>();

    @Data
    public static class Server {
        private boolean enabled = true;
        /** Executable to launch, e.g. npx or node */
        private String command;
        private List<String> args = new ArrayList<>();
        /** Extra environment for the child process, e.g. API keys */
        private Map<String, String> env = new LinkedHashMap<>();
        private Duration startupTimeout = Duration.ofSeconds(30);
        private Duration callTimeout = Duration.ofSeconds(30);
    }
}
