package com.deepansh.assistant.tool;

import com.deepansh.assistant.exception.ToolTimeoutException;
import com.deepansh.assistant.exception.ToolUnavailableException;
import com.deepansh.assistant.model.ToolResult;

import java.util.Map;

/**
 * Bridge from the orchestrator's generic tool-call shape to an external tool
 * server.
 *
 * Implementations must be safe for concurrent {@link #invoke} calls.
 */
public interface ToolClient {

    /** Tools advertised by the server. Fetched once and cached. */
    ToolCatalog listTools();

    /**
     * One round trip to the tool server.
     *
     * A tool that ran but reported a domain error (unknown city, bad input) is
     * returned as a failed {@link ToolResult}; only connection-level problems
     * throw.
     *
     * @throws ToolUnavailableException the connection is not established or was released
     * @throws ToolTimeoutException     no response within the call timeout
     */
    ToolResult invoke(String toolName, Map<String, Object> arguments);
}
