package com.deepansh.assistant.tool;

import java.io.Closeable;

/**
 * A {@link ToolClient} bound to one long-lived tool server. Acquired with
 * {@link #connect()} at startup and released with {@link #close()} at
 * shutdown; calls after release fail with ToolUnavailableException.
 */
public interface ToolServerConnection extends ToolClient, Closeable {

    String getServerId();

    /** Start the server, perform the handshake and cache its tool catalog. */
    void connect();

    boolean isConnected();

    @Override
    void close();
}
