package com.deepansh.assistant.llm;

import com.deepansh.assistant.model.Message;
import com.deepansh.assistant.model.ModelResponse;
import com.deepansh.assistant.tool.ToolCatalog;

import java.util.List;

public interface ModelGateway {

    /**
     * Send the full conversation history and the tool catalog to the model in
     * one request. No looping and no persistence.
     *
     * @param history full conversation so far, in insertion order
     * @param tools   tools the model may choose to invoke
     * @return either a final text answer or the tool calls the model wants made
     * @throws com.deepansh.assistant.exception.ModelGatewayException on any failure
     */
    ModelResponse complete(List<Message> history, ToolCatalog tools);
}
