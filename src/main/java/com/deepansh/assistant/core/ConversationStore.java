package com.deepansh.assistant.core;

import com.deepansh.assistant.model.Message;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory, ordered log of one conversation.
 *
 * Insertion order is the only order: what {@link #snapshot()} returns is what
 * gets displayed and what gets sent to the model. Appending is package-private
 * so that only the orchestrator writes turns.
 */
@Slf4j
public class ConversationStore {

    private final String systemPrompt;
    private final List<Message> messages = new ArrayList<>();
    private long nextSequence = 1;

    public ConversationStore(String systemPrompt) {
        this.systemPrompt = systemPrompt;
        seed();
    }

    synchronized Message append(Message message) {
        if (message.getRole() == null || message.getContent() == null) {
            throw new IllegalArgumentException("message needs a role and content");
        }
        if (message.getRole() == Message.Role.tool
                && (message.getToolCallId() == null || message.getToolCallId().isBlank())) {
            throw new IllegalArgumentException("tool message needs a toolCallId");
        }

        Message stamped = stamp(message);
        messages.add(stamped);
        return stamped;
    }

    /** Read-only copy in insertion order. */
    public synchronized List<Message> snapshot() {
        return List.copyOf(messages);
    }

    /** Discards every message and re-seeds the system prompt, if one is configured. */
    public synchronized void clear() {
        int discarded = messages.size();
        messages.clear();
        seed();
        log.info("Cleared conversation ({} messages discarded)", discarded);
    }

    public synchronized int size() {
        return messages.size();
    }

    private void seed() {
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            messages.add(stamp(Message.system(systemPrompt.strip())));
        }
    }

    private Message stamp(Message message) {
        return message.toBuilder()
                .sequence(nextSequence++)
                .createdAt(Instant.now())
                .build();
    }
}
