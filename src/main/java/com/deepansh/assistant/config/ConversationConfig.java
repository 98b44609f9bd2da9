package com.deepansh.assistant.config;

import com.deepansh.assistant.core.ConversationStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The single chat session of this process.
 */
@Configuration
public class ConversationConfig {

    @Bean
    public ConversationStore conversationStore(AssistantProperties props) {
        return new ConversationStore(props.getSystemPrompt());
    }
}
