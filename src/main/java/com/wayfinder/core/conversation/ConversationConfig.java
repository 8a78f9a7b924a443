package com.wayfinder.core.conversation;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class ConversationConfig {

    @Bean
    public ConversationStore conversationStore(ConversationProperties properties, Clock clock) {
        if (properties.isFileStore()) {
            return new FileConversationStore(Path.of(properties.getDirectory()), clock, properties.getFileTtl());
        }
        return new InMemoryConversationStore(clock, properties.getMemoryTtl());
    }
}
