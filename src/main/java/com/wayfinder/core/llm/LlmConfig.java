package com.wayfinder.core.llm;

import com.wayfinder.core.metrics.WayfinderMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class LlmConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmConfig.class);

    @Bean
    public ConverseClient converseClient(ChatClient.Builder builder, LlmProperties properties,
                                         WayfinderMetrics metrics,
                                         @Value("${spring.ai.openai.base-url:NOT_SET}") String baseUrl) {
        log.info("Converse client initialized: OpenAI base-url {}, model '{}', retry attempts {}",
                baseUrl, properties.getModel(), properties.getRetry().getMaxAttempts());
        return new RetryingConverseClient(
                new SpringAiConverseClient(builder.build(), properties),
                RetryPolicy.from(properties.getRetry()),
                metrics);
    }
}
