package com.flowsmith.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the active {@link LlmProvider} from {@code flowsmith.llm.provider}.
 * Spring AI auto-configures only the matching chat model through
 * {@code spring.ai.model.chat}, so the injected builder targets that vendor.
 */
@Configuration
public class LlmProviderConfig {

    private static final Logger log = LoggerFactory.getLogger(LlmProviderConfig.class);

    @Bean
    @ConditionalOnProperty(name = "flowsmith.llm.provider", havingValue = "openai", matchIfMissing = true)
    public LlmProvider openAiLlmProvider(ChatClient.Builder builder, LlmProperties properties) {
        log.info("Using OpenAI LLM provider (model: {}, schema-constrained: {})", displayModel(properties),
                properties.isSchemaConstrained());
        return new OpenAiLlmProvider(builder, properties.getModel(), properties.isSchemaConstrained());
    }

    @Bean
    @ConditionalOnProperty(name = "flowsmith.llm.provider", havingValue = "anthropic")
    public LlmProvider anthropicLlmProvider(ChatClient.Builder builder, LlmProperties properties) {
        log.info("Using Anthropic LLM provider (model: {})", displayModel(properties));
        return new AnthropicLlmProvider(builder, properties.getModel());
    }

    private static String displayModel(LlmProperties properties) {
        return properties.getModel() == null || properties.getModel().isBlank()
                ? "provider default" : properties.getModel();
    }
}
