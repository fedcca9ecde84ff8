package com.flowsmith.core.llm;

import org.springframework.ai.anthropic.AnthropicChatOptions;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;

public class AnthropicLlmProvider extends ChatClientLlmProvider {

    public AnthropicLlmProvider(ChatClient.Builder builder, String model) {
        super(builder, model);
    }

    @Override
    public String name() {
        return "anthropic";
    }

    @Override
    protected ChatOptions buildOptions(GenerationOptions options) {
        return AnthropicChatOptions.builder()
                .model(model())
                .temperature(options.temperature())
                .maxTokens(options.maxTokens())
                .build();
    }
}
