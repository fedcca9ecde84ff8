package com.flowsmith.core.llm;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.ai.openai.OpenAiChatOptions;
import org.springframework.ai.openai.api.ResponseFormat;

/**
 * OpenAI chat completions. With {@code schemaConstrained} set, structured
 * calls ask for a {@code json_schema} response format built from the target
 * type, so the model cannot answer outside the schema.
 */
public class OpenAiLlmProvider extends ChatClientLlmProvider {

    private final boolean schemaConstrained;

    public OpenAiLlmProvider(ChatClient.Builder builder, String model) {
        this(builder, model, false);
    }

    public OpenAiLlmProvider(ChatClient.Builder builder, String model, boolean schemaConstrained) {
        super(builder, model);
        this.schemaConstrained = schemaConstrained;
    }

    @Override
    public String name() {
        return "openai";
    }

    @Override
    protected ChatOptions buildOptions(GenerationOptions options) {
        OpenAiChatOptions.Builder builder = OpenAiChatOptions.builder()
                .model(model())
                .temperature(options.temperature())
                .maxTokens(options.maxTokens());
        if (schemaConstrained && options.responseSchema() != null && !options.responseSchema().isBlank()) {
            builder.responseFormat(new ResponseFormat(ResponseFormat.Type.JSON_SCHEMA, options.responseSchema()));
        }
        return builder.build();
    }
}
