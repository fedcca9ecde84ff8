package com.flowsmith.core.llm;

import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.metadata.Usage;
import org.springframework.ai.chat.model.ChatResponse;
import org.springframework.ai.chat.prompt.ChatOptions;

/**
 * Base for providers backed by Spring AI's {@link ChatClient}. Subclasses
 * only translate {@link GenerationOptions} into their vendor's chat options.
 */
public abstract class ChatClientLlmProvider implements LlmProvider {

    private final ChatClient chatClient;
    private final String model;

    protected ChatClientLlmProvider(ChatClient.Builder builder, String model) {
        this.chatClient = builder.build();
        this.model = model == null || model.isBlank() ? null : model;
    }

    protected String model() {
        return model;
    }

    protected abstract ChatOptions buildOptions(GenerationOptions options);

    @Override
    public LlmResponse complete(LlmRequest request) {
        ChatResponse response = chatClient.prompt()
                .system(request.systemPrompt())
                .user(request.userPrompt())
                .options(buildOptions(request.options()))
                .call()
                .chatResponse();
        if (response == null) {
            return new LlmResponse(null, model, TokenUsage.none());
        }
        String content = null;
        if (response.getResult() != null && response.getResult().getOutput() != null) {
            content = response.getResult().getOutput().getText();
        }
        String answeredBy = model;
        TokenUsage usage = TokenUsage.none();
        if (response.getMetadata() != null) {
            if (response.getMetadata().getModel() != null && !response.getMetadata().getModel().isBlank()) {
                answeredBy = response.getMetadata().getModel();
            }
            usage = toTokenUsage(response.getMetadata().getUsage());
        }
        return new LlmResponse(content, answeredBy, usage);
    }

    private static TokenUsage toTokenUsage(Usage usage) {
        if (usage == null) {
            return TokenUsage.none();
        }
        int prompt = usage.getPromptTokens() == null ? 0 : usage.getPromptTokens();
        int completion = usage.getCompletionTokens() == null ? 0 : usage.getCompletionTokens();
        int total = usage.getTotalTokens() == null ? prompt + completion : usage.getTotalTokens();
        return new TokenUsage(prompt, completion, total);
    }
}
