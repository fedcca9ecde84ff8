package com.flowsmith.core.llm;

public record LlmResponse(String content, String model, TokenUsage usage) {

    public LlmResponse {
        usage = usage == null ? TokenUsage.none() : usage;
    }
}
