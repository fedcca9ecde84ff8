package com.flowsmith.core.llm;

public record LlmRequest(String systemPrompt, String userPrompt, GenerationOptions options) {}
