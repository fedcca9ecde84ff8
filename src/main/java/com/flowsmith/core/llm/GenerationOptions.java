package com.flowsmith.core.llm;

import java.time.Duration;

/**
 * Per-call generation settings handed to an {@link LlmProvider}.
 *
 * @param responseSchema JSON schema of the expected answer for structured calls;
 *                       providers that can constrain decoding to a schema use it
 */
public record GenerationOptions(double temperature, int maxTokens, Duration timeout, String responseSchema) {

    public GenerationOptions {
        timeout = timeout == null ? Duration.ofSeconds(120) : timeout;
    }

    public GenerationOptions(double temperature, int maxTokens, Duration timeout) {
        this(temperature, maxTokens, timeout, null);
    }

    public GenerationOptions withTemperature(double newTemperature) {
        return new GenerationOptions(newTemperature, maxTokens, timeout, responseSchema);
    }

    public GenerationOptions withResponseSchema(String schema) {
        return new GenerationOptions(temperature, maxTokens, timeout, schema);
    }
}
