package com.flowsmith.core.llm;

/**
 * A decoded model response together with what it cost.
 *
 * @param value      the decoded value
 * @param rawContent the text the model returned, before decoding
 * @param usage      token counters reported by the provider
 * @param model      the model that answered
 * @param durationMs wall-clock time of the call
 */
public record StructuredResponse<T>(T value, String rawContent, TokenUsage usage, String model, long durationMs) {}
