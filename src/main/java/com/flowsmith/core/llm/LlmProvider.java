package com.flowsmith.core.llm;

/**
 * Provider-agnostic seam to a language model. Implementations are
 * interchangeable; exactly one is active, chosen by {@code flowsmith.llm.provider}.
 */
public interface LlmProvider {

    String name();

    LlmResponse complete(LlmRequest request);
}
