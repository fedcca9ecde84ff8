package com.flowsmith.core.llm;

import java.time.Duration;

/**
 * Thrown when a provider call does not settle within its timeout. The call
 * itself has been cancelled by the time this is raised.
 */
public class LlmTimeoutException extends RuntimeException {

    private final Duration timeout;

    public LlmTimeoutException(Duration timeout) {
        super("LLM call timed out after " + timeout.toSeconds() + "s");
        this.timeout = timeout;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
