package com.flowsmith.core.llm;

/**
 * Thrown when LLM output cannot be decoded into the expected type.
 */
public class LlmParseException extends RuntimeException {

    private final String rawContent;

    public LlmParseException(String message, String rawContent, Throwable cause) {
        super(message, cause);
        this.rawContent = rawContent;
    }

    public String getRawContent() {
        return rawContent;
    }
}
