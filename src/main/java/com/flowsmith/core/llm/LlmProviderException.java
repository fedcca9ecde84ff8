package com.flowsmith.core.llm;

import java.util.Locale;

/**
 * A failure reported by the provider itself. Authentication and rate-limit
 * failures are non-retryable: another attempt with the same credentials
 * cannot succeed within the request.
 */
public class LlmProviderException extends RuntimeException {

    public enum Kind { AUTHENTICATION, RATE_LIMIT, OTHER }

    private final Kind kind;

    public LlmProviderException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }

    public boolean isNonRetryable() {
        return kind != Kind.OTHER;
    }

    /**
     * Classifies a raw provider failure by its message.
     */
    public static LlmProviderException classify(String provider, RuntimeException cause) {
        String message = cause.getMessage() == null ? "" : cause.getMessage();
        String lower = message.toLowerCase(Locale.ROOT);
        Kind kind;
        if (lower.contains("api key") || lower.contains("401") || lower.contains("403")
                || lower.contains("unauthorized") || lower.contains("authentication")) {
            kind = Kind.AUTHENTICATION;
        } else if (lower.contains("rate limit") || lower.contains("429") || lower.contains("too many requests")) {
            kind = Kind.RATE_LIMIT;
        } else {
            kind = Kind.OTHER;
        }
        return new LlmProviderException(kind, provider + " call failed: " + message, cause);
    }
}
