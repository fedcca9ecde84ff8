package com.flowsmith.core.llm;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class LlmProviderExceptionTest {

    @Test
    @DisplayName("classification ignores the default locale's case rules")
    void classifiesUnderTurkishLocale() {
        Locale original = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            var auth = LlmProviderException.classify("openai", new RuntimeException("AUTHENTICATION FAILED"));
            assertEquals(LlmProviderException.Kind.AUTHENTICATION, auth.getKind());
            assertTrue(auth.isNonRetryable());

            var rateLimit = LlmProviderException.classify("openai", new RuntimeException("RATE LIMIT EXCEEDED"));
            assertEquals(LlmProviderException.Kind.RATE_LIMIT, rateLimit.getKind());
        } finally {
            Locale.setDefault(original);
        }
    }

    @Test
    @DisplayName("other failures stay retryable and keep the provider in the message")
    void otherFailures() {
        var other = LlmProviderException.classify("anthropic", new RuntimeException((String) null));
        assertEquals(LlmProviderException.Kind.OTHER, other.getKind());
        assertFalse(other.isNonRetryable());
        assertEquals("anthropic call failed: ", other.getMessage());
    }
}
