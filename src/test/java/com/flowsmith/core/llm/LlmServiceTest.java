package com.flowsmith.core.llm;

import com.flowsmith.core.metrics.PipelineMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for {@link LlmService}.
 * <p>
 * Mocks the {@link LlmProvider} so no real model is called.
 */
class LlmServiceTest {

    record Verdict(String label, int score) {}

    private static final GenerationOptions OPTIONS = new GenerationOptions(0.0, 1000, Duration.ofSeconds(5));

    private LlmProvider provider;
    private SimpleMeterRegistry registry;
    private LlmService llmService;

    @BeforeEach
    void setUp() {
        provider = mock(LlmProvider.class);
        when(provider.name()).thenReturn("openai");
        registry = new SimpleMeterRegistry();
        llmService = new LlmService(provider, new PipelineMetrics(registry));
    }

    @AfterEach
    void tearDown() {
        llmService.shutdown();
    }

    @Test
    @DisplayName("structuredCall sends system prompt and format instructions to the provider")
    void structuredCallSendsPrompts() {
        when(provider.complete(any())).thenReturn(
                new LlmResponse("{\"label\":\"urgent\",\"score\":7}", "gpt-4o", new TokenUsage(10, 5, 15)));

        var response = llmService.structuredCall("System prompt", "User prompt", Verdict.class, OPTIONS);

        assertEquals(new Verdict("urgent", 7), response.value());
        assertEquals(15, response.usage().totalTokens());
        assertEquals("gpt-4o", response.model());

        var captor = ArgumentCaptor.forClass(LlmRequest.class);
        verify(provider).complete(captor.capture());
        assertEquals("System prompt", captor.getValue().systemPrompt());
        assertTrue(captor.getValue().userPrompt().startsWith("User prompt"));
        assertTrue(captor.getValue().userPrompt().length() > "User prompt".length());
        assertEquals(0.0, captor.getValue().options().temperature());
        assertNotNull(captor.getValue().options().responseSchema());
        assertTrue(captor.getValue().options().responseSchema().contains("label"));
    }

    @Test
    @DisplayName("markdown fences and unknown properties are tolerated")
    void toleratesFencesAndExtraFields() {
        when(provider.complete(any())).thenReturn(new LlmResponse("""
                ```json
                {"label":"low","score":1,"explanation":"extra"}
                ```
                """, null, null));

        var response = llmService.structuredCall("s", "u", Verdict.class, OPTIONS);

        assertEquals("low", response.value().label());
        assertEquals(0, response.usage().totalTokens());
    }

    @Test
    @DisplayName("malformed JSON raises LlmParseException carrying the raw content")
    void malformedJson() {
        when(provider.complete(any())).thenReturn(new LlmResponse("{\"label\": \"oops\"", "m", null));

        var ex = assertThrows(LlmParseException.class,
                () -> llmService.structuredCall("s", "u", Verdict.class, OPTIONS));
        assertEquals("{\"label\": \"oops\"", ex.getRawContent());
    }

    @Test
    @DisplayName("blank content is an empty-response error")
    void blankContent() {
        when(provider.complete(any())).thenReturn(new LlmResponse("   ", "m", null));

        assertThrows(LlmEmptyResponseException.class, () -> llmService.complete("s", "u", OPTIONS));
        assertEquals(1.0, registry.find("flowsmith.llm.calls").tag("outcome", "empty").counter().count());
    }

    @Test
    @DisplayName("a call that outlives its timeout is cancelled")
    void timeout() {
        when(provider.complete(any())).thenAnswer(invocation -> {
            Thread.sleep(5_000);
            return new LlmResponse("{}", "m", null);
        });
        var fast = new GenerationOptions(0.0, 100, Duration.ofMillis(100));

        var ex = assertThrows(LlmTimeoutException.class, () -> llmService.complete("s", "u", fast));
        assertEquals(Duration.ofMillis(100), ex.getTimeout());
        assertEquals(1.0, registry.find("flowsmith.llm.calls").tag("outcome", "timeout").counter().count());
    }

    @Test
    @DisplayName("provider failures are classified")
    void classifiesProviderFailures() {
        when(provider.complete(any())).thenThrow(new RuntimeException("HTTP 401 Unauthorized: invalid api key"));

        var ex = assertThrows(LlmProviderException.class, () -> llmService.complete("s", "u", OPTIONS));
        assertEquals(LlmProviderException.Kind.AUTHENTICATION, ex.getKind());
        assertTrue(ex.isNonRetryable());
    }

    @Test
    @DisplayName("providerName reports the active provider")
    void providerName() {
        assertEquals("openai", llmService.providerName());
    }

    @Test
    @DisplayName("stripFences removes json code fences")
    void stripFences() {
        assertEquals("{\"a\":1}", LlmService.stripFences("```json\n{\"a\":1}\n```"));
        assertEquals("{\"a\":1}", LlmService.stripFences("```\n{\"a\":1}```"));
        assertEquals("{\"a\":1}", LlmService.stripFences("  {\"a\":1}  "));
    }
}
