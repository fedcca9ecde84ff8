package com.flowsmith.core.llm;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;
import com.flowsmith.core.metrics.PipelineMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.ai.converter.BeanOutputConverter;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps the active {@link LlmProvider} with a timeout race and structured
 * (typed) decoding.
 * <p>
 * Every call runs on a worker thread and is raced against its timeout; on
 * timeout the worker is interrupted and the result discarded. Blank output
 * is an {@link LlmEmptyResponseException}. {@link #structuredCall} appends
 * {@link BeanOutputConverter} format instructions to the user prompt and
 * decodes strictly, falling back to a lenient Jackson mapper that tolerates
 * markdown fences and unknown properties but never malformed JSON.
 */
@Service
public class LlmService {

    private static final Logger log = LoggerFactory.getLogger(LlmService.class);
    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final LlmProvider provider;
    private final PipelineMetrics metrics;
    private final ObjectMapper lenientMapper;
    private final ExecutorService executor = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "llm-call-" + THREAD_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    public LlmService(LlmProvider provider, PipelineMetrics metrics) {
        this.provider = provider;
        this.metrics = metrics;
        this.lenientMapper = new ObjectMapper();
        lenientMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        lenientMapper.configure(DeserializationFeature.ACCEPT_EMPTY_STRING_AS_NULL_OBJECT, true);
        lenientMapper.configure(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY, true);
        lenientMapper.registerModule(new ParameterNamesModule());
        log.info("LlmService initialized with provider: {}", provider.name());
    }

    public String providerName() {
        return provider.name();
    }

    /**
     * Sends a system + user prompt and returns the raw text response.
     *
     * @throws LlmTimeoutException       when the call does not settle within {@code options.timeout()}
     * @throws LlmEmptyResponseException when the model returns blank content
     * @throws LlmProviderException      when the provider itself fails
     */
    public LlmResponse complete(String systemPrompt, String userPrompt, GenerationOptions options) {
        var request = new LlmRequest(systemPrompt, userPrompt, options);
        Duration timeout = options.timeout();
        long start = System.currentTimeMillis();
        Map<String, String> mdc = MDC.getCopyOfContextMap();

        Future<LlmResponse> future = executor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return provider.complete(request);
            } finally {
                MDC.clear();
            }
        });

        LlmResponse response;
        try {
            response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.recordLlmCall(provider.name(), "timeout", System.currentTimeMillis() - start);
            log.warn("LLM call timed out after {}s, cancelled", timeout.toSeconds());
            throw new LlmTimeoutException(timeout);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new LlmProviderException(LlmProviderException.Kind.OTHER, "LLM call interrupted", e);
        } catch (ExecutionException e) {
            metrics.recordLlmCall(provider.name(), "error", System.currentTimeMillis() - start);
            throw unwrap(e.getCause());
        }

        long elapsed = System.currentTimeMillis() - start;
        if (response == null || response.content() == null || response.content().isBlank()) {
            metrics.recordLlmCall(provider.name(), "empty", elapsed);
            throw new LlmEmptyResponseException("LLM returned empty content from " + provider.name()
                    + ". Check that the model is running and supports structured JSON output.");
        }
        metrics.recordLlmCall(provider.name(), "success", elapsed);
        log.info("LLM call complete ({}s, {} tokens)", String.format("%.1f", elapsed / 1000.0),
                response.usage().totalTokens());
        return response;
    }

    /**
     * Sends a system + user prompt and decodes the response into {@code outputType}.
     *
     * @throws LlmParseException when the response cannot be decoded
     */
    public <T> StructuredResponse<T> structuredCall(String systemPrompt, String userPrompt,
                                                    Class<T> outputType, GenerationOptions options) {
        log.info("LLM call started → {}", outputType.getSimpleName());
        long start = System.currentTimeMillis();
        var converter = new BeanOutputConverter<>(outputType);
        LlmResponse response = complete(systemPrompt, userPrompt + "\n\n" + converter.getFormat(),
                options.withResponseSchema(converter.getJsonSchema()));
        String content = response.content();
        T value;
        try {
            value = converter.convert(content);
        } catch (RuntimeException e) {
            log.warn("Strict decoding to {} failed: {}", outputType.getSimpleName(), e.getMessage());
            log.debug("Raw LLM response: {}", content);
            value = parseWithJackson(content, outputType);
        }
        if (value == null) {
            throw new LlmParseException("LLM response decoded to null for " + outputType.getSimpleName(), content, null);
        }
        return new StructuredResponse<>(value, content, response.usage(), response.model(),
                System.currentTimeMillis() - start);
    }

    /**
     * Fallback decoding with lenient settings. Strips markdown code fences first.
     */
    <T> T parseWithJackson(String json, Class<T> outputType) {
        String cleaned = stripFences(json);
        try {
            T result = lenientMapper.readValue(cleaned, outputType);
            log.info("Jackson fallback parsing succeeded for {}", outputType.getSimpleName());
            return result;
        } catch (Exception e) {
            log.error("Jackson fallback parsing FAILED for {}: {}", outputType.getSimpleName(), e.getMessage());
            throw new LlmParseException("Failed to parse LLM response to " + outputType.getSimpleName()
                    + ": " + e.getMessage(), json, e);
        }
    }

    static String stripFences(String raw) {
        String cleaned = raw.trim();
        if (cleaned.startsWith("```json")) {
            cleaned = cleaned.substring(7);
        } else if (cleaned.startsWith("```")) {
            cleaned = cleaned.substring(3);
        }
        if (cleaned.endsWith("```")) {
            cleaned = cleaned.substring(0, cleaned.length() - 3);
        }
        return cleaned.trim();
    }

    private RuntimeException unwrap(Throwable cause) {
        if (cause instanceof LlmProviderException providerException) {
            return providerException;
        }
        if (cause instanceof LlmEmptyResponseException emptyResponse) {
            return emptyResponse;
        }
        if (cause instanceof RuntimeException runtime) {
            LlmProviderException classified = LlmProviderException.classify(provider.name(), runtime);
            log.error("LLM provider {} failed ({}): {}", provider.name(), classified.getKind(), runtime.getMessage());
            return classified;
        }
        return new LlmProviderException(LlmProviderException.Kind.OTHER,
                provider.name() + " call failed: " + cause.getMessage(), cause);
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
