package com.flowsmith.core.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded retry for model calls. Each retry sees the original user prompt
 * with the previous failure appended, so the model can correct itself.
 * Authentication and rate-limit failures stop retrying at once.
 */
public class RetryPolicy {

    private static final Logger log = LoggerFactory.getLogger(RetryPolicy.class);

    static final String FAILURE_CONTEXT = "\n\n---\n\nPREVIOUS ATTEMPT FAILED:\n%s\n\nPlease fix these issues in your response.";

    private final int maxAttempts;

    public RetryPolicy(int maxAttempts) {
        this.maxAttempts = Math.max(1, maxAttempts);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    @FunctionalInterface
    public interface Attempt<T> {
        /**
         * @param userPrompt    the prompt for this attempt, with failure context on retries
         * @param attemptNumber 1-based
         */
        T run(String userPrompt, int attemptNumber);
    }

    /**
     * Result of running an attempt under this policy. Exactly one of
     * {@code value} and {@code failure} is set.
     */
    public record Outcome<T>(T value, RuntimeException failure, int attempts) {

        public boolean succeeded() {
            return failure == null;
        }
    }

    public <T> Outcome<T> execute(String userPrompt, Attempt<T> attempt) {
        String prompt = userPrompt;
        RuntimeException last = null;
        for (int attemptNumber = 1; attemptNumber <= maxAttempts; attemptNumber++) {
            try {
                return new Outcome<>(attempt.run(prompt, attemptNumber), null, attemptNumber);
            } catch (RuntimeException e) {
                last = e;
                if (!isRetryable(e)) {
                    log.warn("Attempt {}/{} failed with a non-retryable error: {}", attemptNumber, maxAttempts, e.getMessage());
                    return new Outcome<>(null, e, attemptNumber);
                }
                log.warn("Attempt {}/{} failed: {}", attemptNumber, maxAttempts, e.getMessage());
                prompt = withFailureContext(userPrompt, e.getMessage());
            }
        }
        return new Outcome<>(null, last, maxAttempts);
    }

    public static String withFailureContext(String userPrompt, String reason) {
        return userPrompt + String.format(FAILURE_CONTEXT, reason == null ? "unknown error" : reason);
    }

    static boolean isRetryable(RuntimeException e) {
        return !(e instanceof LlmProviderException providerException && providerException.isNonRetryable());
    }
}
