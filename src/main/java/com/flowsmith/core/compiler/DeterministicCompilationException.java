package com.flowsmith.core.compiler;

/**
 * The rule-based compiler does not handle this IR shape. Triggers the
 * fallback to the model-driven compiler.
 */
public class DeterministicCompilationException extends RuntimeException {

    public DeterministicCompilationException(String message) {
        super(message);
    }
}
