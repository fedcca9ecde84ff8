package com.flowsmith.core.compiler;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Reviewer feedback on a previously generated workflow. Only the model-driven
 * compiler can act on it.
 */
public record CompilationFeedback(
    @JsonProperty("previous_workflow") List<Map<String, Object>> previousWorkflow,
    @JsonProperty("user_feedback") String userFeedback,
    @JsonProperty("feedback_history") List<String> feedbackHistory,
    @JsonProperty("regeneration_attempt") int regenerationAttempt
) implements Serializable {

    public CompilationFeedback {
        previousWorkflow = Defaults.list(previousWorkflow);
        feedbackHistory = Defaults.list(feedbackHistory);
    }

    @JsonIgnore
    public boolean isPresent() {
        return userFeedback != null && !userFeedback.isBlank();
    }
}
