package com.flowsmith.core.semantic;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;
import com.flowsmith.core.model.SemanticPlan;

import java.util.List;

/**
 * Outcome of the understanding phase. A failed result may still carry the
 * last decoded plan for diagnosis; callers must check {@code success}.
 */
public record SemanticPlanResult(
    boolean success,
    @JsonProperty("semantic_plan") SemanticPlan plan,
    List<String> errors,
    List<String> warnings,
    Metadata metadata
) {

    public SemanticPlanResult {
        errors = Defaults.list(errors);
        warnings = Defaults.list(warnings);
    }

    public record Metadata(
        String model,
        @JsonProperty("tokens_used") int tokensUsed,
        @JsonProperty("generation_time_ms") long generationTimeMs,
        int attempts
    ) {}
}
