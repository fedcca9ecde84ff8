package com.flowsmith.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * The language model's understanding of intent, prior to any data validation.
 * Created once per request and never mutated; grounding extends it into a
 * {@link GroundedSemanticPlan}.
 */
public record SemanticPlan(
    @JsonProperty("plan_version") String planVersion,
    String goal,
    Understanding understanding,
    List<Assumption> assumptions,
    List<Inference> inferences,
    List<Ambiguity> ambiguities,
    @JsonProperty("reasoning_trace") List<ReasoningStep> reasoningTrace,
    @JsonProperty("clarifications_needed") List<String> clarificationsNeeded
) implements Serializable {

    public SemanticPlan {
        planVersion = planVersion == null || planVersion.isBlank() ? "1.0" : planVersion;
        assumptions = assumptions == null ? null : Defaults.list(assumptions);
        inferences = Defaults.list(inferences);
        ambiguities = Defaults.list(ambiguities);
        reasoningTrace = Defaults.list(reasoningTrace);
        clarificationsNeeded = Defaults.list(clarificationsNeeded);
        // understanding and assumptions stay nullable so schema validation can tell "absent" from "empty"
    }

    public Understanding understandingOrEmpty() {
        return understanding == null ? Understanding.empty() : understanding;
    }

    public List<Assumption> assumptionsOrEmpty() {
        return assumptions == null ? List.of() : assumptions;
    }
}
