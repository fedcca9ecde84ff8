package com.flowsmith.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * A {@link SemanticPlan} extended with grounding outcomes. Serialises flat,
 * with the plan's own fields at the top level, so the review layer can send
 * it back unchanged for compilation.
 * <p>
 * {@code groundingConfidence} is the geometric mean over genuinely validated
 * assumptions only, and exactly 0.0 when none were validated.
 */
public record GroundedSemanticPlan(
    @JsonProperty("plan_version") String planVersion,
    String goal,
    Understanding understanding,
    List<Assumption> assumptions,
    List<Inference> inferences,
    List<Ambiguity> ambiguities,
    @JsonProperty("reasoning_trace") List<ReasoningStep> reasoningTrace,
    @JsonProperty("clarifications_needed") List<String> clarificationsNeeded,
    boolean grounded,
    @JsonProperty("grounding_results") List<GroundingResult> groundingResults,
    @JsonProperty("grounding_errors") List<GroundingError> groundingErrors,
    @JsonProperty("grounding_confidence") double groundingConfidence,
    @JsonProperty("grounding_timestamp") String groundingTimestamp,
    @JsonProperty("validated_assumptions_count") int validatedAssumptionsCount,
    @JsonProperty("total_assumptions_count") int totalAssumptionsCount,
    @JsonProperty("skipped_assumptions_count") int skippedAssumptionsCount,
    @JsonProperty("all_assumptions_skipped") boolean allAssumptionsSkipped
) implements Serializable {

    public GroundedSemanticPlan {
        understanding = understanding == null ? Understanding.empty() : understanding;
        assumptions = Defaults.list(assumptions);
        inferences = Defaults.list(inferences);
        ambiguities = Defaults.list(ambiguities);
        reasoningTrace = Defaults.list(reasoningTrace);
        clarificationsNeeded = Defaults.list(clarificationsNeeded);
        groundingResults = Defaults.list(groundingResults);
        groundingErrors = Defaults.list(groundingErrors);
    }

    public static GroundedSemanticPlan of(SemanticPlan plan,
                                          boolean grounded,
                                          List<GroundingResult> results,
                                          List<GroundingError> errors,
                                          double confidence,
                                          String timestamp,
                                          int validatedCount,
                                          int skippedCount,
                                          boolean allSkipped) {
        return new GroundedSemanticPlan(
                plan.planVersion(), plan.goal(), plan.understandingOrEmpty(), plan.assumptionsOrEmpty(),
                plan.inferences(), plan.ambiguities(), plan.reasoningTrace(), plan.clarificationsNeeded(),
                grounded, results, errors, confidence, timestamp,
                validatedCount, plan.assumptionsOrEmpty().size(), skippedCount, allSkipped);
    }

    public SemanticPlan semanticPlan() {
        return new SemanticPlan(planVersion, goal, understanding, assumptions, inferences,
                ambiguities, reasoningTrace, clarificationsNeeded);
    }

    public GroundedSemanticPlan withGroundingResults(List<GroundingResult> results) {
        return new GroundedSemanticPlan(planVersion, goal, understanding, assumptions, inferences,
                ambiguities, reasoningTrace, clarificationsNeeded, grounded, results, groundingErrors,
                groundingConfidence, groundingTimestamp, validatedAssumptionsCount, totalAssumptionsCount,
                skippedAssumptionsCount, allAssumptionsSkipped);
    }

    public Optional<Assumption> findAssumption(String id) {
        return assumptions.stream().filter(a -> id != null && id.equals(a.id())).findFirst();
    }

    public Optional<GroundingResult> findResult(String assumptionId) {
        return groundingResults.stream()
                .filter(r -> assumptionId != null && assumptionId.equals(r.assumptionId()))
                .findFirst();
    }

    @JsonIgnore
    public boolean hasBlockingErrors() {
        return groundingErrors.stream().anyMatch(GroundingError::isBlocking);
    }
}
