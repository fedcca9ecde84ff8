package com.flowsmith.core.formalization;

import com.flowsmith.core.model.Ambiguity;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.GroundingResult;
import com.flowsmith.core.model.ResolvedInput;
import com.flowsmith.core.model.ReviewDecisions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns review decisions into the flat, ordered override list formalization
 * consumes, and applies disabled assumptions to a copy of the grounded plan.
 */
@Component
public class DecisionResolver {

    public List<ResolvedInput> resolve(ReviewDecisions decisions, GroundedSemanticPlan plan) {
        List<ResolvedInput> overrides = new ArrayList<>();
        if (decisions == null) {
            return overrides;
        }

        for (Map.Entry<String, Object> entry : decisions.resolvedAmbiguities().entrySet()) {
            overrides.add(new ResolvedInput(ambiguityField(entry.getKey(), plan), entry.getValue()));
        }
        for (Map.Entry<String, Object> entry : decisions.confirmedPatterns().entrySet()) {
            overrides.add(new ResolvedInput(patternKey(entry.getKey()), entry.getValue()));
        }
        for (Map.Entry<String, Object> entry : decisions.edgeCaseHandling().entrySet()) {
            overrides.add(new ResolvedInput("edge_case_" + entry.getKey(), entry.getValue()));
        }
        for (Map.Entry<String, Object> entry : decisions.inputParameters().entrySet()) {
            overrides.add(new ResolvedInput(entry.getKey(), entry.getValue()));
        }
        return overrides;
    }

    /**
     * Returns a copy of {@code plan} whose results for the given assumptions are
     * marked skipped with method {@code user_disabled}. The input is not modified.
     */
    public GroundedSemanticPlan applyDisabled(GroundedSemanticPlan plan, List<String> disabledAssumptions) {
        if (disabledAssumptions == null || disabledAssumptions.isEmpty()) {
            return plan;
        }
        Set<String> disabled = new HashSet<>(disabledAssumptions);
        List<GroundingResult> results = plan.groundingResults().stream()
                .map(r -> disabled.contains(r.assumptionId()) ? r.asUserDisabled() : r)
                .toList();
        return plan.withGroundingResults(results);
    }

    static String ambiguityField(String ambiguityId, GroundedSemanticPlan plan) {
        if (plan != null) {
            for (Ambiguity ambiguity : plan.ambiguities()) {
                if (ambiguityId.equals(ambiguity.id()) && !ambiguity.field().isBlank()) {
                    return ambiguity.field();
                }
            }
        }
        return ambiguityId.replaceFirst("^ambiguity_", "");
    }

    static String patternKey(String patternId) {
        return patternId.replaceFirst("^pattern_", "").replaceFirst("^layer[25]_", "");
    }
}
