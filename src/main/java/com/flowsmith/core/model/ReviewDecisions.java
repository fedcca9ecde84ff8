package com.flowsmith.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Decisions captured by the human-review layer between the two stages.
 * Map iteration order follows the submitted JSON order.
 */
public record ReviewDecisions(
    @JsonProperty("confirmed_patterns") Map<String, Object> confirmedPatterns,
    @JsonProperty("resolved_ambiguities") Map<String, Object> resolvedAmbiguities,
    @JsonProperty("approved_assumptions") List<String> approvedAssumptions,
    @JsonProperty("disabled_assumptions") List<String> disabledAssumptions,
    @JsonProperty("edge_case_handling") Map<String, Object> edgeCaseHandling,
    @JsonProperty("input_parameters") Map<String, Object> inputParameters
) implements Serializable {

    public ReviewDecisions {
        confirmedPatterns = Defaults.map(confirmedPatterns);
        resolvedAmbiguities = Defaults.map(resolvedAmbiguities);
        approvedAssumptions = Defaults.list(approvedAssumptions);
        disabledAssumptions = Defaults.list(disabledAssumptions);
        edgeCaseHandling = Defaults.map(edgeCaseHandling);
        inputParameters = Defaults.map(inputParameters);
    }

    public static ReviewDecisions none() {
        return new ReviewDecisions(null, null, null, null, null, null);
    }
}
