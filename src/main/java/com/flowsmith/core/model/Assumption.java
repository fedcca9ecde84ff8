package com.flowsmith.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Map;

/**
 * A specific, falsifiable claim made during understanding, e.g. "the recipient
 * field is named X". Grounding validates it against sampled data.
 *
 * @param id                 stable identifier, referenced by grounding results and review decisions
 * @param category           selects the validator
 * @param description        human-readable claim
 * @param confidence         the model's own confidence in the claim
 * @param validationStrategy method plus free-form parameters (candidates, expected type, pattern)
 * @param impactIfWrong      severity used by fail-fast and confirmation tiers
 * @param fallback           what to do when the claim is wrong; surfaced as a suggested fix
 */
public record Assumption(
    String id,
    AssumptionCategory category,
    String description,
    ConfidenceLevel confidence,
    @JsonProperty("validation_strategy") ValidationStrategy validationStrategy,
    @JsonProperty("impact_if_wrong") ImpactLevel impactIfWrong,
    String fallback
) implements Serializable {

    public Assumption {
        category = category == null ? AssumptionCategory.UNKNOWN : category;
        description = Defaults.text(description);
        confidence = confidence == null ? ConfidenceLevel.MEDIUM : confidence;
        validationStrategy = validationStrategy == null ? new ValidationStrategy(null, null, null) : validationStrategy;
        impactIfWrong = impactIfWrong == null ? ImpactLevel.LOW : impactIfWrong;
    }

    @JsonIgnore
    public boolean isCritical() {
        return impactIfWrong == ImpactLevel.CRITICAL;
    }

    public Map<String, Object> parameters() {
        return validationStrategy.parameters();
    }

    public record ValidationStrategy(
        String method,
        Map<String, Object> parameters,
        Double threshold
    ) implements Serializable {
        public ValidationStrategy {
            method = Defaults.text(method);
            parameters = Defaults.map(parameters);
        }
    }
}
