package com.flowsmith.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Outcome of validating one assumption. A skipped result is never validated
 * and always carries confidence 0.0; the compact constructor enforces this.
 */
public record GroundingResult(
    @JsonProperty("assumption_id") String assumptionId,
    boolean validated,
    boolean skipped,
    @JsonProperty("resolved_value") Object resolvedValue,
    @JsonProperty("validation_method") String validationMethod,
    double confidence,
    String evidence,
    List<Alternative> alternatives
) implements Serializable {

    public GroundingResult {
        if (skipped) {
            validated = false;
            confidence = 0.0;
        }
        confidence = Math.max(0.0, Math.min(1.0, confidence));
        alternatives = Defaults.list(alternatives);
    }

    public static GroundingResult skipped(String assumptionId, String method, String evidence) {
        return new GroundingResult(assumptionId, false, true, null, method, 0.0, evidence, List.of());
    }

    public static GroundingResult failed(String assumptionId, String method, String evidence) {
        return new GroundingResult(assumptionId, false, false, null, method, 0.0, evidence, List.of());
    }

    public GroundingResult withAssumptionId(String id) {
        return new GroundingResult(id, validated, skipped, resolvedValue, validationMethod, confidence, evidence, alternatives);
    }

    public GroundingResult asUserDisabled() {
        return new GroundingResult(assumptionId, false, true, resolvedValue, "user_disabled", 0.0, evidence, alternatives);
    }

    public record Alternative(String value, double confidence, String reasoning) implements Serializable {}
}
