package com.flowsmith.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A grounding problem worth surfacing. Severity "error" blocks confident use of the plan.
 */
public record GroundingError(
    @JsonProperty("assumption_id") String assumptionId,
    @JsonProperty("error_type") String errorType,
    String message,
    String severity,
    @JsonProperty("suggested_fix") String suggestedFix
) implements Serializable {

    public static final String SEVERITY_ERROR = "error";
    public static final String SEVERITY_WARNING = "warning";

    @JsonIgnore
    public boolean isBlocking() {
        return SEVERITY_ERROR.equals(severity);
    }
}
