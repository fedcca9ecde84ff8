package com.flowsmith.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.AmbiguityReport;
import com.flowsmith.core.model.Assumption;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.SemanticPlan;
import com.flowsmith.core.model.Understanding;

import java.util.List;
import java.util.Map;

/**
 * JSON response for a successful generate call.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record GenerateResponse(
    boolean success,
    @JsonProperty("request_id") String requestId,
    @JsonProperty("semantic_plan") SemanticPlan semanticPlan,
    @JsonProperty("grounded_plan") GroundedSemanticPlan groundedPlan,
    @JsonProperty("ambiguity_report") AmbiguityReport ambiguityReport,
    List<Assumption> assumptions,
    @JsonProperty("edge_cases") List<Understanding.EdgeCase> edgeCases,
    List<String> warnings,
    Metadata metadata
) {

    public record Metadata(
        @JsonProperty("phase_times_ms") Map<String, Long> phaseTimesMs,
        @JsonProperty("total_time_ms") long totalTimeMs,
        String provider,
        String model,
        @JsonProperty("tokens_used") int tokensUsed,
        @JsonProperty("metadata_origin") String metadataOrigin,
        @JsonProperty("services_involved") List<String> servicesInvolved
    ) {}
}
