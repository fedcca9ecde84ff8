package com.flowsmith.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.compiler.WorkflowValidationResult;
import com.flowsmith.core.formalization.FormalizationResult;
import com.flowsmith.core.ir.DeclarativeIr;
import com.flowsmith.core.workflow.WorkflowStep;

import java.util.List;
import java.util.Map;

/**
 * JSON response for a compile call that got as far as a workflow.
 * {@code success} is false when the workflow failed structural validation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CompileResponse(
    boolean success,
    @JsonProperty("request_id") String requestId,
    DeclarativeIr ir,
    List<WorkflowStep> workflow,
    WorkflowValidationResult validation,
    FormalizationResult formalization,
    Metadata metadata
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Metadata(
        @JsonProperty("phase_times_ms") Map<String, Long> phaseTimesMs,
        @JsonProperty("total_time_ms") long totalTimeMs,
        @JsonProperty("steps_generated") int stepsGenerated,
        @JsonProperty("plugins_used") List<String> pluginsUsed,
        @JsonProperty("compiler_used") String compilerUsed,
        @JsonProperty("fallback_reason") String fallbackReason
    ) {}
}
