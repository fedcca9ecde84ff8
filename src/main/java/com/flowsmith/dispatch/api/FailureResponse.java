package com.flowsmith.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.PipelineError;

import java.util.List;
import java.util.Map;

/**
 * JSON body for a request that failed inside a pipeline phase (HTTP 422).
 * {@code partial} carries whatever the failed stage produced, for diagnosis.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FailureResponse(
    boolean success,
    @JsonProperty("request_id") String requestId,
    String phase,
    List<PipelineError> errors,
    @JsonProperty("phase_times_ms") Map<String, Long> phaseTimesMs,
    Map<String, Object> partial
) {

    public static FailureResponse of(String requestId, List<PipelineError> errors, Map<String, Long> phaseTimes,
                                     Map<String, Object> partial) {
        String phase = errors.isEmpty() ? null : errors.get(0).phase().value();
        return new FailureResponse(false, requestId, phase, errors, phaseTimes,
                partial == null || partial.isEmpty() ? null : partial);
    }
}
