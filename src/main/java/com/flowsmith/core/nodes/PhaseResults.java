package com.flowsmith.core.nodes;

import com.flowsmith.core.model.PhaseTiming;
import com.flowsmith.core.model.PipelineError;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.support.PipelineException;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * State-update builders shared by the pipeline nodes.
 */
final class PhaseResults {

    private PhaseResults() {
    }

    static Map<String, Object> timed(PipelinePhase phase, long startMillis, Map<String, Object> updates) {
        Map<String, Object> result = new HashMap<>(updates);
        result.put("phaseTimings", List.of(new PhaseTiming(phase, System.currentTimeMillis() - startMillis)));
        return result;
    }

    static Map<String, Object> failed(PipelinePhase phase, long startMillis, String code, String message) {
        return timed(phase, startMillis, Map.of("errors", List.of(new PipelineError(phase, code, message))));
    }

    /**
     * A {@link PipelineException} keeps its own phase and code; anything else is
     * attributed to the node's phase.
     */
    static Map<String, Object> failed(PipelinePhase phase, long startMillis, RuntimeException e) {
        if (e instanceof PipelineException pipelineException) {
            return failed(pipelineException.getPhase(), startMillis, pipelineException.getCode(), e.getMessage());
        }
        return failed(phase, startMillis, phase.value() + "_failed", String.valueOf(e.getMessage()));
    }
}
