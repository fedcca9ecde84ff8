package com.flowsmith.core.compiler;

import com.flowsmith.core.model.Defaults;
import com.flowsmith.core.workflow.WorkflowStep;

import java.util.List;

/**
 * @param compilerUsed   {@value CompilationService#DECLARATIVE} or {@value CompilationService#LLM}
 * @param fallbackReason why the rule-based compiler was bypassed or failed; null when it succeeded
 */
public record CompilationOutcome(
    List<WorkflowStep> steps,
    String compilerUsed,
    String fallbackReason,
    List<String> pluginsUsed
) {
    public CompilationOutcome {
        steps = Defaults.list(steps);
        pluginsUsed = Defaults.list(pluginsUsed);
    }
}
