package com.flowsmith.core.compiler;

import com.flowsmith.core.model.Defaults;
import com.flowsmith.core.workflow.WorkflowStep;

import java.util.List;

public record CompiledWorkflow(List<WorkflowStep> steps, List<String> pluginsUsed) {

    public CompiledWorkflow {
        steps = Defaults.list(steps);
        pluginsUsed = Defaults.list(pluginsUsed);
    }
}
