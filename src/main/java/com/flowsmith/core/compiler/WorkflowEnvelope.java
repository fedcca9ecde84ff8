package com.flowsmith.core.compiler;

import com.flowsmith.core.model.Defaults;
import com.flowsmith.core.workflow.WorkflowStep;

import java.util.List;

/**
 * Model-compiler response shape: {@code {"workflow": [steps]}}.
 */
public record WorkflowEnvelope(List<WorkflowStep> workflow) {

    public WorkflowEnvelope {
        workflow = Defaults.list(workflow);
    }
}
