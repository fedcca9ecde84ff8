package com.flowsmith.core.compiler;

import com.flowsmith.core.workflow.ActionStep;
import com.flowsmith.core.workflow.AiProcessingStep;
import com.flowsmith.core.workflow.ConditionalStep;
import com.flowsmith.core.workflow.ScatterGatherStep;
import com.flowsmith.core.workflow.TransformStep;
import com.flowsmith.core.workflow.WorkflowStep;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Drops transient {@code output_variable} markers. Scatter/gather steps keep
 * theirs, along with everything inside them.
 */
@Component
public class OutputVariableStripper {

    public List<WorkflowStep> strip(List<WorkflowStep> steps) {
        return steps.stream().map(this::strip).toList();
    }

    WorkflowStep strip(WorkflowStep step) {
        if (step instanceof ScatterGatherStep) {
            return step;
        }
        if (step instanceof ConditionalStep conditional) {
            return new ConditionalStep(conditional.id(), conditional.stepId(), conditional.description(),
                    conditional.condition(), strip(conditional.thenSteps()), strip(conditional.elseSteps()), null);
        }
        if (step instanceof ActionStep || step instanceof TransformStep || step instanceof AiProcessingStep) {
            return step.withoutOutputVariable();
        }
        throw new IllegalArgumentException("Unknown step type: " + step.getClass().getName());
    }
}
