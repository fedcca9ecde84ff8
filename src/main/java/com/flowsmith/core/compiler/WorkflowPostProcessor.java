package com.flowsmith.core.compiler;

import com.flowsmith.core.workflow.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Fixed post-processing run on every compiled workflow, whichever compiler
 * produced it: condition simplification, output-variable stripping, then
 * shape normalisation.
 */
@Component
public class WorkflowPostProcessor {

    private static final Logger log = LoggerFactory.getLogger(WorkflowPostProcessor.class);

    private final ConditionSimplifier conditionSimplifier;
    private final OutputVariableStripper outputVariableStripper;
    private final StepShapeNormalizer stepShapeNormalizer;

    public WorkflowPostProcessor(ConditionSimplifier conditionSimplifier,
                                 OutputVariableStripper outputVariableStripper,
                                 StepShapeNormalizer stepShapeNormalizer) {
        this.conditionSimplifier = conditionSimplifier;
        this.outputVariableStripper = outputVariableStripper;
        this.stepShapeNormalizer = stepShapeNormalizer;
    }

    public List<WorkflowStep> process(List<WorkflowStep> steps) {
        List<WorkflowStep> simplified = conditionSimplifier.simplify(steps);
        List<WorkflowStep> stripped = outputVariableStripper.strip(simplified);
        List<WorkflowStep> normalized = stepShapeNormalizer.normalize(stripped);
        log.info("Post-processed {} steps", normalized.size());
        return normalized;
    }
}
