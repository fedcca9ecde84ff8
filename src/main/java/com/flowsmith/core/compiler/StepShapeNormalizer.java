package com.flowsmith.core.compiler;

import com.flowsmith.core.workflow.ActionStep;
import com.flowsmith.core.workflow.AiProcessingStep;
import com.flowsmith.core.workflow.ConditionalStep;
import com.flowsmith.core.workflow.ScatterGatherStep;
import com.flowsmith.core.workflow.TransformStep;
import com.flowsmith.core.workflow.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Folds legacy {@code step_id} into {@code id} at every depth and rewrites
 * legacy scatter/gather {@code config{data, item_variable, actions}} into the
 * canonical {@code scatter}/{@code gather} shape.
 */
@Component
public class StepShapeNormalizer {

    private static final Logger log = LoggerFactory.getLogger(StepShapeNormalizer.class);

    static final String DEFAULT_ITEM_VARIABLE = "item";

    public List<WorkflowStep> normalize(List<WorkflowStep> steps) {
        return steps.stream().map(this::normalize).toList();
    }

    WorkflowStep normalize(WorkflowStep step) {
        if (step instanceof ScatterGatherStep scatterGather) {
            return normalizeScatterGather(scatterGather);
        }
        if (step instanceof ConditionalStep conditional) {
            return new ConditionalStep(conditional.canonicalId(), null, conditional.description(),
                    conditional.condition(), normalize(conditional.thenSteps()), normalize(conditional.elseSteps()),
                    conditional.outputVariable());
        }
        if (step instanceof ActionStep || step instanceof TransformStep || step instanceof AiProcessingStep) {
            return step.stepId() == null ? step : step.withId(step.canonicalId());
        }
        throw new IllegalArgumentException("Unknown step type: " + step.getClass().getName());
    }

    private ScatterGatherStep normalizeScatterGather(ScatterGatherStep step) {
        ScatterGatherStep.Scatter scatter = step.scatter();
        ScatterGatherStep.LegacyConfig legacy = step.config();
        if (scatter == null && legacy != null) {
            log.debug("Rewriting legacy scatter_gather config in step {}", step.canonicalId());
            String itemVariable = legacy.itemVariable() == null ? DEFAULT_ITEM_VARIABLE : legacy.itemVariable();
            List<WorkflowStep> nested = legacy.actions() == null ? List.of() : legacy.actions();
            scatter = new ScatterGatherStep.Scatter(legacy.data(), itemVariable, normalize(nested));
        } else if (scatter != null) {
            String itemVariable = scatter.itemVariable() == null ? DEFAULT_ITEM_VARIABLE : scatter.itemVariable();
            scatter = new ScatterGatherStep.Scatter(scatter.input(), itemVariable, normalize(scatter.steps()));
        }
        ScatterGatherStep.Gather gather = step.gather() == null || step.gather().operation() == null
                ? ScatterGatherStep.Gather.collect() : step.gather();
        return new ScatterGatherStep(step.canonicalId(), null, step.description(), scatter, gather, null,
                step.outputVariable());
    }
}
