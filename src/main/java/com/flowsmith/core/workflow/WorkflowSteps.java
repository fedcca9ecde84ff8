package com.flowsmith.core.workflow;

import java.util.ArrayList;
import java.util.List;

public final class WorkflowSteps {

    private WorkflowSteps() {
    }

    /**
     * Depth-first, parent before children. Covers scatter bodies (canonical and
     * legacy) and both conditional branches.
     */
    public static List<WorkflowStep> flatten(List<WorkflowStep> steps) {
        List<WorkflowStep> all = new ArrayList<>();
        collect(steps, all);
        return all;
    }

    public static List<WorkflowStep> children(WorkflowStep step) {
        if (step instanceof ScatterGatherStep scatterGather) {
            List<WorkflowStep> nested = new ArrayList<>();
            if (scatterGather.scatter() != null) {
                nested.addAll(scatterGather.scatter().steps());
            }
            if (scatterGather.config() != null && scatterGather.config().actions() != null) {
                nested.addAll(scatterGather.config().actions());
            }
            return nested;
        }
        if (step instanceof ConditionalStep conditional) {
            List<WorkflowStep> nested = new ArrayList<>(conditional.thenSteps());
            nested.addAll(conditional.elseSteps());
            return nested;
        }
        return List.of();
    }

    private static void collect(List<WorkflowStep> steps, List<WorkflowStep> into) {
        for (WorkflowStep step : steps) {
            into.add(step);
            collect(children(step), into);
        }
    }
}
