package com.flowsmith.core.compiler;

import com.flowsmith.core.catalog.PluginCatalog;
import com.flowsmith.core.workflow.ActionStep;
import com.flowsmith.core.workflow.ScatterGatherStep;
import com.flowsmith.core.workflow.WorkflowStep;
import com.flowsmith.core.workflow.WorkflowSteps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks on post-processed steps. Unknown plugins only warn; the
 * catalog may lag behind what the execution engine has connected.
 */
@Component
public class WorkflowValidator {

    private static final Logger log = LoggerFactory.getLogger(WorkflowValidator.class);

    private final PluginCatalog catalog;

    public WorkflowValidator(PluginCatalog catalog) {
        this.catalog = catalog;
    }

    public WorkflowValidationResult validate(List<WorkflowStep> steps) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (steps == null || steps.isEmpty()) {
            errors.add("Workflow has no steps");
            return new WorkflowValidationResult(false, errors, warnings);
        }

        Set<String> seen = new HashSet<>();
        for (WorkflowStep step : WorkflowSteps.flatten(steps)) {
            String id = step.canonicalId();
            if (id == null || id.isBlank()) {
                errors.add("Step without id: " + describe(step));
            } else if (!seen.add(id)) {
                errors.add("Duplicate step id: " + id);
            }

            if (step instanceof ActionStep action) {
                if (isBlank(action.plugin())) {
                    errors.add("Action step " + id + " has no plugin");
                } else if (!catalog.contains(action.plugin())) {
                    warnings.add("Action step " + id + " uses unknown plugin '" + action.plugin() + "'");
                }
                if (isBlank(action.action())) {
                    errors.add("Action step " + id + " has no action");
                }
            } else if (step instanceof ScatterGatherStep scatterGather) {
                ScatterGatherStep.Scatter scatter = scatterGather.scatter();
                if (scatter == null || isBlank(scatter.input())) {
                    errors.add("Scatter/gather step " + id + " has no scatter input");
                }
                if (scatter == null || scatter.steps().isEmpty()) {
                    errors.add("Scatter/gather step " + id + " has no nested steps");
                }
                if (scatterGather.gather() == null || isBlank(scatterGather.gather().operation())) {
                    errors.add("Scatter/gather step " + id + " has no gather operation");
                }
            }
        }

        if (!errors.isEmpty()) {
            log.warn("Workflow validation failed: {}", errors);
        }
        return new WorkflowValidationResult(errors.isEmpty(), errors, warnings);
    }

    private static String describe(WorkflowStep step) {
        return step.description() != null ? step.description() : step.getClass().getSimpleName();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
