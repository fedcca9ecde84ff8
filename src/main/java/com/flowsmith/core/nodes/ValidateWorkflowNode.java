package com.flowsmith.core.nodes;

import com.flowsmith.core.compiler.WorkflowValidationResult;
import com.flowsmith.core.compiler.WorkflowValidator;
import com.flowsmith.core.logging.MdcContext;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.state.CompilationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Reports structural validity of the final steps. An invalid workflow is
 * returned with the report rather than as a pipeline error.
 */
@Component
public class ValidateWorkflowNode {

    private static final Logger log = LoggerFactory.getLogger(ValidateWorkflowNode.class);

    private final WorkflowValidator validator;

    public ValidateWorkflowNode(WorkflowValidator validator) {
        this.validator = validator;
    }

    public Map<String, Object> apply(CompilationState state) {
        long start = System.currentTimeMillis();
        MdcContext.setPhase(PipelinePhase.NORMALIZATION);
        try {
            WorkflowValidationResult result = validator.validate(state.workflow());
            if (!result.warnings().isEmpty()) {
                log.warn("Workflow warnings: {}", result.warnings());
            }
            return PhaseResults.timed(PipelinePhase.NORMALIZATION, start, Map.of("workflowValidation", result));
        } catch (RuntimeException e) {
            log.error("Workflow validation failed unexpectedly", e);
            return PhaseResults.failed(PipelinePhase.NORMALIZATION, start, e);
        } finally {
            MdcContext.clearPhase();
        }
    }
}
