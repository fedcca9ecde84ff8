package com.flowsmith.core.nodes;

import com.flowsmith.core.compiler.WorkflowValidationResult;
import com.flowsmith.core.compiler.WorkflowValidator;
import com.flowsmith.core.state.CompilationState;
import com.flowsmith.core.workflow.ActionStep;
import com.flowsmith.core.workflow.WorkflowStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ValidateWorkflowNodeTest {

    @Test
    @DisplayName("an invalid workflow is reported in the result, not as a pipeline error")
    void invalidWorkflowIsNotAnError() {
        List<WorkflowStep> steps = List.of(new ActionStep("step_1", null, "Read", null, null, null, null));
        var result = new WorkflowValidationResult(false, List.of("Action step step_1 has no plugin"), List.of());
        WorkflowValidator validator = mock(WorkflowValidator.class);
        when(validator.validate(steps)).thenReturn(result);

        var updates = new ValidateWorkflowNode(validator).apply(new CompilationState(Map.of("workflow", steps)));

        assertSame(result, updates.get("workflowValidation"));
        assertFalse(updates.containsKey("errors"));
    }
}
