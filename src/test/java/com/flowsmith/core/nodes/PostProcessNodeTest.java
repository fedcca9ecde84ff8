package com.flowsmith.core.nodes;

import com.flowsmith.core.compiler.ConditionSimplifier;
import com.flowsmith.core.compiler.OutputVariableStripper;
import com.flowsmith.core.compiler.StepShapeNormalizer;
import com.flowsmith.core.compiler.WorkflowPostProcessor;
import com.flowsmith.core.model.PhaseTiming;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.state.CompilationState;
import com.flowsmith.core.workflow.ActionStep;
import com.flowsmith.core.workflow.WorkflowStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PostProcessNodeTest {

    @Test
    @DisplayName("replaces the workflow with its post-processed form")
    void postProcesses() {
        var node = new PostProcessNode(new WorkflowPostProcessor(
                new ConditionSimplifier(), new OutputVariableStripper(), new StepShapeNormalizer()));
        List<WorkflowStep> steps = List.of(new ActionStep(null, "read", "Read", "google-sheets", "read_range", null, "rows"));

        var updates = node.apply(new CompilationState(Map.of("workflow", steps)));

        @SuppressWarnings("unchecked")
        var workflow = (List<WorkflowStep>) updates.get("workflow");
        assertEquals(new ActionStep("read", null, "Read", "google-sheets", "read_range", null, null), workflow.get(0));
        @SuppressWarnings("unchecked")
        var timings = (List<PhaseTiming>) updates.get("phaseTimings");
        assertEquals(PipelinePhase.NORMALIZATION, timings.get(0).phase());
    }
}
