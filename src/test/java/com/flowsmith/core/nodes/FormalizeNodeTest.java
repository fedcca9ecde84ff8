package com.flowsmith.core.nodes;

import com.flowsmith.core.formalization.FormalizationResult;
import com.flowsmith.core.formalization.IRFormalizer;
import com.flowsmith.core.ir.DeclarativeIr;
import com.flowsmith.core.model.EnhancedPrompt;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.PipelineError;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.model.ResolvedInput;
import com.flowsmith.core.model.SemanticPlan;
import com.flowsmith.core.model.Understanding;
import com.flowsmith.core.state.CompilationState;
import com.flowsmith.core.support.PipelineException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class FormalizeNodeTest {

    private final GroundedSemanticPlan plan = GroundedSemanticPlan.of(
            new SemanticPlan("1.0", "goal", Understanding.empty(), List.of(), null, null, null, null),
            true, List.of(), List.of(), 1.0, "now", 0, 0, false);

    @Test
    @DisplayName("formalizes the effective plan with resolved inputs and involved services")
    void formalizes() {
        var ir = new DeclarativeIr("3.0", "goal", null, null, null, null, null, null, null, null, null, null, null, null);
        var result = new FormalizationResult(ir, Map.of(), List.of(), 1.0, List.of(), "gpt-4o", "now", null);
        var inputs = List.of(new ResolvedInput("recipient", "me@example.com"));
        var prompt = new EnhancedPrompt(null, null, new EnhancedPrompt.Specifics(List.of("slack"), null));
        IRFormalizer formalizer = mock(IRFormalizer.class);
        when(formalizer.formalize(plan, inputs, List.of("slack"))).thenReturn(result);

        var updates = new FormalizeNode(formalizer).apply(new CompilationState(Map.of(
                "effectivePlan", plan, "resolvedInputs", inputs, "enhancedPrompt", prompt)));

        assertSame(result, updates.get("formalization"));
        assertSame(ir, updates.get("ir"));
    }

    @Test
    @DisplayName("a formalization failure keeps its phase and code")
    void failure() {
        IRFormalizer formalizer = mock(IRFormalizer.class);
        when(formalizer.formalize(any(), anyList(), anyList())).thenThrow(
                new PipelineException(PipelinePhase.FORMALIZATION, "formalization_failed", "model gave up"));

        var updates = new FormalizeNode(formalizer).apply(new CompilationState(Map.of("groundedPlan", plan)));

        @SuppressWarnings("unchecked")
        var errors = (List<PipelineError>) updates.get("errors");
        assertEquals(new PipelineError(PipelinePhase.FORMALIZATION, "formalization_failed", "model gave up"), errors.get(0));
    }
}
