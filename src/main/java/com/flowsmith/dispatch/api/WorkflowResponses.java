package com.flowsmith.dispatch.api;

import com.flowsmith.core.compiler.CompilationOutcome;
import com.flowsmith.core.compiler.WorkflowValidationResult;
import com.flowsmith.core.engine.WorkflowPipelineEngine;
import com.flowsmith.core.model.EnhancedPrompt;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.SemanticPlan;
import com.flowsmith.core.model.Understanding;
import com.flowsmith.core.semantic.SemanticPlanResult;
import com.flowsmith.core.state.CompilationState;
import com.flowsmith.core.state.GenerationState;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps final graph states to the wire responses. Shared by the REST and CLI surfaces.
 */
public final class WorkflowResponses {

    private WorkflowResponses() {
    }

    public static GenerateResponse generated(GenerationState state, String provider) {
        SemanticPlanResult semantic = state.semanticResult().orElseThrow();
        SemanticPlan plan = semantic.plan();
        GroundedSemanticPlan grounded = state.groundedPlan().orElseThrow();
        List<Understanding.EdgeCase> edgeCases = plan.understandingOrEmpty().edgeCases();
        List<String> services = state.enhancedPrompt().map(EnhancedPrompt::servicesInvolved).orElse(List.of());
        SemanticPlanResult.Metadata meta = semantic.metadata();

        var metadata = new GenerateResponse.Metadata(
                WorkflowPipelineEngine.phaseTimes(state.phaseTimings()),
                WorkflowPipelineEngine.totalTime(state.phaseTimings()),
                provider,
                meta == null ? null : meta.model(),
                meta == null ? 0 : meta.tokensUsed(),
                state.metadataOrigin().isEmpty() ? null : state.metadataOrigin(),
                services);
        return new GenerateResponse(true, state.requestId(), plan, grounded, state.ambiguityReport().orElse(null),
                plan.assumptionsOrEmpty(), edgeCases, semantic.warnings(), metadata);
    }

    public static CompileResponse compiled(CompilationState state) {
        CompilationOutcome outcome = state.compilation().orElseThrow();
        WorkflowValidationResult validation = state.workflowValidation().orElse(null);
        boolean valid = validation != null && validation.valid();

        var metadata = new CompileResponse.Metadata(
                WorkflowPipelineEngine.phaseTimes(state.phaseTimings()),
                WorkflowPipelineEngine.totalTime(state.phaseTimings()),
                state.workflow().size(),
                outcome.pluginsUsed(),
                outcome.compilerUsed(),
                outcome.fallbackReason());
        return new CompileResponse(valid, state.requestId(), state.ir().orElse(null), state.workflow(), validation,
                state.formalization().orElse(null), metadata);
    }

    public static FailureResponse failed(GenerationState state) {
        Map<String, Object> partial = new LinkedHashMap<>();
        state.semanticResult().ifPresent(r -> partial.put("semantic_plan_result", r));
        state.groundedPlan().ifPresent(p -> partial.put("grounded_plan", p));
        return FailureResponse.of(state.requestId(), state.errors(),
                WorkflowPipelineEngine.phaseTimes(state.phaseTimings()), partial);
    }

    public static FailureResponse failed(CompilationState state) {
        Map<String, Object> partial = new LinkedHashMap<>();
        state.ir().ifPresent(ir -> partial.put("ir", ir));
        state.irValidation().ifPresent(v -> partial.put("ir_validation", v));
        return FailureResponse.of(state.requestId(), state.errors(),
                WorkflowPipelineEngine.phaseTimes(state.phaseTimings()), partial);
    }
}
