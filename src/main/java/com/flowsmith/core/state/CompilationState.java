package com.flowsmith.core.state;

import com.flowsmith.core.compiler.CompilationFeedback;
import com.flowsmith.core.compiler.CompilationOutcome;
import com.flowsmith.core.compiler.WorkflowValidationResult;
import com.flowsmith.core.formalization.FormalizationResult;
import com.flowsmith.core.ir.DeclarativeIr;
import com.flowsmith.core.ir.IrValidationResult;
import com.flowsmith.core.model.EnhancedPrompt;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.PhaseTiming;
import com.flowsmith.core.model.PipelineError;
import com.flowsmith.core.model.ResolvedInput;
import com.flowsmith.core.model.ReviewDecisions;
import com.flowsmith.core.workflow.WorkflowStep;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Graph state for stage two: apply decisions, formalize, validate IR, compile,
 * post-process, validate workflow.
 */
public class CompilationState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // inputs
        Map.entry("requestId",          Channels.base(() -> "")),
        Map.entry("userId",             Channels.base(() -> "")),
        Map.entry("groundedPlan",       Channels.base((Reducer<GroundedSemanticPlan>) null)),
        Map.entry("enhancedPrompt",     Channels.base((Reducer<EnhancedPrompt>) null)),
        Map.entry("decisions",          Channels.base(ReviewDecisions::none)),
        Map.entry("feedback",           Channels.base((Reducer<CompilationFeedback>) null)),

        // phase outputs
        Map.entry("resolvedInputs",     Channels.base((Supplier<List<ResolvedInput>>) List::of)),
        Map.entry("effectivePlan",      Channels.base((Reducer<GroundedSemanticPlan>) null)),
        Map.entry("formalization",      Channels.base((Reducer<FormalizationResult>) null)),
        Map.entry("ir",                 Channels.base((Reducer<DeclarativeIr>) null)),
        Map.entry("irValidation",       Channels.base((Reducer<IrValidationResult>) null)),
        Map.entry("compilation",        Channels.base((Reducer<CompilationOutcome>) null)),
        Map.entry("workflow",           Channels.base((Supplier<List<WorkflowStep>>) List::of)),
        Map.entry("workflowValidation", Channels.base((Reducer<WorkflowValidationResult>) null)),

        Map.entry("phaseTimings",       Channels.appender(ArrayList::new)),
        Map.entry("errors",             Channels.appender(ArrayList::new))
    );

    public CompilationState(Map<String, Object> initData) {
        super(initData);
    }

    public String requestId() {
        return this.<String>value("requestId").orElse("");
    }

    public String userId() {
        return this.<String>value("userId").orElse("");
    }

    public Optional<GroundedSemanticPlan> groundedPlan() {
        return value("groundedPlan");
    }

    public Optional<EnhancedPrompt> enhancedPrompt() {
        return value("enhancedPrompt");
    }

    public ReviewDecisions decisions() {
        return this.<ReviewDecisions>value("decisions").orElse(ReviewDecisions.none());
    }

    public Optional<CompilationFeedback> feedback() {
        return value("feedback");
    }

    public List<ResolvedInput> resolvedInputs() {
        return this.<List<ResolvedInput>>value("resolvedInputs").orElse(List.of());
    }

    /**
     * The grounded plan with user-disabled assumptions applied; falls back to
     * the submitted plan before decisions have run.
     */
    public Optional<GroundedSemanticPlan> effectivePlan() {
        Optional<GroundedSemanticPlan> effective = value("effectivePlan");
        return effective.isPresent() ? effective : groundedPlan();
    }

    public Optional<FormalizationResult> formalization() {
        return value("formalization");
    }

    public Optional<DeclarativeIr> ir() {
        return value("ir");
    }

    public Optional<IrValidationResult> irValidation() {
        return value("irValidation");
    }

    public Optional<CompilationOutcome> compilation() {
        return value("compilation");
    }

    public List<WorkflowStep> workflow() {
        return this.<List<WorkflowStep>>value("workflow").orElse(List.of());
    }

    public Optional<WorkflowValidationResult> workflowValidation() {
        return value("workflowValidation");
    }

    public List<PhaseTiming> phaseTimings() {
        return this.<List<PhaseTiming>>value("phaseTimings").orElse(List.of());
    }

    public List<PipelineError> errors() {
        return this.<List<PipelineError>>value("errors").orElse(List.of());
    }

    public boolean hasErrors() {
        return !errors().isEmpty();
    }
}
