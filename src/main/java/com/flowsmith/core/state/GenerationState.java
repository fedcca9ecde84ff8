package com.flowsmith.core.state;

import com.flowsmith.core.model.AmbiguityReport;
import com.flowsmith.core.model.DataSourceMetadata;
import com.flowsmith.core.model.EnhancedPrompt;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.PhaseTiming;
import com.flowsmith.core.model.PipelineError;
import com.flowsmith.core.model.SemanticPlan;
import com.flowsmith.core.semantic.SemanticPlanResult;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Graph state for stage one: understand, resolve metadata, ground, detect
 * ambiguities. Errors and phase timings use appender channels.
 */
public class GenerationState extends AgentState {

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // inputs
        Map.entry("requestId",         Channels.base(() -> "")),
        Map.entry("userId",            Channels.base(() -> "")),
        Map.entry("enhancedPrompt",    Channels.base((Reducer<EnhancedPrompt>) null)),
        Map.entry("suppliedMetadata",  Channels.base((Reducer<DataSourceMetadata>) null)),
        Map.entry("failFast",          Channels.base(() -> false)),
        Map.entry("skipGrounding",     Channels.base(() -> false)),

        // phase outputs
        Map.entry("semanticResult",    Channels.base((Reducer<SemanticPlanResult>) null)),
        Map.entry("metadata",          Channels.base((Reducer<DataSourceMetadata>) null)),
        Map.entry("metadataOrigin",    Channels.base(() -> "")),
        Map.entry("groundedPlan",      Channels.base((Reducer<GroundedSemanticPlan>) null)),
        Map.entry("ambiguityReport",   Channels.base((Reducer<AmbiguityReport>) null)),

        Map.entry("phaseTimings",      Channels.appender(ArrayList::new)),
        Map.entry("errors",            Channels.appender(ArrayList::new))
    );

    public GenerationState(Map<String, Object> initData) {
        super(initData);
    }

    public String requestId() {
        return this.<String>value("requestId").orElse("");
    }

    public String userId() {
        return this.<String>value("userId").orElse("");
    }

    public Optional<EnhancedPrompt> enhancedPrompt() {
        return value("enhancedPrompt");
    }

    public Optional<DataSourceMetadata> suppliedMetadata() {
        return value("suppliedMetadata");
    }

    public boolean failFast() {
        return this.<Boolean>value("failFast").orElse(false);
    }

    public boolean skipGrounding() {
        return this.<Boolean>value("skipGrounding").orElse(false);
    }

    public Optional<SemanticPlanResult> semanticResult() {
        return value("semanticResult");
    }

    /**
     * The plan from a successful understanding phase.
     */
    public Optional<SemanticPlan> semanticPlan() {
        return semanticResult().filter(SemanticPlanResult::success).map(SemanticPlanResult::plan);
    }

    public Optional<DataSourceMetadata> metadata() {
        return value("metadata");
    }

    public String metadataOrigin() {
        return this.<String>value("metadataOrigin").orElse("");
    }

    public Optional<GroundedSemanticPlan> groundedPlan() {
        return value("groundedPlan");
    }

    public Optional<AmbiguityReport> ambiguityReport() {
        return value("ambiguityReport");
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
