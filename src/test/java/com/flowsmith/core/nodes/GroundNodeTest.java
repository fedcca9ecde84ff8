package com.flowsmith.core.nodes;

import com.flowsmith.core.grounding.GroundingConfig;
import com.flowsmith.core.grounding.GroundingEngine;
import com.flowsmith.core.grounding.GroundingProperties;
import com.flowsmith.core.metrics.PipelineMetrics;
import com.flowsmith.core.model.DataSourceMetadata;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.GroundingError;
import com.flowsmith.core.model.PipelineError;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.model.SemanticPlan;
import com.flowsmith.core.model.Understanding;
import com.flowsmith.core.semantic.SemanticPlanResult;
import com.flowsmith.core.state.GenerationState;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class GroundNodeTest {

    private GroundingEngine engine;
    private SimpleMeterRegistry registry;
    private GroundNode node;

    private final SemanticPlan plan = new SemanticPlan("1.0", "goal", Understanding.empty(), List.of(),
            null, null, null, null);

    @BeforeEach
    void setUp() {
        engine = mock(GroundingEngine.class);
        registry = new SimpleMeterRegistry();
        node = new GroundNode(engine, new GroundingProperties(), new PipelineMetrics(registry));
    }

    private GenerationState state(Map<String, Object> extra) {
        Map<String, Object> data = new HashMap<>(extra);
        data.put("semanticResult", new SemanticPlanResult(true, plan, null, null, null));
        return new GenerationState(data);
    }

    private GroundedSemanticPlan grounded(List<GroundingError> errors) {
        return GroundedSemanticPlan.of(plan, true, List.of(), errors, 0.9, "now", 0, 0, false);
    }

    @Test
    @DisplayName("grounds against resolved metadata and records confidence")
    void grounds() {
        var metadata = new DataSourceMetadata("tabular", List.of("Stage"), null, null, 1, null);
        var result = grounded(List.of());
        when(engine.ground(eq(plan), eq(metadata), any(GroundingConfig.class))).thenReturn(result);

        var updates = node.apply(state(Map.of("metadata", metadata)));

        assertSame(result, updates.get("groundedPlan"));
        assertFalse(updates.containsKey("errors"));
        assertEquals(1, registry.find("flowsmith.grounding.confidence").summary().count());
    }

    @Test
    @DisplayName("missing metadata grounds against empty metadata")
    void emptyMetadata() {
        when(engine.ground(eq(plan), eq(DataSourceMetadata.empty()), any(GroundingConfig.class))).thenReturn(grounded(List.of()));

        var updates = node.apply(state(Map.of()));

        assertNotNull(updates.get("groundedPlan"));
    }

    @Test
    @DisplayName("fail-fast with a blocking error keeps the plan and reports a grounding error")
    void failFast() {
        var blocking = new GroundingError("recipient", "field_not_found", "Field 'Email' not found", "error", null);
        var result = grounded(List.of(blocking));
        when(engine.ground(eq(plan), any(), any(GroundingConfig.class))).thenReturn(result);

        var updates = node.apply(state(Map.of("failFast", true)));

        var config = ArgumentCaptor.forClass(GroundingConfig.class);
        verify(engine).ground(eq(plan), any(), config.capture());
        assertTrue(config.getValue().failFast());
        assertSame(result, updates.get("groundedPlan"));
        @SuppressWarnings("unchecked")
        var errors = (List<PipelineError>) updates.get("errors");
        assertEquals(new PipelineError(PipelinePhase.GROUNDING, "grounding_failed", "Field 'Email' not found"), errors.get(0));
    }

    @Test
    @DisplayName("without fail-fast, blocking errors travel on the plan only")
    void noFailFast() {
        var blocking = new GroundingError("recipient", "field_not_found", "Field 'Email' not found", "error", null);
        when(engine.ground(eq(plan), any(), any(GroundingConfig.class))).thenReturn(grounded(List.of(blocking)));

        var updates = node.apply(state(Map.of()));

        assertFalse(updates.containsKey("errors"));
    }

    @Test
    @DisplayName("skip grounding returns the ungrounded plan")
    void skipGrounding() {
        var ungrounded = GroundedSemanticPlan.of(plan, false, List.of(), List.of(), 0.0, "now", 0, 0, true);
        when(engine.ungrounded(plan)).thenReturn(ungrounded);

        var updates = node.apply(state(Map.of("skipGrounding", true)));

        assertSame(ungrounded, updates.get("groundedPlan"));
        verify(engine, never()).ground(any(), any(), any());
    }

    @Test
    @DisplayName("no semantic plan means nothing to ground")
    void missingPlan() {
        var updates = node.apply(new GenerationState(Map.of()));

        @SuppressWarnings("unchecked")
        var errors = (List<PipelineError>) updates.get("errors");
        assertEquals("missing_plan", errors.get(0).code());
        verifyNoInteractions(engine);
    }
}
