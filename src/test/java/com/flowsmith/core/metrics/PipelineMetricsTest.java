package com.flowsmith.core.metrics;

import com.flowsmith.core.model.PipelinePhase;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PipelineMetricsTest {

    private SimpleMeterRegistry registry;
    private PipelineMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new PipelineMetrics(registry);
    }

    @Test
    @DisplayName("recordPhaseDuration creates a timer per phase")
    void recordPhaseDuration() {
        metrics.recordPhaseDuration(PipelinePhase.GROUNDING, 120);
        metrics.recordPhaseDuration(PipelinePhase.GROUNDING, 80);
        var timer = registry.find("flowsmith.phase.duration").tag("phase", "grounding").timer();
        assertNotNull(timer);
        assertEquals(2, timer.count());
    }

    @Test
    @DisplayName("recordStageOutcome counts by stage and outcome")
    void recordStageOutcome() {
        metrics.recordStageOutcome("generate", "success");
        metrics.recordStageOutcome("generate", "success");
        metrics.recordStageOutcome("compile", "failure");

        assertEquals(2.0, registry.find("flowsmith.stage.total")
                .tag("stage", "generate").tag("outcome", "success").counter().count());
        assertEquals(1.0, registry.find("flowsmith.stage.total")
                .tag("stage", "compile").tag("outcome", "failure").counter().count());
    }

    @Test
    @DisplayName("recordSkippedRatio ignores empty assumption sets")
    void recordSkippedRatio() {
        metrics.recordSkippedRatio(0, 0);
        assertNull(registry.find("flowsmith.grounding.skipped_ratio").summary());

        metrics.recordSkippedRatio(1, 4);
        var summary = registry.find("flowsmith.grounding.skipped_ratio").summary();
        assertNotNull(summary);
        assertEquals(0.25, summary.totalAmount(), 1e-9);
    }

    @Test
    @DisplayName("recordCompilerStrategy tags fallback usage")
    void recordCompilerStrategy() {
        metrics.recordCompilerStrategy("llm", true);
        metrics.recordCompilerStrategy("declarative", false);

        assertEquals(1.0, registry.find("flowsmith.compiler.strategy")
                .tag("strategy", "llm").tag("fallback", "true").counter().count());
        assertEquals(1.0, registry.find("flowsmith.compiler.strategy")
                .tag("strategy", "declarative").tag("fallback", "false").counter().count());
    }

    @Test
    @DisplayName("recordLlmCall records a counter and a timer")
    void recordLlmCall() {
        metrics.recordLlmCall("anthropic", "success", 900);
        assertEquals(1.0, registry.find("flowsmith.llm.calls")
                .tag("provider", "anthropic").tag("outcome", "success").counter().count());
        assertEquals(1, registry.find("flowsmith.llm.duration").tag("provider", "anthropic").timer().count());
    }

    @Test
    @DisplayName("recordGroundingConfidence feeds a distribution summary")
    void recordGroundingConfidence() {
        metrics.recordGroundingConfidence(0.9);
        assertEquals(1, registry.find("flowsmith.grounding.confidence").summary().count());
    }
}
