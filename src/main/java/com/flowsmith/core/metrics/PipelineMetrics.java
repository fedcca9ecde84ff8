package com.flowsmith.core.metrics;

import com.flowsmith.core.model.PipelinePhase;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for the workflow pipeline.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPhaseDuration(PipelinePhase phase, long ms) {
        Timer.builder("flowsmith.phase.duration")
                .tag("phase", phase.value())
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param stage   "generate" or "compile"
     * @param outcome "success" or "failure"
     */
    public void recordStageOutcome(String stage, String outcome) {
        Counter.builder("flowsmith.stage.total")
                .tag("stage", stage)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordGroundingConfidence(double confidence) {
        DistributionSummary.builder("flowsmith.grounding.confidence")
                .register(registry)
                .record(confidence);
    }

    public void recordSkippedRatio(int skipped, int total) {
        if (total <= 0) {
            return;
        }
        DistributionSummary.builder("flowsmith.grounding.skipped_ratio")
                .description("Share of assumptions skipped for lack of metadata")
                .register(registry)
                .record((double) skipped / total);
    }

    /**
     * @param strategy "declarative" or "llm"
     */
    public void recordCompilerStrategy(String strategy, boolean fallback) {
        Counter.builder("flowsmith.compiler.strategy")
                .tag("strategy", strategy)
                .tag("fallback", String.valueOf(fallback))
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "success", "timeout", "empty" or "error"
     */
    public void recordLlmCall(String provider, String outcome, long ms) {
        Counter.builder("flowsmith.llm.calls")
                .tag("provider", provider)
                .tag("outcome", outcome)
                .register(registry)
                .increment();
        Timer.builder("flowsmith.llm.duration")
                .tag("provider", provider)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
