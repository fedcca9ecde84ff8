package com.flowsmith.core.nodes;

import com.flowsmith.core.grounding.GroundingConfig;
import com.flowsmith.core.grounding.GroundingEngine;
import com.flowsmith.core.grounding.GroundingProperties;
import com.flowsmith.core.logging.MdcContext;
import com.flowsmith.core.metrics.PipelineMetrics;
import com.flowsmith.core.model.DataSourceMetadata;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.GroundingError;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.model.SemanticPlan;
import com.flowsmith.core.state.GenerationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Grounding phase. With fail-fast on, a blocking grounding error ends the
 * request; otherwise errors travel on the grounded plan to the review layer.
 */
@Component
public class GroundNode {

    private static final Logger log = LoggerFactory.getLogger(GroundNode.class);

    private final GroundingEngine engine;
    private final GroundingProperties properties;
    private final PipelineMetrics metrics;

    public GroundNode(GroundingEngine engine, GroundingProperties properties, PipelineMetrics metrics) {
        this.engine = engine;
        this.properties = properties;
        this.metrics = metrics;
    }

    public Map<String, Object> apply(GenerationState state) {
        long start = System.currentTimeMillis();
        MdcContext.setPhase(PipelinePhase.GROUNDING);
        try {
            SemanticPlan plan = state.semanticPlan().orElse(null);
            if (plan == null) {
                return PhaseResults.failed(PipelinePhase.GROUNDING, start, "missing_plan", "No semantic plan to ground");
            }
            if (state.skipGrounding()) {
                return PhaseResults.timed(PipelinePhase.GROUNDING, start,
                        Map.of("groundedPlan", engine.ungrounded(plan)));
            }

            GroundingConfig config = properties.toConfig();
            if (state.failFast()) {
                config = config.withFailFast(true);
            }
            DataSourceMetadata metadata = state.metadata().orElse(DataSourceMetadata.empty());
            GroundedSemanticPlan grounded = engine.ground(plan, metadata, config);
            metrics.recordGroundingConfidence(grounded.groundingConfidence());
            metrics.recordSkippedRatio(grounded.skippedAssumptionsCount(), grounded.totalAssumptionsCount());

            if (config.failFast() && grounded.hasBlockingErrors()) {
                String blocking = grounded.groundingErrors().stream()
                        .filter(GroundingError::isBlocking)
                        .map(GroundingError::message)
                        .collect(Collectors.joining("; "));
                log.warn("Fail-fast grounding stopped the request: {}", blocking);
                Map<String, Object> updates = new HashMap<>(PhaseResults.failed(PipelinePhase.GROUNDING, start,
                        "grounding_failed", blocking));
                updates.put("groundedPlan", grounded);
                return updates;
            }
            return PhaseResults.timed(PipelinePhase.GROUNDING, start, Map.of("groundedPlan", grounded));
        } catch (RuntimeException e) {
            log.error("Grounding phase failed", e);
            return PhaseResults.failed(PipelinePhase.GROUNDING, start, e);
        } finally {
            MdcContext.clearPhase();
        }
    }
}
