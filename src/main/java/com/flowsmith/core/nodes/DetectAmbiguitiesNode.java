package com.flowsmith.core.nodes;

import com.flowsmith.core.ambiguity.AmbiguityDetector;
import com.flowsmith.core.grounding.GroundingProperties;
import com.flowsmith.core.logging.MdcContext;
import com.flowsmith.core.model.AmbiguityReport;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.state.GenerationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class DetectAmbiguitiesNode {

    private static final Logger log = LoggerFactory.getLogger(DetectAmbiguitiesNode.class);

    private final AmbiguityDetector detector;
    private final GroundingProperties properties;

    public DetectAmbiguitiesNode(AmbiguityDetector detector, GroundingProperties properties) {
        this.detector = detector;
        this.properties = properties;
    }

    public Map<String, Object> apply(GenerationState state) {
        long start = System.currentTimeMillis();
        MdcContext.setPhase(PipelinePhase.AMBIGUITY_DETECTION);
        try {
            if (state.semanticPlan().isEmpty() || state.groundedPlan().isEmpty()) {
                return PhaseResults.failed(PipelinePhase.AMBIGUITY_DETECTION, start, "missing_plan",
                        "Ambiguity detection needs both the semantic and the grounded plan");
            }
            AmbiguityReport report = detector.detect(state.semanticPlan().get(), state.groundedPlan().get(),
                    state.enhancedPrompt().orElse(null), properties.getRequireConfirmationThreshold());
            log.info("Ambiguity report: {} must confirm, {} to review, {} look good (confidence {})",
                    report.mustConfirm().size(), report.shouldReview().size(), report.looksGood().size(),
                    String.format("%.2f", report.overallConfidence()));
            return PhaseResults.timed(PipelinePhase.AMBIGUITY_DETECTION, start, Map.of("ambiguityReport", report));
        } catch (RuntimeException e) {
            log.error("Ambiguity detection failed", e);
            return PhaseResults.failed(PipelinePhase.AMBIGUITY_DETECTION, start, e);
        } finally {
            MdcContext.clearPhase();
        }
    }
}
