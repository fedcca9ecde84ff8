package com.flowsmith.core.nodes;

import com.flowsmith.core.logging.MdcContext;
import com.flowsmith.core.model.EnhancedPrompt;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.semantic.SemanticPlanGenerator;
import com.flowsmith.core.semantic.SemanticPlanResult;
import com.flowsmith.core.state.GenerationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Understanding phase: turns the enhanced prompt into a semantic plan.
 */
@Component
public class UnderstandNode {

    private static final Logger log = LoggerFactory.getLogger(UnderstandNode.class);

    private final SemanticPlanGenerator generator;

    public UnderstandNode(SemanticPlanGenerator generator) {
        this.generator = generator;
    }

    public Map<String, Object> apply(GenerationState state) {
        long start = System.currentTimeMillis();
        MdcContext.setPhase(PipelinePhase.UNDERSTANDING);
        try {
            EnhancedPrompt prompt = state.enhancedPrompt().orElse(null);
            if (prompt == null) {
                return PhaseResults.failed(PipelinePhase.UNDERSTANDING, start, "missing_prompt",
                        "No enhanced prompt in request");
            }
            SemanticPlanResult result = generator.generate(prompt);
            if (!result.success()) {
                log.warn("Understanding failed: {}", result.errors());
                Map<String, Object> updates = new HashMap<>(PhaseResults.failed(PipelinePhase.UNDERSTANDING, start,
                        "semantic_plan_failed", String.join("; ", result.errors())));
                updates.put("semanticResult", result);
                return updates;
            }
            return PhaseResults.timed(PipelinePhase.UNDERSTANDING, start, Map.of("semanticResult", result));
        } catch (RuntimeException e) {
            log.error("Understanding phase failed", e);
            return PhaseResults.failed(PipelinePhase.UNDERSTANDING, start, e);
        } finally {
            MdcContext.clearPhase();
        }
    }
}
