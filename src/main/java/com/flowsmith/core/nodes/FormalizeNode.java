package com.flowsmith.core.nodes;

import com.flowsmith.core.formalization.FormalizationResult;
import com.flowsmith.core.formalization.IRFormalizer;
import com.flowsmith.core.logging.MdcContext;
import com.flowsmith.core.model.EnhancedPrompt;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.state.CompilationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class FormalizeNode {

    private static final Logger log = LoggerFactory.getLogger(FormalizeNode.class);

    private final IRFormalizer formalizer;

    public FormalizeNode(IRFormalizer formalizer) {
        this.formalizer = formalizer;
    }

    public Map<String, Object> apply(CompilationState state) {
        long start = System.currentTimeMillis();
        MdcContext.setPhase(PipelinePhase.FORMALIZATION);
        try {
            var plan = state.effectivePlan().orElse(null);
            if (plan == null) {
                return PhaseResults.failed(PipelinePhase.FORMALIZATION, start, "missing_plan",
                        "No grounded plan to formalize");
            }
            List<String> services = state.enhancedPrompt().map(EnhancedPrompt::servicesInvolved).orElse(List.of());
            FormalizationResult result = formalizer.formalize(plan, state.resolvedInputs(), services);
            return PhaseResults.timed(PipelinePhase.FORMALIZATION, start, Map.of(
                    "formalization", result,
                    "ir", result.ir()));
        } catch (RuntimeException e) {
            log.error("Formalization failed", e);
            return PhaseResults.failed(PipelinePhase.FORMALIZATION, start, e);
        } finally {
            MdcContext.clearPhase();
        }
    }
}
