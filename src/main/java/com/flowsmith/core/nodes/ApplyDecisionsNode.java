package com.flowsmith.core.nodes;

import com.flowsmith.core.formalization.DecisionResolver;
import com.flowsmith.core.logging.MdcContext;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.model.ResolvedInput;
import com.flowsmith.core.model.ReviewDecisions;
import com.flowsmith.core.state.CompilationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Merges review decisions into an ordered override list and prunes disabled
 * assumptions. The prompt's own resolved inputs come first.
 */
@Component
public class ApplyDecisionsNode {

    private static final Logger log = LoggerFactory.getLogger(ApplyDecisionsNode.class);

    private final DecisionResolver resolver;

    public ApplyDecisionsNode(DecisionResolver resolver) {
        this.resolver = resolver;
    }

    public Map<String, Object> apply(CompilationState state) {
        long start = System.currentTimeMillis();
        MdcContext.setPhase(PipelinePhase.FORMALIZATION);
        try {
            GroundedSemanticPlan plan = state.groundedPlan().orElse(null);
            if (plan == null) {
                return PhaseResults.failed(PipelinePhase.FORMALIZATION, start, "missing_plan",
                        "No grounded plan in request");
            }
            ReviewDecisions decisions = state.decisions();
            List<ResolvedInput> resolved = new ArrayList<>();
            state.enhancedPrompt().ifPresent(prompt -> resolved.addAll(prompt.resolvedUserInputs()));
            resolved.addAll(resolver.resolve(decisions, plan));
            GroundedSemanticPlan effective = resolver.applyDisabled(plan, decisions.disabledAssumptions());
            log.info("Applied decisions: {} overrides, {} disabled assumptions",
                    resolved.size(), decisions.disabledAssumptions().size());
            return PhaseResults.timed(PipelinePhase.FORMALIZATION, start, Map.of(
                    "resolvedInputs", resolved,
                    "effectivePlan", effective));
        } catch (RuntimeException e) {
            log.error("Applying decisions failed", e);
            return PhaseResults.failed(PipelinePhase.FORMALIZATION, start, e);
        } finally {
            MdcContext.clearPhase();
        }
    }
}
