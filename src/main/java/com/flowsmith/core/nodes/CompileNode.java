package com.flowsmith.core.nodes;

import com.flowsmith.core.compiler.CompilationOutcome;
import com.flowsmith.core.compiler.CompilationService;
import com.flowsmith.core.formalization.FormalizationResult;
import com.flowsmith.core.logging.MdcContext;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.state.CompilationState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class CompileNode {

    private static final Logger log = LoggerFactory.getLogger(CompileNode.class);

    private final CompilationService compilationService;

    public CompileNode(CompilationService compilationService) {
        this.compilationService = compilationService;
    }

    public Map<String, Object> apply(CompilationState state) {
        long start = System.currentTimeMillis();
        MdcContext.setPhase(PipelinePhase.COMPILATION);
        try {
            if (state.ir().isEmpty()) {
                return PhaseResults.failed(PipelinePhase.COMPILATION, start, "missing_ir", "No IR to compile");
            }
            Map<String, Object> facts = state.formalization().map(FormalizationResult::groundedFacts).orElse(Map.of());
            CompilationOutcome outcome = compilationService.compile(state.ir().get(),
                    state.effectivePlan().orElse(null), facts, state.feedback().orElse(null));
            log.info("Compiled {} steps with the {} compiler", outcome.steps().size(), outcome.compilerUsed());
            return PhaseResults.timed(PipelinePhase.COMPILATION, start, Map.of(
                    "compilation", outcome,
                    "workflow", outcome.steps()));
        } catch (RuntimeException e) {
            log.error("Compilation failed", e);
            return PhaseResults.failed(PipelinePhase.COMPILATION, start, e);
        } finally {
            MdcContext.clearPhase();
        }
    }
}
