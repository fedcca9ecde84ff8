package com.flowsmith.core.compiler;

import com.flowsmith.core.ir.DeclarativeIr;
import com.flowsmith.core.metrics.PipelineMetrics;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.support.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Chooses the compiler. Feedback goes straight to the model compiler; otherwise
 * the rule-based compiler runs first and the model compiler is the fallback.
 */
@Service
public class CompilationService {

    private static final Logger log = LoggerFactory.getLogger(CompilationService.class);

    public static final String DECLARATIVE = "declarative";
    public static final String LLM = "llm";

    private final DeclarativeCompiler declarativeCompiler;
    private final LlmWorkflowCompiler llmWorkflowCompiler;
    private final PipelineMetrics metrics;

    public CompilationService(DeclarativeCompiler declarativeCompiler, LlmWorkflowCompiler llmWorkflowCompiler,
                              PipelineMetrics metrics) {
        this.declarativeCompiler = declarativeCompiler;
        this.llmWorkflowCompiler = llmWorkflowCompiler;
        this.metrics = metrics;
    }

    public CompilationOutcome compile(DeclarativeIr ir, GroundedSemanticPlan plan, Map<String, Object> groundedFacts,
                                      CompilationFeedback feedback) {
        if (feedback != null && feedback.isPresent()) {
            log.info("Feedback present, using LLM compiler");
            return viaLlm(ir, plan, groundedFacts, feedback, "user_feedback");
        }

        try {
            CompiledWorkflow compiled = declarativeCompiler.compile(ir);
            metrics.recordCompilerStrategy(DECLARATIVE, false);
            return new CompilationOutcome(compiled.steps(), DECLARATIVE, null, compiled.pluginsUsed());
        } catch (DeterministicCompilationException e) {
            log.warn("Declarative compiler cannot handle this IR: {}. Falling back to LLM compiler", e.getMessage());
            return viaLlm(ir, plan, groundedFacts, null, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Declarative compiler failed unexpectedly. Falling back to LLM compiler", e);
            return viaLlm(ir, plan, groundedFacts, null, "declarative compiler error: " + e.getMessage());
        }
    }

    private CompilationOutcome viaLlm(DeclarativeIr ir, GroundedSemanticPlan plan, Map<String, Object> groundedFacts,
                                      CompilationFeedback feedback, String reason) {
        try {
            CompiledWorkflow compiled = llmWorkflowCompiler.compile(ir, plan, groundedFacts, feedback);
            metrics.recordCompilerStrategy(LLM, feedback == null);
            return new CompilationOutcome(compiled.steps(), LLM, reason, compiled.pluginsUsed());
        } catch (PipelineException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new PipelineException(PipelinePhase.COMPILATION, "compilation_failed",
                    "Both compilers failed: " + e.getMessage(), e);
        }
    }
}
