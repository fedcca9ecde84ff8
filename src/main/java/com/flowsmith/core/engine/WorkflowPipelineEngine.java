package com.flowsmith.core.engine;

import com.flowsmith.core.compiler.CompilationFeedback;
import com.flowsmith.core.graph.CompilationGraph;
import com.flowsmith.core.graph.GenerationGraph;
import com.flowsmith.core.logging.MdcContext;
import com.flowsmith.core.metrics.PipelineMetrics;
import com.flowsmith.core.model.DataSourceMetadata;
import com.flowsmith.core.model.EnhancedPrompt;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.PhaseTiming;
import com.flowsmith.core.model.ReviewDecisions;
import com.flowsmith.core.state.CompilationState;
import com.flowsmith.core.state.GenerationState;
import com.flowsmith.core.support.InvalidRequestException;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the two externally exposed stages. Each call is self-contained: the
 * caller carries the grounded plan and review decisions from stage one to
 * stage two.
 */
@Service
public class WorkflowPipelineEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowPipelineEngine.class);
    private static final AtomicInteger REQUEST_COUNTER = new AtomicInteger(0);

    public static final String STAGE_GENERATE = "generate";
    public static final String STAGE_COMPILE = "compile";

    private final GenerationGraph generationGraph;
    private final CompilationGraph compilationGraph;
    private final PipelineMetrics metrics;

    public WorkflowPipelineEngine(GenerationGraph generationGraph, CompilationGraph compilationGraph,
                                  PipelineMetrics metrics) {
        this.generationGraph = generationGraph;
        this.compilationGraph = compilationGraph;
        this.metrics = metrics;
    }

    /**
     * Stage one: understand, resolve metadata, ground, detect ambiguities.
     *
     * @param failFast null keeps the configured default
     * @throws InvalidRequestException when the prompt is missing
     */
    public GenerationState generate(String requestId, String userId, EnhancedPrompt prompt,
                                    DataSourceMetadata metadata, Boolean failFast, boolean skipGrounding) {
        if (prompt == null) {
            throw new InvalidRequestException("enhanced_prompt is required");
        }
        MdcContext.setRequest(requestId, STAGE_GENERATE);
        try {
            log.info("Generating grounded plan for user {} ({} services)", userId, prompt.servicesInvolved().size());
            var stateMap = new HashMap<String, Object>();
            stateMap.put("requestId", requestId);
            stateMap.put("userId", userId == null ? "" : userId);
            stateMap.put("enhancedPrompt", prompt);
            stateMap.put("skipGrounding", skipGrounding);
            if (failFast != null) {
                stateMap.put("failFast", failFast);
            }
            if (metadata != null) {
                stateMap.put("suppliedMetadata", metadata);
            }

            var config = RunnableConfig.builder().threadId(requestId).build();
            var state = generationGraph.getCompiledGraph().invoke(Map.copyOf(stateMap), config)
                    .orElseThrow(() -> new IllegalStateException("Generation graph returned no state for " + requestId));

            record(STAGE_GENERATE, state.phaseTimings(), state.hasErrors());
            return state;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Stage two: apply decisions, formalize, validate IR, compile, post-process,
     * validate the workflow.
     *
     * @throws InvalidRequestException when the grounded plan is missing
     */
    public CompilationState compile(String requestId, String userId, GroundedSemanticPlan plan,
                                    EnhancedPrompt prompt, ReviewDecisions decisions, CompilationFeedback feedback) {
        if (plan == null) {
            throw new InvalidRequestException("grounded_plan is required");
        }
        MdcContext.setRequest(requestId, STAGE_COMPILE);
        try {
            log.info("Compiling workflow for user {} ({} assumptions, feedback={})", userId,
                    plan.assumptions().size(), feedback != null && feedback.isPresent());
            var stateMap = new HashMap<String, Object>();
            stateMap.put("requestId", requestId);
            stateMap.put("userId", userId == null ? "" : userId);
            stateMap.put("groundedPlan", plan);
            stateMap.put("decisions", decisions == null ? ReviewDecisions.none() : decisions);
            if (prompt != null) {
                stateMap.put("enhancedPrompt", prompt);
            }
            if (feedback != null) {
                stateMap.put("feedback", feedback);
            }

            var config = RunnableConfig.builder().threadId(requestId).build();
            var state = compilationGraph.getCompiledGraph().invoke(Map.copyOf(stateMap), config)
                    .orElseThrow(() -> new IllegalStateException("Compilation graph returned no state for " + requestId));

            record(STAGE_COMPILE, state.phaseTimings(), state.hasErrors());
            return state;
        } finally {
            MdcContext.clear();
        }
    }

    private void record(String stage, List<PhaseTiming> timings, boolean failed) {
        phaseTimes(timings).forEach((phase, ms) -> log.debug("Phase {} took {}ms", phase, ms));
        timings.forEach(t -> metrics.recordPhaseDuration(t.phase(), t.durationMs()));
        metrics.recordStageOutcome(stage, failed ? "failure" : "success");
        log.info("Stage {} finished {} in {}ms", stage, failed ? "with errors" : "successfully", totalTime(timings));
    }

    /**
     * Sums durations per phase, keyed by the phase's wire name, in first-seen order.
     */
    public static Map<String, Long> phaseTimes(List<PhaseTiming> timings) {
        Map<String, Long> times = new LinkedHashMap<>();
        for (PhaseTiming timing : timings) {
            times.merge(timing.phase().value(), timing.durationMs(), Long::sum);
        }
        return times;
    }

    public static long totalTime(List<PhaseTiming> timings) {
        return timings.stream().mapToLong(PhaseTiming::durationMs).sum();
    }

    /**
     * Generates a request id in the format FLOW-YYYY-NNNN.
     */
    public String generateRequestId() {
        int count = REQUEST_COUNTER.incrementAndGet();
        return String.format("FLOW-%d-%04d", LocalDate.now(ZoneOffset.UTC).getYear(), count);
    }
}
