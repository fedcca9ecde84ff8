package com.flowsmith.dispatch.api;

import com.flowsmith.core.engine.WorkflowPipelineEngine;
import com.flowsmith.core.llm.LlmService;
import com.flowsmith.core.state.CompilationState;
import com.flowsmith.core.state.GenerationState;
import com.flowsmith.core.support.InvalidRequestException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * REST controller for the two workflow stages. Stateless: stage two receives
 * everything it needs in its request body.
 */
@RestController
@RequestMapping("/api/v1/workflows")
public class WorkflowController {

    private static final Logger log = LoggerFactory.getLogger(WorkflowController.class);

    private final WorkflowPipelineEngine engine;
    private final LlmService llmService;

    public WorkflowController(WorkflowPipelineEngine engine, LlmService llmService) {
        this.engine = engine;
        this.llmService = llmService;
    }

    /**
     * POST /api/v1/workflows/generate: Understand and ground a request,
     * returning the plan and ambiguity report for human review.
     */
    @PostMapping("/generate")
    public ResponseEntity<?> generate(@RequestBody GenerateRequest request) {
        if (request == null || request.enhancedPrompt() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "enhanced_prompt is required"));
        }
        String requestId = engine.generateRequestId();
        try {
            GenerationState state = engine.generate(requestId, request.userId(), request.enhancedPrompt(),
                    request.metadata(), request.failFast(), request.skipGrounding());
            if (state.hasErrors()) {
                return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(WorkflowResponses.failed(state));
            }
            return ResponseEntity.ok(WorkflowResponses.generated(state, llmService.providerName()));
        } catch (InvalidRequestException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Generate request {} failed", requestId, e);
            return ResponseEntity.internalServerError().body(Map.of(
                    "error", "Internal error",
                    "message", String.valueOf(e.getMessage()),
                    "request_id", requestId));
        }
    }

    /**
     * POST /api/v1/workflows/compile: Apply review decisions, formalize to IR
     * and compile the executable steps.
     */
    @PostMapping("/compile")
    public ResponseEntity<?> compile(@RequestBody CompileRequest request) {
        if (request == null || request.groundedPlan() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "grounded_plan is required"));
        }
        String requestId = engine.generateRequestId();
        try {
            CompilationState state = engine.compile(requestId, request.userId(), request.groundedPlan(),
                    request.enhancedPrompt(), request.decisions(), request.feedback());
            if (state.hasErrors()) {
                return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(WorkflowResponses.failed(state));
            }
            return ResponseEntity.ok(WorkflowResponses.compiled(state));
        } catch (InvalidRequestException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Compile request {} failed", requestId, e);
            return ResponseEntity.internalServerError().body(Map.of(
                    "error", "Internal error",
                    "message", String.valueOf(e.getMessage()),
                    "request_id", requestId));
        }
    }
}
