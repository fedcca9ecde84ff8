package com.flowsmith.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.compiler.CompilationFeedback;
import com.flowsmith.core.model.EnhancedPrompt;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.ReviewDecisions;

/**
 * Inbound JSON body for POST /api/v1/workflows/compile. The grounded plan is
 * the one returned by the generate call, sent back unchanged.
 */
public record CompileRequest(
    @JsonProperty("grounded_plan") GroundedSemanticPlan groundedPlan,
    @JsonProperty("enhanced_prompt") EnhancedPrompt enhancedPrompt,
    ReviewDecisions decisions,
    CompilationFeedback feedback,
    @JsonProperty("user_id") String userId
) {}
