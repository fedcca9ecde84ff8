package com.flowsmith.core.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flowsmith.core.catalog.ActionDefinition;
import com.flowsmith.core.catalog.PluginCatalog;
import com.flowsmith.core.catalog.PluginDefinition;
import com.flowsmith.core.ir.DeclarativeIr;
import com.flowsmith.core.llm.GenerationOptions;
import com.flowsmith.core.llm.LlmEmptyResponseException;
import com.flowsmith.core.llm.LlmProperties;
import com.flowsmith.core.llm.LlmService;
import com.flowsmith.core.llm.RetryPolicy;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.model.ReasoningStep;
import com.flowsmith.core.support.PipelineException;
import com.flowsmith.core.workflow.ActionStep;
import com.flowsmith.core.workflow.WorkflowStep;
import com.flowsmith.core.workflow.WorkflowSteps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Model-driven compiler. Used when the rule-based compiler gives up, and always
 * when a reviewer left feedback on a previous generation.
 */
@Component
public class LlmWorkflowCompiler {

    private static final Logger log = LoggerFactory.getLogger(LlmWorkflowCompiler.class);

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    static final String SYSTEM_PROMPT = """
            You compile a declarative workflow IR into an ordered list of executable steps.

            Step types (field "type"):
            - action: {id, description, plugin, action, params}
            - transform: {id, description, operation, input, config}
              operations: normalize_headers, filter, partition, group_by, sort,
              render_table, summary_block, format_json, format_csv, alert
            - ai_processing: {id, description, input, prompt, output_schema}
            - scatter_gather: {id, description, scatter {input, itemVariable, steps}, gather {operation}}
            - conditional: {id, description, condition, then_steps, else_steps}

            Rules:
            - Step ids are "step_1", "step_2", ... in execution order. Nested ids extend the parent id.
            - Reference earlier results as "{{step_N}}"; inside a scatter use "{{<itemVariable>}}".
            - Use only the plugins and actions listed. Use the IR's plugin_key and operation_type verbatim.
            - Filters on free text use (item.field ?? '').toLowerCase().includes('keyword') clauses.
            - When send_when_no_results is false, wrap delivery in a conditional on the result count.
            Output ONLY {"workflow": [...]}.
            """;

    private final LlmService llmService;
    private final LlmProperties llmProperties;
    private final PluginCatalog catalog;

    public LlmWorkflowCompiler(LlmService llmService, LlmProperties llmProperties, PluginCatalog catalog) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
        this.catalog = catalog;
    }

    public CompiledWorkflow compile(DeclarativeIr ir, GroundedSemanticPlan plan, Map<String, Object> groundedFacts,
                                    CompilationFeedback feedback) {
        boolean regenerating = feedback != null && feedback.isPresent();
        GenerationOptions options = llmProperties.getCompilation().toOptions();
        if (regenerating) {
            options = options.withTemperature(llmProperties.getFeedbackTemperature());
            log.info("Regenerating workflow from feedback (attempt {})", feedback.regenerationAttempt());
        }
        String request = buildRequest(ir, plan, groundedFacts, feedback);
        log.debug("Compilation request:\n{}", request);

        GenerationOptions effective = options;
        RetryPolicy.Outcome<List<WorkflowStep>> outcome = new RetryPolicy(llmProperties.getMaxAttempts())
                .execute(request, (prompt, attempt) -> {
                    WorkflowEnvelope envelope = llmService.structuredCall(
                            SYSTEM_PROMPT, prompt, WorkflowEnvelope.class, effective).value();
                    if (envelope.workflow().isEmpty()) {
                        throw new LlmEmptyResponseException("Compiler returned an empty workflow");
                    }
                    return envelope.workflow();
                });
        if (!outcome.succeeded()) {
            throw new PipelineException(PipelinePhase.COMPILATION, "compilation_failed",
                    "Workflow compilation failed after " + outcome.attempts() + " attempt(s): "
                            + outcome.failure().getMessage(), outcome.failure());
        }
        List<WorkflowStep> steps = outcome.value();
        log.info("LLM compilation produced {} steps", steps.size());
        return new CompiledWorkflow(steps, pluginsUsed(steps, ir));
    }

    String buildRequest(DeclarativeIr ir, GroundedSemanticPlan plan, Map<String, Object> groundedFacts,
                        CompilationFeedback feedback) {
        StringBuilder sb = new StringBuilder();
        sb.append("## Declarative IR\n").append(toJson(ir)).append("\n\n");
        if (plan != null) {
            sb.append("## Goal\n").append(plan.goal()).append("\n\n");
            if (plan.understanding() != null) {
                sb.append("## Understanding\n").append(toJson(plan.understanding())).append("\n\n");
            }
            if (!plan.reasoningTrace().isEmpty()) {
                sb.append("## Reasoning Trace\n");
                for (ReasoningStep step : plan.reasoningTrace()) {
                    sb.append("- ").append(step.decision()).append(": ").append(step.reasoning()).append('\n');
                }
                sb.append('\n');
            }
        }
        if (groundedFacts != null && !groundedFacts.isEmpty()) {
            sb.append("## Grounded Facts\n").append(toJson(groundedFacts)).append("\n\n");
        }
        sb.append("## Available Plugins\n");
        for (PluginDefinition plugin : catalog.scopedTo(ir.pluginKeys())) {
            sb.append("- ").append(plugin.key()).append(": ");
            sb.append(String.join(", ", plugin.actions().keySet())).append('\n');
            for (Map.Entry<String, ActionDefinition> action : plugin.actions().entrySet()) {
                List<String> required = action.getValue().requiredParameters();
                if (!required.isEmpty()) {
                    sb.append("  - ").append(action.getKey()).append(" requires ").append(required).append('\n');
                }
            }
        }
        if (feedback != null && feedback.isPresent()) {
            sb.append("\n## Previous Workflow\n").append(toJson(feedback.previousWorkflow())).append("\n\n");
            sb.append("## Reviewer Feedback (attempt ").append(feedback.regenerationAttempt()).append(")\n");
            sb.append(feedback.userFeedback()).append('\n');
            if (!feedback.feedbackHistory().isEmpty()) {
                sb.append("\nEarlier feedback:\n");
                feedback.feedbackHistory().forEach(f -> sb.append("- ").append(f).append('\n'));
            }
            sb.append("\nApply the feedback while keeping everything else the previous workflow got right.\n");
        }
        return sb.toString();
    }

    private static List<String> pluginsUsed(List<WorkflowStep> steps, DeclarativeIr ir) {
        Set<String> plugins = new LinkedHashSet<>();
        for (WorkflowStep step : WorkflowSteps.flatten(steps)) {
            if (step instanceof ActionStep action && action.plugin() != null) {
                plugins.add(action.plugin());
            }
        }
        if (plugins.isEmpty()) {
            plugins.addAll(ir.pluginKeys());
        }
        return List.copyOf(plugins);
    }

    private static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise compiler context", e);
        }
    }
}
