package com.flowsmith.core.semantic;

import com.flowsmith.core.llm.GenerationOptions;
import com.flowsmith.core.llm.LlmProperties;
import com.flowsmith.core.llm.LlmService;
import com.flowsmith.core.llm.RetryPolicy;
import com.flowsmith.core.llm.StructuredResponse;
import com.flowsmith.core.model.EnhancedPrompt;
import com.flowsmith.core.model.ResolvedInput;
import com.flowsmith.core.model.SemanticPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Understanding phase: asks the model what the user means, as goal,
 * assumptions, ambiguities and reasoning, without committing to an
 * executable form yet.
 */
@Service
public class SemanticPlanGenerator {

    private static final Logger log = LoggerFactory.getLogger(SemanticPlanGenerator.class);

    static final String SYSTEM_PROMPT = """
            You are the understanding stage of a workflow compiler. You read a structured
            description of a business automation and explain what it means. You do NOT
            write executable steps.

            Produce a Semantic Plan:
            - goal: one sentence describing the outcome the user wants.
            - understanding: data_sources (with expected_fields and their field_name_candidates),
              runtime_inputs, filtering (conditions and combination_logic), ai_processing,
              grouping, rendering, delivery and edge_cases.
            - assumptions: every falsifiable claim you rely on. Each has a unique id, a category
              (field_name, data_type, value_format, structure, behavior), a description,
              a validation_strategy {method, parameters}, impact_if_wrong (critical, moderate, low)
              and a fallback. For field_name put the candidate column names in
              parameters.candidates. For data_type put parameters.expected_type. For
              value_format put a regular expression in parameters.pattern.
            - inferences: values you filled in yourself, flagged user_overridable when the user may change them.
            - ambiguities: questions you cannot settle, with possible_resolutions, a
              recommended_resolution and requires_user_input.
            - reasoning_trace: numbered decisions with the options you considered and your choice.

            Make assumptions explicit and express uncertainty honestly. Values listed under
            "Resolved User Inputs" are authoritative: never contradict or reinterpret them.
            """;

    private final LlmService llmService;
    private final LlmProperties llmProperties;
    private final PlanSchemaValidator validator;

    public SemanticPlanGenerator(LlmService llmService, LlmProperties llmProperties, PlanSchemaValidator validator) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
        this.validator = validator;
    }

    public SemanticPlanResult generate(EnhancedPrompt prompt) {
        long start = System.currentTimeMillis();
        GenerationOptions options = llmProperties.getSemantic().toOptions();
        var retry = new RetryPolicy(llmProperties.getMaxAttempts());
        var tokens = new AtomicInteger();
        var model = new AtomicReference<String>(llmProperties.getModel());
        var lastPlan = new AtomicReference<SemanticPlan>();
        var lastReport = new AtomicReference<PlanSchemaValidator.Report>();

        log.info("Generating semantic plan ({} data lines, {} resolved inputs)",
                prompt.sections().data().size(), prompt.resolvedUserInputs().size());

        RetryPolicy.Outcome<SemanticPlan> outcome = retry.execute(buildUserMessage(prompt), (userPrompt, attempt) -> {
            StructuredResponse<SemanticPlan> response =
                    llmService.structuredCall(SYSTEM_PROMPT, userPrompt, SemanticPlan.class, options);
            tokens.addAndGet(response.usage().totalTokens());
            if (response.model() != null) {
                model.set(response.model());
            }
            SemanticPlan plan = response.value();
            PlanSchemaValidator.Report report = validator.validate(plan);
            lastPlan.set(plan);
            lastReport.set(report);
            if (!report.valid()) {
                throw new PlanValidationException(report.errors());
            }
            return plan;
        });

        long duration = System.currentTimeMillis() - start;
        var metadata = new SemanticPlanResult.Metadata(model.get(), tokens.get(), duration, outcome.attempts());

        if (!outcome.succeeded()) {
            List<String> errors = outcome.failure() instanceof PlanValidationException invalid
                    ? invalid.errors
                    : List.of(String.valueOf(outcome.failure().getMessage()));
            log.warn("Semantic plan generation failed after {} attempt(s): {}", outcome.attempts(), errors);
            return new SemanticPlanResult(false, lastPlan.get(), errors, List.of(), metadata);
        }

        SemanticPlan plan = outcome.value();
        List<String> warnings = lastReport.get() == null ? List.of() : lastReport.get().warnings();
        log.info("Semantic plan generated in {}ms: {} assumptions, {} ambiguities, {} inferences, {} tokens",
                duration, plan.assumptionsOrEmpty().size(), plan.ambiguities().size(),
                plan.inferences().size(), tokens.get());
        if (!warnings.isEmpty()) {
            log.info("Semantic plan warnings: {}", warnings);
        }
        return new SemanticPlanResult(true, plan, List.of(), warnings, metadata);
    }

    static String buildUserMessage(EnhancedPrompt prompt) {
        var sections = prompt.sections();
        var context = prompt.userContext();
        var message = new StringBuilder("# Enhanced Prompt\n\n");

        if (!context.originalRequest().isBlank()) {
            message.append("## Original User Request\n").append(context.originalRequest()).append("\n\n");
        }
        appendSection(message, "Data Sources", sections.data(), true);
        appendSection(message, "Actions", sections.actions(), false);
        appendSection(message, "Output Format", sections.output(), false);
        appendSection(message, "Delivery", sections.delivery(), true);
        appendSection(message, "Processing Steps", sections.processingSteps(), false);

        if (!context.clarifications().isEmpty()) {
            message.append("## Clarifications\n");
            context.clarifications().forEach(c -> message.append("- ").append(c).append('\n'));
            message.append('\n');
        }

        List<ResolvedInput> resolved = prompt.resolvedUserInputs();
        if (!resolved.isEmpty()) {
            message.append("## Resolved User Inputs (USE THESE EXACT VALUES)\n")
                    .append("These are pre-validated values from the user. They are authoritative; use them exactly as specified:\n\n");
            resolved.forEach(input -> message.append("- **").append(input.key()).append("**: ")
                    .append(input.valueAsText()).append('\n'));
            message.append('\n')
                    .append("IMPORTANT: For filter conditions, use the exact field names and values from above.\n")
                    .append("Example: if \"high_qualified_rule\" = \"Stage = 4\", the filter field must be \"Stage\" and the value must be \"4\".\n\n");
        }

        message.append("---\n\n")
                .append("Generate a Semantic Plan that captures your understanding of this workflow.\n")
                .append("Focus on understanding, not formalization. Make assumptions explicit, express uncertainty, explain reasoning.");
        return message.toString();
    }

    private static void appendSection(StringBuilder message, String title, List<String> lines, boolean always) {
        if (lines.isEmpty() && !always) {
            return;
        }
        message.append("## ").append(title).append('\n').append(String.join("\n", lines)).append("\n\n");
    }

    static class PlanValidationException extends RuntimeException {

        final List<String> errors;

        PlanValidationException(List<String> errors) {
            super("Schema validation failed: " + String.join(", ", errors));
            this.errors = errors;
        }
    }
}
