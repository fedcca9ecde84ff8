package com.flowsmith.core.formalization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flowsmith.core.catalog.ActionDefinition;
import com.flowsmith.core.catalog.PluginCatalog;
import com.flowsmith.core.catalog.PluginDefinition;
import com.flowsmith.core.catalog.SchemaFieldExtractor;
import com.flowsmith.core.ir.DeclarativeIr;
import com.flowsmith.core.ir.FilterCondition;
import com.flowsmith.core.ir.Partition;
import com.flowsmith.core.llm.LlmProperties;
import com.flowsmith.core.llm.LlmService;
import com.flowsmith.core.llm.RetryPolicy;
import com.flowsmith.core.llm.StructuredResponse;
import com.flowsmith.core.model.Assumption;
import com.flowsmith.core.model.DataSourceMetadata.FieldDescriptor;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.GroundingResult;
import com.flowsmith.core.model.ImpactLevel;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.model.ReasoningStep;
import com.flowsmith.core.model.ResolvedInput;
import com.flowsmith.core.model.Understanding;
import com.flowsmith.core.support.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Formalization phase: maps a grounded plan onto the declarative IR. This is
 * a mechanical mapping, so the model runs at near-zero temperature and only
 * sees the plugins the request actually involves.
 */
@Service
public class IRFormalizer {

    private static final Logger log = LoggerFactory.getLogger(IRFormalizer.class);

    private static final ObjectMapper JSON = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    static final String SYSTEM_PROMPT = """
            You are the formalization stage of a workflow compiler. You map a grounded
            semantic plan onto a declarative intermediate representation (IR). You do not
            reason about intent again; the plan already did that.

            The IR describes WHAT the workflow does, never HOW it executes:
            - ir_version "3.0", goal
            - runtime_inputs: values the user supplies on each run
            - data_sources: type (tabular, api, webhook, database, file, stream), plugin_key,
              operation_type (an exact action name), location, tab, role, config (action parameters)
            - normalization: required_headers, case_sensitive, missing_header_action
            - filters: {combineWith: AND|OR, conditions: [{field, operator, value}], groups: [...]}
              operators: equals, not_equals, contains, not_contains, starts_with, ends_with,
              matches_regex, greater_than, less_than, greater_than_or_equals, less_than_or_equals,
              in, not_in, is_empty, is_not_empty, within_last_days, before, after
            - ai_operations: type, instruction, input_description, output_schema {type, fields}, constraints
            - post_ai_filters: filters applied to AI output
            - partitions [{field, split_by}], grouping {group_by, emit_per_group}
            - rendering: type (email_embedded_table, html_table, summary_block, alert, json, csv),
              columns_in_order, empty_message, sort_order
            - delivery_rules: per_item_delivery, per_group_delivery, summary_delivery,
              multiple_destinations, send_when_no_results. Each delivery has plugin_key,
              operation_type, recipient or recipient_source, cc, subject, body_template.
            - edge_cases [{condition, action, message, recipient}], clarifications_required

            Never emit execution structure: no step ids, no "id" keys, no loops, no
            scatter_gather, no workflow_steps, no "plugin" key (use plugin_key).
            Output ONLY the IR JSON.
            """;

    private final LlmService llmService;
    private final LlmProperties llmProperties;
    private final PluginCatalog catalog;

    public IRFormalizer(LlmService llmService, LlmProperties llmProperties, PluginCatalog catalog) {
        this.llmService = llmService;
        this.llmProperties = llmProperties;
        this.catalog = catalog;
    }

    /**
     * @param resolvedInputs ordered overrides; the enhanced prompt's own resolved
     *                       inputs first, then those derived from review decisions
     * @param services       plugin keys the request involves; every plugin when empty
     */
    public FormalizationResult formalize(GroundedSemanticPlan plan, List<ResolvedInput> resolvedInputs,
                                         List<String> services) {
        Map<String, Object> facts = groundedFacts(plan);
        List<String> missing = missingFacts(plan, facts);
        log.info("Formalizing: {} grounded facts, {} missing", facts.size(), missing.size());
        if (!missing.isEmpty()) {
            log.warn("Missing grounded facts: {}", missing);
        }

        String request = buildRequest(plan, facts, resolvedInputs, services);
        log.debug("Formalization request:\n{}", request);

        var model = new AtomicReference<String>(llmProperties.getModel());
        RetryPolicy.Outcome<StructuredResponse<DeclarativeIr>> outcome = new RetryPolicy(llmProperties.getMaxAttempts())
                .execute(request, (prompt, attempt) -> {
                    StructuredResponse<DeclarativeIr> response = llmService.structuredCall(
                            SYSTEM_PROMPT, prompt, DeclarativeIr.class, llmProperties.getFormalization().toOptions());
                    if (response.model() != null) {
                        model.set(response.model());
                    }
                    return response;
                });
        if (!outcome.succeeded()) {
            throw new PipelineException(PipelinePhase.FORMALIZATION, "formalization_failed",
                    "IR formalization failed after " + outcome.attempts() + " attempt(s): "
                            + outcome.failure().getMessage(), outcome.failure());
        }

        DeclarativeIr ir = outcome.value().value();
        if (ir.goal() == null || ir.goal().isBlank()) {
            ir = ir.withGoal(plan.goal());
            log.info("Filled missing IR goal from the grounded plan");
        }

        List<String> warnings = fieldWarnings(ir, facts);
        if (!warnings.isEmpty()) {
            log.warn("Formalization warnings: {}", warnings);
        }
        double confidence = confidence(plan, missing);
        log.info("Formalization complete (confidence {})", String.format("%.2f", confidence));
        return new FormalizationResult(ir, facts, missing, confidence, warnings, model.get(),
                Instant.now().toString(), outcome.value().rawContent());
    }

    static Map<String, Object> groundedFacts(GroundedSemanticPlan plan) {
        Map<String, Object> facts = new LinkedHashMap<>();
        for (GroundingResult result : plan.groundingResults()) {
            if (result.validated() && !result.skipped() && result.resolvedValue() != null) {
                facts.put(result.assumptionId(), result.resolvedValue());
            }
        }
        return facts;
    }

    static List<String> missingFacts(GroundedSemanticPlan plan, Map<String, Object> facts) {
        Set<String> ids = new LinkedHashSet<>();
        plan.assumptions().forEach(a -> ids.add(a.id()));
        plan.groundingResults().forEach(r -> ids.add(r.assumptionId()));
        ids.remove(null);
        ids.removeAll(facts.keySet());
        return new ArrayList<>(ids);
    }

    static double confidence(GroundedSemanticPlan plan, List<String> missing) {
        double confidence = plan.groundingConfidence();
        if (missingWithImpact(plan, missing, ImpactLevel.CRITICAL)) {
            confidence *= 0.5;
        }
        if (missingWithImpact(plan, missing, ImpactLevel.MODERATE)) {
            confidence *= 0.8;
        }
        return confidence;
    }

    private static boolean missingWithImpact(GroundedSemanticPlan plan, List<String> missing, ImpactLevel impact) {
        return missing.stream()
                .map(plan::findAssumption)
                .anyMatch(a -> a.map(Assumption::impactIfWrong).orElse(null) == impact);
    }

    static List<String> fieldWarnings(DeclarativeIr ir, Map<String, Object> facts) {
        Collection<String> grounded = facts.values().stream().map(String::valueOf).collect(Collectors.toSet());
        List<String> warnings = new ArrayList<>();
        if (ir.filters() != null) {
            for (FilterCondition condition : ir.filters().allConditions()) {
                if (condition.field() != null && !grounded.contains(condition.field())) {
                    warnings.add("Filter field \"" + condition.field() + "\" not found in grounded facts");
                }
            }
        }
        if (ir.grouping() != null && ir.grouping().groupBy() != null && !grounded.contains(ir.grouping().groupBy())) {
            warnings.add("Grouping field \"" + ir.grouping().groupBy() + "\" not found in grounded facts");
        }
        for (Partition partition : ir.partitions()) {
            if (partition.field() != null && !grounded.contains(partition.field())) {
                warnings.add("Partition field \"" + partition.field() + "\" not found in grounded facts");
            }
        }
        return warnings;
    }

    String buildRequest(GroundedSemanticPlan plan, Map<String, Object> facts,
                        List<ResolvedInput> resolvedInputs, List<String> services) {
        var message = new StringBuilder("# Formalization Request\n\n")
                .append("Map this grounded semantic plan to precise IR.\n\n")
                .append("## Grounded Facts (USE THESE EXACTLY)\n\n```json\n")
                .append(toJson(facts)).append("\n```\n\n");

        if (resolvedInputs != null && !resolvedInputs.isEmpty()) {
            message.append("## Resolved User Inputs (USE THESE EXACT VALUES)\n\n");
            resolvedInputs.forEach(input -> message.append("- **").append(input.key()).append("**: ")
                    .append(input.valueAsText()).append('\n'));
            message.append('\n');
        }

        Understanding understanding = plan.understanding();
        message.append("## Semantic Understanding (Map to IR Structure)\n\n```json\n")
                .append(toJson(understanding)).append("\n```\n\n");

        if (hasSearchCriteria(understanding)) {
            message.append(SEARCH_CRITERIA_INSTRUCTIONS);
        }

        String plugins = pluginsSection(services);
        if (!plugins.isEmpty()) {
            message.append(plugins);
        }

        message.append("## Original Goal\n\n").append(plan.goal()).append("\n\n")
                .append("## Reasoning Trace (context only, do not re-reason)\n\n");
        for (ReasoningStep step : plan.reasoningTrace()) {
            message.append("Step ").append(step.step()).append(": ").append(step.choiceMade())
                    .append(" - ").append(step.reasoning()).append('\n');
        }
        message.append('\n').append(RULES);
        return message.toString();
    }

    static boolean hasSearchCriteria(Understanding understanding) {
        if (understanding == null) {
            return false;
        }
        if (understanding.hasFilterConditions()) {
            return true;
        }
        return understanding.dataSources().stream()
                .anyMatch(ds -> "api".equalsIgnoreCase(ds.type()) || "email".equalsIgnoreCase(ds.type()));
    }

    String pluginsSection(List<String> services) {
        List<PluginDefinition> plugins = catalog.scopedTo(services);
        if (plugins.isEmpty()) {
            return "";
        }
        var section = new StringBuilder("## Available Plugins (use these plugin_key values)\n\n");
        for (PluginDefinition plugin : plugins) {
            section.append("- **").append(plugin.key()).append("**: ").append(plugin.description())
                    .append("\n  Actions:\n");
            for (Map.Entry<String, ActionDefinition> entry : plugin.actions().entrySet()) {
                ActionDefinition action = entry.getValue();
                section.append("    - ").append(entry.getKey()).append(": ").append(action.description()).append('\n');
                List<String> required = action.requiredParameters();
                if (!required.isEmpty()) {
                    section.append("      Required parameters: ").append(String.join(", ", required)).append('\n');
                }
                List<FieldDescriptor> outputs = SchemaFieldExtractor.extractFields(action.outputSchema());
                if (!outputs.isEmpty()) {
                    section.append("      Output Fields (use these EXACT names in filters and rendering.columns_in_order):\n");
                    for (FieldDescriptor field : outputs) {
                        section.append("      • ").append(field.name())
                                .append(" (").append(field.type() == null ? "any" : field.type()).append(")");
                        if (field.description() != null) {
                            section.append(": ").append(field.description());
                        }
                        section.append('\n');
                    }
                }
            }
            section.append('\n');
        }
        section.append("""
                operation_type MUST be an exact action name listed under the chosen plugin.
                Filter fields MUST be exact names from the action's Output Fields.

                """);
        return section.toString();
    }

    private static String toJson(Object value) {
        try {
            return JSON.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PipelineException(PipelinePhase.FORMALIZATION, "serialization_failed",
                    "Could not serialise formalization context: " + e.getOriginalMessage(), e);
        }
    }

    static final String SEARCH_CRITERIA_INSTRUCTIONS = """
            ## Search Criteria Handling

            The understanding includes filter conditions or queries an API source.
            1. Time-based filters (newer_than:7d, older_than:30d) go in data_sources[].config.query
            2. Keyword or text matching goes in IR filters with the "contains" operator
            3. Complex AND/OR logic uses filters.groups

            """;

    static final String RULES = """
            ## Rules

            1. Use grounded facts exactly as provided.
            2. Always populate plugin_key and operation_type; never leave them null.
            3. Use only the enum values listed in the IR description.
            4. For API sources, take filter field names from the plugin's Output Fields, never invent them.
            5. Resolved user inputs override anything the plan inferred.

            Output ONLY the IR JSON (no explanations, no markdown).
            """;
}
