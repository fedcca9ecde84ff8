package com.flowsmith.core.compiler;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flowsmith.core.ir.AiOperation;
import com.flowsmith.core.ir.DataSourceSpec;
import com.flowsmith.core.ir.DeclarativeIr;
import com.flowsmith.core.ir.Delivery;
import com.flowsmith.core.ir.DeliveryRules;
import com.flowsmith.core.ir.EdgeCaseRule;
import com.flowsmith.core.ir.FilterCondition;
import com.flowsmith.core.ir.FilterGroup;
import com.flowsmith.core.ir.Grouping;
import com.flowsmith.core.ir.Normalization;
import com.flowsmith.core.ir.Partition;
import com.flowsmith.core.ir.Rendering;
import com.flowsmith.core.workflow.ActionStep;
import com.flowsmith.core.workflow.AiProcessingStep;
import com.flowsmith.core.workflow.ConditionalStep;
import com.flowsmith.core.workflow.ScatterGatherStep;
import com.flowsmith.core.workflow.TransformStep;
import com.flowsmith.core.workflow.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Rule-based IR to workflow compiler. No model calls: the same IR always
 * yields the same steps. Throws {@link DeterministicCompilationException}
 * for shapes it does not cover.
 */
@Component
public class DeclarativeCompiler {

    private static final Logger log = LoggerFactory.getLogger(DeclarativeCompiler.class);

    static final Set<String> UNSUPPORTED_SOURCE_TYPES = Set.of("webhook", "stream");
    static final Set<String> PER_GROUP_AI_TYPES = Set.of("generate", "decide");

    private static final Map<String, String> RENDER_OPERATIONS = Map.of(
            "email_embedded_table", "render_table",
            "html_table", "render_table",
            "summary_block", "summary_block",
            "json", "format_json",
            "csv", "format_csv",
            "alert", "alert");

    private final ObjectMapper objectMapper = new ObjectMapper();

    public CompiledWorkflow compile(DeclarativeIr ir) {
        checkSupported(ir);
        var ctx = new Context();

        String data = null;
        for (int i = 0; i < ir.dataSources().size(); i++) {
            DataSourceSpec source = ir.dataSources().get(i);
            String id = ctx.nextId();
            ctx.steps.add(new ActionStep(id, null, describeSource(source), source.pluginKey(),
                    source.operationType(), source.config(), "source_" + (i + 1)));
            ctx.plugins.add(source.pluginKey());
            if (data == null) {
                data = ref(id);
            }
        }

        Normalization normalization = ir.normalization();
        if (normalization != null && !normalization.requiredHeaders().isEmpty()) {
            Map<String, Object> config = new LinkedHashMap<>();
            config.put("required_headers", normalization.requiredHeaders());
            config.put("case_sensitive", Boolean.TRUE.equals(normalization.caseSensitive()));
            config.put("missing_header_action", normalization.missingHeaderAction() == null
                    ? "error" : normalization.missingHeaderAction());
            data = ctx.transform("Normalize headers", "normalize_headers", data, config, "normalized_rows");
        }

        data = filterSteps(ctx, ir.filters(), data, "filtered_rows");

        for (AiOperation operation : ir.aiOperations()) {
            String id = ctx.nextId();
            ctx.steps.add(new AiProcessingStep(id, null, "AI " + operation.type(), data,
                    aiPrompt(operation), toMap(operation.outputSchema()), "ai_" + operation.type()));
            data = ref(id);
        }

        data = filterSteps(ctx, ir.postAiFilters(), data, "post_ai_filtered");

        for (Partition partition : ir.partitions()) {
            Map<String, Object> config = new LinkedHashMap<>();
            config.put("field", partition.field());
            config.put("split_by", partition.splitBy() == null ? "value" : partition.splitBy());
            data = ctx.transform("Partition by " + partition.field(), "partition", data, config, "partitioned");
        }

        String itemsRef = data;
        String groupsRef = null;
        Grouping grouping = ir.grouping();
        if (grouping != null && grouping.groupBy() != null && !grouping.groupBy().isBlank()
                && !"none".equals(grouping.groupBy())) {
            Map<String, Object> config = new LinkedHashMap<>();
            config.put("field", grouping.groupBy());
            config.put("emit_per_group", Boolean.TRUE.equals(grouping.emitPerGroup()));
            groupsRef = ctx.transform("Group by " + grouping.groupBy(), "group_by", data, config, "groups");
        }

        Rendering rendering = ir.rendering();
        String renderedRef = itemsRef;
        if (rendering != null && !rendering.sortOrder().isEmpty()) {
            List<Map<String, Object>> sortBy = new ArrayList<>();
            for (Rendering.SortSpec spec : rendering.sortOrder()) {
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("field", spec.field());
                entry.put("direction", spec.direction() == null ? "asc" : spec.direction().toLowerCase(Locale.ROOT));
                sortBy.add(entry);
            }
            itemsRef = ctx.transform("Sort results", "sort", itemsRef, Map.of("sort_by", sortBy), "sorted_rows");
            renderedRef = itemsRef;
        }
        if (rendering != null && rendering.type() != null) {
            String operation = RENDER_OPERATIONS.get(rendering.type());
            if (operation == null) {
                throw new DeterministicCompilationException("Unsupported rendering type: " + rendering.type());
            }
            Map<String, Object> config = new LinkedHashMap<>();
            if (!rendering.columnsInOrder().isEmpty()) {
                config.put("columns", rendering.columnsInOrder());
            }
            if (rendering.template() != null) {
                config.put("template", rendering.template());
            }
            if (rendering.emptyMessage() != null) {
                config.put("empty_message", rendering.emptyMessage());
            }
            if (!rendering.summaryStats().isEmpty()) {
                config.put("summary_stats", rendering.summaryStats());
            }
            renderedRef = ctx.transform("Render " + rendering.type(), operation, itemsRef, config, "rendered");
        }

        List<WorkflowStep> delivery = deliverySteps(ctx, ir.deliveryRules(), itemsRef, groupsRef, renderedRef);
        if (!ir.deliveryRules().sendsWhenEmpty() && !delivery.isEmpty()) {
            String id = ctx.nextId();
            ctx.steps.add(new ConditionalStep(id, null, "Deliver only when there are results",
                    itemsRef + ".length > 0", delivery, emptyResultSteps(ctx, ir), null));
        } else {
            ctx.steps.addAll(delivery);
        }

        log.info("Deterministic compilation produced {} steps using {}", ctx.steps.size(), ctx.plugins);
        return new CompiledWorkflow(ctx.steps, new ArrayList<>(ctx.plugins));
    }

    static void checkSupported(DeclarativeIr ir) {
        if (ir.dataSources().isEmpty()) {
            throw new DeterministicCompilationException("IR has no data sources");
        }
        for (DataSourceSpec source : ir.dataSources()) {
            if (isBlank(source.pluginKey())) {
                throw new DeterministicCompilationException("Data source has no plugin_key");
            }
            if (source.type() != null && UNSUPPORTED_SOURCE_TYPES.contains(source.type())) {
                throw new DeterministicCompilationException("Unsupported data source type: " + source.type());
            }
        }
        DeliveryRules rules = ir.deliveryRules();
        if (rules == null) {
            throw new DeterministicCompilationException("IR has no delivery_rules");
        }
        if (rules.perItemDelivery() != null && rules.perGroupDelivery() != null) {
            throw new DeterministicCompilationException("Both per-item and per-group delivery are set");
        }
        for (Delivery delivery : rules.allDeliveries()) {
            if (!delivery.hasPlugin()) {
                throw new DeterministicCompilationException("Delivery '" + delivery.name() + "' has no plugin_key");
            }
        }
        if (!ir.partitions().isEmpty()
                && ir.aiOperations().stream().anyMatch(op -> PER_GROUP_AI_TYPES.contains(op.type()))) {
            throw new DeterministicCompilationException("Per-partition generate/decide AI operations are not supported");
        }
    }

    /**
     * AND groups become one filter step per level, chained; OR groups must be
     * {@code contains} disjunctions and become a single expression.
     */
    private String filterSteps(Context ctx, FilterGroup group, String input, String outputVariable) {
        if (group == null || (group.conditions().isEmpty() && group.groups().isEmpty())) {
            return input;
        }
        if (group.isOr()) {
            return ctx.transform("Filter (any match)", "filter", input,
                    Map.of("condition", disjunction(group)), outputVariable);
        }
        String current = input;
        if (!group.conditions().isEmpty()) {
            Object condition = group.conditions().size() == 1
                    ? structured(group.conditions().get(0))
                    : Map.of("combineWith", "AND", "conditions",
                            group.conditions().stream().map(DeclarativeCompiler::structured).toList());
            current = ctx.transform("Filter rows", "filter", current, Map.of("condition", condition), outputVariable);
        }
        for (FilterGroup nested : group.groups()) {
            current = filterSteps(ctx, nested, current, outputVariable);
        }
        return current;
    }

    static String disjunction(FilterGroup group) {
        List<String> clauses = new ArrayList<>();
        for (FilterCondition condition : group.allConditions()) {
            if (!"contains".equals(condition.operator())) {
                throw new DeterministicCompilationException(
                        "OR filters support only 'contains', found '" + condition.operator() + "'");
            }
            for (String keyword : keywords(condition.value())) {
                clauses.add("(item." + condition.field() + " ?? '').toLowerCase().includes('"
                        + keyword.toLowerCase(Locale.ROOT).replace("'", "\\'") + "')");
            }
        }
        for (FilterGroup nested : group.groups()) {
            if (!nested.isOr()) {
                throw new DeterministicCompilationException("AND group nested inside an OR filter");
            }
        }
        if (clauses.isEmpty()) {
            throw new DeterministicCompilationException("OR filter has no conditions");
        }
        return String.join(" || ", clauses);
    }

    private static List<String> keywords(Object value) {
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return value == null ? List.of() : List.of(String.valueOf(value));
    }

    private static Map<String, Object> structured(FilterCondition condition) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("field", condition.field());
        map.put("operator", condition.operator());
        if (condition.value() != null) {
            map.put("value", condition.value());
        }
        return map;
    }

    private List<WorkflowStep> deliverySteps(Context ctx, DeliveryRules rules, String itemsRef,
                                             String groupsRef, String renderedRef) {
        List<WorkflowStep> steps = new ArrayList<>();
        if (rules.perItemDelivery() != null) {
            Delivery delivery = rules.perItemDelivery();
            String id = ctx.nextId();
            ActionStep send = deliveryAction(id + "_1", delivery, recipient(delivery, "item"), "{{item}}");
            steps.add(new ScatterGatherStep(id, null, "Deliver each item", null, null,
                    new ScatterGatherStep.LegacyConfig(itemsRef, "item", List.of(send)), "item_deliveries"));
            ctx.plugins.add(delivery.pluginKey());
        }
        if (rules.perGroupDelivery() != null) {
            if (groupsRef == null) {
                throw new DeterministicCompilationException("per_group_delivery without grouping");
            }
            Delivery delivery = rules.perGroupDelivery();
            String id = ctx.nextId();
            ActionStep send = deliveryAction(id + "_1", delivery, recipient(delivery, "group"), "{{group.items}}");
            steps.add(new ScatterGatherStep(id, null, "Deliver each group", null, null,
                    new ScatterGatherStep.LegacyConfig(groupsRef, "group", List.of(send)), "group_deliveries"));
            ctx.plugins.add(delivery.pluginKey());
        }
        if (rules.summaryDelivery() != null) {
            Delivery delivery = rules.summaryDelivery();
            steps.add(deliveryAction(ctx.nextId(), delivery, delivery.recipient(), renderedRef));
            ctx.plugins.add(delivery.pluginKey());
        }
        for (Delivery destination : rules.multipleDestinations()) {
            steps.add(deliveryAction(ctx.nextId(), destination,
                    destination.recipient() != null ? destination.recipient() : recipient(destination, "item"),
                    renderedRef));
            ctx.plugins.add(destination.pluginKey());
        }
        return steps;
    }

    private static String recipient(Delivery delivery, String scope) {
        if (delivery.recipientSource() != null && !delivery.recipientSource().isBlank()) {
            return "{{" + scope + "." + delivery.recipientSource() + "}}";
        }
        return delivery.recipient();
    }

    private static ActionStep deliveryAction(String id, Delivery delivery, String recipient, String body) {
        Map<String, Object> params = new LinkedHashMap<>();
        if (recipient != null) {
            params.put("recipient", recipient);
        }
        if (!delivery.cc().isEmpty()) {
            params.put("cc", delivery.cc());
        }
        if (delivery.subject() != null) {
            params.put("subject", delivery.subject());
        }
        params.put("body", delivery.bodyTemplate() != null ? delivery.bodyTemplate() : body);
        params.putAll(delivery.config());
        String description = delivery.name() != null ? delivery.name() : "Deliver via " + delivery.pluginKey();
        return new ActionStep(id, null, description, delivery.pluginKey(), delivery.operationType(), params, null);
    }

    private List<WorkflowStep> emptyResultSteps(Context ctx, DeclarativeIr ir) {
        Delivery summary = ir.deliveryRules().summaryDelivery();
        for (EdgeCaseRule rule : ir.edgeCases()) {
            if ("no_rows_after_filter".equals(rule.condition())
                    && "send_empty_result_message".equals(rule.action()) && summary != null) {
                String recipient = rule.recipient() != null ? rule.recipient() : summary.recipient();
                String message = rule.message() != null ? rule.message()
                        : ir.rendering() != null && ir.rendering().emptyMessage() != null
                        ? ir.rendering().emptyMessage() : "No results found.";
                Map<String, Object> params = new LinkedHashMap<>();
                if (recipient != null) {
                    params.put("recipient", recipient);
                }
                params.put("subject", summary.subject() != null ? summary.subject() : "No results");
                params.put("body", message);
                return List.of(new ActionStep(ctx.nextId(), null, "Send empty-result notice",
                        summary.pluginKey(), summary.operationType(), params, null));
            }
        }
        return List.of();
    }

    private static String aiPrompt(AiOperation operation) {
        StringBuilder prompt = new StringBuilder(operation.instruction() == null ? "" : operation.instruction());
        if (operation.context() != null && !operation.context().isBlank()) {
            prompt.append("\n\nContext: ").append(operation.context());
        }
        return prompt.toString();
    }

    private Map<String, Object> toMap(Object value) {
        if (value == null) {
            return Map.of();
        }
        return objectMapper.convertValue(value, new TypeReference<Map<String, Object>>() {});
    }

    private static String describeSource(DataSourceSpec source) {
        String where = source.location() != null ? source.location() : source.pluginKey();
        return "Read " + where + (source.tab() != null ? " / " + source.tab() : "");
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static String ref(String stepId) {
        return "{{" + stepId + "}}";
    }

    private static final class Context {
        private final List<WorkflowStep> steps = new ArrayList<>();
        private final Set<String> plugins = new LinkedHashSet<>();
        private int counter;

        String nextId() {
            return "step_" + (++counter);
        }

        String transform(String description, String operation, String input,
                         Map<String, Object> config, String outputVariable) {
            String id = nextId();
            steps.add(new TransformStep(id, null, description, operation, input, config, outputVariable));
            return ref(id);
        }
    }
}
