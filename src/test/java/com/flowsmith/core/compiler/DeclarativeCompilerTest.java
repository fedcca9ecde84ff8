package com.flowsmith.core.compiler;

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
import com.flowsmith.core.ir.OutputSchema;
import com.flowsmith.core.ir.Partition;
import com.flowsmith.core.ir.Rendering;
import com.flowsmith.core.workflow.ActionStep;
import com.flowsmith.core.workflow.AiProcessingStep;
import com.flowsmith.core.workflow.ConditionalStep;
import com.flowsmith.core.workflow.ScatterGatherStep;
import com.flowsmith.core.workflow.TransformStep;
import com.flowsmith.core.workflow.WorkflowStep;
import com.flowsmith.core.workflow.WorkflowSteps;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DeclarativeCompilerTest {

    private final DeclarativeCompiler compiler = new DeclarativeCompiler();

    private static final DataSourceSpec SHEET = new DataSourceSpec("tabular", null, "google-sheets", "read_range",
            "Sales", "Leads", null, null, "primary", Map.of("spreadsheet_id", "abc", "range", "Leads"));

    private static Delivery summaryEmail() {
        return new Delivery("Email summary", "sales@example.com", null, null, "Qualified leads", null,
                "google-mail", "send_email", null);
    }

    private static DeclarativeIr ir(List<DataSourceSpec> sources, Normalization normalization, FilterGroup filters,
                                    List<AiOperation> ai, List<Partition> partitions, Grouping grouping,
                                    Rendering rendering, DeliveryRules rules, List<EdgeCaseRule> edgeCases) {
        return new DeclarativeIr("3.0", "Email qualified leads", null, sources, normalization, filters, ai, null,
                partitions, grouping, rendering, rules, edgeCases, null);
    }

    private static DeclarativeIr leadsReport(boolean sendWhenEmpty) {
        return ir(List.of(SHEET),
                new Normalization(List.of("Name", "Stage"), null, null),
                new FilterGroup("AND", List.of(new FilterCondition("Stage", "equals", 4, null)), null),
                null, null, null,
                new Rendering("html_table", null, List.of("Name", "Email"), "No leads today", null, null),
                new DeliveryRules(null, null, summaryEmail(), null, sendWhenEmpty),
                null);
    }

    @Test
    @DisplayName("compiles source, normalization, filter, rendering and guarded delivery in order")
    void compilesLinearPipeline() {
        var compiled = compiler.compile(leadsReport(false));
        var steps = compiled.steps();

        assertEquals(5, steps.size());
        var read = assertInstanceOf(ActionStep.class, steps.get(0));
        assertEquals("step_1", read.id());
        assertEquals("google-sheets", read.plugin());
        assertEquals("read_range", read.action());
        assertEquals("abc", read.params().get("spreadsheet_id"));

        var normalize = assertInstanceOf(TransformStep.class, steps.get(1));
        assertEquals("normalize_headers", normalize.operation());
        assertEquals("{{step_1}}", normalize.input());
        assertEquals("error", normalize.config().get("missing_header_action"));
        assertEquals(false, normalize.config().get("case_sensitive"));

        var filter = assertInstanceOf(TransformStep.class, steps.get(2));
        assertEquals("filter", filter.operation());
        assertEquals("{{step_2}}", filter.input());
        assertEquals(Map.of("field", "Stage", "operator", "equals", "value", 4), filter.config().get("condition"));

        var render = assertInstanceOf(TransformStep.class, steps.get(3));
        assertEquals("render_table", render.operation());
        assertEquals(List.of("Name", "Email"), render.config().get("columns"));
        assertEquals("No leads today", render.config().get("empty_message"));

        var guard = assertInstanceOf(ConditionalStep.class, steps.get(4));
        assertEquals("{{step_3}}.length > 0", guard.condition());
        var send = assertInstanceOf(ActionStep.class, guard.thenSteps().get(0));
        assertEquals("send_email", send.action());
        assertEquals("sales@example.com", send.params().get("recipient"));
        assertEquals("{{step_4}}", send.params().get("body"));
        assertTrue(guard.elseSteps().isEmpty());

        assertEquals(List.of("google-sheets", "google-mail"), compiled.pluginsUsed());
    }

    @Test
    @DisplayName("the same IR always compiles to the same steps with unique ids")
    void deterministic() {
        var first = compiler.compile(leadsReport(false));
        var second = compiler.compile(leadsReport(false));

        assertEquals(first, second);
        var ids = WorkflowSteps.flatten(first.steps()).stream().map(WorkflowStep::id).toList();
        assertEquals(ids.size(), new HashSet<>(ids).size());
    }

    @Test
    @DisplayName("delivery is unguarded when empty results should still be sent")
    void sendWhenEmpty() {
        var steps = compiler.compile(leadsReport(true)).steps();

        assertInstanceOf(ActionStep.class, steps.get(steps.size() - 1));
        assertTrue(steps.stream().noneMatch(s -> s instanceof ConditionalStep));
    }

    @Test
    @DisplayName("an empty-result edge case becomes the else branch")
    void emptyResultNotice() {
        var ir = ir(List.of(SHEET), null, null, null, null, null,
                new Rendering("html_table", null, null, "Nothing matched", null, null),
                new DeliveryRules(null, null, summaryEmail(), null, false),
                List.of(new EdgeCaseRule("no_rows_after_filter", "send_empty_result_message", null, "boss@example.com")));

        var steps = compiler.compile(ir).steps();

        var guard = assertInstanceOf(ConditionalStep.class, steps.get(steps.size() - 1));
        var notice = assertInstanceOf(ActionStep.class, guard.elseSteps().get(0));
        assertEquals("boss@example.com", notice.params().get("recipient"));
        assertEquals("Nothing matched", notice.params().get("body"));
        assertEquals("Qualified leads", notice.params().get("subject"));
    }

    @Test
    @DisplayName("OR filters of contains conditions become one includes expression")
    void orFilter() {
        var ir = ir(List.of(SHEET), null,
                new FilterGroup("OR", List.of(
                        new FilterCondition("subject", "contains", List.of("Invoice", "Receipt"), null),
                        new FilterCondition("snippet", "contains", "bill", null)), null),
                null, null, null, null, new DeliveryRules(null, null, summaryEmail(), null, true), null);

        var filter = (TransformStep) compiler.compile(ir).steps().get(1);

        assertEquals("(item.subject ?? '').toLowerCase().includes('invoice') || "
                + "(item.subject ?? '').toLowerCase().includes('receipt') || "
                + "(item.snippet ?? '').toLowerCase().includes('bill')", filter.config().get("condition"));
    }

    @Test
    @DisplayName("nested AND groups chain one filter step per level")
    void nestedAndGroups() {
        var ir = ir(List.of(SHEET), null,
                new FilterGroup("AND", List.of(new FilterCondition("Stage", "equals", 4, null),
                        new FilterCondition("Region", "equals", "EU", null)),
                        List.of(new FilterGroup("AND", List.of(new FilterCondition("Owner", "is_not_empty", null, null)), null))),
                null, null, null, null, new DeliveryRules(null, null, summaryEmail(), null, true), null);

        var steps = compiler.compile(ir).steps();

        var outer = (TransformStep) steps.get(1);
        var inner = (TransformStep) steps.get(2);
        @SuppressWarnings("unchecked")
        var combined = (Map<String, Object>) outer.config().get("condition");
        assertEquals("AND", combined.get("combineWith"));
        assertEquals(2, ((List<?>) combined.get("conditions")).size());
        assertEquals("{{step_2}}", inner.input());
        assertEquals(Map.of("field", "Owner", "operator", "is_not_empty"), inner.config().get("condition"));
    }

    @Test
    @DisplayName("AI operations feed the next step and carry their output schema")
    void aiOperation() {
        var schema = new OutputSchema("object", List.of(new OutputSchema.SchemaField("category", "string", true, null)),
                null, null, null);
        var ir = ir(List.of(SHEET), null, null,
                List.of(new AiOperation("classify", "Classify each lead", "B2B sales", null, schema, null)),
                null, null, new Rendering("json", null, null, null, null, null),
                new DeliveryRules(null, null, summaryEmail(), null, true), null);

        var steps = compiler.compile(ir).steps();

        var ai = assertInstanceOf(AiProcessingStep.class, steps.get(1));
        assertEquals("{{step_1}}", ai.input());
        assertEquals("Classify each lead\n\nContext: B2B sales", ai.prompt());
        assertEquals("object", ai.outputSchema().get("type"));
        var render = (TransformStep) steps.get(2);
        assertEquals("format_json", render.operation());
        assertEquals("{{step_2}}", render.input());
    }

    @Test
    @DisplayName("per-item delivery scatters over the filtered items with a field-sourced recipient")
    void perItemDelivery() {
        var perItem = new Delivery("Notify owner", null, "Email", null, "Your lead", "Hi {{item.Name}}",
                "google-mail", "send_email", null);
        var ir = ir(List.of(SHEET), null,
                new FilterGroup("AND", List.of(new FilterCondition("Stage", "equals", 4, null)), null),
                null, null, null, null, new DeliveryRules(perItem, null, null, null, true), null);

        var steps = compiler.compile(ir).steps();

        var scatter = assertInstanceOf(ScatterGatherStep.class, steps.get(2));
        assertEquals("{{step_2}}", scatter.config().data());
        assertEquals("item", scatter.config().itemVariable());
        var send = (ActionStep) scatter.config().actions().get(0);
        assertEquals("step_3_1", send.id());
        assertEquals("{{item.Email}}", send.params().get("recipient"));
        assertEquals("Hi {{item.Name}}", send.params().get("body"));
    }

    @Test
    @DisplayName("per-group delivery scatters over the grouping output")
    void perGroupDelivery() {
        var perGroup = new Delivery("Owner digest", null, "owner_email", null, null, null,
                "slack", "send_message", Map.of("channel", "#sales"));
        var ir = ir(List.of(SHEET), null, null, null,
                List.of(new Partition("Owner", null)), new Grouping("Owner", true), null,
                new DeliveryRules(null, perGroup, null, null, true), null);

        var steps = compiler.compile(ir).steps();

        var partition = (TransformStep) steps.get(1);
        assertEquals("partition", partition.operation());
        assertEquals("value", partition.config().get("split_by"));
        var group = (TransformStep) steps.get(2);
        assertEquals("group_by", group.operation());
        assertEquals(true, group.config().get("emit_per_group"));
        var scatter = (ScatterGatherStep) steps.get(3);
        assertEquals("{{step_3}}", scatter.config().data());
        var send = (ActionStep) scatter.config().actions().get(0);
        assertEquals("{{group.owner_email}}", send.params().get("recipient"));
        assertEquals("#sales", send.params().get("channel"));
    }

    @Test
    @DisplayName("sort order becomes a sort step ahead of rendering")
    void sortOrder() {
        var ir = ir(List.of(SHEET), null, null, null, null, null,
                new Rendering("csv", null, null, null, null, List.of(new Rendering.SortSpec("Amount", "DESC", 1))),
                new DeliveryRules(null, null, summaryEmail(), null, true), null);

        var steps = compiler.compile(ir).steps();

        var sort = (TransformStep) steps.get(1);
        assertEquals("sort", sort.operation());
        assertEquals(List.of(Map.of("field", "Amount", "direction", "desc")), sort.config().get("sort_by"));
        assertEquals("format_csv", ((TransformStep) steps.get(2)).operation());
        assertEquals("{{step_2}}", ((TransformStep) steps.get(2)).input());
    }

    @Test
    @DisplayName("unsupported shapes raise DeterministicCompilationException")
    void unsupportedShapes() {
        var rules = new DeliveryRules(null, null, summaryEmail(), null, true);
        var webhook = new DataSourceSpec("webhook", null, "hubspot", "on_deal", null, null, null, null, null, null);
        assertThrows(DeterministicCompilationException.class,
                () -> compiler.compile(ir(List.of(webhook), null, null, null, null, null, null, rules, null)));

        var orEquals = new FilterGroup("OR", List.of(new FilterCondition("Stage", "equals", 4, null)), null);
        assertThrows(DeterministicCompilationException.class,
                () -> compiler.compile(ir(List.of(SHEET), null, orEquals, null, null, null, null, rules, null)));

        var generate = new AiOperation("generate", "Write a summary", null, null, null, null);
        assertThrows(DeterministicCompilationException.class,
                () -> compiler.compile(ir(List.of(SHEET), null, null, List.of(generate),
                        List.of(new Partition("Owner", "value")), null, null, rules, null)));

        var both = new DeliveryRules(summaryEmail(), summaryEmail(), null, null, true);
        assertThrows(DeterministicCompilationException.class,
                () -> compiler.compile(ir(List.of(SHEET), null, null, null, null, new Grouping("Owner", true), null, both, null)));

        var pluginless = new DeliveryRules(null, null,
                new Delivery("x", "a@b.co", null, null, null, null, null, null, null), null, true);
        assertThrows(DeterministicCompilationException.class,
                () -> compiler.compile(ir(List.of(SHEET), null, null, null, null, null, null, pluginless, null)));

        var perGroupWithoutGrouping = new DeliveryRules(null, summaryEmail(), null, null, true);
        assertThrows(DeterministicCompilationException.class,
                () -> compiler.compile(ir(List.of(SHEET), null, null, null, null, null, null, perGroupWithoutGrouping, null)));
    }
}
