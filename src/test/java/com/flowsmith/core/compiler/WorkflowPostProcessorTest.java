package com.flowsmith.core.compiler;

import com.flowsmith.core.workflow.ActionStep;
import com.flowsmith.core.workflow.ScatterGatherStep;
import com.flowsmith.core.workflow.TransformStep;
import com.flowsmith.core.workflow.WorkflowStep;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowPostProcessorTest {

    private final WorkflowPostProcessor postProcessor = new WorkflowPostProcessor(
            new ConditionSimplifier(), new OutputVariableStripper(), new StepShapeNormalizer());

    @Test
    @DisplayName("simplifies, strips and normalizes in one pass")
    void processes() {
        List<String> clauses = new ArrayList<>();
        for (int i = 0; i < 11; i++) {
            clauses.add("(item.subject ?? '').toLowerCase().includes('k" + i + "')");
        }
        List<WorkflowStep> steps = List.of(
                new ActionStep(null, "read", "Read", "google-mail", "search_emails", null, "emails"),
                new TransformStep(null, "filter", "Filter", "filter", "{{read}}",
                        Map.of("condition", String.join(" || ", clauses)), "filtered"),
                new ScatterGatherStep(null, "each", "Each", null, null,
                        new ScatterGatherStep.LegacyConfig("{{filter}}", "email",
                                List.of(new ActionStep(null, "notify", "Notify", "slack", "send_message", null, "posted"))),
                        "notifications"));

        var result = postProcessor.process(steps);

        assertEquals("read", result.get(0).id());
        assertNull(result.get(0).outputVariable());
        var filter = (TransformStep) result.get(1);
        assertEquals("filter", filter.id());
        assertTrue(((String) filter.config().get("condition")).startsWith("['k0'"));
        var scatter = (ScatterGatherStep) result.get(2);
        assertEquals("email", scatter.scatter().itemVariable());
        assertEquals("notify", scatter.scatter().steps().get(0).id());
        assertEquals("posted", scatter.scatter().steps().get(0).outputVariable());
        assertEquals("notifications", scatter.outputVariable());
    }
}
