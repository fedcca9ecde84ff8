package com.flowsmith.core.formalization;

import com.flowsmith.core.model.Ambiguity;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.GroundingResult;
import com.flowsmith.core.model.ResolvedInput;
import com.flowsmith.core.model.ReviewDecisions;
import com.flowsmith.core.model.SemanticPlan;
import com.flowsmith.core.model.Understanding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class DecisionResolverTest {

    private final DecisionResolver resolver = new DecisionResolver();

    private static GroundedSemanticPlan plan() {
        var semantic = new SemanticPlan(null, "goal", Understanding.empty(), List.of(), null,
                List.of(new Ambiguity("ambiguity_recipient", "recipient_email", "Who?", List.of(), null, null, true)),
                null, null);
        return GroundedSemanticPlan.of(semantic, true, List.of(
                new GroundingResult("stage_field", true, false, "Stage", "field_match", 1.0, "exact", List.of()),
                new GroundingResult("owner_field", true, false, "Owner", "field_match", 0.9, "normalized", List.of())),
                List.of(), 0.95, "now", 2, 0, false);
    }

    @Test
    @DisplayName("overrides come out in category order and keep submission order within a category")
    void ordering() {
        Map<String, Object> ambiguities = new LinkedHashMap<>();
        ambiguities.put("ambiguity_recipient", "me@example.com");
        ambiguities.put("ambiguity_schedule", "daily");
        Map<String, Object> patterns = new LinkedHashMap<>();
        patterns.put("pattern_layer2_stage_rule", "Stage = 4");
        var decisions = new ReviewDecisions(patterns, ambiguities, List.of("stage_field"), null,
                Map.of("no_rows", "skip"), Map.of("spreadsheet_id", "abc"));

        var overrides = resolver.resolve(decisions, plan());

        assertEquals(List.of(
                new ResolvedInput("recipient_email", "me@example.com"),
                new ResolvedInput("schedule", "daily"),
                new ResolvedInput("stage_rule", "Stage = 4"),
                new ResolvedInput("edge_case_no_rows", "skip"),
                new ResolvedInput("spreadsheet_id", "abc")), overrides);
    }

    @Test
    @DisplayName("no decisions means no overrides")
    void noDecisions() {
        assertTrue(resolver.resolve(null, plan()).isEmpty());
        assertTrue(resolver.resolve(ReviewDecisions.none(), plan()).isEmpty());
    }

    @Test
    @DisplayName("disabled assumptions are marked user_disabled on a copy")
    void applyDisabled() {
        var original = plan();

        var updated = resolver.applyDisabled(original, List.of("owner_field"));

        var disabled = updated.findResult("owner_field").orElseThrow();
        assertTrue(disabled.skipped());
        assertFalse(disabled.validated());
        assertEquals("user_disabled", disabled.validationMethod());
        assertTrue(updated.findResult("stage_field").orElseThrow().validated());
        assertTrue(original.findResult("owner_field").orElseThrow().validated());
        assertSame(original, resolver.applyDisabled(original, List.of()));
    }

    @Test
    @DisplayName("pattern ids lose their layer prefixes")
    void patternKey() {
        assertEquals("date_format", DecisionResolver.patternKey("pattern_layer5_date_format"));
        assertEquals("plain", DecisionResolver.patternKey("plain"));
        assertEquals("stage_rule", DecisionResolver.patternKey("layer2_stage_rule"));
        assertEquals("custom_pattern_layer2_x", DecisionResolver.patternKey("custom_pattern_layer2_x"));
    }

    @Test
    @DisplayName("only a leading ambiguity prefix is stripped from unknown ambiguity ids")
    void ambiguityFieldPrefix() {
        assertEquals("recipient", DecisionResolver.ambiguityField("ambiguity_recipient", null));
        assertEquals("my_ambiguity_x", DecisionResolver.ambiguityField("my_ambiguity_x", null));
    }
}
