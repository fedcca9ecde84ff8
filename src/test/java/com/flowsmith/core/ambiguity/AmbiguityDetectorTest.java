package com.flowsmith.core.ambiguity;

import com.flowsmith.core.model.Ambiguity;
import com.flowsmith.core.model.AmbiguityReport.ReviewItem;
import com.flowsmith.core.model.Assumption;
import com.flowsmith.core.model.AssumptionCategory;
import com.flowsmith.core.model.ConfidenceLevel;
import com.flowsmith.core.model.EnhancedPrompt;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.GroundingError;
import com.flowsmith.core.model.GroundingResult;
import com.flowsmith.core.model.ImpactLevel;
import com.flowsmith.core.model.Inference;
import com.flowsmith.core.model.ResolvedInput;
import com.flowsmith.core.model.SemanticPlan;
import com.flowsmith.core.model.Understanding;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AmbiguityDetectorTest {

    private final AmbiguityDetector detector = new AmbiguityDetector();

    private SemanticPlan plan;
    private GroundedSemanticPlan grounded;
    private EnhancedPrompt prompt;

    private static Assumption assumption(String id, ImpactLevel impact) {
        return new Assumption(id, AssumptionCategory.FIELD_NAME, "Column for " + id, null, null, impact, null);
    }

    private static List<String> ids(List<ReviewItem> items) {
        return items.stream().map(ReviewItem::id).toList();
    }

    @BeforeEach
    void setUp() {
        plan = new SemanticPlan(null, "Email qualified leads", Understanding.empty(),
                List.of(
                        assumption("stage_field", ImpactLevel.MODERATE),
                        assumption("owner_field", ImpactLevel.LOW),
                        assumption("amount_field", ImpactLevel.CRITICAL),
                        assumption("region_field", ImpactLevel.LOW)),
                List.of(new Inference("send_time", "08:00", "Mornings are typical", ConfidenceLevel.LOW, true),
                        new Inference("format", "html", "Asked for a table", ConfidenceLevel.HIGH, true)),
                List.of(
                        new Ambiguity("recipient", "recipient", "Who receives the email?", List.of("me", "team"), null, null, true),
                        new Ambiguity("schedule", "schedule", "How often?", List.of("daily"), "daily", null, false),
                        new Ambiguity("tab", "Sheet Tab", "Which tab?", List.of("Leads"), null, null, true)),
                null, null);

        var results = List.of(
                new GroundingResult("stage_field", true, false, "Stage", "field_match", 0.95, "exact",
                        List.of(new GroundingResult.Alternative("Stage Name", 0.8, "Alternative field match"))),
                new GroundingResult("owner_field", true, false, "Owner", "field_match", 0.75, "fuzzy", List.of()),
                GroundingResult.failed("amount_field", "field_match", "No matching field"),
                GroundingResult.skipped("region_field", "skipped", "No metadata"));
        var errors = List.of(
                new GroundingError("amount_field", "validation_failed", "No matching field",
                        GroundingError.SEVERITY_ERROR, "Manual correction required"),
                new GroundingError("overall", "insufficient_validation", "Too many skipped",
                        GroundingError.SEVERITY_ERROR, "Provide metadata"),
                new GroundingError("owner_field", "low_confidence", "Low", GroundingError.SEVERITY_WARNING, "Confirm"));
        grounded = GroundedSemanticPlan.of(plan, true, results, errors, 0.9, "now", 2, 1, false);

        prompt = new EnhancedPrompt(null, null,
                new EnhancedPrompt.Specifics(List.of(), List.of(new ResolvedInput("sheet_tab", "Leads"))));
    }

    @Test
    @DisplayName("sorts ambiguities, assumptions and blocking errors into tiers")
    void tiers() {
        var report = detector.detect(plan, grounded, prompt);

        assertEquals(List.of("recipient", "amount_field", "grounding_error_2"), ids(report.mustConfirm()));
        assertEquals(List.of("schedule", "owner_field", "region_field", "inference_send_time"), ids(report.shouldReview()));
        assertEquals(List.of("tab", "stage_field"), ids(report.looksGood()));
    }

    @Test
    @DisplayName("a blocking error for an assumption already in must-confirm is not repeated")
    void noDuplicateForConfirmedAssumption() {
        var report = detector.detect(plan, grounded, prompt);

        assertEquals(1, report.mustConfirm().stream().filter(i -> "grounding_error".equals(i.source())).count());
        var critical = report.mustConfirm().get(1);
        assertEquals("Validation failed (critical impact)", critical.reason());
    }

    @Test
    @DisplayName("field resolutions with alternatives become grounding ambiguities")
    void groundingAmbiguities() {
        var report = detector.detect(plan, grounded, prompt);

        assertEquals(1, report.groundingAmbiguities().size());
        var item = report.groundingAmbiguities().get(0);
        assertEquals("stage_field", item.id());
        assertEquals(List.of("Stage", "Stage Name"), item.options());
        assertEquals("Stage", item.recommended());
    }

    @Test
    @DisplayName("an unresolved field with alternatives offers only the alternatives")
    void unresolvedGroundingAmbiguity() {
        var results = List.of(new GroundingResult("amount_field", false, false, null, "field_match", 0.0,
                "No matching field found", List.of(new GroundingResult.Alternative("Amount USD", 0.6, "fuzzy match"))));
        var unresolved = GroundedSemanticPlan.of(plan, true, results, List.of(), 0.0, "now", 0, 0, true);

        var item = detector.detect(plan, unresolved, prompt).groundingAmbiguities().get(0);

        assertEquals("amount_field", item.field());
        assertEquals(List.of("Amount USD"), item.options());
        assertNull(item.recommended());
        assertFalse(item.options().contains("null"));
    }

    @Test
    @DisplayName("overall confidence decays with each must-confirm item")
    void overallConfidence() {
        var report = detector.detect(plan, grounded, prompt);
        assertEquals(0.9 * Math.pow(0.9, 3), report.overallConfidence(), 1e-9);
    }

    @Test
    @DisplayName("a lower threshold moves validated assumptions up to looks-good")
    void customThreshold() {
        var report = detector.detect(plan, grounded, prompt, 0.7);
        assertTrue(ids(report.looksGood()).contains("owner_field"));
        assertFalse(ids(report.shouldReview()).contains("owner_field"));
    }

    @Test
    @DisplayName("nothing validated means zero confidence")
    void nothingValidated() {
        var ungrounded = GroundedSemanticPlan.of(plan, false, List.of(), List.of(), 0.0, "now", 0, 0, true);
        var report = detector.detect(plan, ungrounded, null);
        assertEquals(0.0, report.overallConfidence());
        assertTrue(ids(report.mustConfirm()).contains("amount_field"));
        assertTrue(ids(report.mustConfirm()).contains("tab"));
    }
}
