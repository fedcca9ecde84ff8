package com.flowsmith.core.grounding;

import com.flowsmith.core.model.Assumption;
import com.flowsmith.core.model.AssumptionCategory;
import com.flowsmith.core.model.DataSourceMetadata;
import com.flowsmith.core.model.GroundingError;
import com.flowsmith.core.model.GroundingResult;
import com.flowsmith.core.model.ImpactLevel;
import com.flowsmith.core.model.SemanticPlan;
import com.flowsmith.core.model.Understanding;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GroundingEngineTest {

    private final GroundingEngine engine = new GroundingEngine(new FieldMatcher(), new DataSampler());

    private static Assumption assumption(String id, AssumptionCategory category, ImpactLevel impact,
                                         String description, Map<String, Object> parameters) {
        return new Assumption(id, category, description, null,
                new Assumption.ValidationStrategy("check", parameters, null), impact, null);
    }

    private static SemanticPlan plan(Assumption... assumptions) {
        return new SemanticPlan(null, "goal", Understanding.empty(), List.of(assumptions), null, null, null, null);
    }

    private static DataSourceMetadata headersOnly(String... headers) {
        return new DataSourceMetadata("tabular", List.of(headers), null, null, null, null);
    }

    private static DataSourceMetadata withRows() {
        return new DataSourceMetadata("tabular", List.of("Name", "Email", "Stage"), null, List.of(
                Map.of("Name", "Ada", "Email", "ada@example.com", "Stage", 4),
                Map.of("Name", "Grace", "Email", "grace@example.com", "Stage", 2),
                Map.of("Name", "Linus", "Email", "linus@example.com", "Stage", 4),
                Map.of("Name", "Ken", "Email", "ken@example.org", "Stage", 1),
                Map.of("Name", "Barbara", "Email", "barbara@example.com", "Stage", 3)), 5, null);
    }

    @Test
    @DisplayName("without metadata every data-bound assumption is skipped and confidence is exactly zero")
    void emptyMetadataSkipsEverything() {
        var grounded = engine.ground(plan(
                assumption("stage_field", AssumptionCategory.FIELD_NAME, ImpactLevel.CRITICAL, "Stage column",
                        Map.of("candidates", List.of("Stage"))),
                assumption("sheet_shape", AssumptionCategory.STRUCTURE, ImpactLevel.LOW, "One header row", Map.of())),
                DataSourceMetadata.empty(), GroundingConfig.defaults());

        assertTrue(grounded.grounded());
        assertEquals(0.0, grounded.groundingConfidence());
        assertEquals(0, grounded.validatedAssumptionsCount());
        assertEquals(2, grounded.skippedAssumptionsCount());
        assertTrue(grounded.allAssumptionsSkipped());
        assertTrue(grounded.groundingResults().stream().allMatch(r -> r.skipped() && r.confidence() == 0.0));

        var types = grounded.groundingErrors().stream().map(GroundingError::errorType).toList();
        assertTrue(types.contains(GroundingEngine.VALIDATION_SKIPPED));
        assertTrue(types.contains(GroundingEngine.INSUFFICIENT_VALIDATION));
        assertTrue(grounded.hasBlockingErrors());
    }

    @Test
    @DisplayName("aggregate confidence is the geometric mean of validated results only")
    void geometricMean() {
        var grounded = engine.ground(plan(
                assumption("a1", AssumptionCategory.FIELD_NAME, ImpactLevel.LOW, "", Map.of("candidates", List.of("Stage"))),
                assumption("a2", AssumptionCategory.FIELD_NAME, ImpactLevel.LOW, "", Map.of("candidates", List.of("email"))),
                assumption("a3", AssumptionCategory.DATA_TYPE, ImpactLevel.LOW, "",
                        Map.of("field_name", "Stage", "expected_type", "number"))),
                headersOnly("Stage", "Email"), GroundingConfig.defaults());

        assertEquals(2, grounded.validatedAssumptionsCount());
        assertEquals(1, grounded.skippedAssumptionsCount());
        assertEquals(Math.sqrt(1.0 * 0.95), grounded.groundingConfidence(), 1e-9);
        assertFalse(grounded.hasBlockingErrors());
    }

    @Test
    @DisplayName("a field resolved earlier is reused by later assumptions that name it differently")
    void reusesResolvedFields() {
        var grounded = engine.ground(plan(
                assumption("stage_field", AssumptionCategory.FIELD_NAME, ImpactLevel.LOW, "Deal stage",
                        Map.of("candidates", List.of("Deal Stage", "stage"))),
                assumption("stage_type", AssumptionCategory.DATA_TYPE, ImpactLevel.LOW, "",
                        Map.of("field_name", "Deal Stage", "expected_type", "integer"))),
                withRows(), GroundingConfig.defaults());

        var field = grounded.findResult("stage_field").orElseThrow();
        assertTrue(field.validated());
        assertEquals("Stage", field.resolvedValue());
        assertEquals("field_match_with_data_sample", field.validationMethod());
        assertEquals((0.95 + 1.0) / 2.0, field.confidence(), 1e-9);

        var type = grounded.findResult("stage_type").orElseThrow();
        assertTrue(type.validated());
        assertEquals("number", type.resolvedValue());
        assertEquals(0.95, type.confidence(), 1e-9);
    }

    @Test
    @DisplayName("\"Customer Email\" resolves to the customer_email header through the normalized tier")
    void normalizedHeaderMatch() {
        var grounded = engine.ground(plan(
                assumption("recipient_field", AssumptionCategory.FIELD_NAME, ImpactLevel.CRITICAL, "Customer email column",
                        Map.of("candidates", List.of("Customer Email")))),
                headersOnly("name", "customer_email", "stage"), GroundingConfig.defaults());

        var result = grounded.findResult("recipient_field").orElseThrow();
        assertTrue(result.validated());
        assertEquals("customer_email", result.resolvedValue());
        assertEquals("field_match", result.validationMethod());
        assertEquals(0.9, result.confidence(), 1e-9);
        assertTrue(result.evidence().contains("matched via normalized"));
        assertEquals(0.9, grounded.groundingConfidence(), 1e-9);
        assertFalse(grounded.hasBlockingErrors());
    }

    @Test
    @DisplayName("\"email content\" resolves against described fields through their descriptions")
    void descriptionFieldMatch() {
        var metadata = new DataSourceMetadata("api", null, List.of(
                new DataSourceMetadata.FieldDescriptor("subject", "Subject line", "string"),
                new DataSourceMetadata.FieldDescriptor("snippet",
                        "Short preview of the email. USE THIS for content matching", "string"),
                new DataSourceMetadata.FieldDescriptor("body", "Full email body content", "string")),
                null, null, "google-mail");

        var grounded = engine.ground(plan(
                assumption("content_field", AssumptionCategory.FIELD_NAME, ImpactLevel.MODERATE, "Email text to scan",
                        Map.of("candidates", List.of("email content")))),
                metadata, GroundingConfig.defaults());

        var result = grounded.findResult("content_field").orElseThrow();
        assertTrue(result.validated());
        assertEquals("snippet", result.resolvedValue());
        assertEquals(0.8, result.confidence(), 1e-9);
        assertTrue(result.evidence().contains("matched via description"));
        assertEquals(List.of("body"), result.alternatives().stream().map(GroundingResult.Alternative::value).toList());
    }

    @Test
    @DisplayName("value format assumptions are checked against sampled values")
    void valueFormat() {
        var grounded = engine.ground(plan(
                assumption("email_domain", AssumptionCategory.VALUE_FORMAT, ImpactLevel.MODERATE, "",
                        Map.of("field_name", "Email", "pattern", "@example\\.com$"))),
                withRows(), GroundingConfig.defaults());

        var result = grounded.findResult("email_domain").orElseThrow();
        assertTrue(result.validated());
        assertEquals(0.8, result.confidence(), 1e-9);
        assertEquals("4/5 values matched pattern \"@example\\.com$\"", result.evidence());
    }

    @Test
    @DisplayName("an invalid regular expression fails the assumption instead of throwing")
    void invalidPattern() {
        var grounded = engine.ground(plan(
                assumption("bad", AssumptionCategory.VALUE_FORMAT, ImpactLevel.LOW, "",
                        Map.of("field_name", "Email", "pattern", "(unclosed"))),
                withRows(), GroundingConfig.defaults());

        var result = grounded.findResult("bad").orElseThrow();
        assertFalse(result.validated());
        assertFalse(result.skipped());
        assertEquals(GroundingEngine.VALIDATION_FAILED, grounded.groundingErrors().get(0).errorType());
        assertEquals(GroundingError.SEVERITY_WARNING, grounded.groundingErrors().get(0).severity());
    }

    @Test
    @DisplayName("fail-fast stops at the first failed critical assumption")
    void failFast() {
        var plan = plan(
                assumption("revenue", AssumptionCategory.FIELD_NAME, ImpactLevel.CRITICAL, "",
                        Map.of("candidates", List.of("Revenue"))),
                assumption("name", AssumptionCategory.FIELD_NAME, ImpactLevel.LOW, "",
                        Map.of("candidates", List.of("Name"))));

        var stopped = engine.ground(plan, headersOnly("Name", "Stage"), GroundingConfig.defaults().withFailFast(true));
        assertEquals(1, stopped.groundingResults().size());
        assertTrue(stopped.hasBlockingErrors());

        var full = engine.ground(plan, headersOnly("Name", "Stage"), GroundingConfig.defaults());
        assertEquals(2, full.groundingResults().size());
        var failed = full.findResult("revenue").orElseThrow();
        assertFalse(failed.validated());
        assertFalse(failed.alternatives().isEmpty());
    }

    @Test
    @DisplayName("behavior assumptions are accepted heuristically and unknown categories fail")
    void behaviorAndUnknown() {
        var grounded = engine.ground(plan(
                assumption("daily", AssumptionCategory.BEHAVIOR, ImpactLevel.LOW, "Runs daily", Map.of()),
                assumption("odd", AssumptionCategory.UNKNOWN, ImpactLevel.LOW, "?", Map.of())),
                headersOnly("Name"), GroundingConfig.defaults());

        var behavior = grounded.findResult("daily").orElseThrow();
        assertTrue(behavior.validated());
        assertEquals(0.7, behavior.confidence());
        assertFalse(grounded.findResult("odd").orElseThrow().validated());
        assertEquals(0.7, grounded.groundingConfidence(), 1e-9);
    }

    @Test
    @DisplayName("field candidates fall back to a quoted column in the description")
    void candidatesFromDescription() {
        var assumption = assumption("x", AssumptionCategory.FIELD_NAME, ImpactLevel.LOW,
                "The sheet has a column named \"Owner\"", Map.of());
        assertEquals(List.of("Owner"), GroundingEngine.fieldCandidates(assumption));
    }

    @Test
    @DisplayName("an ungrounded plan carries no results and zero confidence")
    void ungrounded() {
        var result = engine.ungrounded(plan(
                assumption("a1", AssumptionCategory.BEHAVIOR, ImpactLevel.LOW, "", Map.of())));
        assertFalse(result.grounded());
        assertEquals(0.0, result.groundingConfidence());
        assertTrue(result.groundingResults().isEmpty());
        assertEquals(1, result.totalAssumptionsCount());
    }
}
