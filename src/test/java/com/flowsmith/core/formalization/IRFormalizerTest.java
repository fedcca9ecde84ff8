package com.flowsmith.core.formalization;

import com.flowsmith.core.catalog.CatalogProperties;
import com.flowsmith.core.catalog.PluginCatalog;
import com.flowsmith.core.ir.DataSourceSpec;
import com.flowsmith.core.ir.DeclarativeIr;
import com.flowsmith.core.ir.Delivery;
import com.flowsmith.core.ir.DeliveryRules;
import com.flowsmith.core.ir.FilterCondition;
import com.flowsmith.core.ir.FilterGroup;
import com.flowsmith.core.ir.Grouping;
import com.flowsmith.core.ir.Partition;
import com.flowsmith.core.llm.GenerationOptions;
import com.flowsmith.core.llm.LlmParseException;
import com.flowsmith.core.llm.LlmProperties;
import com.flowsmith.core.llm.LlmProviderException;
import com.flowsmith.core.llm.LlmService;
import com.flowsmith.core.llm.StructuredResponse;
import com.flowsmith.core.llm.TokenUsage;
import com.flowsmith.core.model.Assumption;
import com.flowsmith.core.model.AssumptionCategory;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.GroundingResult;
import com.flowsmith.core.model.ImpactLevel;
import com.flowsmith.core.model.PipelinePhase;
import com.flowsmith.core.model.ReasoningStep;
import com.flowsmith.core.model.ResolvedInput;
import com.flowsmith.core.model.SemanticPlan;
import com.flowsmith.core.model.Understanding;
import com.flowsmith.core.support.PipelineException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class IRFormalizerTest {

    private LlmService llm;
    private IRFormalizer formalizer;

    @BeforeEach
    void setUp() {
        llm = mock(LlmService.class);
        var catalog = new PluginCatalog(new CatalogProperties(), new DefaultResourceLoader());
        catalog.load();
        formalizer = new IRFormalizer(llm, new LlmProperties(), catalog);
    }

    private static Assumption assumption(String id, ImpactLevel impact) {
        return new Assumption(id, AssumptionCategory.FIELD_NAME, id, null, null, impact, null);
    }

    private static GroundedSemanticPlan plan(double confidence, List<GroundingResult> results, Assumption... assumptions) {
        var semantic = new SemanticPlan("1.0", "Email leads in stage 4 to sales", Understanding.empty(),
                List.of(assumptions), null, null,
                List.of(new ReasoningStep(1, "source", null, "google-sheets", "leads live in a sheet", null)), null);
        return GroundedSemanticPlan.of(semantic, true, results, List.of(), confidence, "2026-01-01T00:00:00Z",
                (int) results.stream().filter(GroundingResult::validated).count(), 0, false);
    }

    private static GroundingResult validated(String id, String value) {
        return new GroundingResult(id, true, false, value, "field_match", 1.0, "exact", null);
    }

    private static DeclarativeIr ir(String goal, FilterGroup filters, Grouping grouping, List<Partition> partitions) {
        return new DeclarativeIr("3.0", goal, null,
                List.of(new DataSourceSpec("tabular", null, "google-sheets", "read_range", null, null, null, null, null, null)),
                null, filters, null, null, partitions, grouping, null,
                new DeliveryRules(null, null, new Delivery("summary", "sales@example.com", null, null, null, null,
                        "google-mail", "send_email", null), null, false),
                null, null);
    }

    private void modelReturns(DeclarativeIr ir) {
        when(llm.structuredCall(anyString(), anyString(), eq(DeclarativeIr.class), any(GenerationOptions.class)))
                .thenReturn(new StructuredResponse<>(ir, "{}", new TokenUsage(100, 50, 150), "gpt-4o", 12));
    }

    @Test
    @DisplayName("collects grounded facts and fills a blank goal from the plan")
    void formalizesPlan() {
        var plan = plan(0.95, List.of(validated("stage_field", "Stage"), GroundingResult.skipped("owner_field", "field_match", "no data")),
                assumption("stage_field", ImpactLevel.CRITICAL), assumption("owner_field", ImpactLevel.LOW));
        modelReturns(ir("", new FilterGroup("AND", List.of(new FilterCondition("Stage", "equals", 4, null)), null), null, null));

        var result = formalizer.formalize(plan, List.of(), List.of("google-sheets", "google-mail"));

        assertEquals("Email leads in stage 4 to sales", result.ir().goal());
        assertEquals(Map.of("stage_field", "Stage"), result.groundedFacts());
        assertEquals(List.of("owner_field"), result.missingFacts());
        assertEquals(0.95, result.confidence(), 1e-9);
        assertTrue(result.warnings().isEmpty());
        assertEquals("gpt-4o", result.model());
        assertNotNull(result.timestamp());
        assertEquals("{}", result.rawIr(), "Raw model output is kept for token checks");
    }

    @Test
    @DisplayName("formalization runs with the formalization phase settings")
    void usesPhaseOptions() {
        modelReturns(ir("goal", null, null, null));

        formalizer.formalize(plan(1.0, List.of()), List.of(), List.of());

        var options = ArgumentCaptor.forClass(GenerationOptions.class);
        verify(llm).structuredCall(eq(IRFormalizer.SYSTEM_PROMPT), anyString(), eq(DeclarativeIr.class), options.capture());
        assertEquals(0.0, options.getValue().temperature());
        assertEquals(4000, options.getValue().maxTokens());
    }

    @Test
    @DisplayName("missing critical and moderate facts discount confidence")
    void confidencePenalties() {
        var plan = plan(0.8, List.of(),
                assumption("recipient", ImpactLevel.CRITICAL), assumption("region", ImpactLevel.MODERATE));

        var missing = IRFormalizer.missingFacts(plan, Map.of());

        assertEquals(List.of("recipient", "region"), missing);
        assertEquals(0.8 * 0.5 * 0.8, IRFormalizer.confidence(plan, missing), 1e-9);
        assertEquals(0.8 * 0.8, IRFormalizer.confidence(plan, List.of("region")), 1e-9);
        assertEquals(0.8, IRFormalizer.confidence(plan, List.of()), 1e-9);
    }

    @Test
    @DisplayName("warns about filter, grouping and partition fields that were never grounded")
    void fieldWarnings() {
        var ir = ir("goal",
                new FilterGroup("AND", List.of(new FilterCondition("Stage", "equals", 4, null),
                        new FilterCondition("Priority", "equals", "high", null)), null),
                new Grouping("Owner", true), List.of(new Partition("Region", "value")));

        var warnings = IRFormalizer.fieldWarnings(ir, Map.of("stage_field", "Stage"));

        assertEquals(List.of(
                "Filter field \"Priority\" not found in grounded facts",
                "Grouping field \"Owner\" not found in grounded facts",
                "Partition field \"Region\" not found in grounded facts"), warnings);
    }

    @Test
    @DisplayName("request carries facts, resolved inputs, scoped plugins and the reasoning trace")
    void buildsRequest() {
        var plan = plan(1.0, List.of(validated("stage_field", "Stage")));

        String request = formalizer.buildRequest(plan, Map.of("stage_field", "Stage"),
                List.of(new ResolvedInput("recipient_email", "me@example.com")), List.of("google-sheets"));

        assertTrue(request.contains("## Grounded Facts (USE THESE EXACTLY)"));
        assertTrue(request.contains("\"stage_field\" : \"Stage\""));
        assertTrue(request.contains("- **recipient_email**: me@example.com"));
        assertTrue(request.contains("- **google-sheets**"));
        assertFalse(request.contains("- **slack**"));
        assertTrue(request.contains("Step 1: google-sheets - leads live in a sheet"));
        assertFalse(request.contains("## Search Criteria Handling"));
        assertTrue(request.endsWith(IRFormalizer.RULES));
    }

    @Test
    @DisplayName("API sources switch on the search criteria instructions")
    void searchCriteria() {
        var understanding = new Understanding(
                List.of(new Understanding.DataSourceUnderstanding("api", "Gmail inbox", null, "primary", null)),
                null, null, null, null, null, null, null);

        assertTrue(IRFormalizer.hasSearchCriteria(understanding));
        assertFalse(IRFormalizer.hasSearchCriteria(Understanding.empty()));
        assertFalse(IRFormalizer.hasSearchCriteria(null));
    }

    @Test
    @DisplayName("retries a malformed response, then fails the formalization phase")
    void failsAfterRetries() {
        when(llm.structuredCall(anyString(), anyString(), eq(DeclarativeIr.class), any(GenerationOptions.class)))
                .thenThrow(new LlmParseException("Failed to parse LLM response as DeclarativeIr", "not json", null));

        var ex = assertThrows(PipelineException.class,
                () -> formalizer.formalize(plan(1.0, List.of()), List.of(), List.of()));

        assertEquals(PipelinePhase.FORMALIZATION, ex.getPhase());
        assertEquals("formalization_failed", ex.getCode());
        assertTrue(ex.getMessage().contains("after 2 attempt(s)"));
        verify(llm, times(2)).structuredCall(anyString(), anyString(), eq(DeclarativeIr.class), any(GenerationOptions.class));
    }

    @Test
    @DisplayName("authentication failures are not retried")
    void authNotRetried() {
        when(llm.structuredCall(anyString(), anyString(), eq(DeclarativeIr.class), any(GenerationOptions.class)))
                .thenThrow(new LlmProviderException(LlmProviderException.Kind.AUTHENTICATION, "openai call failed: 401", null));

        assertThrows(PipelineException.class, () -> formalizer.formalize(plan(1.0, List.of()), List.of(), List.of()));

        verify(llm, times(1)).structuredCall(anyString(), anyString(), eq(DeclarativeIr.class), any(GenerationOptions.class));
    }
}
