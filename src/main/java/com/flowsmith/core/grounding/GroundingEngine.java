package com.flowsmith.core.grounding;

import com.flowsmith.core.model.Assumption;
import com.flowsmith.core.model.AssumptionCategory;
import com.flowsmith.core.model.DataSourceMetadata;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.GroundingError;
import com.flowsmith.core.model.GroundingResult;
import com.flowsmith.core.model.SemanticPlan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validates a semantic plan's assumptions against sampled data and extends
 * it into a {@link GroundedSemanticPlan}.
 * <p>
 * Assumptions are validated strictly in order: a field resolved by an earlier
 * assumption is reused when a later one refers to the same semantic name.
 * Missing metadata never counts as success. A result without the data it
 * needs is skipped with confidence 0.0, and the aggregate confidence is the
 * geometric mean over genuinely validated results only (exactly 0.0 when
 * there are none). A skip rate above one half adds a blocking
 * {@code insufficient_validation} error.
 */
@Service
public class GroundingEngine {

    private static final Logger log = LoggerFactory.getLogger(GroundingEngine.class);

    static final String INSUFFICIENT_VALIDATION = "insufficient_validation";
    static final String VALIDATION_FAILED = "validation_failed";
    static final String VALIDATION_ERROR = "validation_error";
    static final String VALIDATION_SKIPPED = "validation_skipped";
    static final String LOW_CONFIDENCE = "low_confidence";

    private static final Pattern COLUMN_IN_DESCRIPTION = Pattern.compile("column.*[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE);
    private static final Pattern FIELD_IN_DESCRIPTION = Pattern.compile("field\\s+[\"']([^\"']+)[\"']", Pattern.CASE_INSENSITIVE);
    private static final double BEHAVIOR_CONFIDENCE = 0.7;
    private static final double TYPE_MATCH_CONFIDENCE = 0.95;
    private static final double TYPE_MISMATCH_CONFIDENCE = 0.3;

    private final FieldMatcher fieldMatcher;
    private final DataSampler dataSampler;

    public GroundingEngine(FieldMatcher fieldMatcher, DataSampler dataSampler) {
        this.fieldMatcher = fieldMatcher;
        this.dataSampler = dataSampler;
    }

    public GroundedSemanticPlan ground(SemanticPlan plan, DataSourceMetadata metadata, GroundingConfig config) {
        DataSourceMetadata source = metadata == null ? DataSourceMetadata.empty() : metadata;
        List<Assumption> assumptions = plan.assumptionsOrEmpty();
        log.info("Grounding {} assumptions against {} fields, {} sample rows",
                assumptions.size(), source.effectiveHeaders().size(), source.sampleRows().size());

        List<GroundingResult> results = new ArrayList<>();
        List<GroundingError> errors = new ArrayList<>();
        Map<String, String> resolvedFields = new HashMap<>();
        double logConfidenceSum = 0.0;
        int validatedCount = 0;
        int skippedCount = 0;

        for (Assumption assumption : assumptions) {
            GroundingResult result;
            try {
                result = validate(assumption, source, config, resolvedFields);
            } catch (RuntimeException e) {
                log.error("Error validating assumption {}: {}", assumption.id(), e.getMessage());
                results.add(GroundingResult.failed(assumption.id(), VALIDATION_ERROR, e.getMessage()));
                errors.add(new GroundingError(assumption.id(), VALIDATION_ERROR, String.valueOf(e.getMessage()),
                        GroundingError.SEVERITY_ERROR, fallbackOr(assumption, "Check assumption and retry")));
                if (config.failFast() && assumption.isCritical()) {
                    log.warn("Fail-fast: stopping after error on critical assumption {}", assumption.id());
                    break;
                }
                continue;
            }
            results.add(result);

            if (result.skipped()) {
                skippedCount++;
                if (assumption.isCritical()) {
                    errors.add(new GroundingError(assumption.id(), VALIDATION_SKIPPED,
                            "Critical assumption skipped: " + result.evidence(),
                            GroundingError.SEVERITY_WARNING, "Provide complete metadata for all data sources"));
                }
                log.warn("Skipped assumption {} ({})", assumption.id(), assumption.impactIfWrong().value());
            } else if (result.validated()) {
                validatedCount++;
                logConfidenceSum += Math.log(Math.max(result.confidence(), Double.MIN_VALUE));
                if (result.resolvedValue() instanceof String resolved && assumption.category() == AssumptionCategory.FIELD_NAME) {
                    for (String candidate : fieldCandidates(assumption)) {
                        resolvedFields.put(FieldMatcher.normalize(candidate), resolved);
                    }
                }
                if (result.confidence() < config.minConfidence()) {
                    errors.add(new GroundingError(assumption.id(), LOW_CONFIDENCE,
                            String.format(Locale.ROOT, "Validated with low confidence %.2f", result.confidence()),
                            GroundingError.SEVERITY_WARNING, "Confirm the resolved value during review"));
                }
            } else {
                errors.add(new GroundingError(assumption.id(), VALIDATION_FAILED,
                        result.evidence() == null ? "Assumption could not be validated" : result.evidence(),
                        assumption.isCritical() ? GroundingError.SEVERITY_ERROR : GroundingError.SEVERITY_WARNING,
                        fallbackOr(assumption, "Manual correction required")));
                if (config.failFast() && assumption.isCritical()) {
                    log.warn("Fail-fast: critical assumption {} failed, stopping", assumption.id());
                    break;
                }
            }
        }

        double confidence = validatedCount == 0 ? 0.0 : Math.exp(logConfidenceSum / validatedCount);
        int total = assumptions.size();
        double skipRate = total > 0 ? (double) skippedCount / total : 0.0;
        if (skipRate > 0.5) {
            log.error("Grounding untrustworthy: {}/{} assumptions skipped", skippedCount, total);
            errors.add(new GroundingError("overall", INSUFFICIENT_VALIDATION,
                    "More than 50% of assumptions were skipped (" + skippedCount + "/" + total
                            + "). Grounding cannot be trusted.",
                    GroundingError.SEVERITY_ERROR, "Provide complete metadata for all data sources"));
        }

        log.info("Grounding complete: {} validated, {} skipped, {} errors, confidence={}",
                validatedCount, skippedCount, errors.size(), String.format(Locale.ROOT, "%.2f", confidence));
        return GroundedSemanticPlan.of(plan, true, results, errors, confidence, Instant.now().toString(),
                validatedCount, skippedCount, validatedCount == 0);
    }

    /**
     * A plan that was deliberately not grounded: no results and zero confidence.
     */
    public GroundedSemanticPlan ungrounded(SemanticPlan plan) {
        return GroundedSemanticPlan.of(plan, false, List.of(), List.of(), 0.0, Instant.now().toString(),
                0, 0, true);
    }

    GroundingResult validate(Assumption assumption, DataSourceMetadata metadata, GroundingConfig config,
                             Map<String, String> resolvedFields) {
        log.debug("Validating assumption {} ({})", assumption.id(), assumption.category().value());
        return switch (assumption.category()) {
            case FIELD_NAME -> validateFieldName(assumption, metadata, config);
            case DATA_TYPE -> validateDataType(assumption, metadata, config, resolvedFields);
            case VALUE_FORMAT -> validateValueFormat(assumption, metadata, config, resolvedFields);
            case STRUCTURE -> validateStructure(assumption, metadata);
            case BEHAVIOR -> new GroundingResult(assumption.id(), true, false, "not_executed", "heuristic",
                    BEHAVIOR_CONFIDENCE, "Behavior cannot be validated without executing the workflow", List.of());
            case UNKNOWN -> GroundingResult.failed(assumption.id(), "unknown",
                    "Unknown assumption category for " + assumption.id());
        };
    }

    private GroundingResult validateFieldName(Assumption assumption, DataSourceMetadata metadata, GroundingConfig config) {
        if (metadata.isEmpty()) {
            return GroundingResult.skipped(assumption.id(), "skipped",
                    "No headers or fields available in data source metadata");
        }
        List<String> candidates = fieldCandidates(assumption);
        if (candidates.isEmpty()) {
            return GroundingResult.failed(assumption.id(), "field_match", "No field candidates specified in assumption");
        }

        FieldMatch match = metadata.fields().isEmpty()
                ? fieldMatcher.matchMultipleCandidates(candidates, metadata.headers(), config.matchOptions())
                : fieldMatcher.matchMultipleCandidatesWithDescriptions(candidates, metadata.fields(), config.matchOptions());

        if (!match.matched()) {
            List<GroundingResult.Alternative> alternatives = match.candidates().stream()
                    .map(c -> new GroundingResult.Alternative(c.fieldName(), c.score(),
                            String.format(Locale.ROOT, "fuzzy match with score %.2f", c.score())))
                    .toList();
            return new GroundingResult(assumption.id(), false, false, null, "field_match", 0.0,
                    "No matching field found. Tried: " + String.join(", ", candidates)
                            + ". Available: " + String.join(", ", metadata.effectiveHeaders()),
                    alternatives);
        }

        List<GroundingResult.Alternative> alternatives = match.candidates().stream()
                .filter(c -> !c.fieldName().equals(match.actualFieldName()))
                .map(c -> new GroundingResult.Alternative(c.fieldName(), c.score(), "Alternative field match"))
                .toList();
        log.info("Field matched: \"{}\" -> \"{}\" (method: {}, confidence: {})", candidates.get(0),
                match.actualFieldName(), match.method().value(), String.format(Locale.ROOT, "%.2f", match.confidence()));

        if (metadata.hasSampleRows()) {
            DataSampler.FieldValidation data = dataSampler.validateFieldAssumption(metadata, match.actualFieldName(),
                    expectedType(assumption), assumption.isCritical(), config.sampleSize());
            double combined = (match.confidence() + data.confidence()) / 2.0;
            return new GroundingResult(assumption.id(), data.validated(), false, match.actualFieldName(),
                    "field_match_with_data_sample", combined,
                    "Field \"" + match.actualFieldName() + "\" matched via " + match.method().value() + ". " + data.details(),
                    alternatives);
        }
        return new GroundingResult(assumption.id(), true, false, match.actualFieldName(), "field_match",
                match.confidence(),
                "Field \"" + match.actualFieldName() + "\" matched via " + match.method().value()
                        + " (no data validation available)",
                alternatives);
    }

    private GroundingResult validateDataType(Assumption assumption, DataSourceMetadata metadata, GroundingConfig config,
                                             Map<String, String> resolvedFields) {
        String fieldName = fieldName(assumption, metadata, resolvedFields);
        DataType expected = expectedType(assumption);
        if (fieldName == null || expected == null) {
            return GroundingResult.failed(assumption.id(), "data_type_check",
                    "Could not extract field name or expected type from assumption");
        }
        if (!metadata.hasSampleRows()) {
            return GroundingResult.skipped(assumption.id(), "skipped", "No sample data available for type validation");
        }
        ColumnSample sample = dataSampler.sample(metadata, fieldName, config.sampleSize());
        if (!sample.isUsable()) {
            return GroundingResult.failed(assumption.id(), "data_type_check",
                    "Field \"" + fieldName + "\" does not exist in data source");
        }
        boolean matches = DataSampler.isCompatible(expected, sample.dataType());
        return new GroundingResult(assumption.id(), matches, false, sample.dataType().value(), "data_type_check",
                matches ? TYPE_MATCH_CONFIDENCE : TYPE_MISMATCH_CONFIDENCE,
                "Field \"" + fieldName + "\" contains " + sample.dataType().value() + " data. Expected: "
                        + expected.value() + ". Match: " + matches,
                List.of());
    }

    private GroundingResult validateValueFormat(Assumption assumption, DataSourceMetadata metadata, GroundingConfig config,
                                                Map<String, String> resolvedFields) {
        String fieldName = fieldName(assumption, metadata, resolvedFields);
        Object rawPattern = assumption.parameters().get("pattern");
        if (fieldName == null || rawPattern == null || String.valueOf(rawPattern).isBlank()) {
            return GroundingResult.failed(assumption.id(), "pattern_match",
                    "Could not extract field name or pattern from assumption");
        }
        if (!metadata.hasSampleRows()) {
            return GroundingResult.skipped(assumption.id(), "skipped", "No sample data available for format validation");
        }
        String pattern = String.valueOf(rawPattern);
        Pattern compiled;
        try {
            compiled = Pattern.compile(pattern);
        } catch (PatternSyntaxException e) {
            return GroundingResult.failed(assumption.id(), "pattern_match", "Invalid pattern \"" + pattern + "\": " + e.getDescription());
        }
        DataSampler.PatternValidation validation = dataSampler.validateFieldPattern(metadata, fieldName, compiled,
                config.patternMinMatchRate(), config.sampleSize());
        return new GroundingResult(assumption.id(), validation.valid(), false, pattern, "pattern_match",
                validation.matchRate(),
                validation.matchingCount() + "/" + validation.sampleSize() + " values matched pattern \"" + pattern + "\"",
                List.of());
    }

    private GroundingResult validateStructure(Assumption assumption, DataSourceMetadata metadata) {
        if (metadata.isEmpty()) {
            return GroundingResult.skipped(assumption.id(), "skipped", "No metadata available for structure validation");
        }
        int headerCount = metadata.effectiveHeaders().size();
        return new GroundingResult(assumption.id(), true, false, true, "structure_check", 1.0,
                "Data source has " + headerCount + " headers", List.of());
    }

    /**
     * Candidates from {@code parameters.candidates}, or a quoted column name in the description.
     */
    static List<String> fieldCandidates(Assumption assumption) {
        Object raw = assumption.parameters().get("candidates");
        if (raw == null) {
            raw = assumption.parameters().get("field_name_candidates");
        }
        List<String> candidates = new ArrayList<>();
        if (raw instanceof Collection<?> values) {
            values.stream().filter(v -> v != null && !String.valueOf(v).isBlank())
                    .forEach(v -> candidates.add(String.valueOf(v)));
        } else if (raw instanceof String single && !single.isBlank()) {
            candidates.add(single);
        }
        if (candidates.isEmpty()) {
            Matcher matcher = COLUMN_IN_DESCRIPTION.matcher(assumption.description());
            if (matcher.find()) {
                candidates.add(matcher.group(1));
            }
        }
        return candidates;
    }

    /**
     * Field named by the assumption, mapped through fields resolved earlier in
     * this grounding run and then through the matcher when it is not a literal header.
     */
    private String fieldName(Assumption assumption, DataSourceMetadata metadata, Map<String, String> resolvedFields) {
        Object raw = assumption.parameters().get("field_name");
        String name = raw == null ? null : String.valueOf(raw);
        if (name == null || name.isBlank()) {
            Matcher matcher = FIELD_IN_DESCRIPTION.matcher(assumption.description());
            name = matcher.find() ? matcher.group(1) : null;
        }
        if (name == null) {
            return null;
        }
        List<String> headers = metadata.effectiveHeaders();
        if (headers.contains(name)) {
            return name;
        }
        String earlier = resolvedFields.get(FieldMatcher.normalize(name));
        if (earlier != null) {
            return earlier;
        }
        FieldMatch match = fieldMatcher.matchField(name, headers, MatchOptions.defaults());
        return match.matched() ? match.actualFieldName() : name;
    }

    static DataType expectedType(Assumption assumption) {
        Object raw = assumption.parameters().get("expected_type");
        if (raw != null) {
            DataType type = DataType.fromValue(String.valueOf(raw));
            return type == DataType.UNKNOWN ? null : type;
        }
        String description = assumption.description().toLowerCase(Locale.ROOT);
        if (description.contains("email")) {
            return DataType.EMAIL;
        }
        if (description.contains("date")) {
            return DataType.DATE;
        }
        if (description.contains("number") || description.contains("numeric")) {
            return DataType.NUMBER;
        }
        return null;
    }

    private static String fallbackOr(Assumption assumption, String defaultFix) {
        return assumption.fallback() == null || assumption.fallback().isBlank() ? defaultFix : assumption.fallback();
    }
}
