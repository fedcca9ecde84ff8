package com.flowsmith.core.ambiguity;

import com.flowsmith.core.grounding.FieldMatcher;
import com.flowsmith.core.model.Ambiguity;
import com.flowsmith.core.model.AmbiguityReport;
import com.flowsmith.core.model.AmbiguityReport.ReviewItem;
import com.flowsmith.core.model.Assumption;
import com.flowsmith.core.model.AssumptionCategory;
import com.flowsmith.core.model.ConfidenceLevel;
import com.flowsmith.core.model.EnhancedPrompt;
import com.flowsmith.core.model.GroundedSemanticPlan;
import com.flowsmith.core.model.GroundingError;
import com.flowsmith.core.model.GroundingResult;
import com.flowsmith.core.model.Inference;
import com.flowsmith.core.model.ResolvedInput;
import com.flowsmith.core.model.SemanticPlan;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Sorts everything a reviewer might need to look at into confirmation tiers.
 * Stateless and side-effect free.
 */
@Component
public class AmbiguityDetector {

    public static final double DEFAULT_CONFIRMATION_THRESHOLD = 0.85;
    static final double MUST_CONFIRM_PENALTY = 0.9;

    public AmbiguityReport detect(SemanticPlan plan, GroundedSemanticPlan grounded, EnhancedPrompt prompt) {
        return detect(plan, grounded, prompt, DEFAULT_CONFIRMATION_THRESHOLD);
    }

    public AmbiguityReport detect(SemanticPlan plan, GroundedSemanticPlan grounded, EnhancedPrompt prompt,
                                  double confirmationThreshold) {
        List<ReviewItem> mustConfirm = new ArrayList<>();
        List<ReviewItem> shouldReview = new ArrayList<>();
        List<ReviewItem> looksGood = new ArrayList<>();
        List<ReviewItem> groundingAmbiguities = new ArrayList<>();

        Set<String> answeredKeys = answeredKeys(prompt);
        for (Ambiguity ambiguity : plan.ambiguities()) {
            ReviewItem item = ambiguityItem(ambiguity);
            if (isAnswered(ambiguity, answeredKeys)) {
                looksGood.add(withReason(item, "Answered by a resolved user input"));
            } else if (ambiguity.requiresUserInput()) {
                mustConfirm.add(withReason(item, "Requires user input"));
            } else {
                shouldReview.add(withReason(item, ambiguity.recommendedResolution() != null
                        ? "A recommended resolution is available"
                        : "No recommended resolution"));
            }
        }

        Set<String> confirmedAssumptions = new HashSet<>();
        for (Assumption assumption : plan.assumptionsOrEmpty()) {
            Optional<GroundingResult> result = grounded.findResult(assumption.id());
            ReviewItem item = assumptionItem(assumption, result.orElse(null));
            boolean validated = result.map(GroundingResult::validated).orElse(false);
            if (validated && result.get().confidence() >= confirmationThreshold) {
                looksGood.add(withReason(item, "Validated against data"));
            } else if (validated) {
                shouldReview.add(withReason(item, "Validated below the confirmation threshold"));
            } else if (assumption.isCritical()) {
                mustConfirm.add(withReason(item, failureReason(result.orElse(null)) + " (critical impact)"));
                confirmedAssumptions.add(assumption.id());
            } else {
                shouldReview.add(withReason(item, failureReason(result.orElse(null))));
            }
        }

        int errorIndex = 0;
        for (GroundingError error : grounded.groundingErrors()) {
            errorIndex++;
            if (!error.isBlocking() || confirmedAssumptions.contains(error.assumptionId())) {
                continue;
            }
            mustConfirm.add(new ReviewItem(
                    "grounding_error_" + errorIndex, "grounding_error", null,
                    error.message(), List.of(), error.suggestedFix(), 0.0, error.errorType()));
        }

        for (Inference inference : plan.inferences()) {
            if (inference.confidence() == ConfidenceLevel.LOW && inference.userOverridable()) {
                shouldReview.add(new ReviewItem(
                        "inference_" + inference.field(), "inference", inference.field(),
                        "Is " + inference.value() + " the right value for " + inference.field() + "?",
                        List.of(), inference.value() == null ? null : String.valueOf(inference.value()),
                        0.3, inference.reasoning()));
            }
        }

        for (GroundingResult result : grounded.groundingResults()) {
            if (result.alternatives().isEmpty()) {
                continue;
            }
            Optional<Assumption> assumption = grounded.findAssumption(result.assumptionId());
            if (assumption.isEmpty() || assumption.get().category() != AssumptionCategory.FIELD_NAME) {
                continue;
            }
            String resolved = result.resolvedValue() == null ? null : String.valueOf(result.resolvedValue());
            Set<String> options = new LinkedHashSet<>();
            if (resolved != null) {
                options.add(resolved);
            }
            result.alternatives().forEach(alternative -> options.add(alternative.value()));
            groundingAmbiguities.add(new ReviewItem(
                    result.assumptionId(), "grounding", resolved == null ? result.assumptionId() : resolved,
                    "Which column does \"" + assumption.get().description() + "\" refer to?",
                    List.copyOf(options), resolved, result.confidence(), result.evidence()));
        }

        return new AmbiguityReport(mustConfirm, shouldReview, looksGood, groundingAmbiguities,
                overallConfidence(grounded, mustConfirm.size()));
    }

    static double overallConfidence(GroundedSemanticPlan grounded, int mustConfirmCount) {
        if (grounded.validatedAssumptionsCount() == 0) {
            return 0.0;
        }
        double value = grounded.groundingConfidence() * Math.pow(MUST_CONFIRM_PENALTY, mustConfirmCount);
        return Math.max(0.0, Math.min(1.0, value));
    }

    private static Set<String> answeredKeys(EnhancedPrompt prompt) {
        Set<String> keys = new HashSet<>();
        if (prompt == null) {
            return keys;
        }
        for (ResolvedInput input : prompt.resolvedUserInputs()) {
            if (input.key() != null && input.value() != null && !input.valueAsText().isBlank()) {
                keys.add(FieldMatcher.normalize(input.key()));
            }
        }
        return keys;
    }

    private static boolean isAnswered(Ambiguity ambiguity, Set<String> answeredKeys) {
        return (!ambiguity.field().isBlank() && answeredKeys.contains(FieldMatcher.normalize(ambiguity.field())))
                || (ambiguity.id() != null && answeredKeys.contains(FieldMatcher.normalize(ambiguity.id())));
    }

    private static ReviewItem ambiguityItem(Ambiguity ambiguity) {
        return new ReviewItem(ambiguity.id(), "ambiguity", ambiguity.field(), ambiguity.question(),
                ambiguity.possibleResolutions(), ambiguity.recommendedResolution(),
                ambiguity.recommendedResolution() == null ? 0.0 : 0.5, null);
    }

    private static ReviewItem assumptionItem(Assumption assumption, GroundingResult result) {
        List<String> options = new ArrayList<>();
        String recommended = null;
        if (result != null && result.resolvedValue() != null) {
            recommended = String.valueOf(result.resolvedValue());
            options.add(recommended);
        }
        if (result != null) {
            result.alternatives().forEach(alternative -> options.add(alternative.value()));
        }
        return new ReviewItem(assumption.id(), "assumption", assumption.category().value(),
                assumption.description(), options, recommended,
                result == null ? 0.0 : result.confidence(), null);
    }

    private static String failureReason(GroundingResult result) {
        if (result == null || result.skipped()) {
            return "Could not be validated";
        }
        return "Validation failed";
    }

    private static ReviewItem withReason(ReviewItem item, String reason) {
        return new ReviewItem(item.id(), item.source(), item.field(), item.question(), item.options(),
                item.recommended(), item.confidence(), reason);
    }
}
