package com.flowsmith.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Review tiers handed to the human-review layer.
 *
 * @param mustConfirm          items the user has to answer before compilation is trustworthy
 * @param shouldReview         items worth a look but with a usable default
 * @param looksGood            items grounded with high confidence or already answered
 * @param groundingAmbiguities field resolutions where grounding found competing candidates
 * @param overallConfidence    single scalar summarising readiness, in [0,1]
 */
public record AmbiguityReport(
    @JsonProperty("must_confirm") List<ReviewItem> mustConfirm,
    @JsonProperty("should_review") List<ReviewItem> shouldReview,
    @JsonProperty("looks_good") List<ReviewItem> looksGood,
    @JsonProperty("grounding_ambiguities") List<ReviewItem> groundingAmbiguities,
    @JsonProperty("overall_confidence") double overallConfidence
) implements Serializable {

    public AmbiguityReport {
        mustConfirm = Defaults.list(mustConfirm);
        shouldReview = Defaults.list(shouldReview);
        looksGood = Defaults.list(looksGood);
        groundingAmbiguities = Defaults.list(groundingAmbiguities);
    }

    /**
     * @param source one of "ambiguity", "assumption", "inference", "grounding_error", "grounding"
     */
    public record ReviewItem(
        String id,
        String source,
        String field,
        String question,
        List<String> options,
        String recommended,
        double confidence,
        String reason
    ) implements Serializable {
        public ReviewItem {
            options = Defaults.list(options);
        }
    }
}
