package com.flowsmith.core.grounding;

/**
 * Immutable per-call grounding settings.
 *
 * @param minConfidence                 results below this are reported as low-confidence warnings
 * @param failFast                      stop at the first failed critical-impact assumption
 * @param requireConfirmationThreshold  validated results below this still go to human review
 * @param maxCandidates                 alternatives offered per unresolved field
 * @param fuzzyMinSimilarity            lowest accepted edit-distance similarity
 * @param descriptionMinScore           lowest accepted description score
 * @param patternMinMatchRate           share of sampled values a format pattern must match
 * @param sampleSize                    rows inspected per column
 */
public record GroundingConfig(
    double minConfidence,
    boolean failFast,
    double requireConfirmationThreshold,
    int maxCandidates,
    double fuzzyMinSimilarity,
    double descriptionMinScore,
    double patternMinMatchRate,
    int sampleSize
) {

    public static GroundingConfig defaults() {
        return new GroundingConfig(0.7, false, 0.85, 3, 0.7, 0.5, 0.8, 10);
    }

    public GroundingConfig withFailFast(boolean value) {
        return new GroundingConfig(minConfidence, value, requireConfirmationThreshold, maxCandidates,
                fuzzyMinSimilarity, descriptionMinScore, patternMinMatchRate, sampleSize);
    }

    public MatchOptions matchOptions() {
        return new MatchOptions(fuzzyMinSimilarity, maxCandidates, descriptionMinScore);
    }
}
