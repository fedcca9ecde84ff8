package com.flowsmith.core.grounding;

/**
 * @param minSimilarity       lowest edit-distance similarity accepted as a fuzzy match
 * @param maxCandidates       how many runner-ups to report
 * @param descriptionMinScore lowest description score accepted as a match
 */
public record MatchOptions(double minSimilarity, int maxCandidates, double descriptionMinScore) {

    public static MatchOptions defaults() {
        return new MatchOptions(0.7, 3, 0.5);
    }
}
