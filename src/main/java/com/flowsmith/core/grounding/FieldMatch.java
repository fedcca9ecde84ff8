package com.flowsmith.core.grounding;

import java.util.List;

/**
 * Result of resolving one semantic field name.
 *
 * @param candidates ranked runner-up fields; for a non-match these are the
 *                   closest fuzzy candidates, offered for human review
 */
public record FieldMatch(
    boolean matched,
    String actualFieldName,
    double confidence,
    MatchMethod method,
    List<Candidate> candidates
) {

    public FieldMatch {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public static FieldMatch of(String fieldName, double confidence, MatchMethod method) {
        return new FieldMatch(true, fieldName, confidence, method, List.of());
    }

    public static FieldMatch none(List<Candidate> alternatives) {
        return new FieldMatch(false, null, 0.0, MatchMethod.NONE, alternatives);
    }

    public boolean matchedViaDescription() {
        return method == MatchMethod.DESCRIPTION;
    }

    /**
     * Ladder tier first, then confidence. Ties keep the current best.
     */
    public boolean isStrongerThan(FieldMatch other) {
        if (other == null || !other.matched) {
            return matched;
        }
        if (!matched) {
            return false;
        }
        if (method != other.method) {
            return method.ordinal() < other.method.ordinal();
        }
        return confidence > other.confidence;
    }

    public record Candidate(String fieldName, double score) {}
}
