package com.flowsmith.core.grounding;

/**
 * Tiers of the field resolution ladder, strongest first. A match from an
 * earlier tier always beats one from a later tier, whatever the scores.
 */
public enum MatchMethod {
    EXACT("exact"),
    CASE_INSENSITIVE("case_insensitive"),
    NORMALIZED("normalized"),
    DESCRIPTION("description"),
    FUZZY("fuzzy"),
    NONE("none");

    private final String value;

    MatchMethod(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }
}
