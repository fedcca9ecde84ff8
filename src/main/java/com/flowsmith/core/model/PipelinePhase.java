package com.flowsmith.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Pipeline phase an error or timing belongs to.
 */
public enum PipelinePhase {
    UNDERSTANDING("understanding"),
    GROUNDING("grounding"),
    AMBIGUITY_DETECTION("ambiguity_detection"),
    FORMALIZATION("formalization"),
    COMPILATION("compilation"),
    NORMALIZATION("normalization");

    private final String value;

    PipelinePhase(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
