package com.flowsmith.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * A value the model filled in on its own, which the user may override.
 */
public record Inference(
    String field,
    Object value,
    String reasoning,
    ConfidenceLevel confidence,
    @JsonProperty("user_overridable") boolean userOverridable
) implements Serializable {

    public Inference {
        reasoning = Defaults.text(reasoning);
        confidence = confidence == null ? ConfidenceLevel.MEDIUM : confidence;
    }
}
