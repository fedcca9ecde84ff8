package com.flowsmith.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

public record ReasoningStep(
    int step,
    String decision,
    @JsonProperty("options_considered") List<String> optionsConsidered,
    @JsonProperty("choice_made") String choiceMade,
    String reasoning,
    ConfidenceLevel confidence
) implements Serializable {

    public ReasoningStep {
        optionsConsidered = Defaults.list(optionsConsidered);
        confidence = confidence == null ? ConfidenceLevel.MEDIUM : confidence;
    }
}
