package com.flowsmith.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * An open question the understanding phase could not settle on its own.
 */
public record Ambiguity(
    String id,
    String field,
    String question,
    @JsonProperty("possible_resolutions") List<String> possibleResolutions,
    @JsonProperty("recommended_resolution") String recommendedResolution,
    @JsonProperty("resolution_strategy") String resolutionStrategy,
    @JsonProperty("requires_user_input") boolean requiresUserInput
) implements Serializable {

    public Ambiguity {
        field = Defaults.text(field);
        question = Defaults.text(question);
        possibleResolutions = Defaults.list(possibleResolutions);
    }
}
