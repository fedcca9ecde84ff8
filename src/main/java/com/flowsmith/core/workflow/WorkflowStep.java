package com.flowsmith.core.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One executable step of a compiled workflow. The set of step kinds is closed;
 * structural rewrites are written as one mapping per kind.
 * <p>
 * {@code stepId} is the legacy identifier key some generators emit; normalisation
 * folds it into {@code id}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ActionStep.class, name = "action"),
        @JsonSubTypes.Type(value = TransformStep.class, name = "transform"),
        @JsonSubTypes.Type(value = AiProcessingStep.class, name = "ai_processing"),
        @JsonSubTypes.Type(value = ScatterGatherStep.class, name = "scatter_gather"),
        @JsonSubTypes.Type(value = ConditionalStep.class, name = "conditional")
})
@JsonInclude(JsonInclude.Include.NON_NULL)
public sealed interface WorkflowStep
        permits ActionStep, TransformStep, AiProcessingStep, ScatterGatherStep, ConditionalStep {

    String id();

    String stepId();

    String description();

    String outputVariable();

    /**
     * Copy with the given identifier and no legacy {@code step_id}.
     */
    WorkflowStep withId(String id);

    WorkflowStep withoutOutputVariable();

    /**
     * The identifier a reader should use: {@code step_id} when present, else {@code id}.
     */
    default String canonicalId() {
        String legacy = stepId();
        return legacy != null && !legacy.isBlank() ? legacy : id();
    }
}
