package com.flowsmith.core.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;

import java.util.List;

/**
 * Runs {@code thenSteps} when the condition holds, otherwise {@code elseSteps}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConditionalStep(
    String id,
    @JsonProperty("step_id") String stepId,
    String description,
    String condition,
    @JsonProperty("then_steps") List<WorkflowStep> thenSteps,
    @JsonProperty("else_steps") List<WorkflowStep> elseSteps,
    @JsonProperty("output_variable") String outputVariable
) implements WorkflowStep {

    public ConditionalStep {
        thenSteps = Defaults.list(thenSteps);
        elseSteps = Defaults.list(elseSteps);
    }

    @Override
    public ConditionalStep withId(String newId) {
        return new ConditionalStep(newId, null, description, condition, thenSteps, elseSteps, outputVariable);
    }

    @Override
    public ConditionalStep withoutOutputVariable() {
        return new ConditionalStep(id, stepId, description, condition, thenSteps, elseSteps, null);
    }
}
