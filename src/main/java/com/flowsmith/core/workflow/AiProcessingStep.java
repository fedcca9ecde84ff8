package com.flowsmith.core.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;

import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record AiProcessingStep(
    String id,
    @JsonProperty("step_id") String stepId,
    String description,
    String input,
    String prompt,
    @JsonProperty("output_schema") Map<String, Object> outputSchema,
    @JsonProperty("output_variable") String outputVariable
) implements WorkflowStep {

    public AiProcessingStep {
        outputSchema = Defaults.map(outputSchema);
    }

    @Override
    public AiProcessingStep withId(String newId) {
        return new AiProcessingStep(newId, null, description, input, prompt, outputSchema, outputVariable);
    }

    @Override
    public AiProcessingStep withoutOutputVariable() {
        return new AiProcessingStep(id, stepId, description, input, prompt, outputSchema, null);
    }
}
