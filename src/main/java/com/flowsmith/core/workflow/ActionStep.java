package com.flowsmith.core.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;

import java.util.Map;

/**
 * Invokes one plugin action.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionStep(
    String id,
    @JsonProperty("step_id") String stepId,
    String description,
    String plugin,
    String action,
    Map<String, Object> params,
    @JsonProperty("output_variable") String outputVariable
) implements WorkflowStep {

    public ActionStep {
        params = Defaults.map(params);
    }

    @Override
    public ActionStep withId(String newId) {
        return new ActionStep(newId, null, description, plugin, action, params, outputVariable);
    }

    @Override
    public ActionStep withoutOutputVariable() {
        return new ActionStep(id, stepId, description, plugin, action, params, null);
    }
}
