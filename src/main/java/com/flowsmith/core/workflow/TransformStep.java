package com.flowsmith.core.workflow;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Deterministic data transform (filter, map, group_by, render_table, ...).
 * A filter's {@code config.condition} is either a structured
 * {@code {field, operator, value}} map or an expression string.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TransformStep(
    String id,
    @JsonProperty("step_id") String stepId,
    String description,
    String operation,
    String input,
    Map<String, Object> config,
    @JsonProperty("output_variable") String outputVariable
) implements WorkflowStep {

    public TransformStep {
        config = Defaults.map(config);
    }

    public TransformStep withConfigEntry(String key, Object value) {
        Map<String, Object> updated = new LinkedHashMap<>(config);
        updated.put(key, value);
        return new TransformStep(id, stepId, description, operation, input, updated, outputVariable);
    }

    @Override
    public TransformStep withId(String newId) {
        return new TransformStep(newId, null, description, operation, input, config, outputVariable);
    }

    @Override
    public TransformStep withoutOutputVariable() {
        return new TransformStep(id, stepId, description, operation, input, config, null);
    }
}
