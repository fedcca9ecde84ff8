package com.flowsmith.core.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * One callable plugin action.
 *
 * @param parameters   JSON schema of the action's input
 * @param outputSchema JSON schema of what the action returns
 */
public record ActionDefinition(
    String description,
    Map<String, Object> parameters,
    @JsonProperty("output_schema") Map<String, Object> outputSchema
) {

    public ActionDefinition {
        description = Defaults.text(description);
        parameters = Defaults.map(parameters);
        outputSchema = Defaults.map(outputSchema);
    }

    public List<String> requiredParameters() {
        Object required = parameters.get("required");
        List<String> names = new ArrayList<>();
        if (required instanceof Collection<?> values) {
            values.forEach(v -> names.add(String.valueOf(v)));
        }
        return names;
    }
}
