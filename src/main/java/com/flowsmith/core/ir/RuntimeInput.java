package com.flowsmith.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;

import java.io.Serializable;
import java.util.List;

/**
 * A value the user supplies each time the workflow runs.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RuntimeInput(
    String name,
    String type,
    String label,
    String description,
    boolean required,
    String placeholder,
    List<String> options,
    @JsonProperty("default_value") String defaultValue
) implements Serializable {
    public RuntimeInput {
        options = Defaults.list(options);
    }
}
