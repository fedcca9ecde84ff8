package com.flowsmith.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;

import java.io.Serializable;
import java.util.Map;

/**
 * @param type        summarize, extract, classify, sentiment, generate, decide, normalize,
 *                    transform, validate, enrich or deterministic_extract
 * @param constraints optional model hints (max_tokens, temperature, model_preference)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AiOperation(
    String type,
    String instruction,
    String context,
    @JsonProperty("input_description") String inputDescription,
    @JsonProperty("output_schema") OutputSchema outputSchema,
    Map<String, Object> constraints
) implements Serializable {
    public AiOperation {
        constraints = Defaults.map(constraints);
    }
}
