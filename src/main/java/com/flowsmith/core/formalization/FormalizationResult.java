package com.flowsmith.core.formalization;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.ir.DeclarativeIr;
import com.flowsmith.core.model.Defaults;

import java.util.List;
import java.util.Map;

/**
 * @param groundedFacts assumption id to resolved value, for validated results only
 * @param missingFacts  assumption ids without a grounded value
 * @param rawIr         the model's IR text before decoding, when it came from a model
 */
public record FormalizationResult(
    @JsonIgnore DeclarativeIr ir,
    @JsonProperty("grounded_facts") Map<String, Object> groundedFacts,
    @JsonProperty("missing_facts") List<String> missingFacts,
    double confidence,
    List<String> warnings,
    String model,
    String timestamp,
    @JsonIgnore String rawIr
) {

    public FormalizationResult {
        groundedFacts = Defaults.map(groundedFacts);
        missingFacts = Defaults.list(missingFacts);
        warnings = Defaults.list(warnings);
    }
}
