package com.flowsmith.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;

import java.io.Serializable;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Normalization(
    @JsonProperty("required_headers") List<String> requiredHeaders,
    @JsonProperty("case_sensitive") Boolean caseSensitive,
    @JsonProperty("missing_header_action") String missingHeaderAction
) implements Serializable {
    public Normalization {
        requiredHeaders = Defaults.list(requiredHeaders);
    }
}
