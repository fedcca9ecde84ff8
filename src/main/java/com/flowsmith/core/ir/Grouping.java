package com.flowsmith.core.ir;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

public record Grouping(
    @JsonProperty("group_by") String groupBy,
    @JsonProperty("emit_per_group") Boolean emitPerGroup
) implements Serializable {}
