package com.flowsmith.core.ir;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

public record Partition(String field, @JsonProperty("split_by") String splitBy) implements Serializable {}
