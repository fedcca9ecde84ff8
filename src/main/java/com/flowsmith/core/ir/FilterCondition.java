package com.flowsmith.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record FilterCondition(
    String field,
    String operator,
    Object value,
    String description
) implements Serializable {

    public static final Set<String> OPERATORS = Set.of(
            "equals", "not_equals", "contains", "not_contains", "starts_with", "ends_with",
            "matches_regex", "greater_than", "less_than", "greater_than_or_equals",
            "less_than_or_equals", "in", "not_in", "is_empty", "is_not_empty",
            "within_last_days", "before", "after");
}
