package com.flowsmith.core.ir;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Conditions combined with AND or OR, optionally with nested groups.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FilterGroup(
    @JsonProperty("combineWith") String combineWith,
    List<FilterCondition> conditions,
    List<FilterGroup> groups
) implements Serializable {

    public FilterGroup {
        combineWith = combineWith == null || combineWith.isBlank() ? "AND" : combineWith.toUpperCase(Locale.ROOT);
        conditions = Defaults.list(conditions);
        groups = Defaults.list(groups);
    }

    @JsonIgnore
    public boolean isOr() {
        return "OR".equals(combineWith);
    }

    public List<FilterCondition> allConditions() {
        List<FilterCondition> all = new ArrayList<>(conditions);
        for (FilterGroup group : groups) {
            all.addAll(group.allConditions());
        }
        return all;
    }
}
