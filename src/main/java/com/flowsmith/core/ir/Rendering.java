package com.flowsmith.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;

import java.io.Serializable;
import java.util.List;
import java.util.Set;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Rendering(
    String type,
    String template,
    @JsonProperty("columns_in_order") List<String> columnsInOrder,
    @JsonProperty("empty_message") String emptyMessage,
    @JsonProperty("summary_stats") List<String> summaryStats,
    @JsonProperty("sort_order") List<SortSpec> sortOrder
) implements Serializable {

    public static final Set<String> TYPES = Set.of(
            "email_embedded_table", "html_table", "summary_block", "alert", "json", "csv");

    public Rendering {
        columnsInOrder = Defaults.list(columnsInOrder);
        summaryStats = Defaults.list(summaryStats);
        sortOrder = Defaults.list(sortOrder);
    }

    public record SortSpec(String field, String direction, Integer priority) implements Serializable {}
}
