package com.flowsmith.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Declarative intermediate representation: a plugin-aware description of what
 * the workflow does, with no execution structure (no step ids, no loops).
 * The compiler infers execution shape from it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DeclarativeIr(
    @JsonProperty("ir_version") String irVersion,
    String goal,
    @JsonProperty("runtime_inputs") List<RuntimeInput> runtimeInputs,
    @JsonProperty("data_sources") List<DataSourceSpec> dataSources,
    Normalization normalization,
    FilterGroup filters,
    @JsonProperty("ai_operations") List<AiOperation> aiOperations,
    @JsonProperty("post_ai_filters") FilterGroup postAiFilters,
    List<Partition> partitions,
    Grouping grouping,
    Rendering rendering,
    @JsonProperty("delivery_rules") DeliveryRules deliveryRules,
    @JsonProperty("edge_cases") List<EdgeCaseRule> edgeCases,
    @JsonProperty("clarifications_required") List<String> clarificationsRequired
) implements Serializable {

    public DeclarativeIr {
        runtimeInputs = Defaults.list(runtimeInputs);
        dataSources = Defaults.list(dataSources);
        aiOperations = Defaults.list(aiOperations);
        partitions = Defaults.list(partitions);
        edgeCases = Defaults.list(edgeCases);
        clarificationsRequired = Defaults.list(clarificationsRequired);
    }

    public DeclarativeIr withGoal(String newGoal) {
        return new DeclarativeIr(irVersion, newGoal, runtimeInputs, dataSources, normalization, filters,
                aiOperations, postAiFilters, partitions, grouping, rendering, deliveryRules, edgeCases,
                clarificationsRequired);
    }

    /**
     * Plugin keys referenced by data sources and deliveries, in first-seen order.
     */
    public List<String> pluginKeys() {
        Set<String> keys = new LinkedHashSet<>();
        for (DataSourceSpec source : dataSources) {
            if (source.pluginKey() != null && !source.pluginKey().isBlank()) {
                keys.add(source.pluginKey());
            }
        }
        if (deliveryRules != null) {
            for (Delivery delivery : deliveryRules.allDeliveries()) {
                if (delivery.pluginKey() != null && !delivery.pluginKey().isBlank()) {
                    keys.add(delivery.pluginKey());
                }
            }
        }
        return new ArrayList<>(keys);
    }

    /**
     * Every field named by filters, post-AI filters, partitions and grouping.
     */
    public List<String> referencedFields() {
        Set<String> fields = new LinkedHashSet<>();
        if (filters != null) {
            filters.allConditions().forEach(c -> fields.add(c.field()));
        }
        if (postAiFilters != null) {
            postAiFilters.allConditions().forEach(c -> fields.add(c.field()));
        }
        partitions.forEach(p -> fields.add(p.field()));
        if (grouping != null && grouping.groupBy() != null) {
            fields.add(grouping.groupBy());
        }
        fields.remove(null);
        return new ArrayList<>(fields);
    }
}
