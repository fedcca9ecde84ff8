package com.flowsmith.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * The model's structured reading of what the workflow has to do. Optional
 * sections decode to empty values rather than null.
 */
public record Understanding(
    @JsonProperty("data_sources") List<DataSourceUnderstanding> dataSources,
    @JsonProperty("runtime_inputs") List<RuntimeInputUnderstanding> runtimeInputs,
    Filtering filtering,
    @JsonProperty("ai_processing") List<AiProcessing> aiProcessing,
    Grouping grouping,
    Rendering rendering,
    Delivery delivery,
    @JsonProperty("edge_cases") List<EdgeCase> edgeCases
) implements Serializable {

    public Understanding {
        dataSources = Defaults.list(dataSources);
        runtimeInputs = Defaults.list(runtimeInputs);
        aiProcessing = Defaults.list(aiProcessing);
        edgeCases = Defaults.list(edgeCases);
    }

    public static Understanding empty() {
        return new Understanding(null, null, null, null, null, null, null, null);
    }

    public boolean hasFilterConditions() {
        return filtering != null && !filtering.conditions().isEmpty();
    }

    public record DataSourceUnderstanding(
        String type,
        @JsonProperty("source_description") String sourceDescription,
        String location,
        String role,
        @JsonProperty("expected_fields") List<FieldAssumption> expectedFields
    ) implements Serializable {
        public DataSourceUnderstanding {
            type = Defaults.text(type);
            expectedFields = Defaults.list(expectedFields);
        }
    }

    public record FieldAssumption(
        @JsonProperty("semantic_name") String semanticName,
        @JsonProperty("field_name_candidates") List<String> fieldNameCandidates,
        @JsonProperty("expected_type") String expectedType,
        boolean required,
        String reasoning
    ) implements Serializable {
        public FieldAssumption {
            fieldNameCandidates = Defaults.list(fieldNameCandidates);
        }
    }

    public record RuntimeInputUnderstanding(
        String name,
        String type,
        String label,
        String description,
        boolean required,
        List<String> options
    ) implements Serializable {
        public RuntimeInputUnderstanding {
            options = Defaults.list(options);
        }
    }

    public record Filtering(
        String description,
        List<FilterCondition> conditions,
        @JsonProperty("combination_logic") String combinationLogic
    ) implements Serializable {
        public Filtering {
            conditions = Defaults.list(conditions);
        }
    }

    public record FilterCondition(
        String field,
        String operation,
        Object value,
        ConfidenceLevel confidence,
        List<String> alternatives
    ) implements Serializable {
        public FilterCondition {
            alternatives = Defaults.list(alternatives);
        }
    }

    public record AiProcessing(
        String type,
        String instruction,
        @JsonProperty("input_description") String inputDescription,
        @JsonProperty("output_description") String outputDescription,
        @JsonProperty("output_type") String outputType
    ) implements Serializable {}

    public record Grouping(
        @JsonProperty("needs_grouping") boolean needsGrouping,
        @JsonProperty("group_by_field") String groupByField,
        @JsonProperty("strategy_description") String strategyDescription,
        @JsonProperty("per_group_action") String perGroupAction
    ) implements Serializable {}

    public record Rendering(
        String format,
        @JsonProperty("columns_to_include") List<String> columnsToInclude,
        @JsonProperty("column_order_preference") String columnOrderPreference,
        @JsonProperty("empty_message") String emptyMessage
    ) implements Serializable {
        public Rendering {
            columnsToInclude = Defaults.list(columnsToInclude);
        }
    }

    public record Delivery(
        String pattern,
        @JsonProperty("recipients_description") String recipientsDescription,
        @JsonProperty("recipient_resolution_strategy") String recipientResolutionStrategy,
        @JsonProperty("subject_template") String subjectTemplate,
        @JsonProperty("body_description") String bodyDescription,
        @JsonProperty("cc_recipients") List<String> ccRecipients,
        String conditions
    ) implements Serializable {
        public Delivery {
            ccRecipients = Defaults.list(ccRecipients);
        }
    }

    public record EdgeCase(
        String scenario,
        @JsonProperty("handling_strategy") String handlingStrategy,
        @JsonProperty("notify_who") String notifyWho
    ) implements Serializable {}
}
