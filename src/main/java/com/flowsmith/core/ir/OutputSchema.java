package com.flowsmith.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;

import java.io.Serializable;
import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record OutputSchema(
    String type,
    List<SchemaField> fields,
    Items items,
    String description,
    @JsonProperty("enum") List<String> enumValues
) implements Serializable {

    public OutputSchema {
        fields = Defaults.list(fields);
        enumValues = Defaults.list(enumValues);
    }

    public record SchemaField(String name, String type, boolean required, String description) implements Serializable {}

    public record Items(List<SchemaField> fields) implements Serializable {
        public Items {
            fields = Defaults.list(fields);
        }
    }
}
