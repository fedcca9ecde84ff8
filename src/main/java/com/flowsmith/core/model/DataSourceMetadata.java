package com.flowsmith.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * Shape and sample of one connected data source, as returned by a connector
 * or derived from a plugin's output schema. Any part may be absent.
 *
 * @param type       source kind, e.g. "tabular"
 * @param headers    column names (legacy; {@code fields} is preferred when present)
 * @param fields     column names with optional descriptions
 * @param sampleRows sampled rows keyed by header
 * @param rowCount   total row count reported by the source, if known
 * @param pluginKey  the plugin the metadata came from
 */
public record DataSourceMetadata(
    String type,
    List<String> headers,
    List<FieldDescriptor> fields,
    @JsonProperty("sample_rows") List<Map<String, Object>> sampleRows,
    @JsonProperty("row_count") Integer rowCount,
    @JsonProperty("plugin_key") String pluginKey
) implements Serializable {

    public DataSourceMetadata {
        headers = Defaults.list(headers);
        fields = Defaults.list(fields);
        sampleRows = Defaults.list(sampleRows);
    }

    public static DataSourceMetadata empty() {
        return new DataSourceMetadata(null, null, null, null, null, null);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return headers.isEmpty() && fields.isEmpty();
    }

    @JsonIgnore
    public boolean hasSampleRows() {
        return !sampleRows.isEmpty();
    }

    /**
     * Headers if present, otherwise the names of {@link #fields()}.
     */
    public List<String> effectiveHeaders() {
        if (!headers.isEmpty()) {
            return headers;
        }
        return fields.stream().map(FieldDescriptor::name).toList();
    }

    public record FieldDescriptor(String name, String description, String type) implements Serializable {}
}
