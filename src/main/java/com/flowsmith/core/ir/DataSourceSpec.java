package com.flowsmith.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;

import java.io.Serializable;
import java.util.Map;

/**
 * @param type          tabular, api, webhook, database, file or stream
 * @param source        legacy source name, e.g. "google_sheets"
 * @param pluginKey     plugin that reads the source
 * @param operationType action to invoke on the plugin
 * @param role          "primary", "reference" or a free-form description
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DataSourceSpec(
    String type,
    String source,
    @JsonProperty("plugin_key") String pluginKey,
    @JsonProperty("operation_type") String operationType,
    String location,
    String tab,
    String endpoint,
    String trigger,
    String role,
    Map<String, Object> config
) implements Serializable {
    public DataSourceSpec {
        config = Defaults.map(config);
    }
}
