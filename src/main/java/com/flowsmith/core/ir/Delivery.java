package com.flowsmith.core.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.Defaults;

import java.io.Serializable;
import java.util.List;
import java.util.Map;

/**
 * One delivery target. Per-item and per-group deliveries resolve the recipient
 * from {@code recipientSource}; summary and multi-destination deliveries
 * usually carry a fixed {@code recipient}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Delivery(
    String name,
    String recipient,
    @JsonProperty("recipient_source") String recipientSource,
    List<String> cc,
    String subject,
    @JsonProperty("body_template") String bodyTemplate,
    @JsonProperty("plugin_key") String pluginKey,
    @JsonProperty("operation_type") String operationType,
    Map<String, Object> config
) implements Serializable {

    public Delivery {
        cc = Defaults.list(cc);
        config = Defaults.map(config);
    }

    public boolean hasPlugin() {
        return pluginKey != null && !pluginKey.isBlank();
    }

    public boolean hasRecipient() {
        return (recipient != null && !recipient.isBlank())
                || (recipientSource != null && !recipientSource.isBlank());
    }
}
