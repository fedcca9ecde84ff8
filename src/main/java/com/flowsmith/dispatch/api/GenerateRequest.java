package com.flowsmith.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flowsmith.core.model.DataSourceMetadata;
import com.flowsmith.core.model.EnhancedPrompt;

/**
 * Inbound JSON body for POST /api/v1/workflows/generate.
 *
 * @param metadata optional data-source metadata; when absent it is sampled or derived
 * @param config   optional per-request grounding overrides
 */
public record GenerateRequest(
    @JsonProperty("enhanced_prompt") EnhancedPrompt enhancedPrompt,
    @JsonProperty("user_id") String userId,
    DataSourceMetadata metadata,
    Config config
) {

    public record Config(
        @JsonProperty("fail_fast") Boolean failFast,
        @JsonProperty("skip_grounding") Boolean skipGrounding
    ) {}

    public Boolean failFast() {
        return config == null ? null : config.failFast();
    }

    public boolean skipGrounding() {
        return config != null && Boolean.TRUE.equals(config.skipGrounding());
    }
}
