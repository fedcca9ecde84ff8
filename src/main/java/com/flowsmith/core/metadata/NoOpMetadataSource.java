package com.flowsmith.core.metadata;

import com.flowsmith.core.model.DataSourceMetadata;

import java.util.Map;
import java.util.Optional;

/**
 * Used when no connector endpoint is configured.
 */
public class NoOpMetadataSource implements MetadataSource {

    @Override
    public Optional<DataSourceMetadata> sample(String pluginKey, String action, Map<String, Object> parameters) {
        return Optional.empty();
    }

    @Override
    public boolean isEnabled() {
        return false;
    }
}
