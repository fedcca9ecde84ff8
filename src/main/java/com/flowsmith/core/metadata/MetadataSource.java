package com.flowsmith.core.metadata;

import com.flowsmith.core.model.DataSourceMetadata;

import java.util.Map;
import java.util.Optional;

/**
 * Samples one connected data source. Implementations may return partial
 * metadata, or nothing at all when the source cannot be reached.
 */
public interface MetadataSource {

    Optional<DataSourceMetadata> sample(String pluginKey, String action, Map<String, Object> parameters);

    /** Whether this source can sample anything. */
    boolean isEnabled();
}
