package com.flowsmith.core.metadata;

import com.flowsmith.core.catalog.ActionDefinition;
import com.flowsmith.core.catalog.ActionSelector;
import com.flowsmith.core.catalog.PluginCatalog;
import com.flowsmith.core.catalog.PluginDefinition;
import com.flowsmith.core.catalog.SchemaFieldExtractor;
import com.flowsmith.core.model.DataSourceMetadata;
import com.flowsmith.core.model.DataSourceMetadata.FieldDescriptor;
import com.flowsmith.core.model.EnhancedPrompt;
import com.flowsmith.core.model.ResolvedInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decides which metadata grounding runs against. The first available wins:
 * metadata supplied with the request, a live sample of the first involved
 * service, field descriptors flattened from that service's output schema.
 * Otherwise grounding gets empty metadata and skips every data-bound check.
 */
@Service
public class MetadataResolver {

    private static final Logger log = LoggerFactory.getLogger(MetadataResolver.class);

    public enum Origin { REQUEST, LIVE_SAMPLE, SCHEMA, NONE }

    public record Resolution(DataSourceMetadata metadata, Origin origin) {}

    private final MetadataSource metadataSource;
    private final PluginCatalog catalog;
    private final ActionSelector actionSelector;

    public MetadataResolver(MetadataSource metadataSource, PluginCatalog catalog, ActionSelector actionSelector) {
        this.metadataSource = metadataSource;
        this.catalog = catalog;
        this.actionSelector = actionSelector;
    }

    public Resolution resolve(DataSourceMetadata supplied, EnhancedPrompt prompt) {
        if (supplied != null && !supplied.isEmpty()) {
            log.info("Using request-supplied metadata ({} headers)", supplied.effectiveHeaders().size());
            return new Resolution(supplied, Origin.REQUEST);
        }

        List<String> services = prompt == null ? List.of() : prompt.servicesInvolved();
        if (services.isEmpty()) {
            log.info("No services involved; grounding without metadata");
            return new Resolution(DataSourceMetadata.empty(), Origin.NONE);
        }

        String pluginKey = services.get(0);
        String actionName = actionSelector.inferActionName(pluginKey);

        if (metadataSource.isEnabled()) {
            Optional<DataSourceMetadata> sampled = metadataSource.sample(pluginKey, actionName, parameters(prompt));
            if (sampled.isPresent() && !sampled.get().isEmpty()) {
                return new Resolution(sampled.get(), Origin.LIVE_SAMPLE);
            }
        }

        Optional<DataSourceMetadata> derived = catalog.find(pluginKey)
                .flatMap(plugin -> fromSchema(plugin, actionName));
        if (derived.isPresent()) {
            log.info("Derived {} fields from {}.{} output schema", derived.get().fields().size(), pluginKey, actionName);
            return new Resolution(derived.get(), Origin.SCHEMA);
        }

        log.info("No metadata available for {}; data-bound assumptions will be skipped", pluginKey);
        return new Resolution(DataSourceMetadata.empty(), Origin.NONE);
    }

    static Optional<DataSourceMetadata> fromSchema(PluginDefinition plugin, String actionName) {
        Optional<ActionDefinition> action = plugin.action(actionName);
        if (action.isEmpty()) {
            return Optional.empty();
        }
        List<FieldDescriptor> fields = SchemaFieldExtractor.extractFields(action.get().outputSchema());
        if (fields.isEmpty()) {
            return Optional.empty();
        }
        List<String> headers = fields.stream().map(FieldDescriptor::name).toList();
        return Optional.of(new DataSourceMetadata("tabular", headers, fields, null, null, plugin.key()));
    }

    private static Map<String, Object> parameters(EnhancedPrompt prompt) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        for (ResolvedInput input : prompt.resolvedUserInputs()) {
            parameters.put(input.key(), input.value());
        }
        return parameters;
    }
}
