package com.flowsmith.core.catalog;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The plugins and actions the compiler may target, loaded once at startup
 * from {@code flowsmith.catalog.location}. Read-only after loading.
 */
@Component
public class PluginCatalog {

    private static final Logger log = LoggerFactory.getLogger(PluginCatalog.class);

    private final CatalogProperties properties;
    private final ResourceLoader resourceLoader;
    private volatile Map<String, PluginDefinition> plugins = Map.of();

    public PluginCatalog(CatalogProperties properties, ResourceLoader resourceLoader) {
        this.properties = properties;
        this.resourceLoader = resourceLoader;
    }

    @PostConstruct
    public void load() {
        Resource resource = resourceLoader.getResource(properties.getLocation());
        if (!resource.exists()) {
            log.warn("Plugin catalog not found at {}; no plugins available", properties.getLocation());
            return;
        }
        var mapper = new ObjectMapper();
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try (InputStream in = resource.getInputStream()) {
            List<PluginDefinition> definitions = mapper.readValue(in, new TypeReference<List<PluginDefinition>>() {});
            Map<String, PluginDefinition> loaded = new LinkedHashMap<>();
            for (PluginDefinition definition : definitions) {
                loaded.put(definition.key(), definition);
            }
            this.plugins = Collections.unmodifiableMap(loaded);
            log.info("Loaded {} plugins from {}", loaded.size(), properties.getLocation());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load plugin catalog from " + properties.getLocation(), e);
        }
    }

    public Optional<PluginDefinition> find(String pluginKey) {
        return pluginKey == null ? Optional.empty() : Optional.ofNullable(plugins.get(pluginKey));
    }

    public boolean contains(String pluginKey) {
        return pluginKey != null && plugins.containsKey(pluginKey);
    }

    public Collection<PluginDefinition> all() {
        return plugins.values();
    }

    /**
     * Plugins restricted to {@code keys}; every plugin when {@code keys} is empty.
     * Unknown keys are ignored.
     */
    public List<PluginDefinition> scopedTo(Collection<String> keys) {
        if (keys == null || keys.isEmpty()) {
            return List.copyOf(plugins.values());
        }
        return keys.stream().map(plugins::get).filter(p -> p != null).distinct().toList();
    }
}
