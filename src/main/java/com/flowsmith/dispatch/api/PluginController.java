package com.flowsmith.dispatch.api;

import com.flowsmith.core.catalog.ActionSelector;
import com.flowsmith.core.catalog.PluginCatalog;
import com.flowsmith.core.catalog.PluginDefinition;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view of the plugin catalog.
 */
@RestController
@RequestMapping("/api/v1/plugins")
public class PluginController {

    private final PluginCatalog catalog;
    private final ActionSelector actionSelector;

    public PluginController(PluginCatalog catalog, ActionSelector actionSelector) {
        this.catalog = catalog;
        this.actionSelector = actionSelector;
    }

    /**
     * GET /api/v1/plugins: Each plugin with its actions and default read action.
     */
    @GetMapping
    public List<Map<String, Object>> list() {
        return catalog.all().stream().map(this::summary).toList();
    }

    @GetMapping("/{key}")
    public ResponseEntity<PluginDefinition> get(@PathVariable String key) {
        return catalog.find(key)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    private Map<String, Object> summary(PluginDefinition plugin) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("key", plugin.key());
        summary.put("name", plugin.name());
        summary.put("description", plugin.description());
        summary.put("actions", List.copyOf(plugin.actions().keySet()));
        summary.put("default_action", actionSelector.inferActionName(plugin.key()));
        return summary;
    }
}
