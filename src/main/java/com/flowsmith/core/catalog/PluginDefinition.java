package com.flowsmith.core.catalog;

import com.flowsmith.core.model.Defaults;

import java.util.Map;
import java.util.Optional;

/**
 * A connectable service and its actions, keyed by action name in catalog order.
 */
public record PluginDefinition(
    String key,
    String name,
    String description,
    Map<String, ActionDefinition> actions
) {

    public PluginDefinition {
        description = Defaults.text(description);
        actions = Defaults.map(actions);
    }

    public Optional<ActionDefinition> action(String actionName) {
        return Optional.ofNullable(actions.get(actionName));
    }
}
