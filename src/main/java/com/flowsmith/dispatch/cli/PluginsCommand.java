package com.flowsmith.dispatch.cli;

import com.flowsmith.core.catalog.ActionSelector;
import com.flowsmith.core.catalog.PluginCatalog;
import com.flowsmith.core.catalog.PluginDefinition;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

/**
 * CLI command: flowsmith plugins
 */
@Command(name = "plugins", mixinStandardHelpOptions = true, description = "List catalog plugins and their default actions")
@Component
public class PluginsCommand implements Runnable {

    private final PluginCatalog catalog;
    private final ActionSelector actionSelector;

    public PluginsCommand(PluginCatalog catalog, ActionSelector actionSelector) {
        this.catalog = catalog;
        this.actionSelector = actionSelector;
    }

    @Override
    public void run() {
        if (catalog.all().isEmpty()) {
            ConsoleOutput.warn("Plugin catalog is empty");
            return;
        }
        System.out.println("PLUGINS:");
        for (PluginDefinition plugin : catalog.all()) {
            System.out.printf("  %-16s default: %-16s actions: %s%n", plugin.key(),
                    actionSelector.inferActionName(plugin.key()), String.join(", ", plugin.actions().keySet()));
        }
    }
}
