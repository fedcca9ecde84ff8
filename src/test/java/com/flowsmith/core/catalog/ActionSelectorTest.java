package com.flowsmith.core.catalog;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionSelectorTest {

    private ActionSelector selector;

    @BeforeEach
    void setUp() {
        var catalog = new PluginCatalog(new CatalogProperties(), new DefaultResourceLoader());
        catalog.load();
        selector = new ActionSelector(catalog);
    }

    @Test
    @DisplayName("prefers read-like actions over write-like ones")
    void prefersReadActions() {
        assertEquals("search_emails", selector.inferActionName("google-mail"));
        assertEquals("read_range", selector.inferActionName("google-sheets"));
        assertEquals("read_messages", selector.inferActionName("slack"));
        assertEquals("get_contacts", selector.inferActionName("hubspot"));
    }

    @Test
    @DisplayName("unknown plugin falls back to the generic action name")
    void unknownPlugin() {
        assertEquals(ActionSelector.DEFAULT_ACTION, selector.inferActionName("jira"));
        assertEquals(ActionSelector.DEFAULT_ACTION, selector.inferActionName(null));
    }

    @Test
    @DisplayName("write verbs lose even with a richer output schema")
    void writeVerbsPenalized() {
        Map<String, ActionDefinition> actions = new LinkedHashMap<>();
        actions.put("create_ticket", new ActionDefinition("", Map.of(), Map.of(
                "type", "object",
                "properties", Map.of(
                        "a", Map.of("type", "string"),
                        "b", Map.of("type", "string"),
                        "c", Map.of("type", "string")))));
        actions.put("list_tickets", new ActionDefinition("", Map.of(), Map.of()));
        var plugin = new PluginDefinition("tickets", "Tickets", null, actions);
        assertEquals("list_tickets", ActionSelector.bestAction(plugin));
    }
}
