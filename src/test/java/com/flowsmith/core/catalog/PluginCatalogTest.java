package com.flowsmith.core.catalog;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PluginCatalogTest {

    private PluginCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new PluginCatalog(new CatalogProperties(), new DefaultResourceLoader());
        catalog.load();
    }

    @Test
    @DisplayName("loads the bundled catalog in file order")
    void loadsBundledCatalog() {
        var keys = catalog.all().stream().map(PluginDefinition::key).toList();
        assertEquals(List.of("google-mail", "google-sheets", "slack", "hubspot"), keys);
        assertTrue(catalog.contains("slack"));
        assertFalse(catalog.contains("jira"));
        assertFalse(catalog.contains(null));
    }

    @Test
    @DisplayName("exposes action schemas and required parameters")
    void exposesActions() {
        var gmail = catalog.find("google-mail").orElseThrow();
        var search = gmail.action("search_emails").orElseThrow();
        assertEquals(List.of("query"), search.requiredParameters());
        assertFalse(search.outputSchema().isEmpty());
        assertTrue(gmail.action("archive").isEmpty());
    }

    @Test
    @DisplayName("scopedTo ignores unknown keys and returns everything for an empty scope")
    void scopedTo() {
        assertEquals(4, catalog.scopedTo(List.of()).size());
        var scoped = catalog.scopedTo(List.of("slack", "jira"));
        assertEquals(1, scoped.size());
        assertEquals("slack", scoped.get(0).key());
    }

    @Test
    @DisplayName("missing catalog resource leaves the catalog empty")
    void missingCatalog() {
        var props = new CatalogProperties();
        props.setLocation("classpath:catalog/does-not-exist.json");
        var empty = new PluginCatalog(props, new DefaultResourceLoader());
        empty.load();
        assertTrue(empty.all().isEmpty());
        assertTrue(empty.find("slack").isEmpty());
    }

    @Test
    @DisplayName("countFields walks nested objects and array items")
    void countFields() {
        Map<String, Object> schema = Map.of(
                "type", "object",
                "properties", Map.of(
                        "rows", Map.of(
                                "type", "array",
                                "items", Map.of(
                                        "type", "object",
                                        "properties", Map.of(
                                                "name", Map.of("type", "string"),
                                                "email", Map.of("type", "string")))),
                        "count", Map.of("type", "integer")));
        assertEquals(4, SchemaFieldExtractor.countFields(schema));
        var names = SchemaFieldExtractor.extractFields(schema).stream().map(f -> f.name()).sorted().toList();
        assertEquals(List.of("count", "email", "name"), names);
    }
}
