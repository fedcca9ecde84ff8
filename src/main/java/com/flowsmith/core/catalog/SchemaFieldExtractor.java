package com.flowsmith.core.catalog;

import com.flowsmith.core.model.DataSourceMetadata.FieldDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Flattens JSON-schema output definitions into field descriptors. Arrays are
 * unwrapped to their items; nested objects contribute their leaf properties.
 */
public final class SchemaFieldExtractor {

    private SchemaFieldExtractor() {}

    public static List<FieldDescriptor> extractFields(Map<String, Object> schema) {
        List<FieldDescriptor> fields = new ArrayList<>();
        collect(schema, fields);
        return fields;
    }

    @SuppressWarnings("unchecked")
    private static void collect(Map<String, Object> schema, List<FieldDescriptor> fields) {
        if (schema == null) {
            return;
        }
        if ("array".equals(schema.get("type")) && schema.get("items") instanceof Map<?, ?> items) {
            collect((Map<String, Object>) items, fields);
            return;
        }
        if (!(schema.get("properties") instanceof Map<?, ?> properties)) {
            return;
        }
        for (Map.Entry<?, ?> entry : properties.entrySet()) {
            String name = String.valueOf(entry.getKey());
            if (!(entry.getValue() instanceof Map<?, ?> raw)) {
                fields.add(new FieldDescriptor(name, null, entry.getValue() instanceof String s ? s : null));
                continue;
            }
            Map<String, Object> property = (Map<String, Object>) raw;
            Object type = property.get("type");
            if ("object".equals(type) && property.get("properties") instanceof Map) {
                collect(property, fields);
            } else if ("array".equals(type) && property.get("items") instanceof Map<?, ?> items) {
                collect((Map<String, Object>) items, fields);
            } else {
                fields.add(new FieldDescriptor(name, (String) property.get("description"),
                        type == null ? null : String.valueOf(type)));
            }
        }
    }

    /**
     * Number of properties, counted recursively through objects and array items.
     */
    @SuppressWarnings("unchecked")
    public static int countFields(Map<String, Object> schema) {
        if (schema == null) {
            return 0;
        }
        int count = 0;
        if (schema.get("properties") instanceof Map<?, ?> properties) {
            count += properties.size();
            for (Object value : properties.values()) {
                if (value instanceof Map<?, ?> property) {
                    Object type = property.get("type");
                    if ("object".equals(type)) {
                        count += countFields((Map<String, Object>) property);
                    } else if ("array".equals(type) && property.get("items") instanceof Map<?, ?> items) {
                        count += countFields((Map<String, Object>) items);
                    }
                }
            }
        }
        if ("array".equals(schema.get("type")) && schema.get("items") instanceof Map<?, ?> items) {
            count += countFields((Map<String, Object>) items);
        }
        return count;
    }
}
