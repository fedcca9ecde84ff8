package com.flowsmith.core.grounding;

import java.util.Locale;

public enum DataType {
    STRING("string"),
    NUMBER("number"),
    DATE("date"),
    EMAIL("email"),
    BOOLEAN("boolean"),
    MIXED("mixed"),
    UNKNOWN("unknown");

    private final String value;

    DataType(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static DataType fromValue(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (DataType type : values()) {
            if (type.value.equals(normalized)) {
                return type;
            }
        }
        return switch (normalized) {
            case "text" -> STRING;
            case "integer", "int", "float", "double", "numeric", "decimal" -> NUMBER;
            case "datetime", "timestamp" -> DATE;
            case "bool" -> BOOLEAN;
            default -> UNKNOWN;
        };
    }
}
