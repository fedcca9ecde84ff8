package com.flowsmith.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Closed set of assumption kinds. The category decides which grounding
 * validator handles an assumption; {@link #UNKNOWN} captures anything the
 * model produced outside the set and always fails validation.
 */
public enum AssumptionCategory {
    FIELD_NAME("field_name"),
    DATA_TYPE("data_type"),
    VALUE_FORMAT("value_format"),
    STRUCTURE("structure"),
    BEHAVIOR("behavior"),
    UNKNOWN("unknown");

    private final String value;

    AssumptionCategory(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static AssumptionCategory fromValue(String raw) {
        if (raw == null) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (AssumptionCategory category : values()) {
            if (category.value.equals(normalized)) {
                return category;
            }
        }
        return UNKNOWN;
    }
}
