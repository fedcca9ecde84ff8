package com.flowsmith.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How badly the workflow breaks if an assumption turns out to be wrong.
 * Accepts the older "major"/"minor" wording as aliases.
 */
public enum ImpactLevel {
    CRITICAL("critical"),
    MODERATE("moderate"),
    LOW("low");

    private final String value;

    ImpactLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static ImpactLevel fromValue(String raw) {
        if (raw == null) {
            return LOW;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "critical", "high" -> CRITICAL;
            case "moderate", "major", "medium" -> MODERATE;
            default -> LOW;
        };
    }
}
