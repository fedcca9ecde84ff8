package com.flowsmith.core.model;

import java.io.Serializable;

/**
 * A single key/value override, either pre-resolved upstream or produced from
 * human review decisions. Order of a list of these is significant.
 */
public record ResolvedInput(String key, Object value) implements Serializable {

    public String valueAsText() {
        return value == null ? "" : String.valueOf(value);
    }
}
