package com.example.demo.sheetgen.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Line weight of one cell border side. NONE leaves that side undrawn.
 */
public enum BorderWeight {
    THIN("thin"),
    MEDIUM("medium"),
    THICK("thick"),
    NONE("none");

    private final String value;

    BorderWeight(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @return the matching weight ignoring case, or null when the value names none
     */
    @JsonCreator
    public static BorderWeight fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (BorderWeight candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        return null;
    }
}
