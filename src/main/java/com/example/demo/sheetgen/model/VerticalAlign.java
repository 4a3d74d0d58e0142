package com.example.demo.sheetgen.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Vertical alignment of a cell's content.
 */
public enum VerticalAlign {
    TOP("top"),
    CENTER("center"),
    BOTTOM("bottom");

    private final String value;

    VerticalAlign(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static VerticalAlign fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (VerticalAlign candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        return null;
    }
}
