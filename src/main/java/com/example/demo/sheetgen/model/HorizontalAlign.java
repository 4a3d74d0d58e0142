package com.example.demo.sheetgen.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Horizontal alignment of a cell's content.
 */
public enum HorizontalAlign {
    LEFT("left"),
    CENTER("center"),
    RIGHT("right");

    private final String value;

    HorizontalAlign(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Case-insensitive lookup; returns null for an unknown value.
     */
    @JsonCreator
    public static HorizontalAlign fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (HorizontalAlign candidate : values()) {
            if (candidate.value.equalsIgnoreCase(value.trim())) {
                return candidate;
            }
        }
        return null;
    }
}
