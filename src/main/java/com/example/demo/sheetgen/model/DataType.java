package com.example.demo.sheetgen.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declared type of an extracted field, as written by the upstream extraction step
 * ("String", "Number", "Date", "Table").
 */
public enum DataType {
    STRING("String"),
    NUMBER("Number"),
    DATE("Date"),
    TABLE("Table");

    private final String label;

    DataType(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static DataType fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (DataType type : values()) {
            if (type.label.equalsIgnoreCase(value.trim())) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown data_type: " + value);
    }
}
