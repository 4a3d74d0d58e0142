package com.example.demo.sheetgen.util;

/**
 * Coerces extracted values into what a cell can hold.
 */
public final class CellValues {

    private CellValues() {
    }

    /**
     * Null becomes "", strings, numbers and booleans pass through, anything nested is
     * written as its string form.
     */
    public static Object toCellValue(Object value) {
        if (value == null) {
            return "";
        }
        if (value instanceof String || value instanceof Number || value instanceof Boolean) {
            return value;
        }
        return String.valueOf(value);
    }
}
