package com.example.demo.sheetgen.model;

/**
 * Structural role of a cell, from the title down to table cells.
 */
public enum CellRole {
    TITLE(false),
    SECTION_HEADER(false),
    FIELD_LABEL(false),
    TABLE_HEADER(false),
    FIELD_VALUE(true),
    TABLE_CELL(true);

    private final boolean typeSensitive;

    CellRole(boolean typeSensitive) {
        this.typeSensitive = typeSensitive;
    }

    /**
     * Whether the horizontal alignment of this role depends on the data type.
     */
    public boolean isTypeSensitive() {
        return typeSensitive;
    }
}
