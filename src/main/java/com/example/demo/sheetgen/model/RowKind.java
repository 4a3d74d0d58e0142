package com.example.demo.sheetgen.model;

public enum RowKind {
    TITLE,
    SECTION_HEADER,
    FIELD,
    TABLE_HEADER,
    TABLE_ROW,
    BLANK
}
