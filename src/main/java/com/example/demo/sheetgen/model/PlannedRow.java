package com.example.demo.sheetgen.model;

import lombok.Value;

import java.util.List;

@Value
public class PlannedRow {
    int rowNumber;
    RowKind kind;
    List<PlannedCell> cells;

    public static PlannedRow blank(int rowNumber) {
        return new PlannedRow(rowNumber, RowKind.BLANK, List.of());
    }

    public boolean isBlank() {
        return kind == RowKind.BLANK;
    }
}
