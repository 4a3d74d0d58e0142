package com.example.demo.sheetgen.model;

import lombok.Value;

/**
 * A cell placed by the planner, before any style is attached.
 */
@Value
public class PlannedCell {
    int column;
    Object value;
    CellRole role;
    DataType dataType;
}
