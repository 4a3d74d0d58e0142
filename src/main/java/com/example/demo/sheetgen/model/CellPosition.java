package com.example.demo.sheetgen.model;

import lombok.Value;

/**
 * 1-based row and column of a cell.
 */
@Value
public class CellPosition {
    int row;
    int column;
}
