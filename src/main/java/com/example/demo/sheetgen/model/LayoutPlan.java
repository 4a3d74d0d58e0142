package com.example.demo.sheetgen.model;

import lombok.Value;

import java.util.List;

/**
 * Ordered rows of one document's sheet, row numbers ascending from 1.
 */
@Value
public class LayoutPlan {
    String fileName;
    String sheetName;
    String title;
    List<PlannedRow> rows;
}
