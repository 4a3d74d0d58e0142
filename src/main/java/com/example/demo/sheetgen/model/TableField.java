package com.example.demo.sheetgen.model;

import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A table field with its columns resolved, in source order.
 */
@Value
public class TableField {
    Field field;
    List<TableColumn> columns;
    List<Map<String, Object>> records;
}
