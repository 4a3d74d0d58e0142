package com.example.demo.sheetgen.model;

import lombok.Value;

/**
 * A table column name with the type inferred from its values.
 */
@Value
public class TableColumn {
    String name;
    DataType dataType;
}
