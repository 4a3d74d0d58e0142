package com.example.demo.sheetgen.model;

import lombok.Value;

import java.util.List;

/**
 * A section after grouping: its scalar fields and its table fields, each list in the
 * relative order the fields had in the input.
 */
@Value
public class NormalizedSection {
    String name;
    List<Field> scalarFields;
    List<TableField> tableFields;

    public boolean hasScalarFields() {
        return !scalarFields.isEmpty();
    }
}
