package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.model.CellRole;
import com.example.demo.sheetgen.model.DataType;
import com.example.demo.sheetgen.model.Field;
import com.example.demo.sheetgen.model.LayoutPlan;
import com.example.demo.sheetgen.model.NormalizedDocument;
import com.example.demo.sheetgen.model.NormalizedSection;
import com.example.demo.sheetgen.model.PlannedCell;
import com.example.demo.sheetgen.model.PlannedRow;
import com.example.demo.sheetgen.model.RowKind;
import com.example.demo.sheetgen.model.TableColumn;
import com.example.demo.sheetgen.model.TableField;
import com.example.demo.sheetgen.util.CellValues;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Decides which row and column every piece of a normalized document occupies.
 *
 * Layout, top to bottom:
 * <pre>
 *   row 1      title
 *              per section with scalar fields:
 *                section header            (column A)
 *                label | value             (columns A, B), one row per field
 *              one blank row between consecutive sections
 *   blank row  before the first table, when scalar sections were emitted
 *              per table field:
 *                section header            (column A)
 *                column headers            (columns A..N, source order)
 *                record values             one row per record
 *              one blank row between consecutive tables
 * </pre>
 * The planner assigns roles and data types but no styles.
 */
@Slf4j
@Component
public class LayoutPlanner {

    public LayoutPlan plan(NormalizedDocument document) {
        RowCursor cursor = new RowCursor();
        cursor.emit(RowKind.TITLE, List.of(
                new PlannedCell(1, document.getTitle(), CellRole.TITLE, DataType.STRING)));

        boolean scalarBlockEmitted = false;
        for (NormalizedSection section : document.getSections()) {
            if (!section.hasScalarFields()) {
                continue;
            }
            if (scalarBlockEmitted) {
                cursor.blank();
            }
            cursor.emit(RowKind.SECTION_HEADER, sectionHeader(section.getName()));
            for (Field field : section.getScalarFields()) {
                cursor.emit(RowKind.FIELD, List.of(
                        new PlannedCell(1, field.label(), CellRole.FIELD_LABEL, DataType.STRING),
                        new PlannedCell(2, CellValues.toCellValue(field.getValue()), CellRole.FIELD_VALUE, typeOf(field))));
            }
            scalarBlockEmitted = true;
        }

        boolean tableBlockEmitted = false;
        for (NormalizedSection section : document.getSections()) {
            for (TableField table : section.getTableFields()) {
                if (scalarBlockEmitted || tableBlockEmitted) {
                    cursor.blank();
                }
                planTable(cursor, section.getName(), table);
                tableBlockEmitted = true;
            }
        }

        log.debug("Planned {} row(s) for sheet '{}'", cursor.rows.size(), document.getSheetName());
        return new LayoutPlan(document.getFileName(), document.getSheetName(), document.getTitle(),
                Collections.unmodifiableList(cursor.rows));
    }

    private void planTable(RowCursor cursor, String sectionName, TableField table) {
        cursor.emit(RowKind.SECTION_HEADER, sectionHeader(sectionName));

        List<TableColumn> columns = table.getColumns();
        if (columns.isEmpty()) {
            log.debug("Table field '{}' in section '{}' has no columns; emitting its section header only",
                    table.getField().label(), sectionName);
            return;
        }

        List<PlannedCell> headers = new ArrayList<>(columns.size());
        for (int i = 0; i < columns.size(); i++) {
            headers.add(new PlannedCell(i + 1, columns.get(i).getName(), CellRole.TABLE_HEADER, columns.get(i).getDataType()));
        }
        cursor.emit(RowKind.TABLE_HEADER, headers);

        for (Map<String, Object> record : table.getRecords()) {
            List<PlannedCell> cells = new ArrayList<>(columns.size());
            for (int i = 0; i < columns.size(); i++) {
                TableColumn column = columns.get(i);
                cells.add(new PlannedCell(i + 1, CellValues.toCellValue(record.get(column.getName())),
                        CellRole.TABLE_CELL, column.getDataType()));
            }
            cursor.emit(RowKind.TABLE_ROW, cells);
        }
    }

    private static List<PlannedCell> sectionHeader(String name) {
        return List.of(new PlannedCell(1, name, CellRole.SECTION_HEADER, DataType.STRING));
    }

    private static DataType typeOf(Field field) {
        return field.getDataType() == null ? DataType.STRING : field.getDataType();
    }

    /**
     * Hands out row numbers; only ever moves forward.
     */
    private static final class RowCursor {
        private final List<PlannedRow> rows = new ArrayList<>();
        private int next = 1;

        void emit(RowKind kind, List<PlannedCell> cells) {
            rows.add(new PlannedRow(next++, kind, List.copyOf(cells)));
        }

        void blank() {
            rows.add(PlannedRow.blank(next++));
        }
    }
}
