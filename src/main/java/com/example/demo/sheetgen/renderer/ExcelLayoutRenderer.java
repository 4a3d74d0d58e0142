package com.example.demo.sheetgen.renderer;

import com.example.demo.sheetgen.aspect.LogExecutionTime;
import com.example.demo.sheetgen.exception.LayoutException;
import com.example.demo.sheetgen.model.BorderWeight;
import com.example.demo.sheetgen.model.CellMapping;
import com.example.demo.sheetgen.model.CellPosition;
import com.example.demo.sheetgen.model.CellStyle;
import com.example.demo.sheetgen.model.HorizontalAlign;
import com.example.demo.sheetgen.model.LayoutOutput;
import com.example.demo.sheetgen.model.VerticalAlign;
import com.example.demo.sheetgen.util.CellCoordinates;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.apache.poi.xssf.usermodel.extensions.XSSFCellBorder.BorderSide;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes a layout mapping into a new XLSX workbook: one sheet per layout key, every
 * mapping's value and full style applied to its cell.
 *
 * Cell styles are created once per distinct {@link CellStyle} and shared between
 * cells, keeping the workbook well under the format's style limit.
 */
@Slf4j
@Component
public class ExcelLayoutRenderer implements ExcelRenderer {

    @Override
    @LogExecutionTime("Excel Rendering")
    public Workbook renderWorkbook(LayoutOutput layout, boolean wrapText) {
        if (layout == null || layout.isEmpty()) {
            throw new LayoutException(LayoutException.EMPTY_LAYOUT, "Layout mapping has no sheets to render");
        }

        XSSFWorkbook workbook = new XSSFWorkbook();
        try {
            Map<CellStyle, XSSFCellStyle> styleCache = new HashMap<>();
            for (Map.Entry<String, List<CellMapping>> sheetEntry : layout.getSheets().entrySet()) {
                Sheet sheet = workbook.createSheet(sheetEntry.getKey());
                for (CellMapping mapping : sheetEntry.getValue()) {
                    Cell cell = cellAt(sheet, mapping.getCoordinate());
                    setCellValue(cell, mapping.getValue());
                    cell.setCellStyle(styleCache.computeIfAbsent(mapping.getStyle(),
                            style -> createCellStyle(workbook, style, wrapText)));
                }
                log.debug("Rendered sheet '{}' with {} cell(s)", sheetEntry.getKey(), sheetEntry.getValue().size());
            }
            removeUnmappedSheets(workbook, layout);
            log.info("Rendered workbook with {} sheet(s) and {} distinct cell style(s)",
                    workbook.getNumberOfSheets(), styleCache.size());
            return workbook;
        } catch (RuntimeException e) {
            closeAfterFailure(workbook, e);
            throw e;
        }
    }

    /**
     * Locate (creating if needed) the cell for an address such as "B4".
     */
    private Cell cellAt(Sheet sheet, String coordinate) {
        CellPosition position;
        try {
            position = CellCoordinates.decode(coordinate);
        } catch (LayoutException e) {
            throw new LayoutException(LayoutException.BAD_COORDINATE,
                    "Sheet '" + sheet.getSheetName() + "' has a mapping with unusable coordinate '" + coordinate + "'", e);
        }

        try {
            Row row = sheet.getRow(position.getRow() - 1);
            if (row == null) {
                row = sheet.createRow(position.getRow() - 1);
            }
            Cell cell = row.getCell(position.getColumn() - 1);
            if (cell == null) {
                cell = row.createCell(position.getColumn() - 1);
            }
            return cell;
        } catch (IllegalArgumentException e) {
            throw new LayoutException(LayoutException.BAD_COORDINATE,
                    "Sheet '" + sheet.getSheetName() + "' coordinate '" + coordinate + "' is outside the worksheet", e);
        }
    }

    /**
     * Numbers and booleans keep their type; everything else is written as text,
     * including numeric-looking strings such as account numbers.
     */
    private void setCellValue(Cell cell, Object value) {
        if (value instanceof Number) {
            cell.setCellValue(((Number) value).doubleValue());
        } else if (value instanceof Boolean) {
            cell.setCellValue((Boolean) value);
        } else {
            cell.setCellValue(value == null ? "" : value.toString());
        }
    }

    private XSSFCellStyle createCellStyle(XSSFWorkbook workbook, CellStyle style, boolean wrapText) {
        XSSFFont font = workbook.createFont();
        font.setFontHeightInPoints((short) style.getFontSize());
        if (style.getFontColor() != null) {
            font.setColor(color(style.getFontColor()));
        }
        font.setBold(style.isBold());
        font.setItalic(style.isItalic());

        XSSFCellStyle cellStyle = workbook.createCellStyle();
        cellStyle.setFont(font);
        if (style.getBackgroundColor() != null) {
            cellStyle.setFillForegroundColor(color(style.getBackgroundColor()));
            cellStyle.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        }
        cellStyle.setAlignment(horizontal(style.getHorizontalAlignment()));
        cellStyle.setVerticalAlignment(vertical(style.getVerticalAlignment()));
        cellStyle.setWrapText(wrapText);

        cellStyle.setBorderTop(border(style.getBorderTop()));
        cellStyle.setBorderBottom(border(style.getBorderBottom()));
        cellStyle.setBorderLeft(border(style.getBorderLeft()));
        cellStyle.setBorderRight(border(style.getBorderRight()));
        if (style.getBorderColor() != null) {
            XSSFColor borderColor = color(style.getBorderColor());
            for (BorderSide side : new BorderSide[]{BorderSide.TOP, BorderSide.BOTTOM, BorderSide.LEFT, BorderSide.RIGHT}) {
                cellStyle.setBorderColor(side, borderColor);
            }
        }
        return cellStyle;
    }

    /**
     * Drop any sheet the layout does not name, such as a default sheet.
     */
    private void removeUnmappedSheets(Workbook workbook, LayoutOutput layout) {
        for (int i = workbook.getNumberOfSheets() - 1; i >= 0; i--) {
            String name = workbook.getSheetName(i);
            if (!layout.getSheetNames().contains(name)) {
                log.debug("Removing unmapped sheet '{}'", name);
                workbook.removeSheetAt(i);
            }
        }
    }

    private void closeAfterFailure(Workbook workbook, RuntimeException failure) {
        try {
            workbook.close();
        } catch (IOException closeError) {
            failure.addSuppressed(closeError);
        }
    }

    private static XSSFColor color(String hex) {
        int rgb = Integer.parseInt(hex, 16);
        return new XSSFColor(new byte[]{(byte) (rgb >> 16), (byte) (rgb >> 8), (byte) rgb}, null);
    }

    private static HorizontalAlignment horizontal(HorizontalAlign alignment) {
        if (alignment == null) {
            return HorizontalAlignment.GENERAL;
        }
        switch (alignment) {
            case CENTER:
                return HorizontalAlignment.CENTER;
            case RIGHT:
                return HorizontalAlignment.RIGHT;
            default:
                return HorizontalAlignment.LEFT;
        }
    }

    private static VerticalAlignment vertical(VerticalAlign alignment) {
        if (alignment == null) {
            return VerticalAlignment.CENTER;
        }
        switch (alignment) {
            case TOP:
                return VerticalAlignment.TOP;
            case BOTTOM:
                return VerticalAlignment.BOTTOM;
            default:
                return VerticalAlignment.CENTER;
        }
    }

    private static BorderStyle border(BorderWeight weight) {
        if (weight == null) {
            return BorderStyle.NONE;
        }
        switch (weight) {
            case THIN:
                return BorderStyle.THIN;
            case MEDIUM:
                return BorderStyle.MEDIUM;
            case THICK:
                return BorderStyle.THICK;
            default:
                return BorderStyle.NONE;
        }
    }
}
