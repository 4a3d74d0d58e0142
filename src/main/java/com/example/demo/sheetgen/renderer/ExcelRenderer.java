package com.example.demo.sheetgen.renderer;

import com.example.demo.sheetgen.model.LayoutOutput;
import org.apache.poi.ss.usermodel.Workbook;

/**
 * Renderers that materialize a layout mapping as an Apache POI Workbook.
 */
public interface ExcelRenderer {
    /**
     * Render every sheet of the layout into a new workbook. The caller owns the
     * returned workbook and must close it.
     *
     * @param wrapText whether styled cells wrap their text
     */
    Workbook renderWorkbook(LayoutOutput layout, boolean wrapText);
}
