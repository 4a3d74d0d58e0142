package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.model.BorderWeight;
import com.example.demo.sheetgen.model.CellRole;
import com.example.demo.sheetgen.model.CellStyle;
import com.example.demo.sheetgen.model.DataType;
import com.example.demo.sheetgen.model.HorizontalAlign;
import com.example.demo.sheetgen.model.VerticalAlign;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Maps a cell's role and data type to its style.
 *
 * Every role has a fixed attribute set; only the horizontal alignment of values and
 * table cells depends on the type (numbers right, dates centered, the rest left).
 * The table is built once, so the same role and type always yield the same instance.
 */
@Component
public class StyleResolver {

    static final String BLACK = "000000";
    static final String LIGHT_GRAY = "D3D3D3";
    static final String TITLE_FILL = "FFD2BF";
    static final String SECTION_FILL = "B6C2DB";
    static final String HEADER_FILL = "F0EFE8";

    private final Map<CellRole, Map<DataType, CellStyle>> styles;

    public StyleResolver() {
        Map<CellRole, Map<DataType, CellStyle>> table = new EnumMap<>(CellRole.class);
        for (CellRole role : CellRole.values()) {
            CellStyle base = baseStyle(role);
            Map<DataType, CellStyle> byType = new EnumMap<>(DataType.class);
            for (DataType type : DataType.values()) {
                HorizontalAlign alignment = alignmentFor(role, type);
                byType.put(type, alignment == base.getHorizontalAlignment()
                        ? base
                        : base.toBuilder().horizontalAlignment(alignment).build());
            }
            table.put(role, Collections.unmodifiableMap(byType));
        }
        this.styles = Collections.unmodifiableMap(table);
    }

    /**
     * @param role     structural role of the cell
     * @param dataType declared or inferred type; null is treated as String
     */
    public CellStyle resolve(CellRole role, DataType dataType) {
        if (role == null) {
            throw new IllegalArgumentException("Cell role is required");
        }
        return styles.get(role).get(dataType == null ? DataType.STRING : dataType);
    }

    static HorizontalAlign alignmentFor(CellRole role, DataType type) {
        if (!role.isTypeSensitive()) {
            return HorizontalAlign.LEFT;
        }
        switch (type) {
            case NUMBER:
                return HorizontalAlign.RIGHT;
            case DATE:
                return HorizontalAlign.CENTER;
            default:
                return HorizontalAlign.LEFT;
        }
    }

    private static CellStyle baseStyle(CellRole role) {
        switch (role) {
            case TITLE:
                return style(12, TITLE_FILL, true)
                        .borderTop(BorderWeight.MEDIUM).borderBottom(BorderWeight.MEDIUM)
                        .borderLeft(BorderWeight.MEDIUM).borderRight(BorderWeight.MEDIUM)
                        .borderColor(BLACK)
                        .build();
            case SECTION_HEADER:
                return style(11, SECTION_FILL, true)
                        .borderTop(BorderWeight.MEDIUM).borderBottom(BorderWeight.MEDIUM)
                        .borderLeft(BorderWeight.THIN).borderRight(BorderWeight.THIN)
                        .borderColor(BLACK)
                        .build();
            case FIELD_LABEL:
            case TABLE_HEADER:
                return thinBorders(style(10, HEADER_FILL, true), BLACK);
            case FIELD_VALUE:
            case TABLE_CELL:
                return thinBorders(style(10, null, false), LIGHT_GRAY);
            default:
                throw new IllegalArgumentException("No style defined for role " + role);
        }
    }

    private static CellStyle.CellStyleBuilder style(int fontSize, String fill, boolean bold) {
        return CellStyle.builder()
                .fontSize(fontSize)
                .fontColor(BLACK)
                .backgroundColor(fill)
                .bold(bold)
                .italic(false)
                .horizontalAlignment(HorizontalAlign.LEFT)
                .verticalAlignment(VerticalAlign.CENTER);
    }

    private static CellStyle thinBorders(CellStyle.CellStyleBuilder builder, String color) {
        return builder
                .borderTop(BorderWeight.THIN).borderBottom(BorderWeight.THIN)
                .borderLeft(BorderWeight.THIN).borderRight(BorderWeight.THIN)
                .borderColor(color)
                .build();
    }
}
