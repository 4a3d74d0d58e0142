package com.example.demo.sheetgen.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The layout mapping: sheet name to the ordered cells of that sheet. Sheet order is
 * the insertion order. Immutable once built.
 */
@EqualsAndHashCode
@ToString
public final class LayoutOutput {

    private final Map<String, List<CellMapping>> sheets;

    public LayoutOutput(Map<String, List<CellMapping>> sheets) {
        Map<String, List<CellMapping>> copy = new LinkedHashMap<>();
        sheets.forEach((name, cells) -> copy.put(name, List.copyOf(cells)));
        this.sheets = Collections.unmodifiableMap(copy);
    }

    @JsonValue
    public Map<String, List<CellMapping>> getSheets() {
        return sheets;
    }

    public Set<String> getSheetNames() {
        return sheets.keySet();
    }

    public List<CellMapping> getSheet(String sheetName) {
        return sheets.getOrDefault(sheetName, List.of());
    }

    public boolean isEmpty() {
        return sheets.isEmpty();
    }
}
