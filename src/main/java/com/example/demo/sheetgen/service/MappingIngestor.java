package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.exception.LayoutException;
import com.example.demo.sheetgen.model.BorderWeight;
import com.example.demo.sheetgen.model.CellMapping;
import com.example.demo.sheetgen.model.CellPosition;
import com.example.demo.sheetgen.model.CellStyle;
import com.example.demo.sheetgen.model.HorizontalAlign;
import com.example.demo.sheetgen.model.LayoutOutput;
import com.example.demo.sheetgen.model.VerticalAlign;
import com.example.demo.sheetgen.util.CellCoordinates;
import com.example.demo.sheetgen.util.SheetNames;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Accepts a layout mapping produced outside this service (typically by a generative
 * model) and turns it into a validated {@link LayoutOutput}.
 *
 * The text may be wrapped in a fenced code block and surrounded by prose; everything
 * outside the outermost braces is ignored. The parsed mapping must satisfy the same
 * rules as an assembled one, otherwise INVALID_LAYOUT_MAPPING names the first broken rule.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MappingIngestor {

    private static final Pattern LEADING_FENCE = Pattern.compile("^```[A-Za-z0-9_+.-]*");
    private static final Pattern TRAILING_FENCE = Pattern.compile("```$");
    private static final Pattern HEX_COLOR = Pattern.compile("[0-9A-Fa-f]{6}");
    private static final int FRAGMENT_LENGTH = 80;

    private final ObjectMapper objectMapper;

    public LayoutOutput ingest(String rawText) {
        String json = extractJsonObject(rawText);
        JsonNode root;
        try {
            // anything after the first complete value (a second object, braces in trailing prose) is an error
            root = objectMapper.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readTree(json);
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            String where = location == null ? "" : " at line " + location.getLineNr() + ", column " + location.getColumnNr();
            throw new LayoutException(LayoutException.MALFORMED_JSON,
                    "Could not parse mapping" + where + ": " + e.getOriginalMessage() + " in '" + fragment(json) + "'", e);
        }
        LayoutOutput layout = validate(root);
        log.info("Ingested layout mapping with {} sheet(s)", layout.getSheetNames().size());
        return layout;
    }

    /**
     * Removes one surrounding code fence, then returns the text from the first '{' to
     * the last '}'.
     *
     * @throws LayoutException NO_JSON_OBJECT_FOUND when there is no balanced brace pair
     */
    String extractJsonObject(String rawText) {
        if (rawText == null) {
            throw new LayoutException(LayoutException.NO_JSON_OBJECT_FOUND, "Mapping text is missing");
        }
        String text = rawText.strip();
        if (text.startsWith("```")) {
            text = LEADING_FENCE.matcher(text).replaceFirst("");
            text = TRAILING_FENCE.matcher(text).replaceFirst("");
            text = text.strip();
        }

        int first = text.indexOf('{');
        int last = text.lastIndexOf('}');
        if (first < 0 || last < first) {
            throw new LayoutException(LayoutException.NO_JSON_OBJECT_FOUND,
                    "No JSON object found in '" + fragment(rawText) + "'");
        }
        String candidate = text.substring(first, last + 1);
        if (!bracesBalanced(candidate)) {
            throw new LayoutException(LayoutException.NO_JSON_OBJECT_FOUND,
                    "Unbalanced braces, no complete JSON object in '" + fragment(candidate) + "'");
        }
        return candidate;
    }

    /**
     * Counts braces outside string literals.
     */
    static boolean bracesBalanced(String text) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
            } else if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }

    LayoutOutput validate(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw invalid("the mapping root must be an object of sheet name to cell list");
        }
        if (root.size() == 0) {
            throw invalid("the mapping contains no sheets");
        }

        Map<String, List<CellMapping>> sheets = new LinkedHashMap<>();
        Set<String> sheetKeys = new HashSet<>();
        Iterator<Map.Entry<String, JsonNode>> entries = root.fields();
        while (entries.hasNext()) {
            Map.Entry<String, JsonNode> entry = entries.next();
            String sheetName = entry.getKey();
            if (!SheetNames.isValid(sheetName)) {
                throw invalid("sheet name '" + sheetName + "' must be 1-" + SheetNames.MAX_LENGTH
                        + " letters, digits or spaces");
            }
            if (!sheetKeys.add(sheetName.toLowerCase(Locale.ROOT))) {
                throw invalid("sheet name '" + sheetName + "' is used twice (sheet names ignore case)");
            }
            if (!entry.getValue().isArray()) {
                throw invalid("sheet '" + sheetName + "' must map to a list of cells");
            }
            sheets.put(sheetName, validateSheet(sheetName, entry.getValue()));
        }
        return new LayoutOutput(sheets);
    }

    private List<CellMapping> validateSheet(String sheetName, JsonNode cells) {
        List<CellMapping> result = new ArrayList<>(cells.size());
        Set<String> coordinates = new HashSet<>();
        int previousRow = 0;
        int index = 0;
        for (JsonNode cell : cells) {
            String where = "sheet '" + sheetName + "', cell #" + index;
            if (!cell.isObject()) {
                throw invalid(where + " is not an object");
            }

            JsonNode coordinateNode = cell.get("cell_coordinate");
            if (coordinateNode == null || !coordinateNode.isTextual()) {
                throw invalid(where + " has no cell_coordinate");
            }
            String coordinate = coordinateNode.asText();
            String canonical;
            try {
                canonical = CellCoordinates.normalize(coordinate);
            } catch (LayoutException e) {
                throw new LayoutException(LayoutException.INVALID_LAYOUT_MAPPING,
                        "malformed coordinate: " + where + " has cell_coordinate '" + coordinate + "'", e);
            }
            CellPosition position = CellCoordinates.decode(canonical);
            where = where + " (" + canonical + ")";

            if (!coordinates.add(canonical)) {
                throw invalid("duplicate coordinate: " + where + " repeats an earlier cell");
            }
            int row = position.getRow();
            if (row < previousRow) {
                throw invalid("rows out of order: " + where + " comes after row " + previousRow);
            }
            if (previousRow == 0 && row != 1) {
                throw invalid("row gap: " + where + " is the first cell but the sheet must start at row 1");
            }
            if (row - previousRow > 2) {
                throw invalid("row gap: " + where + " leaves " + (row - previousRow - 1)
                        + " empty rows after row " + previousRow + "; only single blank separator rows are allowed");
            }
            previousRow = row;

            result.add(new CellMapping(canonical, readValue(cell, where), readStyle(cell, where)));
            index++;
        }
        return result;
    }

    private Object readValue(JsonNode cell, String where) {
        JsonNode value = cell.get("cell_value");
        if (value == null || value.isNull()) {
            throw invalid("null cell value: " + where + " must carry a cell_value (\"\" for empty)");
        }
        if (value.isTextual()) {
            return value.asText();
        }
        if (value.isNumber()) {
            return value.numberValue();
        }
        if (value.isBoolean()) {
            return value.booleanValue();
        }
        throw invalid("nested cell value: " + where + " has a cell_value that is not a string, number or boolean");
    }

    private CellStyle readStyle(JsonNode cell, String where) {
        JsonNode fontSize = required(cell, "font_size", where);
        if (!fontSize.isIntegralNumber() || !fontSize.canConvertToInt() || fontSize.intValue() <= 0) {
            throw invalid("bad style attribute: " + where + " font_size must be a positive integer, got " + fontSize);
        }
        return CellStyle.builder()
                .fontSize(fontSize.intValue())
                .fontColor(color(cell, "font_color", where, false))
                .backgroundColor(color(cell, "background_color", where, true))
                .bold(flag(cell, "is_bold", where))
                .italic(flag(cell, "is_italic", where))
                .horizontalAlignment(choice(cell, "horizontal_alignment", where, HorizontalAlign::fromValue))
                .verticalAlignment(choice(cell, "vertical_alignment", where, VerticalAlign::fromValue))
                .borderTop(choice(cell, "border_top", where, BorderWeight::fromValue))
                .borderBottom(choice(cell, "border_bottom", where, BorderWeight::fromValue))
                .borderLeft(choice(cell, "border_left", where, BorderWeight::fromValue))
                .borderRight(choice(cell, "border_right", where, BorderWeight::fromValue))
                .borderColor(color(cell, "border_color", where, false))
                .build();
    }

    private JsonNode required(JsonNode cell, String attribute, String where) {
        JsonNode node = cell.get(attribute);
        if (node == null) {
            throw invalid("missing style attribute: " + where + " has no " + attribute);
        }
        return node;
    }

    private String color(JsonNode cell, String attribute, String where, boolean nullable) {
        JsonNode node = required(cell, attribute, where);
        if (node.isNull() && nullable) {
            return null;
        }
        if (!node.isTextual() || !HEX_COLOR.matcher(node.asText()).matches()) {
            throw invalid("bad style attribute: " + where + " " + attribute + " must be a 6-digit hex color, got " + node);
        }
        return node.asText().toUpperCase(Locale.ROOT);
    }

    private boolean flag(JsonNode cell, String attribute, String where) {
        JsonNode node = required(cell, attribute, where);
        if (!node.isBoolean()) {
            throw invalid("bad style attribute: " + where + " " + attribute + " must be true or false, got " + node);
        }
        return node.booleanValue();
    }

    private <T> T choice(JsonNode cell, String attribute, String where, Function<String, T> parser) {
        JsonNode node = required(cell, attribute, where);
        T value = node.isTextual() ? parser.apply(node.asText()) : null;
        if (value == null) {
            throw invalid("bad style attribute: " + where + " has unsupported " + attribute + " " + node);
        }
        return value;
    }

    private static LayoutException invalid(String description) {
        return new LayoutException(LayoutException.INVALID_LAYOUT_MAPPING, description);
    }

    private static String fragment(String text) {
        String flat = text.replaceAll("\\s+", " ").strip();
        return flat.length() <= FRAGMENT_LENGTH ? flat : flat.substring(0, FRAGMENT_LENGTH) + "...";
    }
}
