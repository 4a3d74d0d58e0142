package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.exception.LayoutException;
import com.example.demo.sheetgen.model.CellMapping;
import com.example.demo.sheetgen.model.Document;
import com.example.demo.sheetgen.model.LayoutOutput;
import com.example.demo.sheetgen.model.LayoutPlan;
import com.example.demo.sheetgen.model.NormalizedDocument;
import com.example.demo.sheetgen.model.PlannedCell;
import com.example.demo.sheetgen.model.PlannedRow;
import com.example.demo.sheetgen.model.SheetNamePolicy;
import com.example.demo.sheetgen.util.CellCoordinates;
import com.example.demo.sheetgen.util.SheetNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turns documents into the layout mapping: normalizes and plans each document, then
 * attaches a coordinate and a style to every planned cell.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MappingAssembler {

    private final FieldNormalizer fieldNormalizer;
    private final LayoutPlanner layoutPlanner;
    private final StyleResolver styleResolver;

    /**
     * @param documents documents in sheet order
     * @param policy    how to treat two documents that derive the same sheet name
     * @throws LayoutException EMPTY_DOCUMENT when a document has no sections,
     *                         AMBIGUOUS_SHEET_NAME on a clash under {@link SheetNamePolicy#FAIL}
     */
    public LayoutOutput assemble(List<Document> documents, SheetNamePolicy policy) {
        Map<String, List<CellMapping>> sheets = new LinkedHashMap<>();
        // lower-cased sheet name -> file that claimed it; sheet names are case-insensitive in xlsx
        Map<String, String> claimedBy = new HashMap<>();

        for (Document document : documents) {
            NormalizedDocument normalized = fieldNormalizer.normalize(document);
            if (normalized.getSections().isEmpty()) {
                throw new LayoutException(LayoutException.EMPTY_DOCUMENT,
                        "Document '" + normalized.getFileName() + "' (" + normalized.getTitle() + ") has no sections to lay out");
            }

            LayoutPlan plan = layoutPlanner.plan(normalized);
            String sheetName = uniqueSheetName(plan, policy, claimedBy);
            sheets.put(sheetName, assemble(plan));
            log.debug("Assembled sheet '{}' from '{}' with {} cell(s)", sheetName, plan.getFileName(), sheets.get(sheetName).size());
        }
        return new LayoutOutput(sheets);
    }

    /**
     * Walks one plan top to bottom; blank rows produce no mappings.
     */
    public List<CellMapping> assemble(LayoutPlan plan) {
        List<CellMapping> cells = new ArrayList<>();
        for (PlannedRow row : plan.getRows()) {
            for (PlannedCell cell : row.getCells()) {
                cells.add(new CellMapping(
                        CellCoordinates.encode(row.getRowNumber(), cell.getColumn()),
                        cell.getValue(),
                        styleResolver.resolve(cell.getRole(), cell.getDataType())));
            }
        }
        return cells;
    }

    private String uniqueSheetName(LayoutPlan plan, SheetNamePolicy policy, Map<String, String> claimedBy) {
        String base = plan.getSheetName();
        String source = plan.getFileName() != null ? plan.getFileName() : plan.getTitle();
        String candidate = base;
        String owner = claimedBy.get(key(candidate));
        if (owner != null) {
            if (policy == SheetNamePolicy.FAIL) {
                throw new LayoutException(LayoutException.AMBIGUOUS_SHEET_NAME,
                        "Documents '" + owner + "' and '" + source + "' both map to sheet '" + base + "'");
            }
            int suffix = 2;
            while (claimedBy.containsKey(key(candidate))) {
                candidate = SheetNames.withSuffix(base, suffix++);
            }
            log.info("Sheet name '{}' already used by '{}'; using '{}' for '{}'", base, owner, candidate, source);
        }
        claimedBy.put(key(candidate), source);
        return candidate;
    }

    private static String key(String sheetName) {
        return sheetName.toLowerCase(Locale.ROOT);
    }
}
