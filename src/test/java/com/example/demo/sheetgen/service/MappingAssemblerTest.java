package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.exception.LayoutException;
import com.example.demo.sheetgen.model.CellMapping;
import com.example.demo.sheetgen.model.CellRole;
import com.example.demo.sheetgen.model.DataType;
import com.example.demo.sheetgen.model.Document;
import com.example.demo.sheetgen.model.HorizontalAlign;
import com.example.demo.sheetgen.model.LayoutOutput;
import com.example.demo.sheetgen.model.SheetNamePolicy;
import com.example.demo.sheetgen.util.CellCoordinates;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

import static com.example.demo.sheetgen.support.SampleDocuments.*;
import static org.junit.jupiter.api.Assertions.*;

public class MappingAssemblerTest {

    private final MappingAssembler assembler = newAssembler();
    private final StyleResolver styles = new StyleResolver();

    @Test
    public void testAccountSummaryMapping() {
        LayoutOutput layout = assembler.assemble(List.of(accountSummary()), SheetNamePolicy.SUFFIX);

        assertEquals(Set.of("Bank Statement"), layout.getSheetNames());
        List<CellMapping> cells = layout.getSheet("Bank Statement");
        assertEquals(List.of("A1", "A2", "A3", "B3", "A4", "B4"), coordinates(cells));

        Map<String, CellMapping> byCoordinate = byCoordinate(cells);
        assertEquals("Bank Statement", byCoordinate.get("A1").getValue());
        assertEquals(styles.resolve(CellRole.TITLE, DataType.STRING), byCoordinate.get("A1").getStyle());
        assertEquals("Account Information", byCoordinate.get("A2").getValue());
        assertEquals("Account Number", byCoordinate.get("A3").getValue());

        assertEquals("12345", byCoordinate.get("B3").getValue());
        assertEquals(HorizontalAlign.LEFT, byCoordinate.get("B3").getStyle().getHorizontalAlignment());

        assertEquals("Balance", byCoordinate.get("A4").getValue());
        assertEquals(1000, byCoordinate.get("B4").getValue());
        assertEquals(HorizontalAlign.RIGHT, byCoordinate.get("B4").getStyle().getHorizontalAlignment());
    }

    @Test
    public void testTransactionTableMapping() {
        Document document = document("statement.pdf", "bank_statement",
                table("Transaction History", "Transactions", transactions()));

        List<CellMapping> cells = assembler.assemble(List.of(document), SheetNamePolicy.SUFFIX)
                .getSheet("Bank Statement");
        Map<String, CellMapping> byCoordinate = byCoordinate(cells);

        assertEquals("Transaction History", byCoordinate.get("A2").getValue());
        assertEquals("Date", byCoordinate.get("A3").getValue());
        assertEquals("Description", byCoordinate.get("B3").getValue());
        assertEquals("Amount", byCoordinate.get("C3").getValue());
        assertEquals(styles.resolve(CellRole.TABLE_HEADER, DataType.STRING), byCoordinate.get("C3").getStyle());

        assertEquals("2024-01-05", byCoordinate.get("A4").getValue());
        assertEquals(HorizontalAlign.CENTER, byCoordinate.get("A4").getStyle().getHorizontalAlignment());
        assertEquals("Coffee Shop", byCoordinate.get("B4").getValue());
        assertEquals(HorizontalAlign.LEFT, byCoordinate.get("B4").getStyle().getHorizontalAlignment());
        assertEquals(-4.5, byCoordinate.get("C4").getValue());
        assertEquals(HorizontalAlign.RIGHT, byCoordinate.get("C4").getStyle().getHorizontalAlignment());
        assertEquals(2500, byCoordinate.get("C5").getValue());
        assertEquals(11, cells.size());
    }

    @Test
    public void testBlankRowLeavesNoMappings() {
        List<CellMapping> cells = assembler.assemble(List.of(bankStatement()), SheetNamePolicy.SUFFIX)
                .getSheet("Bank Statement");

        Set<Integer> rows = cells.stream()
                .map(c -> CellCoordinates.decode(c.getCoordinate()).getRow())
                .collect(Collectors.toSet());
        assertEquals(Set.of(1, 2, 3, 4, 6, 7, 8, 9), rows);
        assertEquals(16, cells.size());
    }

    @Test
    public void testCoordinatesAreUniqueAndValuesNeverNull() {
        Document document = document("invoice.pdf", "invoice",
                scalar("Invoice", "Number", DataType.STRING, "INV-7"),
                scalar("Invoice", "PO Number", DataType.STRING, null),
                table("Lines", "Lines", List.of(
                        record("Item", "Widget", "Qty", 2, "Price", 3.5),
                        record("Item", "Gadget", "Qty", null, "Price", 10))));

        List<CellMapping> cells = assembler.assemble(List.of(document), SheetNamePolicy.SUFFIX).getSheet("Invoice");

        Set<String> seen = new HashSet<>();
        for (CellMapping cell : cells) {
            assertTrue(seen.add(cell.getCoordinate()), "duplicate " + cell.getCoordinate());
            assertNotNull(cell.getValue(), cell.getCoordinate());
            assertNotNull(cell.getStyle(), cell.getCoordinate());
        }
        assertEquals("", byCoordinate(cells).get("B4").getValue());
    }

    @Test
    public void testSheetsFollowDocumentOrder() {
        Document paystub = document("paystub.pdf", "pay_stub",
                scalar("Earnings", "Gross Pay", DataType.NUMBER, 4200));

        LayoutOutput layout = assembler.assemble(List.of(paystub, accountSummary()), SheetNamePolicy.SUFFIX);

        assertEquals(List.of("Pay Stub", "Bank Statement"), new ArrayList<>(layout.getSheetNames()));
    }

    @Test
    public void testDuplicateSheetNamesAreSuffixed() {
        LayoutOutput layout = assembler.assemble(
                List.of(accountSummary(), accountSummary(), accountSummary()), SheetNamePolicy.SUFFIX);

        assertEquals(List.of("Bank Statement", "Bank Statement 2", "Bank Statement 3"),
                new ArrayList<>(layout.getSheetNames()));
        // the title cell keeps the document title
        assertEquals("Bank Statement", layout.getSheet("Bank Statement 2").get(0).getValue());
    }

    @Test
    public void testSheetNameClashIgnoresCase() {
        Document lower = document("a.pdf", "bank_statement",
                scalar("Account", "Number", DataType.STRING, "1"));
        Document upper = document("b.pdf", "BANK_STATEMENT",
                scalar("Account", "Number", DataType.STRING, "2"));

        LayoutOutput layout = assembler.assemble(List.of(lower, upper), SheetNamePolicy.SUFFIX);

        assertEquals(List.of("Bank Statement", "BANK STATEMENT 2"), new ArrayList<>(layout.getSheetNames()));
    }

    @Test
    public void testDuplicateSheetNamesFailUnderFailPolicy() {
        LayoutException e = assertThrows(LayoutException.class, () -> assembler.assemble(
                List.of(accountSummary(), accountSummary()), SheetNamePolicy.FAIL));

        assertEquals(LayoutException.AMBIGUOUS_SHEET_NAME, e.getCode());
        assertTrue(e.getDescription().contains("Bank Statement"));
    }

    @Test
    public void testDocumentWithoutFieldsIsRejected() {
        Document empty = document("blank_scan.pdf", "unknown");

        LayoutException e = assertThrows(LayoutException.class,
                () -> assembler.assemble(List.of(accountSummary(), empty), SheetNamePolicy.SUFFIX));

        assertEquals(LayoutException.EMPTY_DOCUMENT, e.getCode());
        assertTrue(e.getDescription().contains("blank_scan.pdf"));
    }

    @Test
    public void testNoDocumentsGiveEmptyLayout() {
        assertTrue(assembler.assemble(List.of(), SheetNamePolicy.SUFFIX).isEmpty());
    }

    /**
     * The same input must give the same mapping, down to the serialized JSON.
     */
    @Test
    public void testAssemblyIsDeterministic() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        LayoutOutput first = assembler.assemble(List.of(bankStatement(), accountSummary()), SheetNamePolicy.SUFFIX);
        LayoutOutput second = newAssembler().assemble(List.of(bankStatement(), accountSummary()), SheetNamePolicy.SUFFIX);

        assertEquals(first, second);
        assertEquals(mapper.writeValueAsString(first), mapper.writeValueAsString(second));
    }

    @Test
    public void testSerializedCellUsesFlatProducerShape() throws Exception {
        LayoutOutput layout = assembler.assemble(List.of(accountSummary()), SheetNamePolicy.SUFFIX);

        JsonNode balance = new ObjectMapper().valueToTree(layout).get("Bank Statement").get(5);

        assertEquals("B4", balance.get("cell_coordinate").asText());
        assertEquals(1000, balance.get("cell_value").intValue());
        assertEquals(10, balance.get("font_size").intValue());
        assertEquals("000000", balance.get("font_color").asText());
        assertTrue(balance.get("background_color").isNull());
        assertFalse(balance.get("is_bold").booleanValue());
        assertFalse(balance.get("is_italic").booleanValue());
        assertEquals("right", balance.get("horizontal_alignment").asText());
        assertEquals("center", balance.get("vertical_alignment").asText());
        assertEquals("thin", balance.get("border_top").asText());
        assertEquals("thin", balance.get("border_right").asText());
        assertEquals("D3D3D3", balance.get("border_color").asText());
        assertNull(balance.get("style"));
    }

    private static List<String> coordinates(List<CellMapping> cells) {
        return cells.stream().map(CellMapping::getCoordinate).collect(Collectors.toList());
    }

    private static Map<String, CellMapping> byCoordinate(List<CellMapping> cells) {
        return cells.stream().collect(Collectors.toMap(CellMapping::getCoordinate, Function.identity()));
    }
}
