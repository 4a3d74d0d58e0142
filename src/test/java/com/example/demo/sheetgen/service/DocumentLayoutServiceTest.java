package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.config.LayoutProperties;
import com.example.demo.sheetgen.exception.LayoutException;
import com.example.demo.sheetgen.model.LayoutOutput;
import com.example.demo.sheetgen.model.SheetNamePolicy;
import com.example.demo.sheetgen.renderer.ExcelLayoutRenderer;
import com.example.demo.sheetgen.renderer.ExcelRenderer;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mockito;

import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

import static com.example.demo.sheetgen.support.SampleDocuments.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class DocumentLayoutServiceTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private LayoutProperties properties;
    private ExcelRenderer renderer;

    @TempDir
    Path tempDir;

    @BeforeEach
    public void setup() {
        properties = new LayoutProperties();
        renderer = new ExcelLayoutRenderer();
    }

    private DocumentLayoutService service() {
        return new DocumentLayoutService(newAssembler(), new MappingIngestor(objectMapper), renderer,
                new ExcelOutputService(), properties);
    }

    @Test
    public void testGenerateExcelProducesWorkbookBytes() throws Exception {
        byte[] xlsx = service().generateExcel(List.of(bankStatement()));

        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(xlsx))) {
            assertEquals("Bank Statement", workbook.getSheetName(0));
            assertEquals("Account Information", workbook.getSheetAt(0).getRow(1).getCell(0).getStringCellValue());
        }
    }

    @Test
    public void testGenerateExcelWritesFile() throws Exception {
        Path target = tempDir.resolve("statements/layout.xlsx");

        Path written = service().generateExcel(List.of(bankStatement(), accountSummary()), target);

        assertTrue(Files.exists(written));
        try (Workbook workbook = new XSSFWorkbook(Files.newInputStream(written))) {
            assertEquals(2, workbook.getNumberOfSheets());
            assertEquals("Bank Statement 2", workbook.getSheetName(1));
        }
    }

    /**
     * A mapping produced elsewhere renders exactly like the assembled one.
     */
    @Test
    public void testGenerateExcelFromMapping() throws Exception {
        LayoutOutput assembled = service().buildLayout(List.of(bankStatement()));
        String producerText = "Sure! Here is the mapping:\n```json\n"
                + objectMapper.writeValueAsString(assembled) + "\n```";

        DocumentLayoutService service = service();
        assertEquals(assembled, service.ingestMapping(producerText));

        byte[] xlsx = service.generateExcelFromMapping(producerText);
        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(xlsx))) {
            assertEquals(1000.0, workbook.getSheet("Bank Statement").getRow(3).getCell(1).getNumericCellValue(), 0.0001);
        }
    }

    @Test
    public void testSheetNamePolicyComesFromProperties() {
        properties.setDuplicateSheetNames(SheetNamePolicy.FAIL);

        LayoutException e = assertThrows(LayoutException.class,
                () -> service().buildLayout(List.of(accountSummary(), accountSummary())));

        assertEquals(LayoutException.AMBIGUOUS_SHEET_NAME, e.getCode());
    }

    @Test
    public void testWrapTextComesFromProperties() throws Exception {
        properties.setWrapText(false);

        byte[] xlsx = service().generateExcel(List.of(accountSummary()));

        try (Workbook workbook = new XSSFWorkbook(new ByteArrayInputStream(xlsx))) {
            assertFalse(workbook.getSheetAt(0).getRow(0).getCell(0).getCellStyle().getWrapText());
        }
    }

    @Test
    public void testInvalidMappingNeverReachesRenderer() {
        renderer = Mockito.mock(ExcelRenderer.class);

        LayoutException e = assertThrows(LayoutException.class,
                () -> service().generateExcelFromMapping("{\"Summary\": [{\"cell_coordinate\": \"A1\"}]}"));

        assertEquals(LayoutException.INVALID_LAYOUT_MAPPING, e.getCode());
        verify(renderer, never()).renderWorkbook(any(), anyBoolean());
    }

    @Test
    public void testRenderFailureLeavesNoOutputFile() throws Exception {
        renderer = Mockito.mock(ExcelRenderer.class);
        when(renderer.renderWorkbook(any(), anyBoolean()))
                .thenThrow(new LayoutException(LayoutException.BAD_COORDINATE, "Sheet 'Bank Statement' coordinate 'B0'"));
        Path target = tempDir.resolve("layout.xlsx");

        LayoutException e = assertThrows(LayoutException.class,
                () -> service().generateExcel(List.of(bankStatement()), target));

        assertEquals(LayoutException.BAD_COORDINATE, e.getCode());
        assertFalse(Files.exists(target));
        try (Stream<Path> files = Files.list(tempDir)) {
            assertEquals(0, files.count());
        }
    }

    @Test
    public void testEmptyDocumentStopsBeforeWriting() {
        Path target = tempDir.resolve("layout.xlsx");

        LayoutException e = assertThrows(LayoutException.class,
                () -> service().generateExcel(List.of(document("empty.pdf", "receipt")), target));

        assertEquals(LayoutException.EMPTY_DOCUMENT, e.getCode());
        assertFalse(Files.exists(target));
    }
}
