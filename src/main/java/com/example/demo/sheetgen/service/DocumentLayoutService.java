package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.aspect.LogExecutionTime;
import com.example.demo.sheetgen.config.LayoutProperties;
import com.example.demo.sheetgen.exception.LayoutException;
import com.example.demo.sheetgen.model.Document;
import com.example.demo.sheetgen.model.LayoutOutput;
import com.example.demo.sheetgen.renderer.ExcelRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Workbook;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Main orchestrator for workbook generation.
 *
 * Two entry points produce the same layout mapping: extracted documents go through
 * the assembler (normalize, plan, style, address), while a mapping produced
 * elsewhere goes through the ingestor. Either mapping is then rendered fully in
 * memory and only then serialized or written to disk.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DocumentLayoutService {
    private final MappingAssembler mappingAssembler;
    private final MappingIngestor mappingIngestor;
    private final ExcelRenderer excelRenderer;
    private final ExcelOutputService excelOutputService;
    private final LayoutProperties layoutProperties;

    @LogExecutionTime("Layout Planning")
    public LayoutOutput buildLayout(List<Document> documents) {
        log.info("Building layout for {} document(s)", documents.size());
        return mappingAssembler.assemble(documents, layoutProperties.getDuplicateSheetNames());
    }

    /**
     * @return the XLSX file content
     */
    @LogExecutionTime("Total Workbook Generation")
    public byte[] generateExcel(List<Document> documents) {
        return render(buildLayout(documents));
    }

    public Path generateExcel(List<Document> documents, Path output) {
        return excelOutputService.write(generateExcel(documents), output);
    }

    public LayoutOutput ingestMapping(String rawText) {
        return mappingIngestor.ingest(rawText);
    }

    @LogExecutionTime("Workbook Generation From Mapping")
    public byte[] generateExcelFromMapping(String rawText) {
        return render(ingestMapping(rawText));
    }

    public Path generateExcelFromMapping(String rawText, Path output) {
        return excelOutputService.write(generateExcelFromMapping(rawText), output);
    }

    private byte[] render(LayoutOutput layout) {
        try (Workbook workbook = excelRenderer.renderWorkbook(layout, layoutProperties.isWrapText())) {
            return excelOutputService.toBytes(workbook);
        } catch (IOException e) {
            throw new LayoutException(LayoutException.OUTPUT_WRITE_FAILED, "Failed to close rendered workbook", e);
        }
    }
}
