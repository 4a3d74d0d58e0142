package com.example.demo.sheetgen.controller;

import com.example.demo.sheetgen.exception.LayoutException;
import com.example.demo.sheetgen.model.Document;
import com.example.demo.sheetgen.model.DocumentLayoutRequest;
import com.example.demo.sheetgen.model.LayoutOutput;
import com.example.demo.sheetgen.service.DocumentLayoutService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST API for sheet layout generation
 */
@Slf4j
@RestController
@RequestMapping("/api/layouts")
@RequiredArgsConstructor
public class DocumentLayoutController {

    static final MediaType XLSX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");

    private static final Set<String> CLIENT_ERRORS = Set.of(
            LayoutException.NO_JSON_OBJECT_FOUND,
            LayoutException.MALFORMED_JSON,
            LayoutException.INVALID_LAYOUT_MAPPING,
            LayoutException.INVALID_COORDINATE,
            LayoutException.BAD_COORDINATE,
            LayoutException.AMBIGUOUS_SHEET_NAME);

    private static final Set<String> EMPTY_INPUTS = Set.of(
            LayoutException.EMPTY_DOCUMENT,
            LayoutException.EMPTY_LAYOUT);

    private final DocumentLayoutService documentLayoutService;

    /**
     * Plan the layout without rendering it.
     *
     * POST /api/layouts/plan
     * {
     *   "files": [
     *     { "file_name": "statement.pdf", "classified_file_type": "bank_statement",
     *       "fields": [ { "field_name": "Balance", "field_key": "balance",
     *                     "section": "Account Information", "data_type": "Number", "value": 1000 } ] }
     *   ]
     * }
     *
     * @return the layout mapping: sheet name to cells with coordinate, value and style
     */
    @PostMapping("/plan")
    public ResponseEntity<?> planLayout(@RequestBody DocumentLayoutRequest request) {
        List<Document> files = filesOf(request);
        log.info("Received layout planning request for {} file(s)", files.size());
        try {
            LayoutOutput layout = documentLayoutService.buildLayout(files);
            return ResponseEntity.ok(layout);
        } catch (LayoutException e) {
            return errorResponse(e);
        }
    }

    /**
     * Generate and download the styled workbook (XLSX) for the given files.
     */
    @PostMapping("/excel")
    public ResponseEntity<?> generateExcel(@RequestBody DocumentLayoutRequest request) {
        List<Document> files = filesOf(request);
        log.info("Received Excel generation request for {} file(s)", files.size());
        try {
            return xlsxResponse(documentLayoutService.generateExcel(files));
        } catch (LayoutException e) {
            return errorResponse(e);
        }
    }

    /**
     * Render a layout mapping produced elsewhere. The body is the producer's raw text;
     * code fences and surrounding prose are tolerated.
     */
    @PostMapping(value = "/excel/from-mapping",
            consumes = {MediaType.TEXT_PLAIN_VALUE, MediaType.APPLICATION_JSON_VALUE})
    public ResponseEntity<?> generateExcelFromMapping(@RequestBody String rawText) {
        log.info("Received Excel generation request from a {}-character mapping", rawText.length());
        try {
            return xlsxResponse(documentLayoutService.generateExcelFromMapping(rawText));
        } catch (LayoutException e) {
            return errorResponse(e);
        }
    }

    /**
     * Health check endpoint
     */
    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("Sheet layout service is running");
    }

    private static List<Document> filesOf(DocumentLayoutRequest request) {
        return request.getFiles() == null ? List.of() : request.getFiles();
    }

    private ResponseEntity<byte[]> xlsxResponse(byte[] xlsx) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(XLSX);
        headers.setContentDispositionFormData("attachment", "layout.xlsx");
        headers.setContentLength(xlsx.length);
        return new ResponseEntity<>(xlsx, headers, HttpStatus.OK);
    }

    private ResponseEntity<Map<String, String>> errorResponse(LayoutException e) {
        log.warn("Layout request failed: {}", e.getMessage());

        Map<String, String> body = new LinkedHashMap<>();
        body.put("code", e.getCode());
        body.put("description", e.getDescription());

        if (CLIENT_ERRORS.contains(e.getCode())) {
            return new ResponseEntity<>(body, HttpStatus.BAD_REQUEST);
        } else if (EMPTY_INPUTS.contains(e.getCode())) {
            return new ResponseEntity<>(body, HttpStatus.UNPROCESSABLE_ENTITY);
        }
        return new ResponseEntity<>(body, HttpStatus.INTERNAL_SERVER_ERROR);
    }
}
