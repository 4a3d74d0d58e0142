package com.example.demo.sheetgen.exception;

/**
 * Raised when a layout cannot be planned, ingested or rendered.
 * Carries a machine-readable code and a human-readable description naming the
 * offending coordinate, section, file or input fragment.
 */
public class LayoutException extends RuntimeException {

    public static final String INVALID_COORDINATE = "INVALID_COORDINATE";
    public static final String EMPTY_DOCUMENT = "EMPTY_DOCUMENT";
    public static final String AMBIGUOUS_SHEET_NAME = "AMBIGUOUS_SHEET_NAME";
    public static final String NO_JSON_OBJECT_FOUND = "NO_JSON_OBJECT_FOUND";
    public static final String MALFORMED_JSON = "MALFORMED_JSON";
    public static final String INVALID_LAYOUT_MAPPING = "INVALID_LAYOUT_MAPPING";
    public static final String BAD_COORDINATE = "BAD_COORDINATE";
    public static final String EMPTY_LAYOUT = "EMPTY_LAYOUT";
    public static final String OUTPUT_WRITE_FAILED = "OUTPUT_WRITE_FAILED";

    private final String code;
    private final String description;

    public LayoutException(String code, String description) {
        super(code + ": " + description);
        this.code = code;
        this.description = description;
    }

    public LayoutException(String code, String description, Throwable cause) {
        super(code + ": " + description, cause);
        this.code = code;
        this.description = description;
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }
}
