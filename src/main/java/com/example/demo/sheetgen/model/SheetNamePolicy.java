package com.example.demo.sheetgen.model;

/**
 * What to do when two documents derive the same sheet name.
 */
public enum SheetNamePolicy {
    /** Append " 2", " 3", ... in input order. */
    SUFFIX,
    /** Reject the second document. */
    FAIL
}
