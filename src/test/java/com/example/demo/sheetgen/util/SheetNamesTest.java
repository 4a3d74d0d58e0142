package com.example.demo.sheetgen.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SheetNamesTest {

    @Test
    public void testTitleFromClassifiedType() {
        assertEquals("Bank Statement", SheetNames.titleFor("bank_statement", "scan.pdf"));
        assertEquals("Pay Stub", SheetNames.titleFor("pay-stub", null));
        assertEquals("IRS 1040 Form", SheetNames.titleFor("IRS_1040_form", null));
    }

    @Test
    public void testTitleFallsBackToFileNameThenDefault() {
        assertEquals("scan_0042", SheetNames.titleFor(null, "uploads/scan_0042.pdf"));
        assertEquals("scan_0042", SheetNames.titleFor("  ", "scan_0042.pdf"));
        assertEquals(SheetNames.FALLBACK, SheetNames.titleFor(null, null));
    }

    @Test
    public void testSheetNameKeepsLettersDigitsAndSpaces() {
        assertEquals("Bank Statement 2024", SheetNames.sanitize("Bank Statement (2024)!"));
        assertEquals("W2 Form", SheetNames.sanitize("W-2   Form"));
        assertEquals("scan0042", SheetNames.sheetNameFor("***", "scan_0042.pdf"));
        assertEquals(SheetNames.FALLBACK, SheetNames.sheetNameFor("***", "###"));
    }

    @Test
    public void testSheetNameIsCutToThirtyOneCharacters() {
        String name = SheetNames.sanitize("Consolidated Quarterly Brokerage Account Statement");
        assertTrue(name.length() <= SheetNames.MAX_LENGTH);
        assertEquals("Consolidated Quarterly Brokerag", name);
    }

    @Test
    public void testSuffixStaysWithinLimit() {
        assertEquals("Bank Statement 2", SheetNames.withSuffix("Bank Statement", 2));

        String longName = "Consolidated Quarterly Brokerag";
        String suffixed = SheetNames.withSuffix(longName, 12);
        assertEquals(SheetNames.MAX_LENGTH, suffixed.length());
        assertTrue(suffixed.endsWith(" 12"));
    }

    @Test
    public void testIsValid() {
        assertTrue(SheetNames.isValid("Bank Statement 2"));
        assertFalse(SheetNames.isValid(""));
        assertFalse(SheetNames.isValid("   "));
        assertFalse(SheetNames.isValid("Q1/Q2"));
        assertFalse(SheetNames.isValid("A".repeat(32)));
        assertFalse(SheetNames.isValid(null));
    }
}
