package com.exhibition.ledger.sheets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CellSanitizerTest {

    @Test
    @DisplayName("Should normalize values before writing")
    void testNormalizes() {
        CellSanitizer sanitizer = new CellSanitizer();
        assertEquals("SUM(A1)", sanitizer.sanitize("=SUM(A1)"));
        assertEquals("", sanitizer.sanitize("#REF!"));
        assertEquals("", sanitizer.sanitize(null));
    }

    @Test
    @DisplayName("Should truncate values above the cell limit")
    void testTruncates() {
        CellSanitizer sanitizer = new CellSanitizer(10);
        assertEquals("abcdefghij", sanitizer.sanitize("abcdefghijklmnop"));
        assertEquals("short", sanitizer.sanitize("short"));
    }

    @Test
    @DisplayName("Should not split a surrogate pair when truncating")
    void testSurrogatePair() {
        CellSanitizer sanitizer = new CellSanitizer(4);
        assertEquals("abc", sanitizer.sanitize("abc\uD83D\uDE00"));
    }

    @Test
    @DisplayName("Should reject a non-positive limit")
    void testInvalidLimit() {
        assertThrows(IllegalArgumentException.class, () -> new CellSanitizer(0));
    }
}
