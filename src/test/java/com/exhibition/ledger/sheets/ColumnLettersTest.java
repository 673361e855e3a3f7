package com.exhibition.ledger.sheets;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ColumnLettersTest {

    @ParameterizedTest
    @DisplayName("Should convert between indexes and letters")
    @CsvSource({
            "0,A",
            "25,Z",
            "26,AA",
            "51,AZ",
            "52,BA",
            "701,ZZ",
            "702,AAA"
    })
    void testConversion(int index, String letters) {
        assertEquals(letters, ColumnLetters.toLetters(index));
        assertEquals(index, ColumnLetters.toIndex(letters));
    }

    @Test
    @DisplayName("CellRange should render A1 notation and validate bounds")
    void testCellRange() {
        CellRange range = new CellRange(2, 2, 41, 3);

        assertEquals("C2:D41", range.toA1());
        assertEquals(40, range.rowCount());
        assertEquals(2, range.columnCount());
        assertEquals("A1:C1", CellRange.headerRow(3).toA1());
        assertThrows(IllegalArgumentException.class, () -> new CellRange(0, 0, 1, 1));
        assertThrows(IllegalArgumentException.class, () -> new CellRange(3, 0, 2, 1));
    }

    @Test
    @DisplayName("SyncTarget should quote the sheet name")
    void testSyncTarget() {
        SyncTarget target = new SyncTarget("abc", "Booth's Ledger");
        assertEquals("'Booth''s Ledger'!A1:B2", target.qualify("A1:B2"));
        assertThrows(IllegalArgumentException.class, () -> new SyncTarget(" ", "Ledger"));
    }
}
