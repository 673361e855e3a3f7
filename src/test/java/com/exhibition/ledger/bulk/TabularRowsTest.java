package com.exhibition.ledger.bulk;

import com.exhibition.ledger.core.model.RecordSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TabularRowsTest {

    @Test
    @DisplayName("Header names should be made unique and blank ones named")
    void testUniqueHeader() {
        assertEquals(List.of("Email", "Email2", "column3", "Email3", "Phone1"),
                TabularRows.uniqueHeader(List.of("Email", " Email ", "", "Email", "Phone1")));
    }

    @Test
    @DisplayName("Status column should filter rows and be dropped")
    void testStatusFilter() {
        List<String> header = List.of("url", "status", "error", "Email");
        List<List<String>> rows = List.of(
                List.of("acme.com", "SUCCESS", "", "info@acme.com"),
                List.of("down.ir", "FAILED", "timeout", ""));

        ReadResult result = TabularRows.toRecords(header, rows, RecordSource.EXCEL_OPERATOR, "sheet.xlsx");

        assertEquals(1, result.size());
        assertEquals(1, result.skipped());
        assertFalse(result.records().get(0).fields().containsKey("status"));
        assertFalse(result.records().get(0).fields().containsKey("error"));
    }

    @Test
    @DisplayName("Empty rows, duplicate rows and empty columns should be dropped")
    void testCleanup() {
        List<String> header = List.of("CompanyName", "Unused", "Phone1");
        List<List<String>> rows = List.of(
                List.of("Acme", "", "021-1"),
                List.of("", "nan", ""),
                List.of("Acme", "", "۰۲۱-۱"),
                List.of("Apex"));

        ReadResult result = TabularRows.toRecords(header, rows, RecordSource.EXCEL_OPERATOR, "sheet.xlsx");

        assertEquals(2, result.size());
        assertEquals(2, result.skipped());
        assertEquals(List.of("CompanyName", "Phone1"), List.copyOf(result.records().get(0).fields().keySet()));
        assertEquals("", result.records().get(1).get("Phone1"));
    }
}
