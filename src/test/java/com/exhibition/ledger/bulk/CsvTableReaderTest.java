package com.exhibition.ledger.bulk;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class CsvTableReaderTest {

    private final CsvTableReader reader = new CsvTableReader();

    private ReadResult read(String csv) throws IOException {
        return reader.read(new ByteArrayInputStream(csv.getBytes(StandardCharsets.UTF_8)), "booths.csv");
    }

    @Test
    @DisplayName("Should parse quoted fields and skip a byte-order mark")
    void testQuotedFieldsAndBom() throws IOException {
        ReadResult result = read("\uFEFFCompanyName,Address,Phone1\n"
                + "\"Acme, Ltd\",\"Tehran\nValiasr St\",021-1\n"
                + "\n"
                + "Apex,,021-2\n");

        assertEquals(2, result.size());
        assertEquals("Acme, Ltd", result.records().get(0).get("CompanyName"));
        assertEquals("Tehran\nValiasr St", result.records().get(0).get("Address"));
        assertTrue(result.records().get(0).fields().containsKey("CompanyName"));
        assertEquals("021-2", result.records().get(1).get("Phone1"));
    }

    @Test
    @DisplayName("Should normalize values and Persian digits")
    void testNormalization() throws IOException {
        ReadResult result = read("Phone1,Notes\n۰۲۱۸۸,#N/A\n");

        assertEquals("02188", result.records().get(0).get("Phone1"));
        assertFalse(result.records().get(0).fields().containsKey("Notes"));
    }

    @Test
    @DisplayName("Empty file should yield an empty result")
    void testEmptyFile() throws IOException {
        assertTrue(read("").isEmpty());
        assertEquals("csv", reader.getFormat());
    }
}
