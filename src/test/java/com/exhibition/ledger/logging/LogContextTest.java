package com.exhibition.ledger.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("LogContext Tests")
class LogContextTest {

    @AfterEach
    void cleanupMDC() {
        MDC.clear();
    }

    @Test
    @DisplayName("forFusion should set runId, fusionMode, and operation in MDC")
    void forFusionSetsMDC() {
        try (LogContext ctx = LogContext.forFusion("run-1", "OCR_QR")) {
            assertEquals("run-1", MDC.get("runId"));
            assertEquals("OCR_QR", MDC.get("fusionMode"));
            assertEquals("fusion", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("forSync should set runId, spreadsheetId, sheetName, and operation in MDC")
    void forSyncSetsMDC() {
        try (LogContext ctx = LogContext.forSync("run-2", "sheet-abc", "Ledger")) {
            assertEquals("run-2", MDC.get("runId"));
            assertEquals("sheet-abc", MDC.get("spreadsheetId"));
            assertEquals("Ledger", MDC.get("sheetName"));
            assertEquals("sync", MDC.get("operation"));
        }
    }

    @Test
    @DisplayName("MDC should be cleared on close")
    void mdcClearedOnClose() {
        LogContext ctx = LogContext.forSync("run-3", "sheet-abc", "Ledger");
        assertNotNull(MDC.get("runId"));

        ctx.close();

        assertNull(MDC.get("runId"));
        assertNull(MDC.get("spreadsheetId"));
        assertNull(MDC.get("sheetName"));
        assertNull(MDC.get("operation"));
    }

    @Test
    @DisplayName("with() should add custom keys that are removed on close")
    void withAddsCustomKey() {
        try (LogContext ctx = LogContext.forFusion("run-4", "EXCEL").with("inputFile", "booths.xlsx")) {
            assertEquals("booths.xlsx", MDC.get("inputFile"));
        }
        assertNull(MDC.get("inputFile"));
    }

    @Test
    @DisplayName("generateRunId should return distinct values")
    void generateRunIdIsUnique() {
        assertNotEquals(LogContext.generateRunId(), LogContext.generateRunId());
    }
}
