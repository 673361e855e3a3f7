package com.exhibition.ledger.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Puts run identifiers into the SLF4J MDC for the duration of a try-with-resources block.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forSync(runId, spreadsheetId, "Sheet1")) {
 *     log.info("sync.appended rows={}", rows);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();

    private LogContext() {
    }

    public static LogContext forFusion(String runId, String mode) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("fusionMode", mode);
        ctx.put("operation", "fusion");
        return ctx;
    }

    public static LogContext forSync(String runId, String spreadsheetId, String sheetName) {
        LogContext ctx = new LogContext();
        ctx.put("runId", runId);
        ctx.put("spreadsheetId", spreadsheetId);
        ctx.put("sheetName", sheetName);
        ctx.put("operation", "sync");
        return ctx;
    }

    public static String generateRunId() {
        return UUID.randomUUID().toString();
    }

    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (String key : keys) {
            MDC.remove(key);
        }
        keys.clear();
    }
}
