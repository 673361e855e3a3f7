package com.exhibition.ledger.sheets;

import com.exhibition.ledger.core.model.SheetState;
import com.exhibition.ledger.core.model.Table;
import com.exhibition.ledger.logging.LogContext;
import com.exhibition.ledger.metrics.MetricsService;
import com.exhibition.ledger.metrics.NoOpMetricsService;
import com.exhibition.ledger.tracing.NoOpTracingService;
import com.exhibition.ledger.tracing.Span;
import com.exhibition.ledger.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Appends a fused table to a remote sheet whose schema may lag behind it.
 *
 * <p>One call runs these steps in order:</p>
 * <ol>
 *   <li>read the remote header and row count</li>
 *   <li>if the sheet is empty, write the local columns as its header; otherwise append the
 *       local columns missing from the remote header to its end, then backfill every existing
 *       data row with empty strings in those columns</li>
 *   <li>reorder the local rows to the full header, sanitizing every cell</li>
 *   <li>append the rows after the last occupied row</li>
 * </ol>
 *
 * <p>Existing columns are never removed or moved. The steps are not transactional: a failure
 * after the header write leaves the sheet widened, and re-running is safe because the column
 * diff then finds nothing new and backfill only rewrites empty cells. Remote failures are
 * returned as {@link SyncResult#failure} and never retried here. A rerun after a failed append
 * may append the same rows twice.</p>
 */
public class SheetSynchronizer {
    private static final Logger log = LoggerFactory.getLogger(SheetSynchronizer.class);

    private final SheetClient client;
    private final SyncOptions options;
    private final CellSanitizer sanitizer;
    private final MetricsService metricsService;
    private final TracingService tracingService;

    public SheetSynchronizer(SheetClient client) {
        this(client, SyncOptions.defaults(), new NoOpMetricsService(), new NoOpTracingService());
    }

    public SheetSynchronizer(SheetClient client, SyncOptions options,
                             MetricsService metricsService, TracingService tracingService) {
        this.client = client;
        this.options = options;
        this.sanitizer = new CellSanitizer(options.getMaxCellLength());
        this.metricsService = metricsService != null ? metricsService : new NoOpMetricsService();
        this.tracingService = tracingService != null ? tracingService : new NoOpTracingService();
    }

    public SyncResult synchronize(Table local, SyncTarget target) {
        if (local == null || target == null) {
            throw new NullPointerException("local table and target are required");
        }
        try (LogContext ctx = LogContext.forSync(LogContext.generateRunId(),
                target.spreadsheetId(), target.sheetName())) {
            log.info("sync.started rows={} columns={}", local.rowCount(), local.columnCount());
            SyncResult result = run(local, target);
            if (result.isSuccess()) {
                metricsService.incrementAppendedRows(result.appendedRows());
                metricsService.incrementSyncOutcome("success");
                log.info("sync.completed appended={} totalRows={} totalColumns={} newColumns={} backfilled={}",
                        result.appendedRows(), result.totalRows(), result.totalColumns(),
                        result.newColumns().size(), result.backfilledRows());
            } else {
                metricsService.incrementSyncOutcome(result.errorKind().name());
                log.error("sync.failed kind={} reason=\"{}\"", result.errorKind(), result.reason());
            }
            return result;
        }
    }

    private SyncResult run(Table local, SyncTarget target) {
        try {
            SheetState remote = readState(target);
            Optional<String> duplicate = remote.duplicateColumn();
            if (duplicate.isPresent()) {
                return SyncResult.failure(SyncErrorKind.REMOTE_UNKNOWN_ERROR,
                        "Remote header has duplicate column '" + duplicate.get() + "'");
            }

            List<String> localColumns = leadingCompanyId(local.columns());
            List<String> newColumns = new ArrayList<>();
            List<String> fullHeader;
            if (remote.isEmpty()) {
                fullHeader = localColumns;
            } else {
                Set<String> known = new LinkedHashSet<>(remote.header());
                for (String column : localColumns) {
                    if (!known.contains(column)) {
                        newColumns.add(column);
                    }
                }
                fullHeader = new ArrayList<>(remote.header());
                fullHeader.addAll(newColumns);
            }

            if (fullHeader.isEmpty()) {
                return SyncResult.success(0, remote.rowCount(), 0, List.of(), false, 0);
            }

            // the header row counts even when the sheet is still empty
            int existingRows = Math.max(remote.rowCount(), 1);
            int totalRows = existingRows + local.rowCount();
            long projectedCells = (long) totalRows * fullHeader.size();
            if (projectedCells > options.getCellLimit()) {
                return SyncResult.failure(SyncErrorKind.REMOTE_CAPACITY_EXCEEDED,
                        "Sheet would hold " + projectedCells + " cells, above the limit of "
                                + options.getCellLimit());
            }

            boolean headerWritten = false;
            int backfilled = 0;
            if (remote.isEmpty()) {
                writeHeader(target, fullHeader);
                headerWritten = true;
            } else if (!newColumns.isEmpty()) {
                writeHeader(target, fullHeader);
                headerWritten = true;
                backfilled = backfill(target, remote, newColumns.size());
            }

            List<List<String>> rows = outgoingRows(local, fullHeader);
            if (!rows.isEmpty()) {
                append(target, rows);
            }
            return SyncResult.success(rows.size(), totalRows, fullHeader.size(),
                    newColumns, headerWritten, backfilled);
        } catch (SheetServiceException e) {
            return SyncResult.failure(e.getKind(), e.getMessage());
        }
    }

    private SheetState readState(SyncTarget target) {
        try (Span span = tracingService.startSpan("sheet.read-header", spanAttributes(target))) {
            try {
                List<String> header = client.readHeader(target);
                int rowCount = header.isEmpty() ? 0 : Math.max(1, client.readRowCount(target));
                span.setAttribute("columns", header.size());
                span.setAttribute("rows", rowCount);
                span.setStatus(Span.SpanStatus.OK);
                log.debug("sync.remoteState columns={} rows={}", header.size(), rowCount);
                return new SheetState(header, rowCount);
            } catch (SheetServiceException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }

    private void writeHeader(SyncTarget target, List<String> header) {
        try (Span span = tracingService.startSpan("sheet.write-header", spanAttributes(target))) {
            try {
                client.writeHeader(target, header);
                span.setAttribute("columns", header.size());
                span.setStatus(Span.SpanStatus.OK);
                log.info("sync.headerWritten columns={}", header.size());
            } catch (SheetServiceException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }

    /**
     * Writes empty strings into the new columns of every existing data row.
     *
     * @return number of rows backfilled
     */
    private int backfill(SyncTarget target, SheetState remote, int newColumnCount) {
        int dataRows = remote.dataRowCount();
        if (dataRows == 0) {
            return 0;
        }
        int firstColumn = remote.header().size();
        CellRange range = new CellRange(2, firstColumn, remote.rowCount(), firstColumn + newColumnCount - 1);
        List<List<String>> blanks = new ArrayList<>(dataRows);
        List<String> blankRow = Collections.nCopies(newColumnCount, "");
        for (int i = 0; i < dataRows; i++) {
            blanks.add(blankRow);
        }

        try (Span span = tracingService.startSpan("sheet.backfill", spanAttributes(target))) {
            try {
                client.writeRange(target, range, blanks);
                span.setAttribute("range", range.toA1());
                span.setAttribute("rows", dataRows);
                span.setStatus(Span.SpanStatus.OK);
                log.info("sync.backfilled range={} rows={}", range.toA1(), dataRows);
                return dataRows;
            } catch (SheetServiceException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }

    private void append(SyncTarget target, List<List<String>> rows) {
        try (Span span = tracingService.startSpan("sheet.append", spanAttributes(target))) {
            try {
                client.appendRows(target, rows);
                span.setAttribute("rows", rows.size());
                span.setStatus(Span.SpanStatus.OK);
            } catch (SheetServiceException e) {
                span.recordException(e);
                span.setStatus(Span.SpanStatus.ERROR);
                throw e;
            }
        }
    }

    private List<List<String>> outgoingRows(Table local, List<String> header) {
        Table aligned = local.reindex(header);
        List<List<String>> rows = new ArrayList<>(aligned.rowCount());
        for (int r = 0; r < aligned.rowCount(); r++) {
            List<String> cells = new ArrayList<>(header.size());
            for (String column : header) {
                cells.add(sanitizer.sanitize(aligned.get(r, column)));
            }
            rows.add(cells);
        }
        return rows;
    }

    private static List<String> leadingCompanyId(List<String> columns) {
        List<String> ordered = new ArrayList<>(columns.size());
        if (columns.contains(Table.COMPANY_ID)) {
            ordered.add(Table.COMPANY_ID);
        }
        for (String column : columns) {
            if (!Table.COMPANY_ID.equals(column)) {
                ordered.add(column);
            }
        }
        return ordered;
    }

    private static Map<String, String> spanAttributes(SyncTarget target) {
        return Map.of("spreadsheetId", target.spreadsheetId(), "sheetName", target.sheetName());
    }
}
