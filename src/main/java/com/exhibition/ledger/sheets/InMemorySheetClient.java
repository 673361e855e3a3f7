package com.exhibition.ledger.sheets;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link SheetClient} keeping each sheet as a grid in memory, for dry runs and tests.
 * Every call is recorded by operation name; a failure can be scheduled for an operation.
 */
public class InMemorySheetClient implements SheetClient {

    public static final String READ_HEADER = "readHeader";
    public static final String READ_ROW_COUNT = "readRowCount";
    public static final String WRITE_HEADER = "writeHeader";
    public static final String WRITE_RANGE = "writeRange";
    public static final String APPEND_ROWS = "appendRows";

    private final Map<SyncTarget, List<List<String>>> sheets = new HashMap<>();
    private final Map<String, SheetServiceException> scheduledFailures = new HashMap<>();
    private final List<String> calls = new ArrayList<>();

    /**
     * Replaces the sheet's content. The first row is the header.
     */
    public void seed(SyncTarget target, List<List<String>> rows) {
        List<List<String>> grid = grid(target);
        grid.clear();
        for (List<String> row : rows) {
            grid.add(new ArrayList<>(row));
        }
    }

    /**
     * Makes the next call of the given operation throw instead of running.
     */
    public void failNext(String operation, SheetServiceException failure) {
        scheduledFailures.put(operation, failure);
    }

    @Override
    public List<String> readHeader(SyncTarget target) {
        record(READ_HEADER);
        List<List<String>> grid = grid(target);
        if (grid.isEmpty()) {
            return List.of();
        }
        List<String> header = new ArrayList<>(grid.get(0));
        while (!header.isEmpty() && header.get(header.size() - 1).isBlank()) {
            header.remove(header.size() - 1);
        }
        return header;
    }

    @Override
    public int readRowCount(SyncTarget target) {
        record(READ_ROW_COUNT);
        List<List<String>> grid = grid(target);
        for (int r = grid.size() - 1; r >= 0; r--) {
            List<String> row = grid.get(r);
            if (!row.isEmpty() && !row.get(0).isEmpty()) {
                return r + 1;
            }
        }
        return 0;
    }

    @Override
    public void writeHeader(SyncTarget target, List<String> header) {
        record(WRITE_HEADER);
        List<List<String>> grid = grid(target);
        if (grid.isEmpty()) {
            grid.add(new ArrayList<>());
        }
        List<String> first = grid.get(0);
        for (int c = 0; c < header.size(); c++) {
            setCell(first, c, header.get(c));
        }
    }

    @Override
    public void writeRange(SyncTarget target, CellRange range, List<List<String>> values) {
        record(WRITE_RANGE);
        if (values.size() != range.rowCount()) {
            throw new SheetServiceException(SyncErrorKind.REMOTE_UNKNOWN_ERROR, 400,
                    "range " + range.toA1() + " expects " + range.rowCount() + " rows, got " + values.size());
        }
        List<List<String>> grid = grid(target);
        while (grid.size() < range.lastRow()) {
            grid.add(new ArrayList<>());
        }
        for (int r = 0; r < values.size(); r++) {
            List<String> row = grid.get(range.firstRow() - 1 + r);
            List<String> cells = values.get(r);
            for (int c = 0; c < cells.size(); c++) {
                setCell(row, range.firstColumn() + c, cells.get(c));
            }
        }
    }

    @Override
    public void appendRows(SyncTarget target, List<List<String>> rows) {
        record(APPEND_ROWS);
        List<List<String>> grid = grid(target);
        for (List<String> row : rows) {
            grid.add(new ArrayList<>(row));
        }
    }

    /**
     * Current content of the sheet, rows as stored (not padded).
     */
    public List<List<String>> rows(SyncTarget target) {
        List<List<String>> copy = new ArrayList<>();
        for (List<String> row : grid(target)) {
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        return copy;
    }

    public List<String> calls() {
        return List.copyOf(calls);
    }

    public long callCount(String operation) {
        return calls.stream().filter(operation::equals).count();
    }

    public void clearCalls() {
        calls.clear();
    }

    private void record(String operation) {
        calls.add(operation);
        SheetServiceException failure = scheduledFailures.remove(operation);
        if (failure != null) {
            throw failure;
        }
    }

    private List<List<String>> grid(SyncTarget target) {
        return sheets.computeIfAbsent(target, t -> new ArrayList<>());
    }

    private static void setCell(List<String> row, int column, String value) {
        while (row.size() <= column) {
            row.add("");
        }
        row.set(column, value);
    }
}
