package com.exhibition.ledger.sheets;

import java.util.List;

/**
 * Outcome of one synchronization call.
 *
 * @param success        whether every step completed
 * @param appendedRows   rows appended by this call
 * @param totalRows      occupied rows after the call, header included
 * @param totalColumns   header width after the call
 * @param totalCells     {@code totalRows * totalColumns}
 * @param newColumns     columns added to the remote header, in order
 * @param headerWritten  whether the header row was written
 * @param backfilledRows pre-existing data rows backfilled for new columns
 * @param errorKind      failure classification, null on success
 * @param reason         human-readable failure reason, null on success
 */
public record SyncResult(
        boolean success,
        int appendedRows,
        int totalRows,
        int totalColumns,
        long totalCells,
        List<String> newColumns,
        boolean headerWritten,
        int backfilledRows,
        SyncErrorKind errorKind,
        String reason
) {
    public SyncResult {
        newColumns = newColumns != null ? List.copyOf(newColumns) : List.of();
    }

    public static SyncResult success(int appendedRows, int totalRows, int totalColumns,
                                     List<String> newColumns, boolean headerWritten, int backfilledRows) {
        return new SyncResult(true, appendedRows, totalRows, totalColumns, (long) totalRows * totalColumns,
                newColumns, headerWritten, backfilledRows, null, null);
    }

    public static SyncResult failure(SyncErrorKind kind, String reason) {
        return new SyncResult(false, 0, 0, 0, 0, List.of(), false, 0, kind, reason);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }
}
