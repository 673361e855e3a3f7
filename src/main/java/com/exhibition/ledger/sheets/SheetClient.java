package com.exhibition.ledger.sheets;

import java.util.List;

/**
 * The protocol operations the synchronizer needs from a remote tabular store.
 * Every method either succeeds or throws {@link SheetServiceException}.
 */
public interface SheetClient {

    /**
     * Reads the first row. Returns an empty list for an empty sheet.
     */
    List<String> readHeader(SyncTarget target);

    /**
     * Counts occupied rows, header included, by probing the first column.
     */
    int readRowCount(SyncTarget target);

    /**
     * Overwrites the first row with the given header.
     */
    void writeHeader(SyncTarget target, List<String> header);

    /**
     * Overwrites a bounded block of cells. {@code values} has one list per row of the range.
     */
    void writeRange(SyncTarget target, CellRange range, List<List<String>> values);

    /**
     * Appends rows after the last occupied row without overwriting anything.
     */
    void appendRows(SyncTarget target, List<List<String>> rows);
}
