package com.exhibition.ledger.merge;

import com.exhibition.ledger.core.model.MergedRecord;
import com.exhibition.ledger.core.model.Table;

import java.util.List;

/**
 * Result of folding a table's rows into one row per entity.
 *
 * @param table         merged rows, {@code CompanyID} first
 * @param records       the same rows as {@link MergedRecord}s, in table order
 * @param inputRows     number of rows before merging
 * @param mergedGroups  number of entities built from more than one row
 * @param scrubbedCells number of cells blanked by the repeated-value post-pass
 */
public record MergeResult(
        Table table,
        List<MergedRecord> records,
        int inputRows,
        int mergedGroups,
        int scrubbedCells
) {
    public MergeResult {
        records = records != null ? List.copyOf(records) : List.of();
    }

    public int outputRows() {
        return records.size();
    }

    @Override
    public String toString() {
        return "MergeResult{inputRows=" + inputRows +
                ", outputRows=" + records.size() +
                ", mergedGroups=" + mergedGroups +
                ", scrubbedCells=" + scrubbedCells + '}';
    }
}
