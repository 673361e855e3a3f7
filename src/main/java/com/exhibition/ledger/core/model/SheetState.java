package com.exhibition.ledger.core.model;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The remote tabular store's current header and row count.
 * This is the only state that persists across runs.
 *
 * @param header   ordered column names of the first row
 * @param rowCount number of occupied rows, header row included
 */
public record SheetState(List<String> header, int rowCount) {

    public SheetState {
        header = header != null ? List.copyOf(header) : List.of();
        if (rowCount < 0) {
            throw new IllegalArgumentException("rowCount must be >= 0");
        }
    }

    public static SheetState empty() {
        return new SheetState(List.of(), 0);
    }

    public boolean isEmpty() {
        return header.isEmpty();
    }

    /**
     * Number of rows below the header.
     */
    public int dataRowCount() {
        return Math.max(0, rowCount - 1);
    }

    /**
     * Returns the first non-blank column name that occurs more than once, if any.
     */
    public Optional<String> duplicateColumn() {
        Set<String> seen = new HashSet<>();
        for (String column : header) {
            if (!column.isBlank() && !seen.add(column)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }
}
