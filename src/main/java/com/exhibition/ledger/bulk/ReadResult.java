package com.exhibition.ledger.bulk;

import com.exhibition.ledger.core.model.RawRecord;

import java.util.List;

/**
 * Records read from one source file.
 *
 * @param records  usable records, in file order
 * @param skipped  number of entries dropped (unsuccessful scrapes, empty pages, rows without data)
 * @param warnings human-readable notes about dropped or malformed entries
 */
public record ReadResult(List<RawRecord> records, int skipped, List<String> warnings) {

    public ReadResult {
        records = records != null ? List.copyOf(records) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ReadResult empty() {
        return new ReadResult(List.of(), 0, List.of());
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public int size() {
        return records.size();
    }
}
