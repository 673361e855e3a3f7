package com.exhibition.ledger.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One source-tagged, unmerged row of extracted data.
 * Field order is preserved; the field map cannot be modified after construction.
 *
 * @param source the channel that produced the record
 * @param origin originating file name or row reference (e.g. {@code card_17.pdf#2})
 * @param fields column name to value; values are never null
 */
public record RawRecord(RecordSource source, String origin, Map<String, String> fields) {

    public RawRecord {
        Objects.requireNonNull(source, "source is required");
        origin = origin != null ? origin : "";
        Map<String, String> copy = new LinkedHashMap<>();
        if (fields != null) {
            fields.forEach((k, v) -> {
                if (k != null) {
                    copy.put(k, v != null ? v : "");
                }
            });
        }
        fields = Collections.unmodifiableMap(copy);
    }

    /**
     * Returns the value for the column, or an empty string when absent.
     */
    public String get(String column) {
        return fields.getOrDefault(column, "");
    }

    public boolean has(String column) {
        return !get(column).isEmpty();
    }
}
