package com.exhibition.ledger.merge;

import com.exhibition.ledger.rules.ValueNormalizer;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Blanks a value that an extractor copied into many unrelated fields of one row.
 * When the same non-empty value fills {@code threshold} or more columns, the first
 * column keeps it and the others are cleared.
 */
public class RepeatedValueScrubber {

    public static final int DEFAULT_THRESHOLD = 3;

    private final int threshold;
    private final Set<String> excludedColumns;

    public RepeatedValueScrubber(int threshold, Set<String> excludedColumns) {
        if (threshold < 0) {
            throw new IllegalArgumentException("threshold must be >= 0");
        }
        this.threshold = threshold;
        this.excludedColumns = Set.copyOf(excludedColumns);
    }

    /**
     * Scrubs the row in place.
     *
     * @return number of cells blanked
     */
    public int scrub(Map<String, String> row) {
        if (!isEnabled()) {
            return 0;
        }
        Map<String, Integer> occurrences = new HashMap<>();
        for (Map.Entry<String, String> entry : row.entrySet()) {
            String value = ValueNormalizer.normalize(entry.getValue());
            if (!value.isEmpty() && !excludedColumns.contains(entry.getKey())) {
                occurrences.merge(value, 1, Integer::sum);
            }
        }

        Set<String> kept = new HashSet<>();
        int blanked = 0;
        for (Map.Entry<String, String> entry : row.entrySet()) {
            if (excludedColumns.contains(entry.getKey())) {
                continue;
            }
            String value = ValueNormalizer.normalize(entry.getValue());
            if (value.isEmpty() || occurrences.get(value) < threshold) {
                continue;
            }
            if (!kept.add(value)) {
                entry.setValue("");
                blanked++;
            }
        }
        return blanked;
    }

    /**
     * A threshold of 0 or 1 would blank every duplicate or every value, so both disable scrubbing.
     */
    public boolean isEnabled() {
        return threshold >= 2;
    }

    public int getThreshold() {
        return threshold;
    }
}
