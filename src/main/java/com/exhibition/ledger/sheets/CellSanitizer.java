package com.exhibition.ledger.sheets;

import com.exhibition.ledger.rules.ValueNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last pass over every outgoing cell: the {@link ValueNormalizer} rules again, since some values
 * are synthesized late, then truncation to the remote per-cell character limit.
 */
public class CellSanitizer {
    private static final Logger log = LoggerFactory.getLogger(CellSanitizer.class);

    public static final int DEFAULT_MAX_CELL_LENGTH = 50_000;

    private final int maxCellLength;

    public CellSanitizer() {
        this(DEFAULT_MAX_CELL_LENGTH);
    }

    public CellSanitizer(int maxCellLength) {
        if (maxCellLength < 1) {
            throw new IllegalArgumentException("maxCellLength must be >= 1");
        }
        this.maxCellLength = maxCellLength;
    }

    public String sanitize(String value) {
        String clean = ValueNormalizer.normalize(value);
        if (clean.length() > maxCellLength) {
            log.warn("sync.cellTruncated length={} max={}", clean.length(), maxCellLength);
            int end = maxCellLength;
            if (Character.isHighSurrogate(clean.charAt(end - 1))) {
                end--;
            }
            clean = clean.substring(0, end);
        }
        return clean;
    }
}
