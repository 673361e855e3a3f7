package com.exhibition.ledger.sheets;

/**
 * Limits applied by {@link SheetSynchronizer}.
 */
public class SyncOptions {

    /** Cell limit of a Google Sheets workbook. */
    public static final long DEFAULT_CELL_LIMIT = 10_000_000L;

    private final long cellLimit;
    private final int maxCellLength;

    private SyncOptions(Builder builder) {
        this.cellLimit = builder.cellLimit;
        this.maxCellLength = builder.maxCellLength;
    }

    public long getCellLimit() {
        return cellLimit;
    }

    public int getMaxCellLength() {
        return maxCellLength;
    }

    public static SyncOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private long cellLimit = DEFAULT_CELL_LIMIT;
        private int maxCellLength = CellSanitizer.DEFAULT_MAX_CELL_LENGTH;

        public Builder cellLimit(long cellLimit) {
            if (cellLimit < 1) {
                throw new IllegalArgumentException("cellLimit must be >= 1");
            }
            this.cellLimit = cellLimit;
            return this;
        }

        public Builder maxCellLength(int maxCellLength) {
            if (maxCellLength < 1) {
                throw new IllegalArgumentException("maxCellLength must be >= 1");
            }
            this.maxCellLength = maxCellLength;
            return this;
        }

        public SyncOptions build() {
            return new SyncOptions(this);
        }
    }
}
