package com.exhibition.ledger.pipeline;

import com.exhibition.ledger.identity.IdentityFields;
import com.exhibition.ledger.merge.RepeatedValueScrubber;

/**
 * Configuration for a fusion run.
 */
public class FusionOptions {

    private final UnmatchedScrapePolicy unmatchedScrapePolicy;
    private final boolean reconcileColumns;
    private final boolean mergeRows;
    private final int repeatThreshold;
    private final IdentityFields identityFields;

    private FusionOptions(Builder builder) {
        this.unmatchedScrapePolicy = builder.unmatchedScrapePolicy;
        this.reconcileColumns = builder.reconcileColumns;
        this.mergeRows = builder.mergeRows;
        this.repeatThreshold = builder.repeatThreshold;
        this.identityFields = builder.identityFields;
    }

    public UnmatchedScrapePolicy getUnmatchedScrapePolicy() {
        return unmatchedScrapePolicy;
    }

    public boolean isReconcileColumns() {
        return reconcileColumns;
    }

    /**
     * When false, OCR/QR mode keeps one row per page and Excel mode one row per input row.
     */
    public boolean isMergeRows() {
        return mergeRows;
    }

    public int getRepeatThreshold() {
        return repeatThreshold;
    }

    public IdentityFields getIdentityFields() {
        return identityFields;
    }

    public static FusionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private UnmatchedScrapePolicy unmatchedScrapePolicy = UnmatchedScrapePolicy.MOST_COMMON_FILE_NAME;
        private boolean reconcileColumns = true;
        private boolean mergeRows = true;
        private int repeatThreshold = RepeatedValueScrubber.DEFAULT_THRESHOLD;
        private IdentityFields identityFields = IdentityFields.defaults();

        public Builder unmatchedScrapePolicy(UnmatchedScrapePolicy unmatchedScrapePolicy) {
            if (unmatchedScrapePolicy == null) {
                throw new IllegalArgumentException("unmatchedScrapePolicy is required");
            }
            this.unmatchedScrapePolicy = unmatchedScrapePolicy;
            return this;
        }

        public Builder reconcileColumns(boolean reconcileColumns) {
            this.reconcileColumns = reconcileColumns;
            return this;
        }

        public Builder mergeRows(boolean mergeRows) {
            this.mergeRows = mergeRows;
            return this;
        }

        /**
         * Values repeated in at least this many columns of a row are kept once; 0 disables.
         */
        public Builder repeatThreshold(int repeatThreshold) {
            if (repeatThreshold < 0) {
                throw new IllegalArgumentException("repeatThreshold must be >= 0");
            }
            this.repeatThreshold = repeatThreshold;
            return this;
        }

        public Builder identityFields(IdentityFields identityFields) {
            if (identityFields == null) {
                throw new IllegalArgumentException("identityFields is required");
            }
            this.identityFields = identityFields;
            return this;
        }

        public FusionOptions build() {
            return new FusionOptions(this);
        }
    }
}
