package com.exhibition.ledger.pipeline;

public enum FusionErrorKind {
    /** Neither primary input exists. */
    MISSING_SOURCE_FILE,
    /** Every existing primary input is unreadable or yields no usable record. */
    EMPTY_SOURCE_DATASET
}
